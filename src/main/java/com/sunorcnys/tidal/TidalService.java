package com.sunorcnys.tidal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sunorcnys.auth.OAuth2Authenticator;
import com.sunorcnys.auth.OAuthProvider;
import com.sunorcnys.http.FetchException;
import com.sunorcnys.http.PaginatedFetcher;
import com.sunorcnys.http.Urls;
import com.sunorcnys.mapping.JsonFields;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.model.Song;
import com.sunorcnys.service.AuthorizedApi;
import com.sunorcnys.service.MusicService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TIDAL Open API v2. Requests are scoped to the account's country, which is read once from
 * {@code /users/me} and kept with the token.
 */
public class TidalService implements MusicService {

    private static final Logger log = LoggerFactory.getLogger(TidalService.class);

    public static final String NAME = "tidal";
    public static final OAuthProvider PROVIDER = new OAuthProvider(
            NAME,
            "https://login.tidal.com/authorize",
            "https://auth.tidal.com/v1/oauth2/token",
            true,
            false,
            false);
    public static final List<String> DEFAULT_SCOPES = List.of(
            "playlists.read",
            "playlists.write",
            "user.read",
            "search.read");
    public static final String DEFAULT_API_BASE = "https://openapi.tidal.com/v2";
    public static final String JSON_API = "application/vnd.api+json";

    static final String USER_ID = "user_id";
    static final String COUNTRY = "country";
    private static final int MAX_TRACKS_PER_ADD = 20;

    private final OAuth2Authenticator authenticator;
    private final AuthorizedApi api;
    private final TidalPayloadMapper mapper = new TidalPayloadMapper();
    private final String apiBase;

    public TidalService(OAuth2Authenticator authenticator, AuthorizedApi api) {
        this(authenticator, api, DEFAULT_API_BASE);
    }

    public TidalService(OAuth2Authenticator authenticator, AuthorizedApi api, String apiBase) {
        this.authenticator = authenticator;
        this.api = api;
        this.apiBase = (apiBase == null || apiBase.isBlank()) ? DEFAULT_API_BASE : apiBase.trim();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public OAuth2Authenticator authenticator() {
        return authenticator;
    }

    @Override
    public List<Playlist> getAllPlaylists() {
        Account account = account();
        List<Playlist> playlists = new ArrayList<>();
        for (JsonNode resource : ownPlaylists(account)) {
            String id = JsonFields.text(resource, "id");
            log.debug("Found TIDAL playlist {} ({})", JsonFields.text(resource.path("attributes"), "name"), id);
            List<Song> songs = id != null ? playlistSongs(id, account) : List.of();
            if (songs.isEmpty()) {
                log.warn("TIDAL playlist {} has no readable tracks", id);
            }
            playlists.add(mapper.playlistFromPayload(resource, songs));
        }
        log.info("Loaded {} TIDAL playlists", playlists.size());
        return playlists;
    }

    @Override
    public Optional<String> findPlaylistByName(String name) {
        return PaginatedFetcher.stream(ownPlaylists(account()))
                .filter(resource -> name.equals(JsonFields.text(resource.path("attributes"), "name")))
                .map(resource -> JsonFields.text(resource, "id"))
                .findFirst();
    }

    @Override
    public String createPlaylist(String name, String description) {
        Account account = account();
        ObjectNode attributes = api.getMapper().createObjectNode()
                .put("name", name)
                .put("description", description != null ? description : "")
                .put("privacy", "PRIVATE");
        ObjectNode body = api.getMapper().createObjectNode();
        body.putObject("data").put("type", "playlists").set("attributes", attributes);

        JsonNode created = api.postJson(Urls.withQuery(apiBase + "/playlists", Map.of("countryCode", account.country())),
                body, JSON_API, "create-playlist");
        String id = JsonFields.text(created.path("data"), "id");
        if (id == null) {
            throw new FetchException(NAME, "create-playlist", "TIDAL returned a playlist without id");
        }
        log.info("Created TIDAL playlist '{}' ({})", name, id);
        return id;
    }

    /**
     * A 404 means the recording is not available in the account's region.
     */
    @Override
    public Optional<Song> lookupIsrc(String isrc) {
        if (isrc == null || isrc.isBlank()) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("filter[isrc]", isrc);
        params.put("include", "artists,albums");
        params.put("countryCode", account().country());
        Optional<JsonNode> found = api.getJsonIfFound(Urls.withQuery(apiBase + "/tracks", params), "search-isrc");
        if (found.isEmpty()) {
            log.debug("ISRC {} not available on TIDAL", isrc);
            return Optional.empty();
        }
        JsonNode data = found.get().path("data");
        if (!data.isArray() || data.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode document = api.getMapper().createObjectNode();
        document.set("data", data.get(0));
        JsonNode included = found.get().get("included");
        document.set("included", included != null && included.isArray() ? included : api.getMapper().createArrayNode());
        return Optional.of(mapper.songFromPayload(document));
    }

    @Override
    public List<Song> searchCatalog(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Account account = account();
        URI uri = Urls.withQuery(apiBase + "/searchResults/" + Urls.encode(query) + "/relationships/tracks",
                Map.of("countryCode", account.country()));
        JsonNode refs = api.getJson(uri, "search-text").path("data");
        List<Song> songs = new ArrayList<>();
        for (JsonNode ref : refs) {
            if (songs.size() >= limit) {
                break;
            }
            String id = JsonFields.text(ref, "id");
            if (id != null && "tracks".equals(JsonFields.text(ref, "type"))) {
                track(id, account).ifPresent(songs::add);
            }
        }
        return songs;
    }

    @Override
    public void addTracks(String playlistId, List<String> trackIds) {
        if (trackIds.isEmpty()) {
            return;
        }
        if (trackIds.size() > MAX_TRACKS_PER_ADD) {
            throw new IllegalArgumentException("TIDAL accepts at most " + MAX_TRACKS_PER_ADD + " tracks per request");
        }
        ObjectNode body = api.getMapper().createObjectNode();
        ArrayNode data = body.putArray("data");
        for (String id : trackIds) {
            data.addObject().put("type", "tracks").put("id", id);
        }
        api.postJson(URI.create(apiBase + "/playlists/" + Urls.encode(playlistId) + "/relationships/items"),
                body, JSON_API, "add-tracks");
        log.debug("Added {} tracks to TIDAL playlist {}", trackIds.size(), playlistId);
    }

    @Override
    public int maxTracksPerAddRequest() {
        return MAX_TRACKS_PER_ADD;
    }

    record Account(String userId, String country) {}

    Account account() {
        Optional<String> userId = authenticator.currentToken().map(t -> t.attribute(USER_ID));
        Optional<String> country = authenticator.currentToken().map(t -> t.attribute(COUNTRY));
        if (userId.isPresent() && country.isPresent()) {
            return new Account(userId.get(), country.get());
        }
        JsonNode data = api.getJson(URI.create(apiBase + "/users/me"), "profile").path("data");
        String id = JsonFields.text(data, "id");
        String countryCode = JsonFields.text(data.path("attributes"), "country");
        if (id == null || countryCode == null) {
            throw new FetchException(NAME, "profile", "TIDAL profile lacks id or country");
        }
        authenticator.rememberAttribute(USER_ID, id);
        authenticator.rememberAttribute(COUNTRY, countryCode);
        return new Account(id, countryCode);
    }

    private Iterable<JsonNode> ownPlaylists(Account account) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("filter[r.owners.id]", account.userId());
        params.put("countryCode", account.country());
        return api.fetchAll(Urls.withQuery(apiBase + "/playlists", params), body -> body.get("data"), this::nextLink);
    }

    private List<Song> playlistSongs(String playlistId, Account account) {
        URI start = Urls.withQuery(apiBase + "/playlists/" + Urls.encode(playlistId) + "/relationships/items",
                Map.of("countryCode", account.country()));
        List<Song> songs = new ArrayList<>();
        for (JsonNode ref : api.fetchAll(start, body -> body.get("data"), this::nextLink)) {
            if (!"tracks".equals(JsonFields.text(ref, "type"))) {
                continue;
            }
            String id = JsonFields.text(ref, "id");
            if (id != null) {
                track(id, account).ifPresent(songs::add);
            }
        }
        return songs;
    }

    private Optional<Song> track(String id, Account account) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("include", "artists,albums");
        params.put("countryCode", account.country());
        Optional<JsonNode> document = api.getJsonIfFound(Urls.withQuery(apiBase + "/tracks/" + Urls.encode(id), params), "track");
        if (document.isEmpty()) {
            log.warn("TIDAL track {} not available in region {}, skipping", id, account.country());
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.songFromPayload(document.get()));
        } catch (IllegalArgumentException e) {
            log.warn("Skipping TIDAL track {}: {}", id, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * TIDAL returns next links relative to the API root, e.g. {@code /playlists?page[cursor]=…}.
     */
    private Optional<String> nextLink(JsonNode body) {
        String next = JsonFields.text(body.path("links"), "next");
        if (next == null) {
            return Optional.empty();
        }
        return Optional.of(next.startsWith("/") ? apiBase + next : next);
    }
}
