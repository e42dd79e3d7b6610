package com.sunorcnys.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunorcnys.auth.OAuth2Authenticator;
import com.sunorcnys.auth.OAuthProvider;
import com.sunorcnys.http.ApiRequest;
import com.sunorcnys.http.FetchException;
import com.sunorcnys.http.PaginatedFetcher;
import com.sunorcnys.http.Urls;
import com.sunorcnys.mapping.JsonFields;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.model.Song;
import com.sunorcnys.service.AuthorizedApi;
import com.sunorcnys.service.MusicService;
import com.sunorcnys.service.PlaylistSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Spotify Web API v1.
 */
public class SpotifyService implements MusicService {

    private static final Logger log = LoggerFactory.getLogger(SpotifyService.class);

    public static final String NAME = "spotify";
    public static final OAuthProvider PROVIDER = new OAuthProvider(
            NAME,
            "https://accounts.spotify.com/authorize",
            "https://accounts.spotify.com/api/token",
            false,
            true,
            true);
    public static final List<String> DEFAULT_SCOPES = List.of(
            "playlist-read-private",
            "playlist-read-collaborative",
            "playlist-modify-public",
            "playlist-modify-private");
    public static final String DEFAULT_API_BASE = "https://api.spotify.com/v1";

    static final String USER_ID = "user_id";
    private static final int MAX_TRACKS_PER_ADD = 100;
    private static final int PLAYLIST_PAGE_SIZE = 50;
    private static final int TRACK_PAGE_SIZE = 100;
    private static final int MAX_SEED_GENRES = 5;
    private static final int MAX_RECOMMENDATIONS = 100;

    private final OAuth2Authenticator authenticator;
    private final AuthorizedApi api;
    private final SpotifyPayloadMapper mapper = new SpotifyPayloadMapper();
    private final String apiBase;

    public SpotifyService(OAuth2Authenticator authenticator, AuthorizedApi api) {
        this(authenticator, api, DEFAULT_API_BASE);
    }

    public SpotifyService(OAuth2Authenticator authenticator, AuthorizedApi api, String apiBase) {
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
        List<Playlist> playlists = new ArrayList<>();
        for (JsonNode item : ownPlaylistPages()) {
            String href = JsonFields.text(item.path("tracks"), "href");
            List<Song> songs = href != null ? songsFrom(href) : List.of();
            playlists.add(mapper.playlistFromPayload(item, songs));
        }
        log.info("Loaded {} Spotify playlists", playlists.size());
        return playlists;
    }

    @Override
    public Optional<String> findPlaylistByName(String name) {
        String userId = currentUserId();
        return PaginatedFetcher.stream(ownPlaylistPages())
                .filter(item -> name.equals(JsonFields.text(item, "name")))
                .filter(item -> userId.equals(JsonFields.text(item.path("owner"), "id")))
                .map(item -> JsonFields.text(item, "id"))
                .findFirst();
    }

    @Override
    public String createPlaylist(String name, String description) {
        String userId = currentUserId();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("description", description != null ? description : "");
        body.put("public", false);
        JsonNode created = api.postJson(URI.create(apiBase + "/users/" + encodePath(userId) + "/playlists"),
                body, ApiRequest.JSON, "create-playlist");
        String id = JsonFields.text(created, "id");
        if (id == null) {
            throw new FetchException(NAME, "create-playlist", "Spotify returned a playlist without id");
        }
        log.info("Created Spotify playlist '{}' ({})", name, id);
        return id;
    }

    @Override
    public Optional<Song> lookupIsrc(String isrc) {
        if (isrc == null || isrc.isBlank()) {
            return Optional.empty();
        }
        JsonNode result = api.getJson(search("isrc:" + isrc, 1), "search-isrc");
        JsonNode items = result.path("tracks").path("items");
        if (!items.isArray() || items.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(mapper.songFromPayload(items.get(0)));
    }

    @Override
    public List<Song> searchCatalog(String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        JsonNode result = api.getJson(search(query, Math.max(1, Math.min(limit, 50))), "search-text");
        List<Song> songs = new ArrayList<>();
        for (JsonNode item : result.path("tracks").path("items")) {
            try {
                songs.add(mapper.songFromPayload(item));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping search hit: {}", e.getMessage());
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
            throw new IllegalArgumentException("Spotify accepts at most " + MAX_TRACKS_PER_ADD + " tracks per request");
        }
        List<String> uris = trackIds.stream().map(id -> "spotify:track:" + id).toList();
        api.postJson(URI.create(apiBase + "/playlists/" + encodePath(playlistId) + "/tracks"),
                Map.of("uris", uris), ApiRequest.JSON, "add-tracks");
        log.debug("Added {} tracks to Spotify playlist {}", uris.size(), playlistId);
    }

    @Override
    public int maxTracksPerAddRequest() {
        return MAX_TRACKS_PER_ADD;
    }

    /**
     * Genre-seeded recommendations saved as a new private playlist.
     */
    @Override
    public Optional<Playlist> generatePlaylist(PlaylistSeed seed) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("seed_genres", seed.genres().stream().limit(MAX_SEED_GENRES).collect(Collectors.joining(",")));
        params.put("limit", Integer.toString(Math.min(seed.totalSongs(), MAX_RECOMMENDATIONS)));
        JsonNode data = api.getJson(Urls.withQuery(apiBase + "/recommendations", params), "recommendations");

        List<Song> songs = new ArrayList<>();
        for (JsonNode track : data.path("tracks")) {
            try {
                songs.add(mapper.songFromPayload(track));
            } catch (IllegalArgumentException e) {
                log.debug("Skipping recommendation: {}", e.getMessage());
            }
        }

        String playlistId = createPlaylist(seed.name(), seed.description());
        List<String> ids = songs.stream().map(Song::serviceId).filter(Objects::nonNull).toList();
        for (int from = 0; from < ids.size(); from += MAX_TRACKS_PER_ADD) {
            addTracks(playlistId, ids.subList(from, Math.min(ids.size(), from + MAX_TRACKS_PER_ADD)));
        }
        log.info("Generated Spotify playlist '{}' with {} songs", seed.name(), songs.size());
        return Optional.of(new Playlist(playlistId, seed.name(), seed.description(), songs, NAME, null,
                "https://open.spotify.com/playlist/" + playlistId));
    }

    String currentUserId() {
        String cachedId = authenticator.currentToken().map(t -> t.attribute(USER_ID)).orElse(null);
        if (cachedId != null) {
            return cachedId;
        }
        JsonNode me = api.getJson(URI.create(apiBase + "/me"), "profile");
        String id = JsonFields.text(me, "id");
        if (id == null) {
            throw new FetchException(NAME, "profile", "Spotify profile has no id");
        }
        authenticator.rememberAttribute(USER_ID, id);
        return id;
    }

    private Iterable<JsonNode> ownPlaylistPages() {
        return api.fetchAll(
                Urls.withQuery(apiBase + "/me/playlists", Map.of("limit", Integer.toString(PLAYLIST_PAGE_SIZE))),
                body -> body.get("items"),
                body -> Optional.ofNullable(JsonFields.text(body, "next")));
    }

    private List<Song> songsFrom(String tracksHref) {
        URI start = Urls.withQuery(tracksHref, Map.of("limit", Integer.toString(TRACK_PAGE_SIZE)));
        Iterable<JsonNode> items = api.fetchAll(start,
                body -> body.get("items"),
                body -> Optional.ofNullable(JsonFields.text(body, "next")));
        return PaginatedFetcher.stream(items)
                .filter(mapper::isPlayable)
                .flatMap(item -> {
                    try {
                        return Stream.of(mapper.songFromPayload(item));
                    } catch (IllegalArgumentException e) {
                        log.debug("Skipping playlist item: {}", e.getMessage());
                        return Stream.<Song>empty();
                    }
                })
                .toList();
    }

    private URI search(String query, int limit) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        params.put("type", "track");
        params.put("limit", Integer.toString(limit));
        return Urls.withQuery(apiBase + "/search", params);
    }

    private static String encodePath(String segment) {
        return Urls.encode(segment);
    }
}
