package com.sunorcnys.tidal;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunorcnys.mapping.ImageSelector;
import com.sunorcnys.mapping.JsonFields;
import com.sunorcnys.mapping.PayloadMapper;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.model.Song;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps TIDAL Open API (JSON:API) documents. A track document carries the track under {@code data}
 * and its artists and album under {@code included}.
 */
public class TidalPayloadMapper implements PayloadMapper {

    static final String LISTEN_URL = "https://listen.tidal.com/playlist/";

    @Override
    public Song songFromPayload(JsonNode raw) {
        JsonNode data = primary(raw);
        if (data == null || !"tracks".equals(JsonFields.text(data, "type"))) {
            throw new IllegalArgumentException("Not a TIDAL track resource");
        }
        JsonNode attributes = data.path("attributes");
        JsonNode included = raw.path("included");

        Map<String, JsonNode> byKey = new LinkedHashMap<>();
        for (JsonNode resource : included) {
            byKey.put(resourceKey(resource), resource);
        }

        List<String> artists = new ArrayList<>();
        JsonNode artistRefs = data.path("relationships").path("artists").path("data");
        if (artistRefs.isArray() && !artistRefs.isEmpty()) {
            for (JsonNode ref : artistRefs) {
                JsonNode artist = byKey.get(resourceKey(ref));
                String name = artist != null ? JsonFields.text(artist.path("attributes"), "name") : null;
                if (name != null) {
                    artists.add(name);
                }
            }
        }
        if (artists.isEmpty()) {
            for (JsonNode resource : included) {
                if ("artists".equals(JsonFields.text(resource, "type"))) {
                    String name = JsonFields.text(resource.path("attributes"), "name");
                    if (name != null) {
                        artists.add(name);
                    }
                }
            }
        }

        String album = null;
        for (JsonNode resource : included) {
            if ("albums".equals(JsonFields.text(resource, "type"))) {
                album = JsonFields.text(resource.path("attributes"), "title");
                break;
            }
        }

        return new Song(
                JsonFields.text(data, "id"),
                JsonFields.text(attributes, "title"),
                artists,
                album,
                JsonFields.text(attributes, "isrc"),
                durationMillis(attributes.get("duration")));
    }

    @Override
    public Playlist playlistFromPayload(JsonNode raw, List<Song> songs) {
        JsonNode data = primary(raw);
        if (data == null) {
            throw new IllegalArgumentException("Not a TIDAL playlist resource");
        }
        JsonNode attributes = data.path("attributes");
        String id = JsonFields.text(data, "id");
        String cover = ImageSelector.largest(attributes.get("imageLinks"),
                image -> image.get("meta"),
                image -> JsonFields.text(image, "href")).orElse(null);
        return new Playlist(
                id,
                JsonFields.text(attributes, "name"),
                JsonFields.text(attributes, "description"),
                songs,
                TidalService.NAME,
                cover,
                id != null ? LISTEN_URL + id : null);
    }

    /**
     * ISO-8601 ({@code PT3M25S}) or a plain number of seconds.
     */
    static Integer durationMillis(JsonNode duration) {
        if (duration == null || duration.isNull()) {
            return null;
        }
        if (duration.isNumber()) {
            return (int) (duration.asDouble() * 1000);
        }
        try {
            return Math.toIntExact(Duration.parse(duration.asText()).toMillis());
        } catch (DateTimeParseException | ArithmeticException e) {
            return null;
        }
    }

    private static JsonNode primary(JsonNode raw) {
        if (raw == null) {
            return null;
        }
        JsonNode data = raw.get("data");
        if (data != null && data.isObject()) {
            return data;
        }
        return raw.isObject() && raw.has("type") ? raw : null;
    }

    private static String resourceKey(JsonNode resource) {
        return JsonFields.text(resource, "type") + "/" + JsonFields.text(resource, "id");
    }
}
