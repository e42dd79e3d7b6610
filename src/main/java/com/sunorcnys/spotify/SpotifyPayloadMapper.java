package com.sunorcnys.spotify;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunorcnys.mapping.ImageSelector;
import com.sunorcnys.mapping.JsonFields;
import com.sunorcnys.mapping.PayloadMapper;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.model.Song;

import java.util.List;

/**
 * Maps Spotify Web API track and playlist objects.
 */
public class SpotifyPayloadMapper implements PayloadMapper {

    /**
     * Accepts a bare track or a playlist item wrapping one under {@code track}.
     */
    @Override
    public Song songFromPayload(JsonNode raw) {
        JsonNode track = (raw != null && raw.path("track").isObject()) ? raw.get("track") : raw;
        if (track == null || !track.isObject()) {
            throw new IllegalArgumentException("Not a Spotify track payload");
        }
        String type = JsonFields.text(track, "type");
        if (type != null && !"track".equals(type)) {
            // podcast episodes share playlists with tracks
            throw new IllegalArgumentException("Unsupported Spotify item type: " + type);
        }
        return new Song(
                JsonFields.text(track, "id"),
                JsonFields.text(track, "name"),
                JsonFields.texts(track.get("artists"), "name"),
                JsonFields.text(track.path("album"), "name"),
                JsonFields.text(track.path("external_ids"), "isrc"),
                JsonFields.integer(track, "duration_ms"));
    }

    @Override
    public Playlist playlistFromPayload(JsonNode raw, List<Song> songs) {
        return new Playlist(
                JsonFields.text(raw, "id"),
                JsonFields.text(raw, "name"),
                JsonFields.text(raw, "description"),
                songs,
                SpotifyService.NAME,
                ImageSelector.largest(raw.get("images")).orElse(null),
                JsonFields.text(raw.path("external_urls"), "spotify"));
    }

    /**
     * Playlist items that carry nothing playable: removed tracks, local files without id.
     */
    boolean isPlayable(JsonNode item) {
        JsonNode track = item.path("track");
        return track.isObject() && !track.path("is_local").asBoolean(false) && JsonFields.text(track, "id") != null;
    }
}
