package com.sunorcnys.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.model.Song;

import java.util.List;

/**
 * Pure conversion of one service's payloads into canonical values. No I/O.
 */
public interface PayloadMapper {

    /**
     * @throws IllegalArgumentException when the payload is not a track at all
     */
    Song songFromPayload(JsonNode raw);

    Playlist playlistFromPayload(JsonNode raw, List<Song> songs);
}
