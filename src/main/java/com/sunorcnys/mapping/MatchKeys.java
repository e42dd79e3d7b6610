package com.sunorcnys.mapping;

import com.sunorcnys.model.Song;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class MatchKeys {

    private MatchKeys() {}

    /**
     * {@code isrc:<ISRC>} when known, else {@code text:<title>|<primary artist>} normalized.
     */
    public static String of(Song song) {
        if (song.hasIsrc()) {
            return "isrc:" + song.isrc();
        }
        String artist = TrackNormalizer.artist(song.primaryArtist());
        return "text:" + TrackNormalizer.title(song.title()) + "|" + (artist == null ? "" : artist);
    }

    /**
     * Drops later songs whose match key was already seen, keeping first occurrences in order.
     */
    public static List<Song> distinct(List<Song> songs) {
        Set<String> seen = new HashSet<>();
        List<Song> result = new ArrayList<>(songs.size());
        for (Song song : songs) {
            if (seen.add(of(song))) {
                result.add(song);
            }
        }
        return result;
    }
}
