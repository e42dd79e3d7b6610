package com.sunorcnys.model;

import java.util.List;
import java.util.Locale;

/**
 * A single track as seen by one service. {@code serviceId} is scoped to that service.
 */
public record Song(
        String serviceId,
        String title,
        List<String> artists,
        String album,
        String isrc,
        Integer durationMs
) {

    public Song {
        serviceId = blankToNull(serviceId);
        title = (title != null && !title.isBlank()) ? title.trim() : "Unknown";
        artists = (artists != null) ? List.copyOf(artists.stream()
                .filter(a -> a != null && !a.isBlank())
                .map(String::trim)
                .toList()) : List.of();
        album = blankToNull(album);
        isrc = normalizeIsrc(isrc);
        durationMs = (durationMs != null && durationMs >= 0) ? durationMs : null;
    }

    public boolean hasIsrc() {
        return isrc != null;
    }

    public String primaryArtist() {
        return artists.isEmpty() ? null : artists.get(0);
    }

    /**
     * Copy of this song re-scoped to another service's id.
     */
    public Song withServiceId(String id) {
        return new Song(id, title, artists, album, isrc, durationMs);
    }

    /**
     * ISRCs are compared without hyphens and case-insensitively.
     */
    public static String normalizeIsrc(String isrc) {
        if (isrc == null) {
            return null;
        }
        String normalized = isrc.replace("-", "").trim().toUpperCase(Locale.ROOT);
        return normalized.isEmpty() ? null : normalized;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
