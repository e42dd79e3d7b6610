package com.sunorcnys.mapping;

import com.sunorcnys.model.Song;

import java.util.Objects;

/**
 * Fuzzy fallback: normalized titles equal, the same version markers (live, remix, ...) and primary artists
 * equal. When both durations are known they must also agree within a tolerance.
 */
public class TitleArtistMatcher implements SongMatcher {

    private static final long DEFAULT_DURATION_TOLERANCE_MS = 10_000;

    private final long durationToleranceMs;

    public TitleArtistMatcher() {
        this(DEFAULT_DURATION_TOLERANCE_MS);
    }

    public TitleArtistMatcher(long durationToleranceMs) {
        this.durationToleranceMs = durationToleranceMs;
    }

    @Override
    public boolean matches(Song a, Song b) {
        if (a == null || b == null) {
            return false;
        }
        String titleA = TrackNormalizer.title(a.title());
        String titleB = TrackNormalizer.title(b.title());
        if (titleA == null || titleA.isEmpty() || !titleA.equals(titleB)) {
            return false;
        }
        if (!TrackNormalizer.versionMarkers(a.title()).equals(TrackNormalizer.versionMarkers(b.title()))) {
            return false;
        }
        if (a.primaryArtist() != null && b.primaryArtist() != null
                && !Objects.equals(TrackNormalizer.artist(a.primaryArtist()), TrackNormalizer.artist(b.primaryArtist()))) {
            return false;
        }
        if (a.durationMs() != null && b.durationMs() != null) {
            return Math.abs(a.durationMs() - b.durationMs()) <= durationToleranceMs;
        }
        return true;
    }
}
