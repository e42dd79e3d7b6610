package com.sunorcnys.mapping;

import com.sunorcnys.model.Song;

/**
 * Same track iff both ISRCs are present and equal. Titles and artists are ignored in that case.
 * When either ISRC is absent the fallback matcher decides.
 */
public class IsrcFirstMatcher implements SongMatcher {

    private final SongMatcher fallback;

    public IsrcFirstMatcher() {
        this(new TitleArtistMatcher());
    }

    public IsrcFirstMatcher(SongMatcher fallback) {
        this.fallback = fallback;
    }

    @Override
    public boolean matches(Song a, Song b) {
        if (a == null || b == null) {
            return false;
        }
        if (a.hasIsrc() && b.hasIsrc()) {
            return a.isrc().equals(b.isrc());
        }
        return fallback.matches(a, b);
    }
}
