package com.sunorcnys.mapping;

import com.sunorcnys.model.Song;

/**
 * Decides whether two songs from possibly different services are the same recording.
 */
@FunctionalInterface
public interface SongMatcher {

    boolean matches(Song a, Song b);
}
