package com.sunorcnys.mapping;

import com.sunorcnys.model.Song;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SongMatcherTest {

    private static Song song(String title, String artist, String isrc, Integer durationMs) {
        return new Song(null, title, artist == null ? List.of() : List.of(artist), null, isrc, durationMs);
    }

    @Test
    void equalIsrcMatchesRegardlessOfText() {
        SongMatcher matcher = new IsrcFirstMatcher();
        assertTrue(matcher.matches(song("One More Time", "Daft Punk", "GBDUW0000053", 320_000),
                song("One More Time - Radio Edit", "Someone Else", "gb-duw-00-00053", 200_000)));
    }

    @Test
    void differentIsrcNeverMatchesEvenWithSameText() {
        SongMatcher matcher = new IsrcFirstMatcher();
        assertFalse(matcher.matches(song("Song", "Artist", "USAAA0000001", null),
                song("Song", "Artist", "USAAA0000002", null)));
    }

    @Test
    void missingIsrcFallsBackToTitleAndArtist() {
        SongMatcher matcher = new IsrcFirstMatcher();
        assertTrue(matcher.matches(song("Back In Black (Remastered)", "AC/DC", null, 255_000),
                song("Back in Black", "AC/DC feat. Nobody", "AUAP08000046", 255_500)));
        assertFalse(matcher.matches(song("Back In Black", "AC/DC", null, null),
                song("Back In Black", "Shakira", null, null)));
    }

    @Test
    void durationToleranceRejectsDifferentCuts() {
        TitleArtistMatcher matcher = new TitleArtistMatcher(5_000);
        assertTrue(matcher.matches(song("Song", "A", null, 200_000), song("Song", "A", null, 204_000)));
        assertFalse(matcher.matches(song("Song", "A", null, 200_000), song("Song", "A", null, 260_000)));
        assertTrue(matcher.matches(song("Song", "A", null, null), song("Song", "A", null, 260_000)));
    }

    @Test
    void versionMarkersSeparateLiveAndRemixCutsWithoutDurations() {
        TitleArtistMatcher matcher = new TitleArtistMatcher();
        assertFalse(matcher.matches(song("Song (Live)", "A", null, null), song("Song", "A", null, null)));
        assertFalse(matcher.matches(song("Song - Remix", "A", null, null), song("Song [Live]", "A", null, null)));
        assertTrue(matcher.matches(song("Song (Live at Wembley)", "A", null, null), song("Song - Live", "A", null, null)));
        assertTrue(matcher.matches(song("Song (2011 Remaster)", "A", null, null), song("Song", "A", null, null)));
        assertTrue(matcher.matches(song("Live Forever", "Oasis", null, null), song("Live Forever", "Oasis", null, null)));
    }

    @Test
    void fallbackIsPluggable() {
        SongMatcher never = (a, b) -> false;
        assertFalse(new IsrcFirstMatcher(never).matches(song("X", "Y", null, null), song("X", "Y", null, null)));
    }
}
