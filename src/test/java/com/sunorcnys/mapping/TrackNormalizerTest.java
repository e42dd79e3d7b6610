package com.sunorcnys.mapping;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TrackNormalizerTest {

    @Test
    void extractsPrimaryArtist() {
        assertEquals("AC/DC", TrackNormalizer.primaryArtist("AC/DC feat. Someone"));
        assertEquals("A", TrackNormalizer.primaryArtist("A & B"));
        assertEquals("A", TrackNormalizer.primaryArtist("A, B"));
        assertEquals("Daft Punk", TrackNormalizer.primaryArtist("Daft Punk ft. Pharrell Williams"));
    }

    @Test
    void normalizesTitles() {
        assertEquals("back in black", TrackNormalizer.title("Back In Black (Remastered)"));
        assertEquals("heroes", TrackNormalizer.title("\"Heroes\" - 2017 Remaster"));
        assertEquals("rock and roll", TrackNormalizer.title("Rock & Roll [Live]"));
        assertEquals("Cafe", TrackNormalizer.stripDiacritics("Café"));
        assertEquals(TrackNormalizer.title("Déjà Vu"), TrackNormalizer.title("deja vu"));
    }

    @Test
    void searchTextKeepsCaseButDropsDecorations() {
        assertEquals("Get Lucky Daft Punk", TrackNormalizer.searchText("Get Lucky (Radio Edit)", "Daft Punk feat. Pharrell"));
        assertEquals("Intro", TrackNormalizer.searchText("Intro", null));
    }

    @Test
    void versionMarkersComeFromQualifiersOnly() {
        assertEquals(Set.of("live"), TrackNormalizer.versionMarkers("Rock & Roll [Live]"));
        assertEquals(Set.of("remix", "acoustic"), TrackNormalizer.versionMarkers("Tune (Acoustic) - Club Remixed"));
        assertTrue(TrackNormalizer.versionMarkers("Live Forever").isEmpty());
        assertTrue(TrackNormalizer.versionMarkers("Song (2011 Remaster)").isEmpty());
    }
}
