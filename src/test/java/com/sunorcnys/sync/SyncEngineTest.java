package com.sunorcnys.sync;

import com.sunorcnys.auth.AuthException;
import com.sunorcnys.http.FetchException;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.model.Song;
import com.sunorcnys.model.TokenRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class SyncEngineTest {

    private final SyncEngine engine = new SyncEngine();

    private static Song song(String id, String title, String artist, String isrc) {
        return new Song(id, title, List.of(artist), null, isrc, null);
    }

    @Test
    void emptySourceFailsBeforeAnyCall() {
        FakeMusicService destination = new FakeMusicService(100, null);

        EmptyPlaylistException ex = assertThrows(EmptyPlaylistException.class,
                () -> engine.sync(Playlist.of("Nothing", List.of()), destination));

        assertEquals("sync", ex.getPhase());
        assertTrue(destination.calls.isEmpty());
        assertTrue(destination.tokenEndpoint.requests().isEmpty());
    }

    @Test
    void isrcMatchedSongIsAddedAndUnmatchedIsReported() {
        FakeMusicService destination = new FakeMusicService(100);
        destination.byIsrc.put("USAAA0000001", song("dest-a", "A different title!", "ARTIST", "usaaa0000001"));
        Song b = song("src-b", "Foo", "Nobody", null);

        SyncResult result = engine.sync(Playlist.of("Mix",
                List.of(song("src-a", "A", "Artist", "USAAA0000001"), b)), destination);

        assertEquals(2, result.total());
        assertEquals(1, result.matched());
        assertEquals(1, result.added());
        assertEquals(1, result.unmatched().size());
        assertSame(b, result.unmatched().get(0).song());
        assertEquals(UnmatchedReason.NOT_FOUND, result.unmatched().get(0).reason());
        assertEquals(List.of(List.of("dest-a")), destination.addedChunks);
        assertTrue(result.createdPlaylist());
        assertEquals("created-Mix", result.destinationPlaylistId());
        assertFalse(result.cancelled());
    }

    @Test
    void existingPlaylistIsReused() {
        FakeMusicService destination = new FakeMusicService(100);
        destination.existingPlaylists.put("Mix", "pl-9");
        destination.byIsrc.put("USAAA0000001", song("dest-a", "A", "Artist", "USAAA0000001"));

        SyncResult result = engine.sync(Playlist.of("Mix", List.of(song("s", "A", "Artist", "USAAA0000001"))), destination);

        assertFalse(result.createdPlaylist());
        assertEquals("pl-9", result.destinationPlaylistId());
        assertFalse(destination.calls.stream().anyMatch(c -> c.startsWith("create:")));
    }

    @Test
    void textSearchIsUsedWhenIsrcFails() {
        FakeMusicService destination = new FakeMusicService(100);
        destination.bySearch.put("Get Lucky Daft Punk", List.of(
                song("live", "Get Lucky", "Tribute Band", null),
                song("studio", "Get Lucky", "Daft Punk", null)));

        SyncResult result = engine.sync(Playlist.of("Mix",
                List.of(song("s", "Get Lucky (Radio Edit)", "Daft Punk", "USQX91300108"))), destination);

        assertEquals(1, result.matched());
        assertEquals(List.of(List.of("studio")), destination.addedChunks);
        assertEquals(List.of("find:Mix", "create:Mix", "isrc:USQX91300108", "search:Get Lucky Daft Punk", "add:created-Mix:1"),
                destination.calls);
    }

    @Test
    void candidatesWithConflictingIsrcAreRejected() {
        FakeMusicService destination = new FakeMusicService(100);
        destination.bySearch.put("Song Artist", List.of(song("other", "Song", "Artist", "USBBB0000002")));

        SyncResult result = engine.sync(Playlist.of("Mix", List.of(song("s", "Song", "Artist", "USAAA0000001"))), destination);

        assertEquals(0, result.matched());
        assertEquals(UnmatchedReason.NO_ACCEPTED_CANDIDATE, result.unmatched().get(0).reason());
        assertTrue(destination.addedChunks.isEmpty());
    }

    @Test
    void matchesAreAddedInSourceOrderAndChunkedAtServiceLimit() {
        FakeMusicService destination = new FakeMusicService(20);
        List<Song> songs = new ArrayList<>();
        for (int i = 0; i < 45; i++) {
            String isrc = String.format("USAAA%07d", i);
            destination.byIsrc.put(isrc, song("d" + i, "T" + i, "A", isrc));
            songs.add(song("s" + i, "T" + i, "A", isrc));
        }

        SyncResult result = engine.sync(Playlist.of("Big", songs), destination);

        assertEquals(45, result.added());
        assertEquals(List.of(20, 20, 5), destination.addedChunks.stream().map(List::size).collect(Collectors.toList()));
        List<String> flattened = destination.addedChunks.stream().flatMap(List::stream).collect(Collectors.toList());
        assertEquals(IntStream.range(0, 45).mapToObj(i -> "d" + i).collect(Collectors.toList()), flattened);
    }

    @Test
    void duplicatesAreKeptUnlessSkipped() {
        FakeMusicService destination = new FakeMusicService(100);
        destination.byIsrc.put("USAAA0000001", song("d1", "A", "X", "USAAA0000001"));
        Song s = song("s", "A", "X", "USAAA0000001");
        Playlist source = Playlist.of("Dupes", List.of(s, s));

        assertEquals(2, engine.sync(source, destination).added());

        FakeMusicService second = new FakeMusicService(100);
        second.byIsrc.putAll(destination.byIsrc);
        SyncResult skipped = engine.sync(source, second, SyncOptions.defaults().withSkipDuplicates(true));
        assertEquals(2, skipped.total());
        assertEquals(1, skipped.matched());
        assertEquals(1, skipped.added());
        assertEquals(1, second.calls.stream().filter(c -> c.startsWith("isrc:")).count());
    }

    @Test
    void skippingDuplicatesDropsRepeatedTextOnlySongsBeforeSearch() {
        FakeMusicService destination = new FakeMusicService(100);
        destination.bySearch.put("Foo Bar", List.of(song("d-foo", "Foo", "Bar", null)));
        Playlist source = Playlist.of("Dupes", List.of(
                song("s1", "Foo", "Bar", null),
                song("s2", "Foo (2011 Remaster)", "Bar feat. Baz", null)));

        SyncResult result = engine.sync(source, destination, SyncOptions.defaults().withSkipDuplicates(true));

        assertEquals(1, result.added());
        assertEquals(1, destination.calls.stream().filter(c -> c.startsWith("search:")).count());
    }

    @Test
    void distinctSourceSongsResolvingToOneTrackAreAddedOnce() {
        FakeMusicService destination = new FakeMusicService(100);
        destination.byIsrc.put("USAAA0000001", song("d1", "A", "X", "USAAA0000001"));
        destination.byIsrc.put("USAAA0000002", song("d1", "A", "X", null));
        Playlist source = Playlist.of("Mix", List.of(
                song("s1", "A", "X", "USAAA0000001"),
                song("s2", "A", "X", "USAAA0000002")));

        SyncResult result = engine.sync(source, destination, SyncOptions.defaults().withSkipDuplicates(true));

        assertEquals(2, result.matched());
        assertEquals(1, result.added());
    }

    @Test
    void cancellationBeforeMatchingStopsWithoutAdding() {
        FakeMusicService destination = new FakeMusicService(100);
        destination.byIsrc.put("USAAA0000001", song("d1", "A", "X", "USAAA0000001"));

        SyncResult result = engine.sync(Playlist.of("Mix", List.of(song("s", "A", "X", "USAAA0000001"))), destination,
                SyncOptions.defaults().withCancellation(() -> true));

        assertTrue(result.cancelled());
        assertEquals(0, result.added());
        assertTrue(destination.addedChunks.isEmpty());
    }

    @Test
    void cancellationBetweenChunksKeepsAddedChunks() {
        FakeMusicService destination = new FakeMusicService(2);
        List<Song> songs = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String isrc = String.format("USAAA%07d", i);
            destination.byIsrc.put(isrc, song("d" + i, "T", "A", isrc));
            songs.add(song("s" + i, "T", "A", isrc));
        }
        AtomicInteger chunks = new AtomicInteger();
        destination.onAdd = chunk -> chunks.incrementAndGet();

        SyncResult result = engine.sync(Playlist.of("Mix", songs), destination,
                SyncOptions.defaults().withCancellation(() -> chunks.get() >= 1));

        assertTrue(result.cancelled());
        assertEquals(2, result.added());
        assertEquals(5, result.matched());
        assertEquals(1, destination.addedChunks.size());
    }

    @Test
    void fetchFailurePropagatesAndKeepsEarlierChunks() {
        FakeMusicService destination = new FakeMusicService(1);
        destination.byIsrc.put("USAAA0000001", song("d1", "A", "X", "USAAA0000001"));
        destination.byIsrc.put("USAAA0000002", song("d2", "B", "X", "USAAA0000002"));
        destination.onAdd = chunk -> {
            if (chunk.contains("d2")) {
                throw new FetchException("fake", "add-tracks", "boom", 500, null);
            }
        };

        assertThrows(FetchException.class, () -> engine.sync(Playlist.of("Mix",
                List.of(song("a", "A", "X", "USAAA0000001"), song("b", "B", "X", "USAAA0000002"))), destination));
        assertEquals(List.of(List.of("d1"), List.of("d2")), destination.addedChunks);
    }

    @Test
    void expiredDestinationTokenWithoutRefreshAborts() {
        FakeMusicService destination = new FakeMusicService(100, new TokenRecord("old", null, 0L, List.of()));

        assertThrows(AuthException.class, () -> engine.sync(Playlist.of("Mix", List.of(song("s", "A", "X", null))), destination));
        assertTrue(destination.calls.isEmpty());
    }

    @Test
    void expiredDestinationTokenIsRefreshedFirst() {
        FakeMusicService destination = new FakeMusicService(100, new TokenRecord("old", "rt", 0L, List.of()));
        destination.tokenEndpoint.enqueue(200, "{\"access_token\":\"fresh\",\"expires_in\":3600}");

        engine.sync(Playlist.of("Mix", List.of(song("s", "A", "X", null))), destination);

        assertEquals(1, destination.tokenEndpoint.requests().size());
        assertEquals("fresh", destination.authenticator().currentToken().orElseThrow().getAccessToken());
    }

    @Test
    void summaryMentionsCounts() {
        SyncResult result = new SyncResult("Mix", "tidal", "p", true, 3, 2, null, 2, false);
        assertTrue(result.unmatched().isEmpty());
        assertTrue(result.summary().contains("2/3 matched"));
    }
}
