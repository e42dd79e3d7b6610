package com.sunorcnys.sync;

import com.sunorcnys.mapping.IsrcFirstMatcher;
import com.sunorcnys.mapping.MatchKeys;
import com.sunorcnys.mapping.SongMatcher;
import com.sunorcnys.mapping.TrackNormalizer;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.model.Song;
import com.sunorcnys.service.MusicService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Copies a playlist onto another service: finds or creates the destination playlist by name,
 * resolves every song (ISRC first, then text search) and appends the matches in source order.
 * <p>
 * Auth and fetch failures propagate. Whatever was added before the failure stays added.
 */
public class SyncEngine {

    private static final Logger log = LoggerFactory.getLogger(SyncEngine.class);

    static final int SEARCH_LIMIT = 5;

    private final SongMatcher matcher;

    public SyncEngine() {
        this(new IsrcFirstMatcher());
    }

    public SyncEngine(SongMatcher matcher) {
        this.matcher = matcher;
    }

    public SyncResult sync(Playlist source, MusicService destination) {
        return sync(source, destination, SyncOptions.defaults());
    }

    public SyncResult sync(Playlist source, MusicService destination, SyncOptions options) {
        if (source.isEmpty()) {
            throw new EmptyPlaylistException(destination.name(), source.getName());
        }
        destination.authenticator().ensureValidToken();

        String name = source.getName();
        Optional<String> existing = destination.findPlaylistByName(name);
        boolean created = existing.isEmpty();
        String playlistId = existing.orElseGet(() -> destination.createPlaylist(name, source.getDescription()));
        log.info("Syncing '{}' ({} songs) to {} playlist {}{}", name, source.getSongs().size(),
                destination.name(), playlistId, created ? " (new)" : "");

        List<Song> songs = source.getSongs();
        if (options.skipDuplicates()) {
            songs = MatchKeys.distinct(songs);
            if (songs.size() < source.getSongs().size()) {
                log.debug("Dropped {} repeated songs of '{}' before lookup", source.getSongs().size() - songs.size(), name);
            }
        }

        List<String> trackIds = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        List<UnmatchedSong> unmatched = new ArrayList<>();
        int matched = 0;

        for (Song song : songs) {
            if (options.isCancelled()) {
                log.info("Sync of '{}' cancelled during matching", name);
                return new SyncResult(name, destination.name(), playlistId, created,
                        source.getSongs().size(), matched, unmatched, 0, true);
            }
            Resolution resolution = resolve(song, destination);
            if (resolution.match() == null) {
                log.debug("No {} match for {} ({})", destination.name(), song, resolution.reason());
                unmatched.add(new UnmatchedSong(song, resolution.reason()));
                continue;
            }
            matched++;
            String id = resolution.match().serviceId();
            if (options.skipDuplicates() && !seen.add(id)) {
                log.debug("Skipping duplicate {} track {}", destination.name(), id);
                continue;
            }
            trackIds.add(id);
        }

        int added = 0;
        int chunkSize = Math.max(1, destination.maxTracksPerAddRequest());
        for (int from = 0; from < trackIds.size(); from += chunkSize) {
            if (options.isCancelled()) {
                log.info("Sync of '{}' cancelled after adding {} tracks", name, added);
                return new SyncResult(name, destination.name(), playlistId, created,
                        source.getSongs().size(), matched, unmatched, added, true);
            }
            List<String> chunk = trackIds.subList(from, Math.min(trackIds.size(), from + chunkSize));
            destination.addTracks(playlistId, List.copyOf(chunk));
            added += chunk.size();
        }

        SyncResult result = new SyncResult(name, destination.name(), playlistId, created,
                source.getSongs().size(), matched, unmatched, added, false);
        log.info(result.summary());
        if (!unmatched.isEmpty()) {
            log.warn("{} songs of '{}' have no {} match", unmatched.size(), name, destination.name());
        }
        return result;
    }

    private record Resolution(Song match, UnmatchedReason reason) {}

    private Resolution resolve(Song song, MusicService destination) {
        boolean sawCandidate = false;
        if (song.hasIsrc()) {
            Optional<Song> byIsrc = destination.lookupIsrc(song.isrc());
            if (byIsrc.isPresent()) {
                sawCandidate = true;
                if (acceptable(song, byIsrc.get())) {
                    return new Resolution(byIsrc.get(), null);
                }
            }
        }

        String query = TrackNormalizer.searchText(song.title(), song.primaryArtist());
        if (query != null && !query.isBlank()) {
            for (Song candidate : destination.searchCatalog(query, SEARCH_LIMIT)) {
                sawCandidate = true;
                if (acceptable(song, candidate)) {
                    return new Resolution(candidate, null);
                }
            }
        }
        return new Resolution(null, sawCandidate ? UnmatchedReason.NO_ACCEPTED_CANDIDATE : UnmatchedReason.NOT_FOUND);
    }

    private boolean acceptable(Song wanted, Song candidate) {
        return candidate.serviceId() != null && matcher.matches(wanted, candidate);
    }
}
