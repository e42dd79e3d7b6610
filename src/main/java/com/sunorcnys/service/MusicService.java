package com.sunorcnys.service;

import com.sunorcnys.auth.AuthException;
import com.sunorcnys.auth.OAuth2Authenticator;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.model.Song;
import com.sunorcnys.model.TokenRecord;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * One streaming service as seen by the sync engine. The engine only ever dispatches through this interface.
 */
public interface MusicService {

    String name();

    OAuth2Authenticator authenticator();

    /**
     * @return empty when a usable token is available, otherwise the URL the user has to visit
     */
    default Optional<String> authenticate() {
        OAuth2Authenticator auth = authenticator();
        if (auth.isAuthenticated()) {
            try {
                auth.ensureValidToken();
                return Optional.empty();
            } catch (AuthException e) {
                LoggerFactory.getLogger(MusicService.class).warn("{} token unusable ({}), re-authorization needed", name(), e.getMessage());
            }
        }
        return Optional.of(auth.generateAuthUrl());
    }

    default TokenRecord exchangeCode(String code) {
        return authenticator().exchangeCode(code);
    }

    /**
     * All playlists of the signed-in user, each with its songs in order.
     */
    List<Playlist> getAllPlaylists();

    /**
     * Id of a playlist owned by the user with exactly this name.
     */
    Optional<String> findPlaylistByName(String name);

    /**
     * @return id of the new playlist
     */
    String createPlaylist(String name, String description);

    /**
     * Catalog track carrying this ISRC, with its service id. Empty when the catalog has none.
     */
    Optional<Song> lookupIsrc(String isrc);

    /**
     * Free-text catalog search, best candidates first.
     */
    List<Song> searchCatalog(String query, int limit);

    /**
     * Appends tracks in the given order. Callers keep each call within {@link #maxTracksPerAddRequest()}.
     */
    void addTracks(String playlistId, List<String> trackIds);

    int maxTracksPerAddRequest();

    /**
     * Builds a new playlist from seed data. Empty when the service cannot generate playlists.
     */
    default Optional<Playlist> generatePlaylist(PlaylistSeed seed) {
        return Optional.empty();
    }
}
