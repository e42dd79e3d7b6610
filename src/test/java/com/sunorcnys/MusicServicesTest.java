package com.sunorcnys;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunorcnys.http.ScriptedTransport;
import com.sunorcnys.model.TokenRecord;
import com.sunorcnys.service.MusicService;
import com.sunorcnys.spotify.SpotifyService;
import com.sunorcnys.store.EncryptingTokenStore;
import com.sunorcnys.store.FileTokenStore;
import com.sunorcnys.store.TokenStore;
import com.sunorcnys.tidal.TidalService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class MusicServicesTest {

    @TempDir
    Path tempDir;

    private Config config(Map<String, String> values) {
        Properties p = new Properties();
        p.setProperty("SYNCRONUS_CACHE_DIR", tempDir.toString());
        values.forEach(p::setProperty);
        return Config.from(p, Map.of());
    }

    @Test
    void buildsEachServiceWithItsProvider() {
        Config config = config(Map.of("SPOTIFY_CLIENT_ID", "s-id", "SPOTIFY_CLIENT_SECRET", "s-secret", "TIDAL_CLIENT_ID", "t-id"));

        MusicService spotify = MusicServices.create("Spotify", config, new ScriptedTransport());
        MusicService tidal = MusicServices.create("tidal", config, new ScriptedTransport());

        assertInstanceOf(SpotifyService.class, spotify);
        assertInstanceOf(TidalService.class, tidal);
        assertSame(SpotifyService.PROVIDER, spotify.authenticator().getProvider());
        assertTrue(tidal.authenticator().getProvider().needsPkce());
        assertTrue(tidal.authenticate().orElseThrow().contains("code_challenge="));
    }

    @Test
    void unknownServiceOrMissingClientIdIsRejected() {
        Config config = config(Map.of());
        assertThrows(IllegalArgumentException.class, () -> MusicServices.create("deezer", config, new ScriptedTransport()));
        SyncronusException ex = assertThrows(SyncronusException.class,
                () -> MusicServices.create("spotify", config, new ScriptedTransport()));
        assertEquals("config", ex.getPhase());
    }

    @Test
    void tokensLiveInCacheDirAndAreEncryptedWithMasterKey() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        TokenStore plain = MusicServices.tokenStore("tidal", config(Map.of()), null, mapper);
        assertInstanceOf(FileTokenStore.class, plain);
        assertEquals(tempDir.resolve("tidal_token.json"), ((FileTokenStore) plain).getFile());

        TokenStore encrypted = MusicServices.tokenStore("spotify", config(Map.of("SYNCRONUS_MASTER_KEY", "k")), null, mapper);
        assertInstanceOf(EncryptingTokenStore.class, encrypted);
        encrypted.save(new TokenRecord("secret-access", "secret-refresh", 1L, List.of()));

        String onDisk = Files.readString(tempDir.resolve("spotify_token.json"));
        assertFalse(onDisk.contains("secret-access"));
        assertEquals("secret-access", encrypted.load().orElseThrow().getAccessToken());
    }
}
