package com.sunorcnys;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private Main main() {
        Properties p = new Properties();
        p.setProperty("SYNCRONUS_CACHE_DIR", tempDir.toString());
        p.setProperty("TIDAL_CLIENT_ID", "t-id");
        return new Main(Config.from(p, Map.of()), null);
    }

    @Test
    void unknownCommandOrMissingArgumentsIsUsageError() throws Exception {
        assertEquals(2, main().run(new String[]{"bogus", "tidal"}));
        assertEquals(2, main().run(new String[]{"sync", "tidal", "spotify"}));
        assertEquals(2, main().run(new String[]{"generate", "spotify", "Mix"}));
    }

    @Test
    void playlistsRequireLogin() {
        SyncronusException ex = assertThrows(SyncronusException.class, () -> main().run(new String[]{"playlists", "tidal"}));
        assertEquals("login", ex.getPhase());
    }

    @Test
    void logoutWithoutTokensSucceeds() throws Exception {
        assertEquals(0, main().run(new String[]{"logout", "tidal"}));
    }

    @Test
    void cancellationHookWaitsForSyncToReport() throws Exception {
        AtomicBoolean cancelled = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = Main.cancellationHook(cancelled, finished, Duration.ofSeconds(10));

        hook.start();
        hook.join(200);

        assertTrue(cancelled.get());
        assertTrue(hook.isAlive());

        finished.countDown();
        hook.join(TimeUnit.SECONDS.toMillis(5));
        assertFalse(hook.isAlive());
    }

    @Test
    void cancellationHookGivesUpAfterGrace() throws Exception {
        Thread hook = Main.cancellationHook(new AtomicBoolean(), new CountDownLatch(1), Duration.ofMillis(50));

        hook.start();
        hook.join(TimeUnit.SECONDS.toMillis(5));

        assertFalse(hook.isAlive());
    }
}
