package com.sunorcnys;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunorcnys.http.JdkHttpTransport;
import com.sunorcnys.http.RetryPolicy;
import com.sunorcnys.model.Playlist;
import com.sunorcnys.service.MusicService;
import com.sunorcnys.service.PlaylistSeed;
import com.sunorcnys.store.RedisPools;
import com.sunorcnys.sync.SyncEngine;
import com.sunorcnys.sync.SyncOptions;
import com.sunorcnys.sync.SyncResult;
import com.sunorcnys.sync.UnmatchedSong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Command line entry point.
 * <pre>
 *   login     &lt;service&gt;
 *   logout    &lt;service&gt;
 *   playlists &lt;service&gt;
 *   sync      &lt;from&gt; &lt;to&gt; &lt;playlist name&gt; [--skip-duplicates]
 *   generate  &lt;service&gt; &lt;name&gt; &lt;genre,genre,...&gt; [total]
 * </pre>
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final Duration CALLBACK_TIMEOUT = Duration.ofMinutes(5);
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final Config config;
    private final ObjectMapper mapper = new ObjectMapper();
    private final JedisPool redis;

    Main(Config config, JedisPool redis) {
        this.config = config;
        this.redis = redis;
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            usage();
            System.exit(2);
        }
        Config config = Config.load();
        Optional<JedisPool> redis = RedisPools.connect(config.getRedisHost(), config.getRedisPort(), config.getRedisPassword());
        int exit;
        try {
            exit = new Main(config, redis.orElse(null)).run(args);
        } catch (SyncronusException e) {
            log.error("{}", e.getMessage(), e);
            exit = 1;
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            usage();
            exit = 2;
        } catch (IOException e) {
            log.error("I/O failure: {}", e.getMessage(), e);
            exit = 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted");
            exit = 130;
        } finally {
            redis.ifPresent(JedisPool::close);
        }
        System.exit(exit);
    }

    int run(String[] args) throws IOException, InterruptedException {
        String command = args[0];
        switch (command) {
            case "login":
                login(service(args[1]));
                return 0;
            case "logout":
                service(args[1]).authenticator().logout();
                System.out.println("Logged out of " + args[1]);
                return 0;
            case "playlists":
                listPlaylists(service(args[1]));
                return 0;
            case "sync":
                if (args.length < 4) {
                    usage();
                    return 2;
                }
                return sync(args);
            case "generate":
                if (args.length < 4) {
                    usage();
                    return 2;
                }
                return generate(args);
            default:
                usage();
                return 2;
        }
    }

    private MusicService service(String name) {
        return MusicServices.create(name, config, new JdkHttpTransport(mapper), redis, mapper, RetryPolicy.defaults());
    }

    private void login(MusicService service) throws IOException, InterruptedException {
        Optional<String> url = service.authenticate();
        if (url.isEmpty()) {
            System.out.println("Already logged in to " + service.name());
            return;
        }
        try (OAuthCallbackServer callback = OAuthCallbackServer.start(config.getCallbackPort())) {
            System.out.println("Open this link in your browser and sign in:");
            System.out.println(url.get());
            OAuthCallbackServer.Callback received = callback.await(CALLBACK_TIMEOUT);
            service.authenticator().exchangeCode(received.code(), received.state());
        }
        System.out.println("Logged in to " + service.name());
    }

    private void listPlaylists(MusicService service) {
        requireLogin(service);
        for (Playlist playlist : service.getAllPlaylists()) {
            System.out.printf("%-40s %4d songs  %s%n", playlist.getName(), playlist.getSongs().size(),
                    playlist.getUrl() != null ? playlist.getUrl() : "");
        }
    }

    private int sync(String[] args) {
        MusicService source = service(args[1]);
        MusicService destination = service(args[2]);
        String name = args[3];
        boolean skipDuplicates = Arrays.asList(args).contains("--skip-duplicates");
        requireLogin(source);
        requireLogin(destination);

        Optional<Playlist> playlist = source.getAllPlaylists().stream()
                .filter(p -> name.equals(p.getName()))
                .findFirst();
        if (playlist.isEmpty()) {
            System.err.println("No " + source.name() + " playlist named '" + name + "'");
            return 1;
        }

        AtomicBoolean cancelled = new AtomicBoolean();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = cancellationHook(cancelled, finished, SHUTDOWN_GRACE);
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            SyncResult result = new SyncEngine().sync(playlist.get(), destination,
                    new SyncOptions(skipDuplicates, cancelled::get));
            System.out.println(result.summary());
            for (UnmatchedSong miss : result.unmatched()) {
                System.out.println("  unmatched: " + miss.song() + " (" + miss.reason() + ")");
            }
        } finally {
            finished.countDown();
            if (!cancelled.get()) {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("Shutdown started while sync was finishing: {}", e.getMessage());
                }
            }
        }
        return 0;
    }

    /**
     * Shutdown hook that asks a running sync to stop and holds the JVM open until it has reported,
     * at most for {@code grace}.
     */
    static Thread cancellationHook(AtomicBoolean cancelled, CountDownLatch finished, Duration grace) {
        return new Thread(() -> {
            cancelled.set(true);
            try {
                if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Sync did not stop within {} s", grace.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sync-cancel");
    }

    private int generate(String[] args) {
        MusicService service = service(args[1]);
        requireLogin(service);
        List<String> genres = Arrays.stream(args[3].split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        PlaylistSeed seed = args.length > 4
                ? new PlaylistSeed(args[2], genres, null, Integer.parseInt(args[4]))
                : PlaylistSeed.of(args[2], genres);
        Optional<Playlist> generated = service.generatePlaylist(seed);
        if (generated.isEmpty()) {
            System.err.println(service.name() + " cannot generate playlists");
            return 1;
        }
        System.out.println("Generated " + generated.get());
        return 0;
    }

    private static void requireLogin(MusicService service) {
        Optional<String> url = service.authenticate();
        if (url.isPresent()) {
            throw new SyncronusException(service.name(), "login",
                    "Not logged in, run 'login " + service.name() + "' first");
        }
    }

    private static void usage() {
        System.err.println("usage: syncronus login|logout|playlists <service>");
        System.err.println("       syncronus sync <from> <to> <playlist name> [--skip-duplicates]");
        System.err.println("       syncronus generate <service> <name> <genre,genre,...> [total]");
        System.err.println("services: " + MusicServices.NAMES);
    }
}
