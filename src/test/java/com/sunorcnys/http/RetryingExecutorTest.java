package com.sunorcnys.http;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetryingExecutorTest {

    private static final ApiRequest REQUEST = ApiRequest.get(URI.create("https://api.example.test/items"));

    private MutableClock clock;
    private List<Duration> sleeps;
    private Sleeper sleeper;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        sleeps = new ArrayList<>();
        sleeper = d -> {
            sleeps.add(d);
            clock.advance(d);
        };
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private RetryingExecutor executor(ScriptedTransport transport, RetryPolicy policy) {
        return new RetryingExecutor("test", transport, policy, sleeper, clock);
    }

    @Test
    void rateLimitedRequestIsReplayedWithExponentialBackoff() {
        ScriptedTransport transport = new ScriptedTransport()
                .enqueue(429, "{}")
                .enqueue(429, "{}")
                .enqueue(200, "{\"ok\":true}");

        ApiResponse response = executor(transport, RetryPolicy.defaults()).execute(REQUEST, "fetch");

        assertEquals(200, response.status());
        assertEquals(3, transport.requests().size());
        assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void retryAfterSecondsOverridesBackoff() {
        ScriptedTransport transport = new ScriptedTransport()
                .enqueue(ScriptedTransport.withHeader(ScriptedTransport.json(429, "{}"), "Retry-After", "7"))
                .enqueue(200, "{}");

        executor(transport, RetryPolicy.defaults()).execute(REQUEST, "fetch");

        assertEquals(List.of(Duration.ofSeconds(7)), sleeps);
    }

    @Test
    void retryHintIsCappedAtMaxDelay() {
        ScriptedTransport transport = new ScriptedTransport()
                .enqueue(ScriptedTransport.withHeader(ScriptedTransport.json(429, "{}"), "Retry-After", "3600"))
                .enqueue(200, "{}");

        executor(transport, RetryPolicy.defaults()).execute(REQUEST, "fetch");

        assertEquals(List.of(Duration.ofSeconds(60)), sleeps);
    }

    @Test
    void retryHintReadsHttpDateAndRateLimitReset() {
        RetryingExecutor executor = executor(new ScriptedTransport(), RetryPolicy.defaults());
        String date = DateTimeFormatter.RFC_1123_DATE_TIME.format(clock.instant().plusSeconds(12).atZone(ZoneOffset.UTC));

        ApiResponse byDate = ScriptedTransport.withHeader(ScriptedTransport.json(429, "{}"), "retry-after", date);
        assertEquals(Duration.ofSeconds(12), executor.retryHint(byDate).orElseThrow());

        ApiResponse byReset = ScriptedTransport.withHeader(ScriptedTransport.json(429, "{}"),
                "X-RateLimit-Reset", Long.toString(clock.instant().getEpochSecond() + 4));
        assertEquals(Duration.ofSeconds(4), executor.retryHint(byReset).orElseThrow());

        assertTrue(executor.retryHint(ScriptedTransport.json(429, "{}")).isEmpty());
    }

    @Test
    void outOfRangeRateLimitResetFallsBackToBackoff() {
        ScriptedTransport transport = new ScriptedTransport()
                .enqueue(ScriptedTransport.withHeader(ScriptedTransport.json(429, "{}"),
                        "X-RateLimit-Reset", "99999999999999999"))
                .enqueue(200, "{}");

        ApiResponse response = executor(transport, RetryPolicy.defaults()).execute(REQUEST, "fetch");

        assertEquals(200, response.status());
        assertEquals(List.of(Duration.ofSeconds(1)), sleeps);
    }

    @Test
    void exhaustedRateLimitRetriesRaiseFetchException() {
        RetryPolicy policy = new RetryPolicy(Duration.ofMillis(10), Duration.ofSeconds(1), 2, 0,
                Duration.ZERO, Duration.ofMinutes(1));
        ScriptedTransport transport = new ScriptedTransport(request -> ScriptedTransport.json(429, "{}"));

        FetchException ex = assertThrows(FetchException.class, () -> executor(transport, policy).execute(REQUEST, "fetch"));

        assertEquals(429, ex.getStatus());
        assertEquals("fetch", ex.getPhase());
        assertEquals(3, transport.requests().size());
    }

    @Test
    void serverErrorsAndIoFailuresAreRetriedUpToLimit() {
        ScriptedTransport transport = new ScriptedTransport()
                .enqueue(503, "{}")
                .enqueueFailure(new IOException("connection reset"))
                .enqueue(200, "{}");

        ApiResponse response = executor(transport, RetryPolicy.defaults()).execute(REQUEST, "fetch");

        assertEquals(200, response.status());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(500)), sleeps);
    }

    @Test
    void persistentIoFailureRaisesWithCause() {
        IOException failure = new IOException("unreachable");
        ScriptedTransport transport = new ScriptedTransport(request -> {
            throw failure;
        });

        FetchException ex = assertThrows(FetchException.class,
                () -> executor(transport, RetryPolicy.defaults()).execute(REQUEST, "fetch"));

        assertSame(failure, ex.getCause());
        assertEquals(-1, ex.getStatus());
        assertEquals(4, transport.requests().size());
    }

    @Test
    void clientErrorsAreReturnedWithoutRetry() {
        ScriptedTransport transport = new ScriptedTransport().enqueue(404, "{\"error\":\"missing\"}");

        ApiResponse response = executor(transport, RetryPolicy.defaults()).execute(REQUEST, "fetch");

        assertEquals(404, response.status());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void elapsedBudgetStopsRetrying() {
        RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(10), Duration.ofSeconds(10), 100, 0,
                Duration.ZERO, Duration.ofSeconds(25));
        ScriptedTransport transport = new ScriptedTransport(request -> ScriptedTransport.json(429, "{}"));

        FetchException ex = assertThrows(FetchException.class, () -> executor(transport, policy).execute(REQUEST, "fetch"));

        assertTrue(ex.getMessage().contains("budget"));
        assertEquals(2, sleeps.size());
    }

    @Test
    void interruptedBackoffRestoresFlag() {
        Sleeper interrupting = d -> {
            throw new InterruptedException("stop");
        };
        ScriptedTransport transport = new ScriptedTransport().enqueue(429, "{}");
        RetryingExecutor executor = new RetryingExecutor("test", transport, RetryPolicy.defaults(), interrupting, clock);

        assertThrows(FetchException.class, () -> executor.execute(REQUEST, "fetch"));
        assertTrue(Thread.currentThread().isInterrupted());
    }
}
