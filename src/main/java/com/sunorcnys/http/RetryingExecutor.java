package com.sunorcnys.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Sends one request, replaying it on rate limits and transient failures as allowed by a {@link RetryPolicy}.
 * Any other response, success or client error, is returned for the caller to judge.
 */
public class RetryingExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryingExecutor.class);

    private final String service;
    private final HttpTransport transport;
    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final Clock clock;

    public RetryingExecutor(String service, HttpTransport transport, RetryPolicy policy) {
        this(service, transport, policy, Sleeper.SYSTEM, Clock.systemUTC());
    }

    public RetryingExecutor(String service, HttpTransport transport, RetryPolicy policy, Sleeper sleeper, Clock clock) {
        this.service = service;
        this.transport = transport;
        this.policy = policy;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public String getService() {
        return service;
    }

    /**
     * @param phase short label used in errors, e.g. {@code fetch-page}
     * @throws FetchException when retries or the elapsed budget are exhausted, or the thread is interrupted
     */
    public ApiResponse execute(ApiRequest request, String phase) {
        Instant started = clock.instant();
        int rateLimited = 0;
        int transportFailures = 0;

        while (true) {
            ApiResponse response;
            try {
                response = transport.send(request);
            } catch (IOException e) {
                transportFailures++;
                if (transportFailures > policy.maxTransportRetries()) {
                    throw new FetchException(service, phase,
                            "Request " + request + " failed after " + transportFailures + " attempts: " + e.getMessage(), -1, e);
                }
                log.warn("{} {} failed ({}), retry {}/{}", service, request, e.getMessage(),
                        transportFailures, policy.maxTransportRetries());
                pause(policy.transportDelay(), started, request, phase, -1);
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FetchException(service, phase, "Interrupted during " + request, -1, e);
            }

            if (response.isRateLimited()) {
                rateLimited++;
                if (rateLimited > policy.maxRateLimitRetries()) {
                    throw new FetchException(service, phase,
                            "Rate limit exceeded after " + policy.maxRateLimitRetries() + " retries for " + request,
                            response.status(), null);
                }
                Duration delay = policy.rateLimitDelay(rateLimited, retryHint(response).orElse(null));
                log.warn("{} rate limited on {}, retry {}/{} after {} ms", service, request, rateLimited,
                        policy.maxRateLimitRetries(), delay.toMillis());
                pause(delay, started, request, phase, response.status());
                continue;
            }

            if (response.isServerError()) {
                transportFailures++;
                if (transportFailures > policy.maxTransportRetries()) {
                    throw new FetchException(service, phase,
                            request + " failed with status " + response.status() + ": " + response.bodySnippet(),
                            response.status(), null);
                }
                log.warn("{} {} returned {}, retry {}/{}", service, request, response.status(),
                        transportFailures, policy.maxTransportRetries());
                pause(policy.transportDelay(), started, request, phase, response.status());
                continue;
            }

            return response;
        }
    }

    /**
     * Wait hint from {@code Retry-After} (seconds or HTTP date) or {@code X-RateLimit-Reset} (epoch seconds).
     */
    Optional<Duration> retryHint(ApiResponse response) {
        Optional<String> retryAfter = response.header("Retry-After");
        if (retryAfter.isPresent()) {
            String value = retryAfter.get().trim();
            try {
                double seconds = Double.parseDouble(value);
                return Optional.of(Duration.ofMillis((long) Math.max(0, seconds * 1000)));
            } catch (NumberFormatException e) {
                try {
                    Instant at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
                    return Optional.of(nonNegative(Duration.between(clock.instant(), at)));
                } catch (DateTimeParseException ignored) {
                    log.warn("{} sent unparseable Retry-After: {}", service, value);
                }
            }
        }
        Optional<String> reset = response.header("X-RateLimit-Reset");
        if (reset.isPresent()) {
            try {
                long epochSeconds = Long.parseLong(reset.get().trim());
                return Optional.of(nonNegative(Duration.between(clock.instant(), Instant.ofEpochSecond(epochSeconds))));
            } catch (NumberFormatException | DateTimeException e) {
                log.warn("{} sent unusable X-RateLimit-Reset: {}", service, reset.get());
            }
        }
        return Optional.empty();
    }

    private void pause(Duration delay, Instant started, ApiRequest request, String phase, int status) {
        Duration elapsed = Duration.between(started, clock.instant());
        if (elapsed.plus(delay).compareTo(policy.maxElapsed()) > 0) {
            throw new FetchException(service, phase,
                    "Retry budget of " + policy.maxElapsed().toSeconds() + "s exhausted for " + request, status, null);
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(service, phase, "Interrupted while backing off on " + request, status, e);
        }
    }

    private static Duration nonNegative(Duration d) {
        return d.isNegative() ? Duration.ZERO : d;
    }
}
