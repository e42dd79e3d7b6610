package com.sunorcnys.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunorcnys.http.ApiRequest;
import com.sunorcnys.http.ApiResponse;
import com.sunorcnys.http.HttpTransport;
import com.sunorcnys.http.Urls;
import com.sunorcnys.model.TokenRecord;
import com.sunorcnys.store.TokenStore;
import com.sunorcnys.store.TokenStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the OAuth2 token lifecycle of one service account: authorization URL (optionally PKCE),
 * code exchange, refresh and persistence through a {@link TokenStore}.
 * <p>
 * Exchange and refresh are serialized by a per-instance lock, so one authenticator per account
 * never loses a refreshed token to a concurrent writer.
 */
public class OAuth2Authenticator {

    private static final Logger log = LoggerFactory.getLogger(OAuth2Authenticator.class);

    /** A token this close to expiry is treated as expired. */
    public static final Duration SAFETY_MARGIN = Duration.ofSeconds(60);
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final OAuthProvider provider;
    private final OAuthClientCredentials credentials;
    private final TokenStore store;
    private final HttpTransport transport;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile TokenRecord cached;
    private AuthState pending;

    public OAuth2Authenticator(OAuthProvider provider, OAuthClientCredentials credentials,
                               TokenStore store, HttpTransport transport) {
        this(provider, credentials, store, transport, Clock.systemUTC());
    }

    public OAuth2Authenticator(OAuthProvider provider, OAuthClientCredentials credentials,
                               TokenStore store, HttpTransport transport, Clock clock) {
        this.provider = provider;
        this.credentials = credentials;
        this.store = store;
        this.transport = transport;
        this.clock = clock;
        this.cached = store.load().orElse(null);
        if (cached != null) {
            log.debug("{} token loaded from store, expires at {}", provider.serviceName(), cached.getExpiresAt());
        }
    }

    public String getServiceName() {
        return provider.serviceName();
    }

    public OAuthProvider getProvider() {
        return provider;
    }

    /**
     * Builds the provider authorization URL with a fresh CSRF state.
     * With PKCE a new verifier/challenge pair replaces any previous one.
     */
    public String generateAuthUrl() {
        return generateAuthUrl(Pkce.newState());
    }

    public String generateAuthUrl(String state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", credentials.clientId());
        params.put("response_type", "code");
        params.put("redirect_uri", credentials.redirectUri());
        params.put("scope", String.join(" ", credentials.scopes()));
        if (state != null && !state.isBlank()) {
            params.put("state", state);
        }

        AuthState next;
        if (provider.needsPkce()) {
            String verifier = Pkce.newVerifier();
            String challenge = Pkce.challengeFor(verifier);
            params.put("code_challenge", challenge);
            params.put("code_challenge_method", "S256");
            next = new AuthState(verifier, challenge, state);
        } else {
            next = new AuthState(null, null, state);
        }

        lock.lock();
        try {
            if (pending != null) {
                log.debug("{} replacing outstanding authorization state", provider.serviceName());
            }
            pending = next;
        } finally {
            lock.unlock();
        }
        return Urls.withQuery(provider.authUrl(), params).toString();
    }

    /**
     * Outstanding authorization state, if a URL was generated and not yet exchanged.
     */
    public Optional<AuthState> pendingAuthState() {
        lock.lock();
        try {
            return Optional.ofNullable(pending);
        } finally {
            lock.unlock();
        }
    }

    public TokenRecord exchangeCode(String code) {
        return exchangeCode(code, null);
    }

    /**
     * Exchanges an authorization code for tokens and persists them.
     *
     * @param returnedState the {@code state} echoed on the callback; checked against the outstanding one when given
     */
    public TokenRecord exchangeCode(String code, String returnedState) {
        if (code == null || code.isBlank()) {
            throw new AuthException(provider.serviceName(), "exchange", "Authorization code is missing");
        }
        lock.lock();
        try {
            AuthState state = pending;
            if (provider.needsPkce() && (state == null || state.codeVerifier() == null)) {
                throw new AuthException(provider.serviceName(), "exchange",
                        "No PKCE verifier outstanding, call generateAuthUrl() first");
            }
            if (returnedState != null && (state == null || !returnedState.equals(state.state()))) {
                throw new AuthException(provider.serviceName(), "exchange", "OAuth state mismatch");
            }

            Map<String, String> form = new LinkedHashMap<>();
            form.put("grant_type", "authorization_code");
            form.put("code", code);
            form.put("redirect_uri", credentials.redirectUri());
            form.put("client_id", credentials.clientId());
            if (provider.needsSecretOnExchange()) {
                form.put("client_secret", requireSecret("exchange"));
            }
            if (provider.needsPkce()) {
                form.put("code_verifier", state.codeVerifier());
            }

            JsonNode payload = postToken(form, "exchange");
            TokenRecord record = toRecord(payload, null);
            persist(record);
            cached = record;
            pending = null;
            log.info("{} authorization code exchanged, token valid until {}", provider.serviceName(), record.getExpiresAt());
            return record;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a token with more than {@link #SAFETY_MARGIN} left, refreshing first when needed.
     */
    public TokenRecord ensureValidToken() {
        TokenRecord current = cached;
        if (current == null) {
            throw new AuthException(provider.serviceName(), "ensure-token",
                    "Not authenticated, generate an authorization URL and exchange its code first");
        }
        if (isFresh(current)) {
            return current;
        }
        lock.lock();
        try {
            // another caller may have refreshed while we waited
            current = cached;
            if (current != null && isFresh(current)) {
                return current;
            }
            return doRefresh(current);
        } finally {
            lock.unlock();
        }
    }

    public TokenRecord refresh() {
        lock.lock();
        try {
            return doRefresh(cached);
        } finally {
            lock.unlock();
        }
    }

    /**
     * True iff a token is cached. Expiry does not matter here because it can be refreshed.
     */
    public boolean isAuthenticated() {
        return cached != null;
    }

    public Optional<TokenRecord> currentToken() {
        return Optional.ofNullable(cached);
    }

    /**
     * Stores provider account data (e.g. user id) next to the token.
     */
    public void rememberAttribute(String key, String value) {
        lock.lock();
        try {
            TokenRecord current = cached;
            if (current == null) {
                throw new AuthException(provider.serviceName(), "remember", "Not authenticated");
            }
            TokenRecord updated = current.withAttribute(key, value);
            persist(updated);
            cached = updated;
        } finally {
            lock.unlock();
        }
    }

    public void logout() {
        lock.lock();
        try {
            store.clear();
            cached = null;
            pending = null;
            log.info("{} tokens cleared", provider.serviceName());
        } finally {
            lock.unlock();
        }
    }

    /**
     * A token that cannot be written stays usable in memory until the process exits.
     */
    private void persist(TokenRecord record) {
        try {
            store.save(record);
        } catch (TokenStoreException e) {
            log.warn("{} token kept in memory only: {}", provider.serviceName(), e.getMessage());
        }
    }

    private boolean isFresh(TokenRecord record) {
        return record.getExpiresAt() - clock.millis() > SAFETY_MARGIN.toMillis();
    }

    private TokenRecord doRefresh(TokenRecord current) {
        if (current == null || !current.hasRefreshToken()) {
            throw new AuthException(provider.serviceName(), "refresh", "No refresh token available, re-authentication required");
        }
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", current.getRefreshToken());
        form.put("client_id", credentials.clientId());
        if (provider.needsSecretOnRefresh()) {
            form.put("client_secret", requireSecret("refresh"));
        }

        JsonNode payload = postToken(form, "refresh");
        TokenRecord record = toRecord(payload, current);
        persist(record);
        cached = record;
        log.info("{} access token refreshed, valid until {}", provider.serviceName(), record.getExpiresAt());
        return record;
    }

    private JsonNode postToken(Map<String, String> form, String phase) {
        ApiRequest request = ApiRequest.postForm(URI.create(provider.tokenUrl()), form);
        ApiResponse response;
        try {
            response = transport.send(request);
        } catch (IOException e) {
            throw new AuthException(provider.serviceName(), phase, "Token request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException(provider.serviceName(), phase, "Token request interrupted", e);
        }
        if (!response.isSuccess()) {
            throw new AuthException(provider.serviceName(), phase,
                    "Provider rejected token request with status " + response.status() + ": " + response.bodySnippet());
        }
        JsonNode body = response.body();
        String accessToken = body.path("access_token").asText(null);
        if (accessToken == null || accessToken.isBlank()) {
            throw new AuthException(provider.serviceName(), phase, "Token response has no access_token");
        }
        return body;
    }

    /**
     * @param previous record being refreshed, or null on first exchange
     */
    private TokenRecord toRecord(JsonNode payload, TokenRecord previous) {
        long expiresIn = payload.path("expires_in").asLong(-1);
        if (expiresIn < 0) {
            log.warn("{} token response has no expires_in, assuming {}s", provider.serviceName(), DEFAULT_EXPIRES_IN_SECONDS);
            expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
        }
        long expiresAt = clock.millis() + expiresIn * 1000L;

        String refreshToken = payload.path("refresh_token").asText(null);
        if ((refreshToken == null || refreshToken.isBlank()) && previous != null) {
            // refresh tokens do not always rotate
            refreshToken = previous.getRefreshToken();
        }

        List<String> scope;
        String scopeText = payload.path("scope").asText(null);
        if (scopeText != null && !scopeText.isBlank()) {
            scope = Arrays.stream(scopeText.trim().split("[\\s,]+")).toList();
        } else if (previous != null) {
            scope = previous.getScope();
        } else {
            scope = credentials.scopes();
        }

        Map<String, String> attributes = previous != null ? previous.getAttributes() : null;
        return new TokenRecord(payload.path("access_token").asText(), refreshToken, expiresAt, scope, attributes);
    }

    private String requireSecret(String phase) {
        if (!credentials.hasSecret()) {
            throw new AuthException(provider.serviceName(), phase, "Client secret is required but not configured");
        }
        return credentials.clientSecret();
    }
}
