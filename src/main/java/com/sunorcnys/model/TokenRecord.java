package com.sunorcnys.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cached OAuth2 tokens for one service account. {@code expiresAt} is absolute epoch millis
 * so a persisted record stays meaningful across restarts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TokenRecord {

    private final String accessToken;
    private final String refreshToken;
    private final long expiresAt;
    private final List<String> scope;
    private final Map<String, String> attributes;

    @JsonCreator
    public TokenRecord(
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("refresh_token") String refreshToken,
            @JsonProperty("expires_at") long expiresAt,
            @JsonProperty("scope") List<String> scope,
            @JsonProperty("attributes") Map<String, String> attributes) {
        this.accessToken = accessToken;
        this.refreshToken = (refreshToken != null && !refreshToken.isBlank()) ? refreshToken : null;
        this.expiresAt = expiresAt;
        this.scope = (scope != null) ? List.copyOf(scope) : List.of();
        this.attributes = (attributes != null) ? Map.copyOf(attributes) : Map.of();
    }

    public TokenRecord(String accessToken, String refreshToken, long expiresAt, List<String> scope) {
        this(accessToken, refreshToken, expiresAt, scope, null);
    }

    @JsonProperty("access_token")
    public String getAccessToken() {
        return accessToken;
    }

    @JsonProperty("refresh_token")
    public String getRefreshToken() {
        return refreshToken;
    }

    @JsonProperty("expires_at")
    public long getExpiresAt() {
        return expiresAt;
    }

    @JsonProperty("scope")
    public List<String> getScope() {
        return scope;
    }

    @JsonProperty("attributes")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, String> getAttributes() {
        return attributes;
    }

    @JsonIgnore
    public boolean hasRefreshToken() {
        return refreshToken != null;
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public TokenRecord withAttribute(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new TokenRecord(accessToken, refreshToken, expiresAt, scope, copy);
    }

    public TokenRecord withTokens(String newAccessToken, String newRefreshToken) {
        return new TokenRecord(newAccessToken, newRefreshToken, expiresAt, scope, attributes);
    }

    @Override
    public String toString() {
        // tokens stay out of logs
        return "TokenRecord{" +
                "expiresAt=" + expiresAt +
                ", hasRefreshToken=" + hasRefreshToken() +
                ", scope=" + scope +
                '}';
    }
}
