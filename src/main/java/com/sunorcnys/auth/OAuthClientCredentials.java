package com.sunorcnys.auth;

import java.util.List;

public record OAuthClientCredentials(String clientId, String clientSecret, String redirectUri, List<String> scopes) {

    public OAuthClientCredentials {
        clientId = trimOrNull(clientId);
        clientSecret = trimOrNull(clientSecret);
        redirectUri = trimOrNull(redirectUri);
        scopes = (scopes != null) ? List.copyOf(scopes) : List.of();
        if (clientId == null) {
            throw new IllegalArgumentException("clientId is required");
        }
        if (redirectUri == null) {
            throw new IllegalArgumentException("redirectUri is required");
        }
    }

    public boolean hasSecret() {
        return clientSecret != null;
    }

    @Override
    public String toString() {
        return "OAuthClientCredentials{clientId='" + clientId + "', redirectUri='" + redirectUri + "', scopes=" + scopes + "}";
    }

    private static String trimOrNull(String s) {
        if (s == null) {
            return null;
        }
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
