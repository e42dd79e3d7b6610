package com.sunorcnys.auth;

/**
 * OAuth2 capability table of one provider. The authenticator reads these flags
 * instead of being subclassed per service.
 */
public record OAuthProvider(
        String serviceName,
        String authUrl,
        String tokenUrl,
        boolean needsPkce,
        boolean needsSecretOnExchange,
        boolean needsSecretOnRefresh
) {

    public OAuthProvider {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName is required");
        }
        if (authUrl == null || authUrl.isBlank() || tokenUrl == null || tokenUrl.isBlank()) {
            throw new IllegalArgumentException("authUrl and tokenUrl are required for " + serviceName);
        }
    }
}
