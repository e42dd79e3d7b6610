package com.sunorcnys.auth;

/**
 * Transient state between building an authorization URL and exchanging its code.
 * {@code codeVerifier} and {@code codeChallenge} are null when the provider does not use PKCE.
 */
public record AuthState(String codeVerifier, String codeChallenge, String state) {
}
