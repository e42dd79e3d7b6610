package com.sunorcnys.store;

import com.sunorcnys.model.TokenRecord;

import java.util.Optional;

/**
 * Persists the token record of a single service account.
 * One authenticator owns one store; writes are serialized by that authenticator.
 */
public interface TokenStore {

    Optional<TokenRecord> load();

    void save(TokenRecord record);

    void clear();
}
