package com.sunorcnys.store;

import com.sunorcnys.model.TokenRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Encrypts access and refresh tokens before they reach the delegate store.
 * Expiry, scope and attributes stay readable.
 */
public class EncryptingTokenStore implements TokenStore {

    private static final Logger log = LoggerFactory.getLogger(EncryptingTokenStore.class);

    private final TokenStore delegate;
    private final TokenEncryption encryption;

    public EncryptingTokenStore(TokenStore delegate, TokenEncryption encryption) {
        this.delegate = delegate;
        this.encryption = encryption;
    }

    @Override
    public Optional<TokenRecord> load() {
        Optional<TokenRecord> stored = delegate.load();
        if (stored.isEmpty()) {
            return stored;
        }
        TokenRecord record = stored.get();
        try {
            return Optional.of(record.withTokens(
                    encryption.decrypt(record.getAccessToken()),
                    encryption.decrypt(record.getRefreshToken())));
        } catch (IllegalStateException e) {
            log.warn("Stored tokens could not be decrypted, treating account as signed out: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(TokenRecord record) {
        TokenRecord sealed;
        try {
            sealed = record.withTokens(
                    encryption.encrypt(record.getAccessToken()),
                    encryption.encrypt(record.getRefreshToken()));
        } catch (IllegalStateException e) {
            throw new TokenStoreException(null, "Tokens could not be encrypted", e);
        }
        delegate.save(sealed);
    }

    @Override
    public void clear() {
        delegate.clear();
    }
}
