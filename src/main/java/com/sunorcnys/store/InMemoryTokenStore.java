package com.sunorcnys.store;

import com.sunorcnys.model.TokenRecord;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryTokenStore implements TokenStore {

    private final AtomicReference<TokenRecord> record = new AtomicReference<>();

    public InMemoryTokenStore() {
    }

    public InMemoryTokenStore(TokenRecord initial) {
        record.set(initial);
    }

    @Override
    public Optional<TokenRecord> load() {
        return Optional.ofNullable(record.get());
    }

    @Override
    public void save(TokenRecord value) {
        record.set(value);
    }

    @Override
    public void clear() {
        record.set(null);
    }
}
