package com.sunorcnys.store;

import com.sunorcnys.SyncronusException;

/**
 * Raised when a token record cannot be written to its backing store.
 */
public class TokenStoreException extends SyncronusException {

    public static final String PHASE = "persist";

    public TokenStoreException(String account, String message, Throwable cause) {
        super(account, PHASE, message, cause);
    }
}
