package com.sunorcnys.auth;

import com.sunorcnys.SyncronusException;

/**
 * Raised when a token cannot be obtained: no cached token, no refresh token,
 * or the provider rejected an exchange or refresh.
 */
public class AuthException extends SyncronusException {

    public AuthException(String service, String phase, String message) {
        super(service, phase, message);
    }

    public AuthException(String service, String phase, String message, Throwable cause) {
        super(service, phase, message, cause);
    }
}
