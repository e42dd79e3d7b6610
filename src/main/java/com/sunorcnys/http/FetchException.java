package com.sunorcnys.http;

import com.sunorcnys.SyncronusException;

/**
 * Raised when a request exhausts its retries or a response cannot be walked.
 */
public class FetchException extends SyncronusException {

    private final int status;

    public FetchException(String service, String phase, String message) {
        this(service, phase, message, -1, null);
    }

    public FetchException(String service, String phase, String message, int status, Throwable cause) {
        super(service, phase, message, cause);
        this.status = status;
    }

    /**
     * Last HTTP status seen, or -1 when the failure happened below HTTP.
     */
    public int getStatus() {
        return status;
    }
}
