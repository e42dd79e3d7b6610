package com.sunorcnys;

/**
 * Base for all failures raised by the sync core. Carries the service and phase
 * so a caller can log and retry the whole sync.
 */
public class SyncronusException extends RuntimeException {

    private final String service;
    private final String phase;

    public SyncronusException(String service, String phase, String message) {
        this(service, phase, message, null);
    }

    public SyncronusException(String service, String phase, String message, Throwable cause) {
        super(format(service, phase, message), cause);
        this.service = service;
        this.phase = phase;
    }

    public String getService() {
        return service;
    }

    public String getPhase() {
        return phase;
    }

    private static String format(String service, String phase, String message) {
        StringBuilder sb = new StringBuilder();
        if (service != null && !service.isBlank()) {
            sb.append('[').append(service);
            if (phase != null && !phase.isBlank()) {
                sb.append('/').append(phase);
            }
            sb.append("] ");
        }
        sb.append(message);
        return sb.toString();
    }
}
