package com.byterox.sentinel.exception;

/**
 * The scan provider failed for one target, or returned a result that is not normalized.
 */
public class ScanProviderException extends SentinelException {

    private final String target;

    public ScanProviderException(String target, String message) {
        super(message);
        this.target = target;
    }

    public ScanProviderException(String target, String message, Throwable cause) {
        super(message, cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
