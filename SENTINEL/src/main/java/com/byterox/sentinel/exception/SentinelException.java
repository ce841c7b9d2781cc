package com.byterox.sentinel.exception;

/**
 * Base type for all SENTINEL failures.
 */
public class SentinelException extends RuntimeException {

    public SentinelException(String message) {
        super(message);
    }

    public SentinelException(String message, Throwable cause) {
        super(message, cause);
    }
}
