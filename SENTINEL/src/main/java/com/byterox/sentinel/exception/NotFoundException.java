package com.byterox.sentinel.exception;

public class NotFoundException extends SentinelException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
