package com.byterox.sentinel.exception;

public class TransportException extends SentinelException {

    private final String channel;

    public TransportException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public TransportException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
