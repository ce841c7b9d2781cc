package com.byterox.sentinel.exception;

public class ActionException extends SentinelException {

    private final String actionType;

    public ActionException(String actionType, String message) {
        super(message);
        this.actionType = actionType;
    }

    public ActionException(String actionType, String message, Throwable cause) {
        super(message, cause);
        this.actionType = actionType;
    }

    public String getActionType() {
        return actionType;
    }
}
