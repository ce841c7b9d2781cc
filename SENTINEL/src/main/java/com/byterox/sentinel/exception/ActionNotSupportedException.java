package com.byterox.sentinel.exception;

public class ActionNotSupportedException extends ActionException {

    public ActionNotSupportedException(String actionType) {
        super(actionType, "Unsupported action type: " + actionType);
    }
}
