package com.byterox.sentinel.domain.model;

public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
