package io.cronkit.core;

public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    FAILURE,
    TIMEOUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
