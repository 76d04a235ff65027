package com.llestrade.core.model;

/**
 * Job lifecycle: {@code QUEUED -> RUNNING -> SUCCEEDED | FAILED | CANCELLED}, with
 * {@code RUNNING -> CANCELLING -> CANCELLED} for cooperative cancellation.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    CANCELLING,
    CANCELLED,
    FAILED,
    SUCCEEDED;

    public boolean isTerminal() {
        return this == CANCELLED || this == FAILED || this == SUCCEEDED;
    }
}
