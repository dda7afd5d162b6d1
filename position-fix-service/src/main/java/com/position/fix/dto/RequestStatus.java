package com.position.fix.dto;

/**
 * Lifecycle of a one-shot fix request. Once a request leaves {@link #PENDING} it never returns.
 */
public enum RequestStatus {
    PENDING,
    COMPLETED,
    EXPIRED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
