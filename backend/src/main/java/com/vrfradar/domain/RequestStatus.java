package com.vrfradar.domain;

/**
 * Lifecycle of a randomness request. Transitions are one-way: PENDING → FULFILLED or PENDING → FAILED.
 */
public enum RequestStatus {
    PENDING,
    FULFILLED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
