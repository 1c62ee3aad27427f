package com.acme.correlation.core;

/**
 * Result observed by a waiter. A wait that times out resolves to {@link #FAILED}.
 */
public enum CallbackOutcome {
    SUCCEEDED,
    FAILED;

    public boolean succeeded() {
        return this == SUCCEEDED;
    }
}
