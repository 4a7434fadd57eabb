package com.example.punchsync.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a device worker's connection.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    BOOTSTRAPPING,
    LIVE,
    RECONNECTING;

    /**
     * Whether the worker state machine allows moving from this state to {@code next}.
     * Entering {@link #DISCONNECTED} is always legal because it is the shutdown state.
     */
    public boolean canTransitionTo(ConnectionState next) {
        return successors().contains(next);
    }

    private Set<ConnectionState> successors() {
        switch (this) {
            case DISCONNECTED:
                return EnumSet.of(CONNECTING, DISCONNECTED);
            case CONNECTING:
                return EnumSet.of(BOOTSTRAPPING, RECONNECTING, DISCONNECTED);
            case BOOTSTRAPPING:
                return EnumSet.of(LIVE, RECONNECTING, DISCONNECTED);
            case LIVE:
                return EnumSet.of(RECONNECTING, DISCONNECTED);
            case RECONNECTING:
                return EnumSet.of(CONNECTING, DISCONNECTED);
            default:
                throw new IllegalStateException("Unknown state " + this);
        }
    }
}
