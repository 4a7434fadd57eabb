package com.example.punchsync.model;

/**
 * Result of a conflict-tolerant punch insert. {@link #ALREADY_EXISTS} is an expected
 * outcome for retransmitted punches, not an error.
 */
public enum InsertOutcome {
    INSERTED,
    ALREADY_EXISTS
}
