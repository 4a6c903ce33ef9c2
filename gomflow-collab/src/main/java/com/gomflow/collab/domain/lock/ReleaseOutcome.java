package com.gomflow.collab.domain.lock;

public enum ReleaseOutcome {
    /** Lock removed, persisted and announced. */
    RELEASED,
    /** No lock existed; idempotent no-op. */
    NOT_LOCKED,
    /** A live lock is held by someone else and was left in place. */
    HELD_BY_OTHER
}
