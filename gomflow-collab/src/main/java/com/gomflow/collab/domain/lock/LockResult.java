package com.gomflow.collab.domain.lock;

import java.time.Instant;

/**
 * Outcome of a lock request. A failed result is ordinary contention, not an error.
 */
public record LockResult(
    boolean success,
    Outcome outcome,
    String lockedBy,
    Instant lockedUntil,
    String message
) {
    public enum Outcome {
        GRANTED,
        RENEWED,
        CONTENDED
    }

    public static LockResult granted(OrderLock lock) {
        return new LockResult(true, Outcome.GRANTED, lock.userId(), lock.expiresAt(), "Order locked successfully");
    }

    public static LockResult renewed(OrderLock lock) {
        return new LockResult(true, Outcome.RENEWED, lock.userId(), lock.expiresAt(), "Lock extended");
    }

    public static LockResult contended(OrderLock current) {
        return new LockResult(false, Outcome.CONTENDED, current.userId(), current.expiresAt(),
            "Order is already locked by another user");
    }
}
