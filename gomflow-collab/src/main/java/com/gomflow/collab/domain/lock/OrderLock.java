package com.gomflow.collab.domain.lock;

import java.time.Instant;

/**
 * Exclusive, time-boxed edit lock on an order.
 */
public record OrderLock(
    String orderId,
    String workspaceId,
    String userId,
    Instant expiresAt
) {
    /**
     * Live means expiry has not yet passed.
     */
    public boolean isLive(Instant now) {
        return expiresAt.isAfter(now);
    }

    public boolean isHeldBy(String candidateUserId) {
        return userId.equals(candidateUserId);
    }

    public OrderLock extendTo(Instant newExpiry) {
        return new OrderLock(orderId, workspaceId, userId, newExpiry);
    }
}
