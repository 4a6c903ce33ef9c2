package com.gomflow.collab.application.port.output;

import com.gomflow.collab.domain.lock.OrderLock;

import java.time.Instant;
import java.util.List;

/**
 * Mirror of order edit locks in the durable store, so other readers of order
 * state see the same holder and expiry.
 */
public interface OrderLockRepository {

    /**
     * Record holder and expiry on the order.
     */
    void setLock(OrderLock lock);

    /**
     * Clear holder and expiry on the order.
     */
    void clearLock(String orderId, String workspaceId);

    /**
     * Locks whose expiry is after {@code now}; used to rebuild memory on startup.
     */
    List<OrderLock> findLiveLocks(Instant now);
}
