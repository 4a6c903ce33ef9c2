package com.gomflow.collab.application.service;

import com.gomflow.collab.application.port.output.OrderLockRepository;
import com.gomflow.collab.domain.common.EventType;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.lock.LockResult;
import com.gomflow.collab.domain.lock.OrderLock;
import com.gomflow.collab.domain.lock.ReleaseOutcome;
import com.gomflow.collab.infrastructure.metrics.CollabMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * OrderLockManager - exclusive, time-boxed edit locks on orders.
 *
 * SINGLE-WRITER PER ORDER:
 * Every check-then-set on the lock table runs on the order's lane of the
 * shared order {@link KeyedExecutor}, including sweeps and disconnect cleanup.
 * At most one live lock per order exists at any instant.
 *
 * ORDERING PER MUTATION:
 * 1. Check the in-memory table
 * 2. Persist to the store (abort on failure, nothing broadcast)
 * 3. Update memory
 * 4. Broadcast
 *
 * STATE MACHINE:
 * UNLOCKED -> LOCKED(holder, expiry) on grant
 * LOCKED -> LOCKED(holder, later expiry) on renewal by the holder
 * LOCKED -> UNLOCKED on release, expiry sweep or holder departure
 */
public final class OrderLockManager {
    private static final Logger log = LoggerFactory.getLogger(OrderLockManager.class);

    public static final String REASON_RELEASED = "released";
    public static final String REASON_EXPIRED = "expired";
    public static final String REASON_HOLDER_LEFT = "holder_left";

    private final OrderLockRepository repository;
    private final RoomBroadcaster broadcaster;
    private final KeyedExecutor orderLanes;
    private final CollabMetrics metrics;
    private final Clock clock;
    private final int defaultMinutes;
    private final int maxMinutes;

    // orderId -> lock; may hold expired entries until the next sweep
    private final Map<String, OrderLock> locks = new ConcurrentHashMap<>();

    public OrderLockManager(OrderLockRepository repository,
                            RoomBroadcaster broadcaster,
                            KeyedExecutor orderLanes,
                            CollabMetrics metrics,
                            Clock clock,
                            int defaultMinutes,
                            int maxMinutes) {
        this.repository = repository;
        this.broadcaster = broadcaster;
        this.orderLanes = orderLanes;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultMinutes = defaultMinutes;
        this.maxMinutes = maxMinutes;
    }

    /**
     * Load live locks from the store on startup.
     */
    public void restore(List<OrderLock> liveLocks) {
        Instant now = clock.instant();
        for (OrderLock lock : liveLocks) {
            if (lock.isLive(now)) {
                locks.put(lock.orderId(), lock);
            }
        }
        metrics.setActiveLocks(locks.size());
        log.info("OrderLockManager restored {} live locks", locks.size());
    }

    /**
     * Grant, renew or refuse a lock.
     *
     * Contention is a failed {@link LockResult}, not an exception.
     *
     * @param durationMinutes requested duration; null means the configured default
     * @throws PersistenceException if the store write fails; memory is unchanged
     */
    public LockResult requestLock(String orderId, String userId, String workspaceId, Integer durationMinutes) {
        Duration duration = Duration.ofMinutes(clampMinutes(durationMinutes));

        return orderLanes.call(orderId, () -> {
            Instant now = clock.instant();
            OrderLock current = locks.get(orderId);

            if (current != null && current.isLive(now)) {
                if (!current.isHeldBy(userId)) {
                    metrics.recordLockRequest("contended");
                    log.debug("Lock contended: order={} requester={} holder={}", orderId, userId, current.userId());
                    return LockResult.contended(current);
                }

                // Renewal never shortens the expiry
                Instant candidate = now.plus(duration);
                if (!candidate.isAfter(current.expiresAt())) {
                    metrics.recordLockRequest("renewed");
                    return LockResult.renewed(current);
                }
                OrderLock renewed = current.extendTo(candidate);
                repository.setLock(renewed);
                locks.put(orderId, renewed);
                metrics.recordLockRequest("renewed");
                log.debug("Lock renewed: order={} user={} until={}", orderId, userId, candidate);
                return LockResult.renewed(renewed);
            }

            OrderLock lock = new OrderLock(orderId, workspaceId, userId, now.plus(duration));
            repository.setLock(lock);
            locks.put(orderId, lock);
            metrics.recordLockRequest("granted");
            metrics.setActiveLocks(locks.size());
            log.info("Lock granted: order={} user={} workspace={} until={}", orderId, userId, workspaceId, lock.expiresAt());

            broadcaster.broadcast(workspaceId, EventType.ORDER_LOCK, Payloads.orderLock(lock, now), userId);
            return LockResult.granted(lock);
        });
    }

    /**
     * Release a lock.
     *
     * Absent locks are a no-op. A live lock held by another user is left in
     * place. Expired locks may be released by anyone.
     */
    public ReleaseOutcome releaseLock(String orderId, String userId) {
        return orderLanes.call(orderId, () -> {
            Instant now = clock.instant();
            OrderLock current = locks.get(orderId);

            if (current == null) {
                return ReleaseOutcome.NOT_LOCKED;
            }
            if (current.isLive(now) && !current.isHeldBy(userId)) {
                log.debug("Release refused: order={} requester={} holder={}", orderId, userId, current.userId());
                return ReleaseOutcome.HELD_BY_OTHER;
            }

            repository.clearLock(orderId, current.workspaceId());
            locks.remove(orderId, current);
            metrics.recordLockRelease(REASON_RELEASED);
            metrics.setActiveLocks(locks.size());
            log.info("Lock released: order={} user={}", orderId, userId);

            broadcaster.broadcast(current.workspaceId(), EventType.ORDER_UNLOCK,
                Payloads.orderUnlock(current, userId, REASON_RELEASED, now), userId);
            return ReleaseOutcome.RELEASED;
        });
    }

    /**
     * Release every lock held by a user, optionally limited to one workspace.
     *
     * Runs during leave and disconnect cleanup, so a store failure does not stop
     * it: the lock is dropped from memory, logged, and not announced.
     *
     * @param workspaceId null for all workspaces
     * @return number of locks dropped
     */
    public int releaseAllLocksForUser(String userId, String workspaceId) {
        int released = releaseLocksForUser(userId,
            lockWorkspace -> workspaceId == null || workspaceId.equals(lockWorkspace));
        if (released > 0) {
            log.info("Released {} locks for user {} (workspace={})", released, userId, workspaceId);
        }
        return released;
    }

    /**
     * Release every lock held by a user in the workspaces the filter accepts.
     *
     * @return number of locks dropped
     */
    public int releaseLocksForUser(String userId, Predicate<String> workspaceFilter) {
        int released = 0;
        for (OrderLock candidate : snapshot()) {
            if (!candidate.isHeldBy(userId) || !workspaceFilter.test(candidate.workspaceId())) {
                continue;
            }
            boolean dropped = orderLanes.call(candidate.orderId(), () -> dropHeldLock(candidate.orderId(), userId));
            if (dropped) {
                released++;
            }
        }
        return released;
    }

    private boolean dropHeldLock(String orderId, String userId) {
        OrderLock current = locks.get(orderId);
        if (current == null || !current.isHeldBy(userId)) {
            return false;
        }

        Instant now = clock.instant();
        boolean persisted = true;
        try {
            repository.clearLock(orderId, current.workspaceId());
        } catch (PersistenceException e) {
            persisted = false;
            log.warn("Lock clear failed for order {} held by departing user {}: {}", orderId, userId, e.getMessage());
        }

        locks.remove(orderId, current);
        metrics.recordLockRelease(REASON_HOLDER_LEFT);
        metrics.setActiveLocks(locks.size());

        if (persisted) {
            broadcaster.broadcast(current.workspaceId(), EventType.ORDER_UNLOCK,
                Payloads.orderUnlock(current, userId, REASON_HOLDER_LEFT, now), userId);
        }
        return true;
    }

    /**
     * Remove every lock whose expiry has passed.
     *
     * A lock whose store clear fails stays in the table (already not live) and
     * is retried on the next sweep.
     *
     * @return number of locks removed
     */
    public int sweepExpired() {
        Instant cutoff = clock.instant();
        int removed = 0;
        for (OrderLock candidate : snapshot()) {
            if (candidate.isLive(cutoff)) {
                continue;
            }
            boolean swept = orderLanes.call(candidate.orderId(), () -> sweepOne(candidate.orderId()));
            if (swept) {
                removed++;
            }
        }
        if (removed > 0) {
            metrics.setActiveLocks(locks.size());
            log.info("Sweep removed {} expired locks ({} remaining)", removed, locks.size());
        }
        return removed;
    }

    private boolean sweepOne(String orderId) {
        Instant now = clock.instant();
        OrderLock current = locks.get(orderId);
        if (current == null || current.isLive(now)) {
            return false;
        }

        try {
            repository.clearLock(orderId, current.workspaceId());
        } catch (PersistenceException e) {
            log.warn("Expired lock clear failed for order {}, retrying next sweep: {}", orderId, e.getMessage());
            return false;
        }

        locks.remove(orderId, current);
        metrics.recordLockRelease(REASON_EXPIRED);
        broadcaster.broadcast(current.workspaceId(), EventType.ORDER_UNLOCK,
            Payloads.orderUnlock(current, current.userId(), REASON_EXPIRED, now), null);
        return true;
    }

    // ═══════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════

    /**
     * True if the user holds the live lock. Callers on the order's lane see a
     * consistent answer.
     */
    public boolean isHeldBy(String orderId, String userId) {
        OrderLock current = locks.get(orderId);
        return current != null && current.isLive(clock.instant()) && current.isHeldBy(userId);
    }

    public Optional<OrderLock> findLiveLock(String orderId) {
        OrderLock current = locks.get(orderId);
        if (current == null || !current.isLive(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(current);
    }

    /**
     * Live locks in a workspace, for the join snapshot.
     */
    public List<OrderLock> activeLocks(String workspaceId) {
        Instant now = clock.instant();
        List<OrderLock> result = new ArrayList<>();
        for (OrderLock lock : locks.values()) {
            if (lock.workspaceId().equals(workspaceId) && lock.isLive(now)) {
                result.add(lock);
            }
        }
        return result;
    }

    public int liveLockCount() {
        Instant now = clock.instant();
        int count = 0;
        for (OrderLock lock : locks.values()) {
            if (lock.isLive(now)) {
                count++;
            }
        }
        return count;
    }

    int clampMinutes(Integer requested) {
        if (requested == null) {
            return Math.min(defaultMinutes, maxMinutes);
        }
        return Math.max(1, Math.min(maxMinutes, requested));
    }

    private List<OrderLock> snapshot() {
        return new ArrayList<>(locks.values());
    }
}
