package com.gomflow.collab.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.lock.LockResult;
import com.gomflow.collab.domain.lock.OrderLock;
import com.gomflow.collab.domain.lock.ReleaseOutcome;
import com.gomflow.collab.domain.workspace.WorkspaceRole;
import com.gomflow.collab.support.CollabHarness;
import com.gomflow.collab.support.CollabHarness.Client;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OrderLockManager.
 *
 * Tests:
 * - Grant, contention and renewal
 * - At most one live lock per order under concurrent requests
 * - Ownership-checked release
 * - Expiry sweep and store failures
 */
class OrderLockManagerTest {

    private static final String WS = "ws-1";
    private static final String ORDER = "order-42";

    private CollabHarness h;
    private OrderLockManager locks;
    private Client alice;
    private Client bob;

    @BeforeEach
    void setUp() {
        h = new CollabHarness();
        h.store.member(WS, "alice", WorkspaceRole.EDITOR)
            .member(WS, "bob", WorkspaceRole.EDITOR);
        locks = h.lockManager;
        alice = h.joined("alice", WS);
        bob = h.joined("bob", WS);
        alice.channel().clear();
        bob.channel().clear();
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    @DisplayName("First request is granted, persisted and announced to everyone but the holder")
    void requestLock_grantsAndBroadcasts() {
        LockResult result = locks.requestLock(ORDER, "alice", WS, 10);

        assertTrue(result.success());
        assertEquals(LockResult.Outcome.GRANTED, result.outcome());
        assertEquals("alice", result.lockedBy());
        assertEquals(CollabHarness.START.plus(Duration.ofMinutes(10)), result.lockedUntil());
        assertTrue(h.store.storedLock(ORDER).isPresent());

        JsonNode announced = bob.channel().lastPayload("order_lock");
        assertNotNull(announced);
        assertEquals(ORDER, announced.path("orderId").asText());
        assertEquals("alice", announced.path("userId").asText());
        assertEquals(0, alice.channel().count("order_lock"));
    }

    @Test
    @DisplayName("Another user's live lock is reported, not replaced")
    void requestLock_contendedReportsHolder() {
        locks.requestLock(ORDER, "alice", WS, 10);

        LockResult result = locks.requestLock(ORDER, "bob", WS, 10);

        assertFalse(result.success());
        assertEquals(LockResult.Outcome.CONTENDED, result.outcome());
        assertEquals("alice", result.lockedBy());
        assertEquals(CollabHarness.START.plus(Duration.ofMinutes(10)), result.lockedUntil());
        assertTrue(locks.isHeldBy(ORDER, "alice"));
        assertEquals(0, alice.channel().count("order_lock"));
    }

    @Test
    @DisplayName("Renewal never shortens the expiry and is not broadcast")
    void requestLock_renewalIsMonotonic() {
        locks.requestLock(ORDER, "alice", WS, 10);
        Instant original = CollabHarness.START.plus(Duration.ofMinutes(10));

        LockResult shorter = locks.requestLock(ORDER, "alice", WS, 1);
        assertEquals(LockResult.Outcome.RENEWED, shorter.outcome());
        assertEquals(original, shorter.lockedUntil());

        h.clock.advance(Duration.ofMinutes(8));
        LockResult longer = locks.requestLock(ORDER, "alice", WS, 5);
        assertTrue(longer.success());
        assertEquals(h.clock.instant().plus(Duration.ofMinutes(5)), longer.lockedUntil());
        assertEquals(longer.lockedUntil(), h.store.storedLock(ORDER).orElseThrow().expiresAt());

        assertEquals(1, bob.channel().count("order_lock"));
    }

    @Test
    @DisplayName("Concurrent requests from many users produce exactly one grant")
    void requestLock_concurrentRequestsAreExclusive() throws Exception {
        int contenders = 16;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LockResult>> results = new ArrayList<>();

        try {
            for (int i = 0; i < contenders; i++) {
                String userId = "user-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return locks.requestLock(ORDER, userId, WS, 5);
                }));
            }
            start.countDown();

            int granted = 0;
            String winner = null;
            for (Future<LockResult> f : results) {
                LockResult r = f.get(5, TimeUnit.SECONDS);
                if (r.success()) {
                    granted++;
                    winner = r.lockedBy();
                }
            }

            assertEquals(1, granted);
            for (Future<LockResult> f : results) {
                assertEquals(winner, f.get().lockedBy());
            }
            assertEquals(1, locks.liveLockCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Only the holder releases a live lock; repeated release is a no-op")
    void releaseLock_checksOwnership() {
        locks.requestLock(ORDER, "alice", WS, 10);

        assertEquals(ReleaseOutcome.HELD_BY_OTHER, locks.releaseLock(ORDER, "bob"));
        assertTrue(locks.isHeldBy(ORDER, "alice"));

        assertEquals(ReleaseOutcome.RELEASED, locks.releaseLock(ORDER, "alice"));
        assertTrue(locks.findLiveLock(ORDER).isEmpty());
        assertTrue(h.store.storedLock(ORDER).isEmpty());

        JsonNode unlock = bob.channel().lastPayload("order_unlock");
        assertEquals("released", unlock.path("reason").asText());
        assertEquals(0, alice.channel().count("order_unlock"));

        assertEquals(ReleaseOutcome.NOT_LOCKED, locks.releaseLock(ORDER, "alice"));
    }

    @Test
    void expiredLock_canBeTakenByAnotherUser() {
        locks.requestLock(ORDER, "alice", WS, 1);
        h.clock.advance(Duration.ofMinutes(2));

        LockResult result = locks.requestLock(ORDER, "bob", WS, 5);

        assertTrue(result.success());
        assertEquals("bob", result.lockedBy());
        assertFalse(locks.isHeldBy(ORDER, "alice"));
    }

    @Test
    @DisplayName("Sweep removes expired locks and announces them to the whole room")
    void sweepExpired_removesAndBroadcasts() {
        locks.requestLock(ORDER, "alice", WS, 1);
        locks.requestLock("order-43", "bob", WS, 30);
        h.clock.advance(Duration.ofMinutes(2));

        int removed = locks.sweepExpired();

        assertEquals(1, removed);
        assertTrue(h.store.storedLock(ORDER).isEmpty());
        assertTrue(h.store.storedLock("order-43").isPresent());
        assertEquals("expired", alice.channel().lastPayload("order_unlock").path("reason").asText());
        assertEquals("expired", bob.channel().lastPayload("order_unlock").path("reason").asText());
        assertEquals(0, locks.sweepExpired());
    }

    @Test
    void sweepExpired_keepsLockWhenStoreClearFails() {
        locks.requestLock(ORDER, "alice", WS, 1);
        h.clock.advance(Duration.ofMinutes(2));
        h.store.failLocks = true;

        assertEquals(0, locks.sweepExpired());
        assertEquals(0, bob.channel().count("order_unlock"));

        h.store.failLocks = false;
        assertEquals(1, locks.sweepExpired());
        assertEquals(1, bob.channel().count("order_unlock"));
    }

    @Test
    @DisplayName("A failed store write leaves no lock and broadcasts nothing")
    void requestLock_persistenceFailureChangesNothing() {
        h.store.failLocks = true;

        assertThrows(PersistenceException.class, () -> locks.requestLock(ORDER, "alice", WS, 5));

        assertTrue(locks.findLiveLock(ORDER).isEmpty());
        assertEquals(0, bob.channel().count("order_lock"));
    }

    @Test
    void releaseAllLocksForUser_honoursWorkspaceFilter() {
        locks.requestLock("order-1", "alice", WS, 5);
        locks.requestLock("order-2", "alice", "ws-2", 5);
        locks.requestLock("order-3", "bob", WS, 5);

        assertEquals(1, locks.releaseAllLocksForUser("alice", WS));
        assertTrue(locks.isHeldBy("order-2", "alice"));
        assertTrue(locks.isHeldBy("order-3", "bob"));
        assertEquals("holder_left", bob.channel().lastPayload("order_unlock").path("reason").asText());

        assertEquals(1, locks.releaseAllLocksForUser("alice", null));
        assertEquals(1, locks.liveLockCount());
    }

    @Test
    void releaseAllLocksForUser_dropsLockEvenWhenStoreFails() {
        locks.requestLock(ORDER, "alice", WS, 5);
        h.store.failLocks = true;

        assertEquals(1, locks.releaseAllLocksForUser("alice", null));

        assertTrue(locks.findLiveLock(ORDER).isEmpty());
        assertEquals(0, bob.channel().count("order_unlock"));
    }

    @Test
    void restore_skipsExpiredLocks() {
        Instant now = h.clock.instant();
        locks.restore(List.of(
            new OrderLock("order-live", WS, "alice", now.plusSeconds(60)),
            new OrderLock("order-dead", WS, "bob", now.minusSeconds(60))
        ));

        assertTrue(locks.isHeldBy("order-live", "alice"));
        assertTrue(locks.findLiveLock("order-dead").isEmpty());
        assertEquals(List.of("order-live"), locks.activeLocks(WS).stream().map(OrderLock::orderId).toList());
    }

    @Test
    void clampMinutes_boundsRequestedDuration() {
        assertEquals(5, locks.clampMinutes(null));
        assertEquals(1, locks.clampMinutes(0));
        assertEquals(1, locks.clampMinutes(-3));
        assertEquals(60, locks.clampMinutes(500));
        assertEquals(15, locks.clampMinutes(15));
    }
}
