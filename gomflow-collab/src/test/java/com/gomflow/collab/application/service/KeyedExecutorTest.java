package com.gomflow.collab.application.service;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for KeyedExecutor.
 *
 * Tests:
 * - Tasks for one key run in submission order
 * - Different keys do not block each other
 * - call() unwraps unchecked exceptions and runs inline on its own lane
 */
class KeyedExecutorTest {

    private KeyedExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new KeyedExecutor("test", 4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Tasks for the same key run in submission order")
    void sameKeyRunsInOrder() {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        List<CompletableFuture<Void>> futures = new ArrayList<>();

        for (int i = 0; i < 200; i++) {
            int value = i;
            futures.add(executor.execute("order-1", () -> seen.add(value)));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertEquals(200, seen.size());
        for (int i = 0; i < 200; i++) {
            assertEquals(i, seen.get(i));
        }
    }

    @Test
    @DisplayName("A blocked key does not hold up a key on another partition")
    void differentKeysProceedIndependently() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        String blockedKey = "a";
        String otherKey = findKeyOnOtherPartition(blockedKey);

        CompletableFuture<Void> blocked = executor.execute(blockedKey, () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        String result = executor.submit(otherKey, () -> "done").get(2, TimeUnit.SECONDS);

        assertEquals("done", result);
        assertFalse(blocked.isDone());
        release.countDown();
        blocked.get(2, TimeUnit.SECONDS);
    }

    @Test
    void call_propagatesUncheckedExceptionUnwrapped() {
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> executor.call("k", () -> {
                throw new IllegalStateException("boom");
            }));

        assertEquals("boom", thrown.getMessage());
    }

    @Test
    void call_runsInlineWhenAlreadyOnSameLane() throws Exception {
        String outer = executor.submit("k", () ->
            executor.call("k", () -> Thread.currentThread().getName())
        ).get(2, TimeUnit.SECONDS);

        assertTrue(outer.startsWith("test-lane-"));
    }

    @Test
    void constructor_rejectsNonPositivePartitionCount() {
        assertThrows(IllegalArgumentException.class, () -> new KeyedExecutor("bad", 0));
    }

    private String findKeyOnOtherPartition(String key) {
        int partition = Math.floorMod(key.hashCode(), executor.getPartitionCount());
        for (int i = 0; i < 100; i++) {
            String candidate = "key-" + i;
            if (Math.floorMod(candidate.hashCode(), executor.getPartitionCount()) != partition) {
                return candidate;
            }
        }
        throw new IllegalStateException("no key on another partition");
    }
}
