package com.gomflow.collab.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * KeyedExecutor - single-writer routing by key.
 *
 * SINGLE-WRITER PER KEY:
 * All tasks for a key are routed to the same single-thread partition, so they
 * run one at a time in submission order. Different keys proceed in parallel
 * up to the partition count.
 *
 * PARTITIONING STRATEGY:
 * - Route by: hash(key) % partitions
 * - Partition count comes from configuration, clamp(cpus, 8, 32) by default
 *
 * INSTANCES:
 * - "conn"     keyed by connection ID (inbound events in arrival order)
 * - "order"    keyed by order ID (lock table and edit versions)
 * - "presence" keyed by user ID (presence writes)
 *
 * Connection lanes may wait on order and presence lanes, and presence lanes on
 * order lanes, never the reverse.
 */
public final class KeyedExecutor {
    private static final Logger log = LoggerFactory.getLogger(KeyedExecutor.class);

    private final String name;
    private final ExecutorService[] partitions;
    private final int partitionCount;
    private final ThreadLocal<Integer> ownedPartition = new ThreadLocal<>();

    public KeyedExecutor(String name, int partitionCount) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be positive: " + partitionCount);
        }
        this.name = name;
        this.partitionCount = partitionCount;
        this.partitions = new ExecutorService[partitionCount];

        for (int i = 0; i < partitionCount; i++) {
            final int partitionIndex = i;
            this.partitions[i] = Executors.newSingleThreadExecutor(runnable -> {
                Thread t = new Thread(() -> {
                    ownedPartition.set(partitionIndex);
                    runnable.run();
                }, name + "-lane-" + partitionIndex);
                t.setDaemon(true);
                return t;
            });
        }

        log.info("KeyedExecutor[{}] initialized with {} partitions", name, partitionCount);
    }

    /**
     * Queue a task on the key's partition.
     */
    public CompletableFuture<Void> execute(String key, Runnable task) {
        return CompletableFuture.runAsync(task, partitions[partitionOf(key)]);
    }

    /**
     * Queue a task on the key's partition and return its result.
     */
    public <T> CompletableFuture<T> submit(String key, Callable<T> task) {
        return CompletableFuture.supplyAsync(() -> invoke(task), partitions[partitionOf(key)]);
    }

    /**
     * Run a task on the key's partition and wait for it.
     *
     * Runs inline when the caller is already that partition's thread. Unchecked
     * exceptions thrown by the task reach the caller unwrapped.
     */
    public <T> T call(String key, Callable<T> task) {
        int partition = partitionOf(key);
        Integer owned = ownedPartition.get();
        if (owned != null && owned == partition) {
            return invoke(task);
        }
        try {
            return CompletableFuture.supplyAsync(() -> invoke(task), partitions[partition]).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    /**
     * Run a void task on the key's partition and wait for it.
     */
    public void run(String key, Runnable task) {
        call(key, () -> {
            task.run();
            return null;
        });
    }

    private static <T> T invoke(Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private int partitionOf(String key) {
        return Math.floorMod(key.hashCode(), partitionCount);
    }

    /**
     * Shutdown all partitions, waiting up to 10 seconds for queued tasks.
     */
    public void shutdown() {
        log.info("Shutting down KeyedExecutor[{}] with {} partitions", name, partitionCount);

        for (ExecutorService partition : partitions) {
            partition.shutdown();
        }

        try {
            for (int i = 0; i < partitionCount; i++) {
                if (!partitions[i].awaitTermination(10, TimeUnit.SECONDS)) {
                    log.warn("KeyedExecutor[{}] partition {} did not terminate in time, forcing shutdown", name, i);
                    partitions[i].shutdownNow();
                }
            }
        } catch (InterruptedException e) {
            log.error("KeyedExecutor[{}] shutdown interrupted", name, e);
            for (ExecutorService partition : partitions) {
                partition.shutdownNow();
            }
            Thread.currentThread().interrupt();
        }
    }

    public String getName() {
        return name;
    }

    public int getPartitionCount() {
        return partitionCount;
    }
}
