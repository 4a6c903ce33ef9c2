package com.gomflow.collab.application.service;

import com.gomflow.collab.domain.common.EventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic sweeper: expires stale locks, then sends a heartbeat to every
 * open connection.
 *
 * Usage:
 * <pre>
 * HeartbeatSweeper sweeper = new HeartbeatSweeper(lockManager, broadcaster, Duration.ofSeconds(30), clock);
 * sweeper.start();
 * // on shutdown:
 * sweeper.stop();
 * </pre>
 */
public class HeartbeatSweeper {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatSweeper.class);

    private final OrderLockManager lockManager;
    private final RoomBroadcaster broadcaster;
    private final Duration interval;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> tickTask;
    private volatile boolean running = false;

    public HeartbeatSweeper(OrderLockManager lockManager, RoomBroadcaster broadcaster,
                            Duration interval, Clock clock) {
        this.lockManager = lockManager;
        this.broadcaster = broadcaster;
        this.interval = interval;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-sweeper");
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("Heartbeat sweeper already running");
            return;
        }

        log.info("Starting heartbeat sweeper (interval: {}s)", interval.getSeconds());
        running = true;

        tickTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                tick();
            } catch (RuntimeException e) {
                log.error("Heartbeat tick failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping heartbeat sweeper");
        running = false;

        if (tickTask != null) {
            tickTask.cancel(false);
            tickTask = null;
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One sweep: expire locks, then heartbeat all connections.
     *
     * @return number of locks expired
     */
    public int tick() {
        int expired = lockManager.sweepExpired();
        Instant now = clock.instant();
        int delivered = broadcaster.broadcastAll(EventType.HEARTBEAT, Payloads.heartbeat(now));
        log.debug("Heartbeat: expired={} delivered={}", expired, delivered);
        return expired;
    }

    public boolean isRunning() {
        return running;
    }
}
