package com.gomflow.collab.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

/**
 * Prometheus metrics for the collaboration coordinator.
 *
 * Key Metrics:
 * - collab_connections - Open authenticated sockets
 * - collab_active_locks - Live order locks held in memory
 * - collab_lock_requests_total{outcome} - granted / renewed / contended
 * - collab_lock_releases_total{reason} - released / expired / holder_left
 * - collab_edits_total{outcome} - applied / rejected / failed
 * - collab_events_total{event} - Inbound events dispatched
 * - collab_errors_total{code} - collaboration_error frames sent
 * - collab_broadcast_deliveries_total{event} - Frames written to sockets
 * - collab_handler_latency_seconds{event} - Inbound handler latency
 *
 * Pass a fresh {@link CollectorRegistry} in tests.
 */
public class CollabMetrics {

    private final CollectorRegistry registry;

    private final Gauge connections;
    private final Gauge activeLocks;
    private final Counter lockRequests;
    private final Counter lockReleases;
    private final Counter edits;
    private final Counter events;
    private final Counter errors;
    private final Counter deliveries;
    private final Histogram handlerLatency;

    public CollabMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public CollabMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connections = Gauge.build()
            .name("collab_connections")
            .help("Open authenticated collaboration sockets")
            .register(registry);

        this.activeLocks = Gauge.build()
            .name("collab_active_locks")
            .help("Live order edit locks held in memory")
            .register(registry);

        this.lockRequests = Counter.build()
            .name("collab_lock_requests_total")
            .help("Order lock requests by outcome")
            .labelNames("outcome")
            .register(registry);

        this.lockReleases = Counter.build()
            .name("collab_lock_releases_total")
            .help("Order lock releases by reason")
            .labelNames("reason")
            .register(registry);

        this.edits = Counter.build()
            .name("collab_edits_total")
            .help("Order edits by outcome")
            .labelNames("outcome")
            .register(registry);

        this.events = Counter.build()
            .name("collab_events_total")
            .help("Inbound events dispatched")
            .labelNames("event")
            .register(registry);

        this.errors = Counter.build()
            .name("collab_errors_total")
            .help("collaboration_error frames sent")
            .labelNames("code")
            .register(registry);

        this.deliveries = Counter.build()
            .name("collab_broadcast_deliveries_total")
            .help("Outbound frames written to sockets")
            .labelNames("event")
            .register(registry);

        this.handlerLatency = Histogram.build()
            .name("collab_handler_latency_seconds")
            .help("Inbound event handler latency in seconds")
            .labelNames("event")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0)
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    public void setConnections(int count) {
        connections.set(count);
    }

    public void setActiveLocks(int count) {
        activeLocks.set(count);
    }

    public void recordLockRequest(String outcome) {
        lockRequests.labels(outcome).inc();
    }

    public void recordLockRelease(String reason) {
        lockReleases.labels(reason).inc();
    }

    public void recordEdit(String outcome) {
        edits.labels(outcome).inc();
    }

    public void recordEvent(String event) {
        events.labels(event).inc();
    }

    public void recordError(String code) {
        errors.labels(code).inc();
    }

    public void recordDeliveries(String event, int count) {
        if (count > 0) {
            deliveries.labels(event).inc(count);
        }
    }

    public void recordHandlerLatency(String event, long nanos) {
        handlerLatency.labels(event).observe(nanos / 1_000_000_000.0);
    }
}
