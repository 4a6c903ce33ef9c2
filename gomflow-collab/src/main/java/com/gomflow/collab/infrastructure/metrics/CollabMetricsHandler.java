package com.gomflow.collab.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics - the collaboration counters, gauges and handler latencies in
 * Prometheus text format.
 *
 * Scrapers may narrow the output with repeated {@code name[]} parameters,
 * e.g. {@code /metrics?name[]=collab_connections&name[]=collab_active_locks}.
 */
public class CollabMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(CollabMetricsHandler.class);

    private final CollectorRegistry registry;

    public CollabMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        StringWriter body = new StringWriter();
        try {
            TextFormat.write004(body, names.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("Metrics scrape failed: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("metrics unavailable");
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(body.toString());
        log.debug("Metrics scrape served {} chars (filter={})", body.getBuffer().length(), names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Collections.emptySet() : new HashSet<>(values);
    }
}
