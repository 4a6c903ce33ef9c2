package com.gomflow.collab.transport.http;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gomflow.collab.application.service.ConnectionRegistry;
import com.gomflow.collab.application.service.OrderLockManager;
import com.gomflow.collab.util.Json;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.time.Clock;

/**
 * GET /health - liveness plus a summary of live state.
 */
public final class HealthHandler implements HttpHandler {

    private final ConnectionRegistry registry;
    private final OrderLockManager lockManager;
    private final Clock clock;

    public HealthHandler(ConnectionRegistry registry, OrderLockManager lockManager, Clock clock) {
        this.registry = registry;
        this.lockManager = lockManager;
        this.clock = clock;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.put("status", "UP");
        body.put("connections", registry.connectionCount());
        body.put("users", registry.userCount());
        body.put("rooms", registry.roomCount());
        body.put("activeLocks", lockManager.liveLockCount());
        body.put("timestamp", clock.instant().toString());

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.setStatusCode(200);
        exchange.getResponseSender().send(body.toString());
    }
}
