package com.gomflow.collab.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.domain.common.ErrorCode;
import com.gomflow.collab.domain.common.EventType;
import com.gomflow.collab.domain.session.ClientConnection;
import com.gomflow.collab.infrastructure.metrics.CollabMetrics;
import com.gomflow.collab.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Multicasts events to workspace rooms and single connections.
 *
 * Each frame is serialized once and written to every target channel. A failing
 * channel is logged and skipped; it never affects delivery to the others.
 */
public final class RoomBroadcaster {
    private static final Logger log = LoggerFactory.getLogger(RoomBroadcaster.class);

    private final ConnectionRegistry registry;
    private final CollabMetrics metrics;
    private final Clock clock;
    private final AtomicLong seq = new AtomicLong(0);

    public RoomBroadcaster(ConnectionRegistry registry, CollabMetrics metrics, Clock clock) {
        this.registry = registry;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Outbound envelope: {"event", "payload", "ts", "seq"}.
     */
    public record OutboundMessage(String event, JsonNode payload, Instant ts, long seq) {}

    /**
     * Deliver to every connection joined to the workspace.
     *
     * @param excludeUserId when non-null, every connection of this user is skipped
     * @return number of connections written to
     */
    public int broadcast(String workspaceId, EventType event, JsonNode payload, String excludeUserId) {
        String frame = frame(event, payload);
        if (frame == null) {
            return 0;
        }

        int delivered = 0;
        List<ClientConnection> targets = registry.connectionsIn(workspaceId);
        for (ClientConnection target : targets) {
            if (excludeUserId != null && excludeUserId.equals(target.getUserId())) {
                continue;
            }
            if (write(target, frame)) {
                delivered++;
            }
        }

        metrics.recordDeliveries(event.wireName(), delivered);
        log.debug("Broadcast {} to workspace {}: {} of {} connections (exclude={})",
            event.wireName(), workspaceId, delivered, targets.size(), excludeUserId);
        return delivered;
    }

    /**
     * Deliver to every open connection, regardless of workspace.
     */
    public int broadcastAll(EventType event, JsonNode payload) {
        String frame = frame(event, payload);
        if (frame == null) {
            return 0;
        }

        int delivered = 0;
        for (ClientConnection target : registry.allConnections()) {
            if (write(target, frame)) {
                delivered++;
            }
        }
        metrics.recordDeliveries(event.wireName(), delivered);
        return delivered;
    }

    /**
     * Direct reply to one connection.
     */
    public boolean sendTo(ClientConnection target, EventType event, JsonNode payload) {
        String frame = frame(event, payload);
        boolean sent = frame != null && write(target, frame);
        if (sent) {
            metrics.recordDeliveries(event.wireName(), 1);
        }
        return sent;
    }

    public void sendError(ClientConnection target, ErrorCode code, String message) {
        metrics.recordError(code.name());
        sendTo(target, EventType.COLLABORATION_ERROR, Payloads.error(code, message, clock.instant()));
    }

    private String frame(EventType event, JsonNode payload) {
        OutboundMessage message = new OutboundMessage(event.wireName(), payload, clock.instant(), seq.incrementAndGet());
        try {
            return Json.MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} frame: {}", event.wireName(), e.getMessage());
            return null;
        }
    }

    private boolean write(ClientConnection target, String frame) {
        if (!target.getChannel().isOpen()) {
            return false;
        }
        try {
            target.getChannel().send(frame);
            return true;
        } catch (RuntimeException e) {
            log.warn("Send failed on {}: {}", target.getConnectionId(), e.toString());
            return false;
        }
    }
}
