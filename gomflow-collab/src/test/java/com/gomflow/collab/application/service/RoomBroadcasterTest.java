package com.gomflow.collab.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.domain.common.ErrorCode;
import com.gomflow.collab.domain.common.EventType;
import com.gomflow.collab.domain.session.ClientChannel;
import com.gomflow.collab.domain.session.ClientConnection;
import com.gomflow.collab.domain.workspace.WorkspaceRole;
import com.gomflow.collab.infrastructure.metrics.CollabMetrics;
import com.gomflow.collab.support.CollabHarness;
import com.gomflow.collab.support.InMemoryCollabStore;
import com.gomflow.collab.support.MutableClock;
import com.gomflow.collab.support.RecordingChannel;
import com.gomflow.collab.util.Json;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RoomBroadcasterTest {

    @Mock
    private ClientChannel brokenChannel;

    private ConnectionRegistry registry;
    private RoomBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        InMemoryCollabStore store = new InMemoryCollabStore()
            .member("ws-1", "alice", WorkspaceRole.EDITOR)
            .member("ws-1", "bob", WorkspaceRole.EDITOR)
            .member("ws-2", "carol", WorkspaceRole.EDITOR);
        registry = new ConnectionRegistry(store);
        broadcaster = new RoomBroadcaster(registry, new CollabMetrics(new CollectorRegistry()),
            MutableClock.at("2026-03-02T09:00:00Z"));
    }

    private RecordingChannel joined(String connectionId, String userId, String workspaceId) {
        RecordingChannel channel = new RecordingChannel(connectionId);
        ClientConnection c = new ClientConnection(connectionId, userId, channel, CollabHarness.START);
        registry.register(c);
        registry.join(c, workspaceId);
        return channel;
    }

    @Test
    @DisplayName("Excluding a user skips every one of their connections")
    void broadcast_excludesAllConnectionsOfUser() {
        RecordingChannel aliceTab1 = joined("a1", "alice", "ws-1");
        RecordingChannel aliceTab2 = joined("a2", "alice", "ws-1");
        RecordingChannel bob = joined("b1", "bob", "ws-1");
        RecordingChannel carol = joined("c1", "carol", "ws-2");

        int delivered = broadcaster.broadcast("ws-1", EventType.ORDER_LOCK,
            Json.MAPPER.createObjectNode().put("orderId", "o-1"), "alice");

        assertEquals(1, delivered);
        assertEquals(1, bob.count("order_lock"));
        assertEquals(0, aliceTab1.count("order_lock"));
        assertEquals(0, aliceTab2.count("order_lock"));
        assertEquals(0, carol.count("order_lock"));
    }

    @Test
    void broadcast_frameCarriesEnvelopeAndSequence() {
        RecordingChannel bob = joined("b1", "bob", "ws-1");

        broadcaster.broadcast("ws-1", EventType.HEARTBEAT, Json.MAPPER.createObjectNode(), null);
        broadcaster.broadcast("ws-1", EventType.HEARTBEAT, Json.MAPPER.createObjectNode(), null);

        JsonNode first = bob.frames().get(0);
        JsonNode second = bob.frames().get(1);
        assertEquals("heartbeat", first.path("event").asText());
        assertEquals("2026-03-02T09:00:00Z", first.path("ts").asText());
        assertTrue(first.has("payload"));
        assertTrue(second.path("seq").asLong() > first.path("seq").asLong());
    }

    @Test
    @DisplayName("A failing channel does not stop delivery to the others")
    void broadcast_skipsFailingChannel() {
        when(brokenChannel.isOpen()).thenReturn(true);
        doThrow(new IllegalStateException("socket gone")).when(brokenChannel).send(anyString());
        ClientConnection broken = new ClientConnection("a1", "alice", brokenChannel, CollabHarness.START);
        registry.register(broken);
        registry.join(broken, "ws-1");
        RecordingChannel bob = joined("b1", "bob", "ws-1");

        int delivered = broadcaster.broadcast("ws-1", EventType.CHAT_MESSAGE, Json.MAPPER.createObjectNode(), null);

        assertEquals(1, delivered);
        assertEquals(1, bob.count("chat_message"));
    }

    @Test
    void broadcast_skipsClosedChannels() {
        RecordingChannel alice = joined("a1", "alice", "ws-1");
        RecordingChannel bob = joined("b1", "bob", "ws-1");
        alice.close();

        assertEquals(1, broadcaster.broadcast("ws-1", EventType.HEARTBEAT, Json.MAPPER.createObjectNode(), null));
        assertEquals(0, alice.count("heartbeat"));
        assertEquals(1, bob.count("heartbeat"));
    }

    @Test
    void broadcastAll_reachesEveryWorkspace() {
        RecordingChannel bob = joined("b1", "bob", "ws-1");
        RecordingChannel carol = joined("c1", "carol", "ws-2");

        assertEquals(2, broadcaster.broadcastAll(EventType.HEARTBEAT, Json.MAPPER.createObjectNode()));
        assertEquals(1, bob.count("heartbeat"));
        assertEquals(1, carol.count("heartbeat"));
    }

    @Test
    void sendError_repliesToOneConnection() {
        RecordingChannel alice = joined("a1", "alice", "ws-1");
        RecordingChannel bob = joined("b1", "bob", "ws-1");

        broadcaster.sendError(registry.get("a1"), ErrorCode.ORDER_EDIT_ERROR, "nope");

        JsonNode error = alice.lastPayload("collaboration_error");
        assertEquals("ORDER_EDIT_ERROR", error.path("code").asText());
        assertEquals("nope", error.path("message").asText());
        assertEquals(0, bob.count("collaboration_error"));
    }
}
