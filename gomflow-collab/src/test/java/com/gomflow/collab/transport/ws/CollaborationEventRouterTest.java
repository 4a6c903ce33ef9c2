package com.gomflow.collab.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.domain.presence.PresenceStatus;
import com.gomflow.collab.domain.workspace.WorkspaceRole;
import com.gomflow.collab.support.CollabHarness;
import com.gomflow.collab.support.CollabHarness.Client;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static com.gomflow.collab.support.CollabHarness.data;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end event handling over recording channels.
 *
 * Tests:
 * - Lock handoff between two editors
 * - Edit broadcast with the post-apply version
 * - Protocol and authorization failures answered with one error frame
 * - Disconnect and leave cleanup
 * - Connection timestamps taken from the service clock
 */
class CollaborationEventRouterTest {

    private static final String WS = "ws-1";
    private static final String ORDER = "order-1";

    private CollabHarness h;
    private Client alice;
    private Client bob;

    @BeforeEach
    void setUp() {
        h = new CollabHarness();
        h.store.member(WS, "alice", WorkspaceRole.EDITOR)
            .member(WS, "bob", WorkspaceRole.EDITOR)
            .member(WS, "victor", WorkspaceRole.VIEWER)
            .user("mallory")
            .order(ORDER, 3);
        alice = h.joined("alice", WS);
        bob = h.joined("bob", WS);
        alice.channel().clear();
        bob.channel().clear();
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    private void requestLock(Client client, String orderId) {
        h.send(client, "request_order_lock", data().put("orderId", orderId).put("workspaceId", WS));
    }

    private void releaseLock(Client client, String orderId) {
        h.send(client, "release_order_lock", data().put("orderId", orderId).put("workspaceId", WS));
    }

    private static JsonNode lastError(Client client) {
        return client.channel().lastPayload("collaboration_error");
    }

    @Test
    @DisplayName("Lock handoff: A locks, B is refused, A releases, B locks")
    void lockHandoffBetweenTwoEditors() {
        requestLock(alice, ORDER);
        JsonNode aliceResponse = alice.channel().lastPayload("order_lock_response");
        assertTrue(aliceResponse.path("success").asBoolean());
        assertEquals("alice", aliceResponse.path("lockedBy").asText());
        assertEquals("alice", bob.channel().lastPayload("order_lock").path("userId").asText());

        requestLock(bob, ORDER);
        JsonNode bobResponse = bob.channel().lastPayload("order_lock_response");
        assertFalse(bobResponse.path("success").asBoolean());
        assertEquals("alice", bobResponse.path("lockedBy").asText());
        assertFalse(bobResponse.path("lockedUntil").isNull());

        releaseLock(alice, ORDER);
        JsonNode unlock = bob.channel().lastPayload("order_unlock");
        assertEquals(ORDER, unlock.path("orderId").asText());
        assertEquals("released", unlock.path("reason").asText());

        requestLock(bob, ORDER);
        assertTrue(bob.channel().lastPayload("order_lock_response").path("success").asBoolean());
        assertEquals("bob", alice.channel().lastPayload("order_lock").path("userId").asText());
    }

    @Test
    @DisplayName("Title edit at version 3 reaches the room as version 4")
    void orderEditBroadcastsAppliedVersion() {
        requestLock(alice, ORDER);

        h.send(alice, "order_edit", data()
            .put("orderId", ORDER)
            .put("workspaceId", WS)
            .put("fieldPath", "title")
            .put("oldValue", "Spring drop")
            .put("newValue", "Summer drop")
            .put("version", 3));

        JsonNode edit = bob.channel().lastPayload("order_edit");
        assertNotNull(edit);
        assertEquals(4, edit.path("version").asLong());
        assertEquals("Summer drop", edit.path("newValue").asText());
        assertEquals("alice", edit.path("userId").asText());
        assertEquals(0, alice.channel().count("order_edit"));
        assertEquals(0, alice.channel().count("collaboration_error"));
        assertEquals(4, h.store.orderVersion(ORDER));
    }

    @Test
    void orderEditWithoutLockIsRejected() {
        h.send(bob, "order_edit", data()
            .put("orderId", ORDER)
            .put("workspaceId", WS)
            .put("fieldPath", "title")
            .put("newValue", "x")
            .put("version", 3));

        JsonNode error = lastError(bob);
        assertEquals("ORDER_EDIT_ERROR", error.path("code").asText());
        assertTrue(error.path("message").asText().startsWith("EDIT_LOCK_REQUIRED"));
        assertEquals(0, alice.channel().count("order_edit"));
    }

    @Test
    void staleEditIsRejectedAsVersionConflict() {
        requestLock(alice, ORDER);

        h.send(alice, "order_edit", data()
            .put("orderId", ORDER).put("workspaceId", WS).put("fieldPath", "items[0].quantity")
            .put("newValue", 5).put("version", 1));

        assertTrue(lastError(alice).path("message").asText().startsWith("VERSION_CONFLICT"));
        assertEquals(0, bob.channel().count("order_edit"));
    }

    @Test
    void malformedJsonIsProtocolError() {
        h.sendRaw(alice, "{not json");

        assertEquals("PROTOCOL_ERROR", lastError(alice).path("code").asText());
        assertEquals(1, alice.channel().count("collaboration_error"));
        assertEquals(0, bob.channel().count("collaboration_error"));
    }

    @Test
    void unknownOrOutboundOnlyEventIsProtocolError() {
        h.send(alice, "delete_everything", data());
        h.send(alice, "heartbeat", data());

        assertEquals(2, alice.channel().count("collaboration_error"));
        assertEquals("PROTOCOL_ERROR", lastError(alice).path("code").asText());
    }

    @Test
    void missingDataIsReportedWithHandlerCode() {
        h.sendRaw(alice, "{\"event\":\"join_workspace\"}");

        JsonNode error = lastError(alice);
        assertEquals("JOIN_WORKSPACE_ERROR", error.path("code").asText());
        assertEquals("Missing 'data' object", error.path("message").asText());
    }

    @Test
    @DisplayName("Non-member join is refused and the user never enters the room")
    void nonMemberJoinIsRefused() {
        Client mallory = h.connect("mallory");

        h.send(mallory, "join_workspace", data().put("workspaceId", WS));

        assertEquals("JOIN_WORKSPACE_ERROR", lastError(mallory).path("code").asText());
        assertFalse(h.registry.isPresent("mallory", WS));
        assertEquals(0, alice.channel().count("member_joined"));
        assertEquals(0, mallory.channel().count("workspace_state"));
    }

    @Test
    void malformedWorkspaceIdIsRefused() {
        Client extra = h.connect("alice");

        h.send(extra, "join_workspace", data().put("workspaceId", "ws 1; drop"));

        assertEquals("workspaceId is malformed", lastError(extra).path("message").asText());
    }

    @Test
    void snakeCaseFieldsAreAccepted() {
        h.send(alice, "request_order_lock", data().put("order_id", ORDER).put("workspace_id", WS)
            .put("lock_duration_minutes", 2));

        JsonNode response = alice.channel().lastPayload("order_lock_response");
        assertTrue(response.path("success").asBoolean());
        assertEquals(h.clock.instant().plusSeconds(120).toString(), response.path("lockedUntil").asText());
    }

    @Test
    void eventsBeforeJoinAreRefused() {
        Client outsider = h.connect("alice");

        h.send(outsider, "chat_message", data().put("workspaceId", "ws-9").put("content", "hello"));

        assertEquals("CHAT_MESSAGE_ERROR", lastError(outsider).path("code").asText());
    }

    @Test
    @DisplayName("Viewers may chat but not lock orders")
    void viewerPermissions() {
        Client victor = h.joined("victor", WS);

        requestLock(victor, ORDER);
        assertEquals("ORDER_LOCK_ERROR", lastError(victor).path("code").asText());
        assertTrue(h.lockManager.findLiveLock(ORDER).isEmpty());

        h.send(victor, "chat_message", data().put("workspaceId", WS).put("content", "Looks good"));
        assertEquals("Looks good", alice.channel().lastPayload("chat_message").path("content").asText());
        assertEquals(1, victor.channel().count("chat_message"));
    }

    @Test
    void blankChatIsRejected() {
        h.send(alice, "chat_message", data().put("workspaceId", WS).put("content", "   "));

        assertEquals("CHAT_MESSAGE_ERROR", lastError(alice).path("code").asText());
        assertEquals(0, bob.channel().count("chat_message"));
    }

    @Test
    void presenceUpdateIsRelayed() {
        h.send(alice, "presence_update", data().put("workspaceId", WS).put("status", "busy")
            .put("currentPage", "/orders/1"));

        JsonNode update = bob.channel().lastPayload("presence_update");
        assertEquals("busy", update.path("status").asText());
        assertEquals(PresenceStatus.BUSY, h.store.presenceOf("alice", WS).orElseThrow().status());
    }

    @Test
    void unknownPresenceStatusIsRejected() {
        h.send(alice, "presence_update", data().put("workspaceId", WS).put("status", "sleeping"));

        assertEquals("PRESENCE_UPDATE_ERROR", lastError(alice).path("code").asText());
    }

    @Test
    void typingIsRelayedToOthers() {
        h.send(alice, "typing_start", data().put("workspaceId", WS));
        h.send(alice, "typing_stop", data().put("workspaceId", WS));

        assertEquals(2, bob.channel().count("typing_indicator"));
        assertFalse(bob.channel().lastPayload("typing_indicator").path("isTyping").asBoolean());
        assertEquals(0, alice.channel().count("typing_indicator"));
    }

    @Test
    @DisplayName("Disconnect releases the holder's locks and marks them offline")
    void disconnectReleasesLocks() {
        requestLock(alice, ORDER);

        h.disconnect(alice);

        assertTrue(h.lockManager.findLiveLock(ORDER).isEmpty());
        assertEquals("holder_left", bob.channel().lastPayload("order_unlock").path("reason").asText());
        assertEquals("alice", bob.channel().lastPayload("member_left").path("userId").asText());
        assertEquals(PresenceStatus.OFFLINE, h.store.presenceOf("alice", WS).orElseThrow().status());
        assertEquals(1, h.registry.connectionCount());
    }

    @Test
    void disconnectCleanupSurvivesPresenceFailure() {
        requestLock(alice, ORDER);
        h.store.failPresence = true;

        h.disconnect(alice);

        assertTrue(h.lockManager.findLiveLock(ORDER).isEmpty());
        assertFalse(h.registry.isPresent("alice", WS));
    }

    @Test
    void leaveReleasesLocksInThatWorkspace() {
        requestLock(alice, ORDER);

        h.send(alice, "leave_workspace", data().put("workspaceId", WS));

        assertFalse(alice.connection().hasJoined(WS));
        assertTrue(h.lockManager.findLiveLock(ORDER).isEmpty());
        assertEquals(1, bob.channel().count("member_left"));
    }

    @Test
    void leaveWithoutJoinIsNoop() {
        Client other = h.connect("bob");

        h.send(other, "leave_workspace", data().put("workspaceId", WS));

        assertEquals(0, other.channel().count("collaboration_error"));
        assertTrue(h.registry.isPresent("bob", WS));
        assertEquals(0, alice.channel().count("member_left"));
    }

    @Test
    void connectionSurvivesFailedEvent() {
        h.sendRaw(alice, "garbage");
        requestLock(alice, ORDER);

        assertTrue(alice.channel().lastPayload("order_lock_response").path("success").asBoolean());
    }

    @Test
    @DisplayName("Connection open and activity times come from the service clock")
    void connectionTimesFollowClock() {
        Client carol = h.connect("alice");
        assertEquals(CollabHarness.START, carol.connection().getConnectedAt());

        h.clock.advance(Duration.ofMinutes(7));
        h.send(carol, "typing_stop", data().put("workspaceId", WS));

        assertEquals(CollabHarness.START, carol.connection().getConnectedAt());
        assertEquals(CollabHarness.START.plus(Duration.ofMinutes(7)), carol.connection().getLastActivity());
    }
}
