package com.gomflow.collab.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.domain.chat.ChatMessage;
import com.gomflow.collab.domain.chat.ChatMessageType;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.workspace.WorkspaceRole;
import com.gomflow.collab.support.CollabHarness;
import com.gomflow.collab.support.CollabHarness.Client;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatRelayTest {

    private static final String WS = "ws-1";

    private CollabHarness h;
    private Client alice;
    private Client bob;

    @BeforeEach
    void setUp() {
        h = new CollabHarness();
        h.store.member(WS, "alice", WorkspaceRole.EDITOR)
            .member(WS, "bob", WorkspaceRole.VIEWER);
        alice = h.joined("alice", WS);
        bob = h.joined("bob", WS);
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    @Test
    void post_storesBroadcastsToSenderTooAndLogsActivity() {
        ChatMessage stored = h.chatRelay.post(
            ChatMessage.draft(WS, "alice", null, null, ChatMessageType.TEXT, "Shipping today?"));

        assertNotNull(stored.messageId());
        assertEquals(1, h.store.chatMessages().size());

        JsonNode seenByBob = bob.channel().lastPayload("chat_message");
        assertEquals(stored.messageId(), seenByBob.path("id").asText());
        assertEquals("Shipping today?", seenByBob.path("content").asText());
        assertEquals("text", seenByBob.path("messageType").asText());
        assertEquals(1, alice.channel().count("chat_message"));

        assertEquals("chat_message", h.store.activity().get(0).activityType());
    }

    @Test
    void post_storeFailureBroadcastsNothing() {
        h.store.failChat = true;

        assertThrows(PersistenceException.class, () -> h.chatRelay.post(
            ChatMessage.draft(WS, "alice", null, null, ChatMessageType.TEXT, "lost")));

        assertEquals(0, bob.channel().count("chat_message"));
        assertTrue(h.store.activity().isEmpty());
    }

    @Test
    void post_activityFailureDoesNotUndoMessage() {
        h.store.failActivity = true;

        ChatMessage stored = h.chatRelay.post(
            ChatMessage.draft(WS, "alice", "thread-1", null, ChatMessageType.ORDER_MENTION, "see order-7"));

        assertNotNull(stored.messageId());
        assertEquals("thread-1", bob.channel().lastPayload("chat_message").path("threadId").asText());
    }

    @Test
    void typing_excludesTypist() {
        int delivered = h.chatRelay.typing("alice", WS, "general", true);

        assertEquals(1, delivered);
        JsonNode indicator = bob.channel().lastPayload("typing_indicator");
        assertTrue(indicator.path("isTyping").asBoolean());
        assertEquals("general", indicator.path("channelId").asText());
        assertEquals(0, alice.channel().count("typing_indicator"));
    }
}
