package com.gomflow.collab.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gomflow.collab.domain.chat.ChatMessage;
import com.gomflow.collab.domain.common.ErrorCode;
import com.gomflow.collab.domain.edit.EditRecord;
import com.gomflow.collab.domain.lock.LockResult;
import com.gomflow.collab.domain.lock.OrderLock;
import com.gomflow.collab.domain.presence.PresenceRecord;
import com.gomflow.collab.domain.workspace.WorkspaceSnapshot;
import com.gomflow.collab.util.Json;

import java.time.Instant;

/**
 * Builders for outbound event payloads. Field names are camelCase on the wire.
 */
public final class Payloads {

    public static ObjectNode memberJoined(String userId, String workspaceId, String role, Instant ts) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("userId", userId);
        n.put("workspaceId", workspaceId);
        n.put("role", role);
        n.put("timestamp", ts.toString());
        return n;
    }

    public static ObjectNode memberLeft(String userId, String workspaceId, Instant ts) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("userId", userId);
        n.put("workspaceId", workspaceId);
        n.put("timestamp", ts.toString());
        return n;
    }

    public static ObjectNode presenceUpdate(PresenceRecord presence) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("userId", presence.userId());
        n.put("workspaceId", presence.workspaceId());
        n.put("status", presence.status().wireName());
        n.put("currentPage", presence.currentPage());
        putJson(n, "cursorPosition", presence.cursorPosition());
        n.put("timestamp", presence.lastActivity().toString());
        return n;
    }

    public static ObjectNode orderLock(OrderLock lock, Instant ts) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("orderId", lock.orderId());
        n.put("workspaceId", lock.workspaceId());
        n.put("userId", lock.userId());
        n.put("expiresAt", lock.expiresAt().toString());
        n.put("timestamp", ts.toString());
        return n;
    }

    public static ObjectNode orderUnlock(OrderLock lock, String byUserId, String reason, Instant ts) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("orderId", lock.orderId());
        n.put("workspaceId", lock.workspaceId());
        n.put("userId", byUserId);
        n.put("reason", reason);
        n.put("timestamp", ts.toString());
        return n;
    }

    public static ObjectNode lockResponse(String orderId, LockResult result) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("orderId", orderId);
        n.put("success", result.success());
        n.put("lockedBy", result.lockedBy());
        n.put("lockedUntil", result.lockedUntil() != null ? result.lockedUntil().toString() : null);
        n.put("message", result.message());
        return n;
    }

    /**
     * Accepted edit as broadcast to the room; carries the post-apply version.
     */
    public static ObjectNode orderEdit(EditRecord stored) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("editId", stored.editId());
        n.put("orderId", stored.orderId());
        n.put("workspaceId", stored.workspaceId());
        n.put("userId", stored.userId());
        n.put("fieldPath", stored.fieldPath());
        putJson(n, "oldValue", stored.oldValue());
        putJson(n, "newValue", stored.newValue());
        n.put("version", stored.appliedVersion());
        n.put("timestamp", stored.timestamp().toString());
        return n;
    }

    public static ObjectNode chatMessage(ChatMessage message, Instant ts) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("id", message.messageId());
        n.put("workspaceId", message.workspaceId());
        n.put("userId", message.userId());
        n.put("threadId", message.threadId());
        n.put("parentMessageId", message.parentMessageId());
        n.put("messageType", message.messageType().wireName());
        n.put("content", message.content());
        n.put("createdAt", message.createdAt() != null ? message.createdAt().toString() : null);
        n.put("timestamp", ts.toString());
        return n;
    }

    public static ObjectNode typing(String userId, String workspaceId, String channelId, boolean isTyping, Instant ts) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("userId", userId);
        n.put("workspaceId", workspaceId);
        n.put("channelId", channelId);
        n.put("isTyping", isTyping);
        n.put("timestamp", ts.toString());
        return n;
    }

    public static ObjectNode workspaceState(WorkspaceSnapshot snapshot) {
        return Json.MAPPER.valueToTree(snapshot);
    }

    public static ObjectNode error(ErrorCode code, String message, Instant ts) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("code", code.name());
        n.put("message", message);
        n.put("timestamp", ts.toString());
        return n;
    }

    public static ObjectNode heartbeat(Instant ts) {
        ObjectNode n = Json.MAPPER.createObjectNode();
        n.put("timestamp", ts.toString());
        return n;
    }

    private static void putJson(ObjectNode target, String field, JsonNode value) {
        if (value == null) {
            target.putNull(field);
        } else {
            target.set(field, value);
        }
    }

    private Payloads() {}
}
