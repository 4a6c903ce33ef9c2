package com.gomflow.collab.transport.ws;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.domain.common.ProtocolException;
import com.gomflow.collab.util.Json;

/**
 * Inbound message models. Field names are camelCase; snake_case aliases are
 * accepted for older clients.
 */
public final class ClientMessages {

    /**
     * {"event": "...", "data": {...}}
     */
    public static final class Envelope {
        public String event;
        public JsonNode data;
    }

    public static final class WorkspaceRef {
        @JsonAlias("workspace_id") public String workspaceId;
    }

    public static final class PresenceUpdate {
        @JsonAlias("workspace_id") public String workspaceId;
        public String status;
        @JsonAlias("current_page") public String currentPage;
        @JsonAlias("cursor_position") public JsonNode cursorPosition;
    }

    public static final class LockRequest {
        @JsonAlias("order_id") public String orderId;
        @JsonAlias("workspace_id") public String workspaceId;
        @JsonAlias("lock_duration_minutes") public Integer lockDurationMinutes;
    }

    public static final class LockRelease {
        @JsonAlias("order_id") public String orderId;
        @JsonAlias("workspace_id") public String workspaceId;
    }

    public static final class OrderEdit {
        @JsonAlias("order_id") public String orderId;
        @JsonAlias("workspace_id") public String workspaceId;
        @JsonAlias("field_path") public String fieldPath;
        @JsonAlias("old_value") public JsonNode oldValue;
        @JsonAlias("new_value") public JsonNode newValue;
        public Long version;
    }

    public static final class ChatMessage {
        @JsonAlias("workspace_id") public String workspaceId;
        public String content;
        @JsonAlias("message_type") public String messageType;
        @JsonAlias("thread_id") public String threadId;
        @JsonAlias("parent_message_id") public String parentMessageId;
    }

    public static final class Typing {
        @JsonAlias("workspace_id") public String workspaceId;
        @JsonAlias("channel_id") public String channelId;
    }

    public static Envelope parseEnvelope(String raw) {
        Envelope envelope;
        try {
            envelope = Json.MAPPER.readValue(raw, Envelope.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (envelope == null || envelope.event == null || envelope.event.isBlank()) {
            throw new ProtocolException("Missing 'event'");
        }
        return envelope;
    }

    /**
     * Bind an event's data object.
     *
     * @throws ProtocolException if data is absent or does not fit the type
     */
    public static <T> T bind(JsonNode data, Class<T> type) {
        if (data == null || !data.isObject()) {
            throw new ProtocolException("Missing 'data' object");
        }
        try {
            return Json.MAPPER.treeToValue(data, type);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * JSON null and absent both read as null.
     */
    public static JsonNode nullable(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() ? null : node;
    }

    private ClientMessages() {}
}
