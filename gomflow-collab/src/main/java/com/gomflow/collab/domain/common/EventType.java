package com.gomflow.collab.domain.common;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Socket event names exchanged with collaboration clients.
 */
public enum EventType {
    // ═══════════════════════════════════════════════════════════════
    // INBOUND (client -> coordinator)
    // ═══════════════════════════════════════════════════════════════
    JOIN_WORKSPACE("join_workspace", true),
    LEAVE_WORKSPACE("leave_workspace", true),
    PRESENCE_UPDATE("presence_update", true),
    REQUEST_ORDER_LOCK("request_order_lock", true),
    RELEASE_ORDER_LOCK("release_order_lock", true),
    ORDER_EDIT("order_edit", true),
    CHAT_MESSAGE("chat_message", true),
    TYPING_START("typing_start", true),
    TYPING_STOP("typing_stop", true),

    // ═══════════════════════════════════════════════════════════════
    // OUTBOUND (coordinator -> client)
    // ═══════════════════════════════════════════════════════════════
    ORDER_LOCK_RESPONSE("order_lock_response", false),
    MEMBER_JOINED("member_joined", false),
    MEMBER_LEFT("member_left", false),
    ORDER_LOCK("order_lock", false),
    ORDER_UNLOCK("order_unlock", false),
    TYPING_INDICATOR("typing_indicator", false),
    WORKSPACE_STATE("workspace_state", false),
    COLLABORATION_ERROR("collaboration_error", false),
    HEARTBEAT("heartbeat", false);

    private static final Map<String, EventType> INBOUND = Arrays.stream(values())
        .filter(EventType::isInbound)
        .collect(Collectors.toMap(EventType::wireName, Function.identity()));

    private final String wireName;
    private final boolean inbound;

    EventType(String wireName, boolean inbound) {
        this.wireName = wireName;
        this.inbound = inbound;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isInbound() {
        return inbound;
    }

    /**
     * Resolve an inbound event name. Returns null for unknown names.
     * presence_update, order_edit and chat_message are used in both directions.
     */
    public static EventType inbound(String wireName) {
        return wireName == null ? null : INBOUND.get(wireName);
    }
}
