package com.gomflow.collab.domain.common;

/**
 * Codes carried by collaboration_error frames. One code per inbound handler,
 * plus protocol-level and socket-level failures.
 */
public enum ErrorCode {
    JOIN_WORKSPACE_ERROR,
    LEAVE_WORKSPACE_ERROR,
    PRESENCE_UPDATE_ERROR,
    ORDER_LOCK_ERROR,
    ORDER_UNLOCK_ERROR,
    ORDER_EDIT_ERROR,
    CHAT_MESSAGE_ERROR,
    TYPING_ERROR,
    PROTOCOL_ERROR,
    SOCKET_ERROR;

    public static ErrorCode forEvent(EventType type) {
        return switch (type) {
            case JOIN_WORKSPACE -> JOIN_WORKSPACE_ERROR;
            case LEAVE_WORKSPACE -> LEAVE_WORKSPACE_ERROR;
            case PRESENCE_UPDATE -> PRESENCE_UPDATE_ERROR;
            case REQUEST_ORDER_LOCK -> ORDER_LOCK_ERROR;
            case RELEASE_ORDER_LOCK -> ORDER_UNLOCK_ERROR;
            case ORDER_EDIT -> ORDER_EDIT_ERROR;
            case CHAT_MESSAGE -> CHAT_MESSAGE_ERROR;
            case TYPING_START, TYPING_STOP -> TYPING_ERROR;
            default -> PROTOCOL_ERROR;
        };
    }
}
