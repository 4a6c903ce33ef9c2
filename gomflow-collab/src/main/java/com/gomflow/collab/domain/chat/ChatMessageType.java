package com.gomflow.collab.domain.chat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChatMessageType {
    TEXT,
    SYSTEM,
    FILE,
    ORDER_MENTION,
    MEMBER_MENTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Null or blank resolves to TEXT.
     */
    @JsonCreator
    public static ChatMessageType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        return ChatMessageType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
