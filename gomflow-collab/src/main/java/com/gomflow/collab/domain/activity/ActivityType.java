package com.gomflow.collab.domain.activity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Activity kinds written by the coordinator. The feed holds more kinds written
 * by other services; those are read back verbatim as strings.
 */
public enum ActivityType {
    ORDER_UPDATED,
    CHAT_MESSAGE,
    PRESENCE_UPDATE;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
