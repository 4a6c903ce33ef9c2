package com.gomflow.collab.domain.presence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PresenceStatus {
    ONLINE,
    AWAY,
    BUSY,
    OFFLINE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static PresenceStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Presence status is required");
        }
        return PresenceStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
