package com.gomflow.collab.domain.workspace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WorkspaceRole {
    OWNER,
    ADMIN,
    EDITOR,
    VIEWER;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkspaceRole fromWire(String value) {
        return WorkspaceRole.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Permission set a member gets when the stored row has none.
     */
    public WorkspacePermissions defaultPermissions() {
        return switch (this) {
            case OWNER, ADMIN -> new WorkspacePermissions(true, true, true, true, true, true, true);
            case EDITOR -> new WorkspacePermissions(true, true, false, true, false, false, true);
            case VIEWER -> new WorkspacePermissions(false, false, false, false, false, false, true);
        };
    }
}
