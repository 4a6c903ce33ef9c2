package com.gomflow.collab.domain.presence;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Presence of one user in one workspace.
 *
 * currentPage and cursorPosition may be null; the store keeps the previous
 * value in that case.
 */
public record PresenceRecord(
    String userId,
    String workspaceId,
    PresenceStatus status,
    String currentPage,
    JsonNode cursorPosition,
    Instant lastActivity
) {
    public static String key(String userId, String workspaceId) {
        return userId + ":" + workspaceId;
    }

    public String key() {
        return key(userId, workspaceId);
    }

    /**
     * Merge a newer update over this record, keeping page and cursor when absent.
     */
    public PresenceRecord merge(PresenceRecord update) {
        return new PresenceRecord(
            userId,
            workspaceId,
            update.status(),
            update.currentPage() != null ? update.currentPage() : currentPage,
            update.cursorPosition() != null ? update.cursorPosition() : cursorPosition,
            update.lastActivity()
        );
    }
}
