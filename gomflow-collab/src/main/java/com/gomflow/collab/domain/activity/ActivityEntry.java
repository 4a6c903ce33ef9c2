package com.gomflow.collab.domain.activity;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Activity feed row.
 */
public record ActivityEntry(
    String activityId,
    String workspaceId,
    String userId,
    String activityType,
    String entityType,
    String entityId,
    JsonNode metadata,
    String description,
    Instant createdAt
) {
    public static ActivityEntry of(String workspaceId, String userId, ActivityType type,
                                   String entityType, String entityId, JsonNode metadata, String description) {
        return new ActivityEntry(null, workspaceId, userId, type.dbValue(), entityType, entityId,
            metadata, description, null);
    }
}
