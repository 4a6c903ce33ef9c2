package com.gomflow.collab.domain.workspace;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.domain.presence.PresenceStatus;

import java.time.Instant;

/**
 * One row of the workspace roster: a member joined with their last known presence.
 */
public record MemberPresence(
    String userId,
    String name,
    String username,
    WorkspaceRole role,
    PresenceStatus presenceStatus,
    String currentPage,
    JsonNode cursorPosition,
    Instant lastActivity
) {}
