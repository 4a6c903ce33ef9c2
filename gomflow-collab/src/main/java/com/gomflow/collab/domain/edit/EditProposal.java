package com.gomflow.collab.domain.edit;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Field-level replacement proposed by a client against a known order version.
 */
public record EditProposal(
    String orderId,
    String userId,
    String workspaceId,
    String fieldPath,
    JsonNode oldValue,
    JsonNode newValue,
    long expectedVersion
) {}
