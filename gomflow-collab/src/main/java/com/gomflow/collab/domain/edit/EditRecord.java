package com.gomflow.collab.domain.edit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Append-only operational transform entry. Never mutated once stored.
 *
 * {@code version} is the order version the edit was based on; applying it moves
 * the order to {@code version + 1}.
 */
public record EditRecord(
    String editId,
    String orderId,
    String userId,
    String workspaceId,
    OperationType operationType,
    String fieldPath,
    JsonNode oldValue,
    JsonNode newValue,
    long version,
    Instant timestamp
) {
    public enum OperationType {
        INSERT,
        DELETE,
        RETAIN,
        REPLACE;

        public String dbValue() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    public static EditRecord replace(EditProposal proposal, Instant timestamp) {
        return new EditRecord(null, proposal.orderId(), proposal.userId(), proposal.workspaceId(),
            OperationType.REPLACE, proposal.fieldPath(), proposal.oldValue(), proposal.newValue(),
            proposal.expectedVersion(), timestamp);
    }

    public EditRecord withId(String id) {
        return new EditRecord(id, orderId, userId, workspaceId, operationType, fieldPath,
            oldValue, newValue, version, timestamp);
    }

    public long appliedVersion() {
        return version + 1;
    }
}
