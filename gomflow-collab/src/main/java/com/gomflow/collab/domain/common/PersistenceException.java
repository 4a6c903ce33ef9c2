package com.gomflow.collab.domain.common;

/**
 * A call to the durable store failed. No broadcast follows; the client may retry.
 */
public class PersistenceException extends CollaborationException {

    private final String operation;

    public PersistenceException(String operation, Throwable cause) {
        super("Store operation failed: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
