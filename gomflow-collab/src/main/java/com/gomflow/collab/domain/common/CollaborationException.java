package com.gomflow.collab.domain.common;

/**
 * Base type for failures surfaced to collaboration clients.
 *
 * The event router turns these into a single collaboration_error frame for the
 * requesting connection; nothing is broadcast.
 */
public abstract class CollaborationException extends RuntimeException {

    protected CollaborationException(String message) {
        super(message);
    }

    protected CollaborationException(String message, Throwable cause) {
        super(message, cause);
    }
}
