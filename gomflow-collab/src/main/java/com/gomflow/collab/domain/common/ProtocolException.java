package com.gomflow.collab.domain.common;

/**
 * Malformed or incomplete inbound payload.
 */
public class ProtocolException extends CollaborationException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
