package com.gomflow.collab.domain.common;

/**
 * Handshake rejected: missing credential, bad signature, expired token or unknown user.
 */
public class AuthenticationException extends CollaborationException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
