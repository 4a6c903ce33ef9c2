package com.gomflow.collab.domain.user;

/**
 * Entry in the user directory, as resolved during the handshake.
 */
public record User(
    String userId,
    String email,
    String name,
    String username
) {}
