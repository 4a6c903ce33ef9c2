package com.gomflow.collab.application.port.output;

import com.gomflow.collab.domain.user.User;

import java.util.Optional;

/**
 * User directory, consulted once per handshake.
 */
public interface UserRepository {

    /**
     * Find an existing user by ID.
     */
    Optional<User> findById(String userId);
}
