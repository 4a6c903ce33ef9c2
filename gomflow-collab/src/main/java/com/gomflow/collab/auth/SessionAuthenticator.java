package com.gomflow.collab.auth;

import com.gomflow.collab.application.port.output.UserRepository;
import com.gomflow.collab.domain.common.AuthenticationException;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate for every collaboration connection.
 *
 * A credential is accepted only if its signature and expiry are valid and its
 * user exists in the user directory. Nothing is registered until this passes.
 */
public final class SessionAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticator.class);

    private final JwtService jwtService;
    private final UserRepository userRepository;

    public SessionAuthenticator(JwtService jwtService, UserRepository userRepository) {
        this.jwtService = jwtService;
        this.userRepository = userRepository;
    }

    /**
     * @throws AuthenticationException if the credential is missing, invalid,
     *         expired, names an unknown user, or the directory is unreachable
     */
    public User authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthenticationException("Authentication token required");
        }

        String userId = jwtService.validateAndGetUserId(token);
        if (userId == null) {
            throw new AuthenticationException("Invalid authentication token");
        }

        try {
            return userRepository.findById(userId)
                .orElseThrow(() -> new AuthenticationException("User not found"));
        } catch (PersistenceException e) {
            log.warn("User lookup failed during handshake for {}: {}", userId, e.getMessage());
            throw new AuthenticationException("User directory unavailable", e);
        }
    }
}
