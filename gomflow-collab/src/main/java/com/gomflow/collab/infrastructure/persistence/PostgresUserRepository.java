package com.gomflow.collab.infrastructure.persistence;

import com.gomflow.collab.application.port.output.UserRepository;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.user.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * PostgreSQL implementation of the user directory.
 */
public final class PostgresUserRepository implements UserRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresUserRepository.class);

    private final DataSource dataSource;

    public PostgresUserRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<User> findById(String userId) {
        String sql = "SELECT id, email, name, username FROM users WHERE id = ?::uuid";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new User(
                        rs.getString("id"),
                        rs.getString("email"),
                        rs.getString("name"),
                        rs.getString("username")
                    ));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to find user {}: {}", userId, e.getMessage());
            throw new PersistenceException("users.findById", e);
        }
        return Optional.empty();
    }
}
