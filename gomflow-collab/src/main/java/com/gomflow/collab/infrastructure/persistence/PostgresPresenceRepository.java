package com.gomflow.collab.infrastructure.persistence;

import com.gomflow.collab.application.port.output.PresenceRepository;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.presence.PresenceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * PostgreSQL implementation of PresenceRepository.
 *
 * Delegates to the update_user_presence() DB function, which upserts on
 * (user_id, workspace_id) and keeps page/cursor when passed NULL.
 */
public final class PostgresPresenceRepository implements PresenceRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresPresenceRepository.class);

    private final DataSource dataSource;

    public PostgresPresenceRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void upsert(PresenceRecord record) {
        String sql = "SELECT update_user_presence(?::uuid, ?::uuid, ?::presence_status, ?, ?::jsonb)";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.userId());
            ps.setString(2, record.workspaceId());
            ps.setString(3, record.status().wireName());
            ps.setString(4, record.currentPage());
            ps.setString(5, JdbcJson.write(record.cursorPosition()));
            ps.execute();
        } catch (SQLException e) {
            log.error("Failed to upsert presence user={} workspace={}: {}",
                record.userId(), record.workspaceId(), e.getMessage());
            throw new PersistenceException("presence_tracking.upsert", e);
        }
    }
}
