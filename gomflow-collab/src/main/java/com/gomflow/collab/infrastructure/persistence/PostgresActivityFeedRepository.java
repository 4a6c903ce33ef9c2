package com.gomflow.collab.infrastructure.persistence;

import com.gomflow.collab.application.port.output.ActivityFeedRepository;
import com.gomflow.collab.domain.activity.ActivityEntry;
import com.gomflow.collab.domain.common.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of ActivityFeedRepository.
 */
public final class PostgresActivityFeedRepository implements ActivityFeedRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresActivityFeedRepository.class);

    private final DataSource dataSource;

    public PostgresActivityFeedRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<ActivityEntry> findRecent(String workspaceId, int limit) {
        String sql = """
                SELECT id, workspace_id, user_id, activity_type, entity_type, entity_id,
                       metadata, description, created_at
                FROM activity_feed
                WHERE workspace_id = ?::uuid
                ORDER BY created_at DESC
                LIMIT ?
                """;

        List<ActivityEntry> entries = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workspaceId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Timestamp createdAt = rs.getTimestamp("created_at");
                    entries.add(new ActivityEntry(
                        rs.getString("id"),
                        rs.getString("workspace_id"),
                        rs.getString("user_id"),
                        rs.getString("activity_type"),
                        rs.getString("entity_type"),
                        rs.getString("entity_id"),
                        JdbcJson.read(rs.getString("metadata")),
                        rs.getString("description"),
                        createdAt != null ? createdAt.toInstant() : null
                    ));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read activity feed for workspace {}: {}", workspaceId, e.getMessage());
            throw new PersistenceException("activity_feed.findRecent", e);
        }
        return entries;
    }

    @Override
    public void log(ActivityEntry entry) {
        String sql = "SELECT log_workspace_activity(?::uuid, ?::uuid, ?::activity_type, ?, ?::uuid, COALESCE(?::jsonb, '{}'::jsonb), ?)";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, entry.workspaceId());
            ps.setString(2, entry.userId());
            ps.setString(3, entry.activityType());
            ps.setString(4, entry.entityType());
            ps.setString(5, entry.entityId());
            ps.setString(6, JdbcJson.write(entry.metadata()));
            ps.setString(7, entry.description());
            ps.execute();
        } catch (SQLException e) {
            log.error("Failed to log activity {} in workspace {}: {}",
                entry.activityType(), entry.workspaceId(), e.getMessage());
            throw new PersistenceException("activity_feed.log", e);
        }
    }
}
