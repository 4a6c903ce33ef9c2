package com.gomflow.collab.infrastructure.persistence;

import com.gomflow.collab.application.port.output.EditRepository;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.edit.EditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * PostgreSQL implementation of EditRepository.
 *
 * Rows go to operational_transforms (append-only). Application goes through
 * apply_operational_transform(), which compares the order version and bumps it.
 */
public final class PostgresEditRepository implements EditRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresEditRepository.class);

    private final DataSource dataSource;

    public PostgresEditRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public EditRecord append(EditRecord record) {
        String sql = """
                INSERT INTO operational_transforms (
                    order_id, user_id, workspace_id, operation_type, field_path,
                    old_value, new_value, version, timestamp
                ) VALUES (?::uuid, ?::uuid, ?::uuid, ?::operation_type, ?, ?::jsonb, ?::jsonb, ?, ?)
                RETURNING id
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, record.orderId());
            ps.setString(2, record.userId());
            ps.setString(3, record.workspaceId());
            ps.setString(4, record.operationType().dbValue());
            ps.setString(5, record.fieldPath());
            ps.setString(6, JdbcJson.write(record.oldValue()));
            ps.setString(7, JdbcJson.write(record.newValue()));
            ps.setLong(8, record.version());
            ps.setTimestamp(9, Timestamp.from(record.timestamp()));

            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("INSERT returned no id");
                }
                EditRecord stored = record.withId(rs.getString(1));
                log.debug("Edit appended: {} order={} v{}", stored.editId(), stored.orderId(), stored.version());
                return stored;
            }
        } catch (SQLException e) {
            log.error("Failed to append edit for order {}: {}", record.orderId(), e.getMessage());
            throw new PersistenceException("operational_transforms.append", e);
        }
    }

    @Override
    public boolean apply(EditRecord stored) {
        String sql = "SELECT apply_operational_transform(?::uuid)";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, stored.editId());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getBoolean(1);
            }
        } catch (SQLException e) {
            log.error("Failed to apply edit {} on order {}: {}", stored.editId(), stored.orderId(), e.getMessage());
            throw new PersistenceException("operational_transforms.apply", e);
        }
    }
}
