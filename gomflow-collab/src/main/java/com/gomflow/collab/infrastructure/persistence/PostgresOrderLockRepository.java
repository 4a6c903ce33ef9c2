package com.gomflow.collab.infrastructure.persistence;

import com.gomflow.collab.application.port.output.OrderLockRepository;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.lock.OrderLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * PostgreSQL implementation of OrderLockRepository.
 *
 * Locks live on collaborative_orders (edit_lock_user_id, edit_lock_expires_at).
 * No atomicity with the in-memory lock table is attempted.
 */
public final class PostgresOrderLockRepository implements OrderLockRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresOrderLockRepository.class);

    private final DataSource dataSource;

    public PostgresOrderLockRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void setLock(OrderLock lock) {
        String sql = """
                UPDATE collaborative_orders
                SET edit_lock_user_id = ?::uuid, edit_lock_expires_at = ?
                WHERE order_id = ?::uuid AND workspace_id = ?::uuid
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, lock.userId());
            ps.setTimestamp(2, Timestamp.from(lock.expiresAt()));
            ps.setString(3, lock.orderId());
            ps.setString(4, lock.workspaceId());
            int rows = ps.executeUpdate();
            if (rows == 0) {
                log.debug("No collaborative_orders row for order {} in workspace {}", lock.orderId(), lock.workspaceId());
            }
        } catch (SQLException e) {
            log.error("Failed to set lock on order {}: {}", lock.orderId(), e.getMessage());
            throw new PersistenceException("collaborative_orders.setLock", e);
        }
    }

    @Override
    public void clearLock(String orderId, String workspaceId) {
        String sql = """
                UPDATE collaborative_orders
                SET edit_lock_user_id = NULL, edit_lock_expires_at = NULL
                WHERE order_id = ?::uuid AND workspace_id = ?::uuid
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, orderId);
            ps.setString(2, workspaceId);
            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Failed to clear lock on order {}: {}", orderId, e.getMessage());
            throw new PersistenceException("collaborative_orders.clearLock", e);
        }
    }

    @Override
    public List<OrderLock> findLiveLocks(Instant now) {
        String sql = """
                SELECT order_id, workspace_id, edit_lock_user_id, edit_lock_expires_at
                FROM collaborative_orders
                WHERE edit_lock_user_id IS NOT NULL AND edit_lock_expires_at > ?
                """;

        List<OrderLock> locks = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(now));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    locks.add(new OrderLock(
                        rs.getString("order_id"),
                        rs.getString("workspace_id"),
                        rs.getString("edit_lock_user_id"),
                        rs.getTimestamp("edit_lock_expires_at").toInstant()
                    ));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to load live locks: {}", e.getMessage());
            throw new PersistenceException("collaborative_orders.findLiveLocks", e);
        }
        return locks;
    }
}
