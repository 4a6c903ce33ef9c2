package com.gomflow.collab.infrastructure.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.application.port.output.WorkspaceMemberRepository;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.presence.PresenceStatus;
import com.gomflow.collab.domain.workspace.MemberPresence;
import com.gomflow.collab.domain.workspace.WorkspaceMember;
import com.gomflow.collab.domain.workspace.WorkspacePermissions;
import com.gomflow.collab.domain.workspace.WorkspaceRole;
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
import java.util.Optional;

/**
 * PostgreSQL implementation of WorkspaceMemberRepository.
 *
 * Reads workspace_members for authorization and the member_presence view for
 * the roster shipped in workspace_state.
 */
public final class PostgresWorkspaceMemberRepository implements WorkspaceMemberRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresWorkspaceMemberRepository.class);

    private final DataSource dataSource;

    public PostgresWorkspaceMemberRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Optional<WorkspaceMember> findActiveMember(String workspaceId, String userId) {
        String sql = """
                SELECT role, permissions FROM workspace_members
                WHERE workspace_id = ?::uuid AND user_id = ?::uuid AND status = 'active'
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workspaceId);
            ps.setString(2, userId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    WorkspaceRole role = WorkspaceRole.fromWire(rs.getString("role"));
                    WorkspacePermissions permissions = parsePermissions(rs.getString("permissions"), role);
                    return Optional.of(new WorkspaceMember(workspaceId, userId, role, permissions));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read membership user={} workspace={}: {}", userId, workspaceId, e.getMessage());
            throw new PersistenceException("workspace_members.findActiveMember", e);
        }
        return Optional.empty();
    }

    @Override
    public List<MemberPresence> findPresenceRoster(String workspaceId) {
        String sql = """
                SELECT user_id, name, username, role, presence_status, current_page,
                       cursor_position, last_activity
                FROM member_presence
                WHERE workspace_id = ?::uuid
                ORDER BY name
                """;

        List<MemberPresence> roster = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, workspaceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    roster.add(mapRoster(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to read roster for workspace {}: {}", workspaceId, e.getMessage());
            throw new PersistenceException("member_presence.findByWorkspace", e);
        }
        return roster;
    }

    private MemberPresence mapRoster(ResultSet rs) throws SQLException {
        Timestamp lastActivity = rs.getTimestamp("last_activity");
        return new MemberPresence(
            rs.getString("user_id"),
            rs.getString("name"),
            rs.getString("username"),
            WorkspaceRole.fromWire(rs.getString("role")),
            PresenceStatus.fromWire(rs.getString("presence_status")),
            rs.getString("current_page"),
            JdbcJson.read(rs.getString("cursor_position")),
            lastActivity != null ? lastActivity.toInstant() : null
        );
    }

    private static WorkspacePermissions parsePermissions(String raw, WorkspaceRole role) {
        JsonNode node = JdbcJson.read(raw);
        WorkspacePermissions defaults = role.defaultPermissions();
        if (node == null || !node.isObject()) {
            return defaults;
        }
        return new WorkspacePermissions(
            node.path("can_create_orders").asBoolean(defaults.canCreateOrders()),
            node.path("can_edit_orders").asBoolean(defaults.canEditOrders()),
            node.path("can_delete_orders").asBoolean(defaults.canDeleteOrders()),
            node.path("can_view_analytics").asBoolean(defaults.canViewAnalytics()),
            node.path("can_manage_payments").asBoolean(defaults.canManagePayments()),
            node.path("can_invite_members").asBoolean(defaults.canInviteMembers()),
            node.path("can_chat").asBoolean(defaults.canChat())
        );
    }
}
