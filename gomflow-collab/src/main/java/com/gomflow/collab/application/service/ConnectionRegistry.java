package com.gomflow.collab.application.service;

import com.gomflow.collab.application.port.output.WorkspaceMemberRepository;
import com.gomflow.collab.domain.common.AuthorizationException;
import com.gomflow.collab.domain.common.ProtocolException;
import com.gomflow.collab.domain.session.ClientConnection;
import com.gomflow.collab.domain.workspace.WorkspaceMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ConnectionRegistry - live index of authenticated connections and workspace rooms.
 *
 * STRUCTURE:
 * - connectionId -> ClientConnection
 * - userId -> Set<connectionId> (a user may hold several sockets)
 * - workspaceId -> Set<connectionId> (room membership)
 *
 * THREAD-SAFETY:
 * ConcurrentHashMap + ConcurrentHashMap.newKeySet(). Every change to a user's
 * connections or room memberships runs inside {@code userConnections.compute()}
 * for that user, so register, join, leave and unregister are atomic per user.
 * Rooms are updated with compute() and dropped when empty.
 */
public final class ConnectionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final WorkspaceMemberRepository memberRepository;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();

    public ConnectionRegistry(WorkspaceMemberRepository memberRepository) {
        this.memberRepository = memberRepository;
    }

    /**
     * Result of a join: the membership read from the store, and whether this
     * connection is the user's first in the workspace.
     */
    public record JoinOutcome(WorkspaceMember member, boolean firstPresence) {}

    /**
     * Result of removing a connection.
     *
     * @param lastConnection     the user has no connections left
     * @param departedWorkspaces workspaces where no other connection of the user remains
     */
    public record DisconnectOutcome(boolean lastConnection, Set<String> departedWorkspaces) {}

    public void register(ClientConnection connection) {
        userConnections.compute(connection.getUserId(), (userId, ids) -> {
            Set<String> set = ids != null ? ids : ConcurrentHashMap.newKeySet();
            connections.put(connection.getConnectionId(), connection);
            set.add(connection.getConnectionId());
            return set;
        });
        log.info("Connection registered: {} user={} (users={}, connections={})",
            connection.getConnectionId(), connection.getUserId(), userConnections.size(), connections.size());
    }

    /**
     * Remove a connection and detach it from every room it joined.
     */
    public DisconnectOutcome unregister(ClientConnection connection) {
        String connectionId = connection.getConnectionId();
        Set<String> departed = new HashSet<>();
        boolean[] last = new boolean[1];

        userConnections.compute(connection.getUserId(), (userId, ids) -> {
            connections.remove(connectionId);
            Set<String> remaining = ids != null ? ids : ConcurrentHashMap.newKeySet();
            remaining.remove(connectionId);

            for (String workspaceId : connection.getJoinedWorkspaces()) {
                connection.markLeft(workspaceId);
                removeFromRoom(workspaceId, connectionId);
                if (!anyJoined(remaining, workspaceId)) {
                    departed.add(workspaceId);
                }
            }

            last[0] = remaining.isEmpty();
            return last[0] ? null : remaining;
        });

        log.info("Connection unregistered: {} user={} last={} departed={}",
            connectionId, connection.getUserId(), last[0], departed);
        return new DisconnectOutcome(last[0], Set.copyOf(departed));
    }

    /**
     * Add a connection to a workspace room.
     *
     * Membership is re-read from the store on every join.
     *
     * @throws AuthorizationException if the user is not an active member
     * @throws ProtocolException if the connection is no longer registered
     */
    public JoinOutcome join(ClientConnection connection, String workspaceId) {
        String userId = connection.getUserId();
        WorkspaceMember member = memberRepository.findActiveMember(workspaceId, userId)
            .orElseThrow(() -> new AuthorizationException(userId, workspaceId,
                "Not a member of workspace " + workspaceId));

        boolean[] first = new boolean[1];
        userConnections.compute(userId, (u, ids) -> {
            if (ids == null || !ids.contains(connection.getConnectionId())) {
                throw new ProtocolException("Connection is closed");
            }
            first[0] = !anyJoined(ids, workspaceId);
            connection.markJoined(member);
            rooms.compute(workspaceId, (ws, room) -> {
                Set<String> set = room != null ? room : ConcurrentHashMap.newKeySet();
                set.add(connection.getConnectionId());
                return set;
            });
            return ids;
        });

        log.debug("Joined: {} user={} workspace={} role={} first={}",
            connection.getConnectionId(), userId, workspaceId, member.role().wireName(), first[0]);
        return new JoinOutcome(member, first[0]);
    }

    /**
     * Remove a connection from a workspace room.
     *
     * @return true if no other connection of the user remains in the workspace
     */
    public boolean leave(ClientConnection connection, String workspaceId) {
        boolean[] departed = new boolean[1];
        userConnections.computeIfPresent(connection.getUserId(), (userId, ids) -> {
            if (connection.markLeft(workspaceId)) {
                removeFromRoom(workspaceId, connection.getConnectionId());
                departed[0] = !anyJoined(ids, workspaceId);
            }
            return ids;
        });
        return departed[0];
    }

    private boolean anyJoined(Collection<String> connectionIds, String workspaceId) {
        for (String id : connectionIds) {
            ClientConnection c = connections.get(id);
            if (c != null && c.hasJoined(workspaceId)) {
                return true;
            }
        }
        return false;
    }

    private void removeFromRoom(String workspaceId, String connectionId) {
        rooms.computeIfPresent(workspaceId, (ws, room) -> {
            room.remove(connectionId);
            return room.isEmpty() ? null : room;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // LOOKUPS
    // ═══════════════════════════════════════════════════════════════

    public ClientConnection get(String connectionId) {
        return connections.get(connectionId);
    }

    public List<ClientConnection> connectionsIn(String workspaceId) {
        return resolve(rooms.get(workspaceId));
    }

    public List<ClientConnection> connectionsOf(String userId) {
        return resolve(userConnections.get(userId));
    }

    public List<ClientConnection> allConnections() {
        return new ArrayList<>(connections.values());
    }

    /**
     * Users with at least one connection joined to the workspace.
     */
    public Set<String> onlineUserIds(String workspaceId) {
        Set<String> users = new HashSet<>();
        for (ClientConnection c : connectionsIn(workspaceId)) {
            users.add(c.getUserId());
        }
        return users;
    }

    public boolean isPresent(String userId, String workspaceId) {
        for (ClientConnection c : connectionsOf(userId)) {
            if (c.hasJoined(workspaceId)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> workspacesOf(String userId) {
        Set<String> workspaces = new HashSet<>();
        for (ClientConnection c : connectionsOf(userId)) {
            workspaces.addAll(c.getJoinedWorkspaces());
        }
        return workspaces;
    }

    public int connectionCount() {
        return connections.size();
    }

    public int userCount() {
        return userConnections.size();
    }

    public int roomCount() {
        return rooms.size();
    }

    private List<ClientConnection> resolve(Set<String> ids) {
        if (ids == null) {
            return List.of();
        }
        List<ClientConnection> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            ClientConnection c = connections.get(id);
            if (c != null) {
                result.add(c);
            }
        }
        return result;
    }
}
