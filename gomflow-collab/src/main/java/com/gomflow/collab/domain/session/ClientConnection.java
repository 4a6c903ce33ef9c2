package com.gomflow.collab.domain.session;

import com.gomflow.collab.domain.workspace.WorkspaceMember;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authenticated collaboration connection.
 *
 * Exists from a successful handshake until the socket closes. Tracks the
 * workspaces this socket has joined together with the membership (role and
 * permissions) resolved at join time.
 */
public final class ClientConnection {
    private final String connectionId;
    private final String userId;
    private final ClientChannel channel;
    private final Map<String, WorkspaceMember> joined;
    private final Instant connectedAt;
    private volatile Instant lastActivity;    // volatile: touched by lane threads, read by monitoring

    public ClientConnection(String connectionId, String userId, ClientChannel channel, Instant connectedAt) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.channel = channel;
        this.joined = new ConcurrentHashMap<>();
        this.connectedAt = connectedAt;
        this.lastActivity = connectedAt;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public String getUserId() {
        return userId;
    }

    public ClientChannel getChannel() {
        return channel;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch(Instant at) {
        this.lastActivity = at;
    }

    public Set<String> getJoinedWorkspaces() {
        return Set.copyOf(joined.keySet());
    }

    public boolean hasJoined(String workspaceId) {
        return workspaceId != null && joined.containsKey(workspaceId);
    }

    public Optional<WorkspaceMember> membership(String workspaceId) {
        return workspaceId == null ? Optional.empty() : Optional.ofNullable(joined.get(workspaceId));
    }

    public void markJoined(WorkspaceMember member) {
        joined.put(member.workspaceId(), member);
    }

    public boolean markLeft(String workspaceId) {
        return joined.remove(workspaceId) != null;
    }

    @Override
    public String toString() {
        return "ClientConnection{" + connectionId + ", user=" + userId + ", workspaces=" + joined.keySet() + "}";
    }
}
