package com.gomflow.collab.application.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.application.port.output.PresenceRepository;
import com.gomflow.collab.domain.common.EventType;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.presence.PresenceRecord;
import com.gomflow.collab.domain.presence.PresenceStatus;
import com.gomflow.collab.domain.session.ClientConnection;
import com.gomflow.collab.domain.workspace.WorkspaceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PresenceTracker - per (user, workspace) presence.
 *
 * The store is the system of record; the local map is a cache of what was
 * last published. Writes for a user run on that user's presence lane, and each
 * write is persisted before it is broadcast.
 *
 * Offline means no connection of the user remains in the workspace. A user
 * leaving from one tab while another tab stays joined keeps their presence.
 * Join, leave and the offline decision all run on the user's presence lane;
 * the departing user's locks in the workspace are released on the same lane.
 */
public final class PresenceTracker {
    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    private final ConnectionRegistry registry;
    private final PresenceRepository repository;
    private final RoomBroadcaster broadcaster;
    private final WorkspaceStateAssembler stateAssembler;
    private final OrderLockManager lockManager;
    private final KeyedExecutor presenceLanes;
    private final Clock clock;

    // "userId:workspaceId" -> last published presence
    private final Map<String, PresenceRecord> cache = new ConcurrentHashMap<>();

    public PresenceTracker(ConnectionRegistry registry,
                           PresenceRepository repository,
                           RoomBroadcaster broadcaster,
                           WorkspaceStateAssembler stateAssembler,
                           OrderLockManager lockManager,
                           KeyedExecutor presenceLanes,
                           Clock clock) {
        this.registry = registry;
        this.repository = repository;
        this.broadcaster = broadcaster;
        this.stateAssembler = stateAssembler;
        this.lockManager = lockManager;
        this.presenceLanes = presenceLanes;
        this.clock = clock;
    }

    /**
     * Join a workspace: authorize, mark online, announce, then ship the snapshot
     * to the joining connection only.
     *
     * Runs on the user's presence lane, so it cannot interleave with a leave or
     * disconnect of another connection of the same user.
     *
     * If persisting or snapshotting fails, the connection is taken back out of
     * the room, the user is written back offline when no other connection keeps
     * them in the workspace, and the failure propagates; nothing is broadcast.
     */
    public WorkspaceSnapshot join(ClientConnection connection, String workspaceId) {
        return presenceLanes.call(connection.getUserId(), () -> joinOnLane(connection, workspaceId));
    }

    private WorkspaceSnapshot joinOnLane(ClientConnection connection, String workspaceId) {
        String userId = connection.getUserId();
        ConnectionRegistry.JoinOutcome outcome = registry.join(connection, workspaceId);

        Instant now = clock.instant();
        WorkspaceSnapshot snapshot;
        try {
            write(new PresenceRecord(userId, workspaceId, PresenceStatus.ONLINE, null, null, now));
            snapshot = stateAssembler.assemble(workspaceId);
        } catch (RuntimeException e) {
            rollBackJoin(connection, workspaceId, e);
            throw e;
        }

        log.info("User {} joined workspace {} ({}, first={})",
            userId, workspaceId, outcome.member().role().wireName(), outcome.firstPresence());

        broadcaster.broadcast(workspaceId, EventType.MEMBER_JOINED,
            Payloads.memberJoined(userId, workspaceId, outcome.member().role().wireName(), now), userId);
        broadcaster.sendTo(connection, EventType.WORKSPACE_STATE, Payloads.workspaceState(snapshot));
        return snapshot;
    }

    private void rollBackJoin(ClientConnection connection, String workspaceId, RuntimeException cause) {
        String userId = connection.getUserId();
        registry.leave(connection, workspaceId);
        log.warn("Join rolled back: user={} workspace={}: {}", userId, workspaceId, cause.getMessage());
        if (registry.isPresent(userId, workspaceId)) {
            return;
        }

        cache.remove(PresenceRecord.key(userId, workspaceId));
        try {
            repository.upsert(new PresenceRecord(userId, workspaceId, PresenceStatus.OFFLINE, null, null,
                clock.instant()));
        } catch (PersistenceException e) {
            log.error("Join rollback: offline for user {} in workspace {} not persisted: {}",
                userId, workspaceId, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    /**
     * Publish a status, page or cursor change. Null page or cursor keeps the
     * previous value.
     */
    public PresenceRecord update(ClientConnection connection, String workspaceId, PresenceStatus status,
                                 String currentPage, JsonNode cursorPosition) {
        PresenceRecord incoming = new PresenceRecord(connection.getUserId(), workspaceId, status,
            currentPage, cursorPosition, clock.instant());
        PresenceRecord published = write(incoming);

        broadcaster.broadcast(workspaceId, EventType.PRESENCE_UPDATE,
            Payloads.presenceUpdate(published), connection.getUserId());
        return published;
    }

    /**
     * Leave a workspace from one connection.
     *
     * @return true if the user is now absent from the workspace
     */
    public boolean leave(ClientConnection connection, String workspaceId) {
        String userId = connection.getUserId();
        return presenceLanes.call(userId, () ->
            registry.leave(connection, workspaceId) && departIfAbsent(userId, workspaceId));
    }

    /**
     * Mark a user offline after disconnect cleanup took one of their
     * connections out of the workspace.
     *
     * Checked again on the presence lane: if another connection of the user
     * joined in the meantime, nothing is written, announced or released.
     *
     * @return true if the user was absent and marked offline
     */
    public boolean markOffline(String userId, String workspaceId) {
        return presenceLanes.call(userId, () -> departIfAbsent(userId, workspaceId));
    }

    /**
     * Release the user's locks in every workspace they are no longer present in.
     * Used when the user's last connection closes.
     *
     * @return number of locks dropped
     */
    public int releaseAbandonedLocks(String userId) {
        return presenceLanes.call(userId, () ->
            lockManager.releaseLocksForUser(userId, workspaceId -> !registry.isPresent(userId, workspaceId)));
    }

    // Presence lane only. Locks are released even if the offline write fails.
    private boolean departIfAbsent(String userId, String workspaceId) {
        if (registry.isPresent(userId, workspaceId)) {
            log.debug("User {} still present in workspace {}, keeping presence", userId, workspaceId);
            return false;
        }

        Instant now = clock.instant();
        try {
            cache.remove(PresenceRecord.key(userId, workspaceId));
            repository.upsert(new PresenceRecord(userId, workspaceId, PresenceStatus.OFFLINE, null, null, now));

            log.info("User {} left workspace {}", userId, workspaceId);
            broadcaster.broadcast(workspaceId, EventType.MEMBER_LEFT,
                Payloads.memberLeft(userId, workspaceId, now), userId);
        } finally {
            lockManager.releaseAllLocksForUser(userId, workspaceId);
        }
        return true;
    }

    public Optional<PresenceRecord> presenceOf(String userId, String workspaceId) {
        return Optional.ofNullable(cache.get(PresenceRecord.key(userId, workspaceId)));
    }

    public int cachedCount() {
        return cache.size();
    }

    private PresenceRecord write(PresenceRecord incoming) {
        return presenceLanes.call(incoming.userId(), () -> {
            repository.upsert(incoming);
            return cache.merge(incoming.key(), incoming, PresenceRecord::merge);
        });
    }
}
