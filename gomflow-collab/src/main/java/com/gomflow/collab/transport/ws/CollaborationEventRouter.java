package com.gomflow.collab.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.gomflow.collab.application.service.ChatRelay;
import com.gomflow.collab.application.service.ConnectionRegistry;
import com.gomflow.collab.application.service.EditCoordinator;
import com.gomflow.collab.application.service.KeyedExecutor;
import com.gomflow.collab.application.service.OrderLockManager;
import com.gomflow.collab.application.service.Payloads;
import com.gomflow.collab.application.service.PresenceTracker;
import com.gomflow.collab.application.service.RoomBroadcaster;
import com.gomflow.collab.domain.chat.ChatMessage;
import com.gomflow.collab.domain.chat.ChatMessageType;
import com.gomflow.collab.domain.common.AuthorizationException;
import com.gomflow.collab.domain.common.CollaborationException;
import com.gomflow.collab.domain.common.EditRejectedException;
import com.gomflow.collab.domain.common.ErrorCode;
import com.gomflow.collab.domain.common.EventType;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.common.ProtocolException;
import com.gomflow.collab.domain.edit.EditProposal;
import com.gomflow.collab.domain.lock.LockResult;
import com.gomflow.collab.domain.lock.ReleaseOutcome;
import com.gomflow.collab.domain.presence.PresenceStatus;
import com.gomflow.collab.domain.session.ClientChannel;
import com.gomflow.collab.domain.session.ClientConnection;
import com.gomflow.collab.domain.user.User;
import com.gomflow.collab.domain.workspace.WorkspaceMember;
import com.gomflow.collab.infrastructure.metrics.CollabMetrics;
import com.gomflow.collab.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;

/**
 * Routes inbound socket events to the collaboration services.
 *
 * EXECUTION MODEL:
 * Events from one connection run on that connection's lane in arrival order.
 * Disconnect cleanup is queued on the same lane, so it runs after every event
 * already received and always runs.
 *
 * FAILURE BOUNDARY:
 * Each event is handled inside its own boundary. Any failure is logged and
 * answered with exactly one collaboration_error carrying the handler's code;
 * other connections are never affected.
 */
public final class CollaborationEventRouter {
    private static final Logger log = LoggerFactory.getLogger(CollaborationEventRouter.class);

    private final ConnectionRegistry registry;
    private final PresenceTracker presenceTracker;
    private final OrderLockManager lockManager;
    private final EditCoordinator editCoordinator;
    private final ChatRelay chatRelay;
    private final RoomBroadcaster broadcaster;
    private final KeyedExecutor connectionLanes;
    private final InputValidator validator;
    private final CollabMetrics metrics;
    private final Clock clock;

    public CollaborationEventRouter(ConnectionRegistry registry,
                                    PresenceTracker presenceTracker,
                                    OrderLockManager lockManager,
                                    EditCoordinator editCoordinator,
                                    ChatRelay chatRelay,
                                    RoomBroadcaster broadcaster,
                                    KeyedExecutor connectionLanes,
                                    InputValidator validator,
                                    CollabMetrics metrics,
                                    Clock clock) {
        this.registry = registry;
        this.presenceTracker = presenceTracker;
        this.lockManager = lockManager;
        this.editCoordinator = editCoordinator;
        this.chatRelay = chatRelay;
        this.broadcaster = broadcaster;
        this.connectionLanes = connectionLanes;
        this.validator = validator;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════
    // CONNECTION LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Register an authenticated socket.
     */
    public ClientConnection onOpen(User user, ClientChannel channel) {
        ClientConnection connection = new ClientConnection(channel.id(), user.userId(), channel, clock.instant());
        registry.register(connection);
        metrics.setConnections(registry.connectionCount());
        return connection;
    }

    public CompletableFuture<Void> onMessage(ClientConnection connection, String raw) {
        return connectionLanes.execute(connection.getConnectionId(), () -> dispatch(connection, raw));
    }

    /**
     * Queue disconnect cleanup behind any pending events of this connection.
     */
    public CompletableFuture<Void> onClose(ClientConnection connection) {
        return connectionLanes.execute(connection.getConnectionId(), () -> cleanup(connection));
    }

    void cleanup(ClientConnection connection) {
        String userId = connection.getUserId();
        ConnectionRegistry.DisconnectOutcome outcome = registry.unregister(connection);
        metrics.setConnections(registry.connectionCount());

        for (String workspaceId : outcome.departedWorkspaces()) {
            try {
                presenceTracker.markOffline(userId, workspaceId);
            } catch (RuntimeException e) {
                log.error("Disconnect cleanup: presence for user {} in workspace {} not persisted: {}",
                    userId, workspaceId, e.getMessage());
            }
        }

        if (outcome.lastConnection()) {
            try {
                presenceTracker.releaseAbandonedLocks(userId);
            } catch (RuntimeException e) {
                log.error("Disconnect cleanup: lock release for user {} failed: {}", userId, e.getMessage());
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // DISPATCH
    // ═══════════════════════════════════════════════════════════════

    void dispatch(ClientConnection connection, String raw) {
        connection.touch(clock.instant());

        ClientMessages.Envelope envelope;
        EventType type;
        try {
            envelope = ClientMessages.parseEnvelope(raw);
            type = EventType.inbound(envelope.event);
            if (type == null) {
                throw new ProtocolException("Unknown event: " + envelope.event);
            }
        } catch (ProtocolException e) {
            log.debug("Protocol error on {}: {}", connection.getConnectionId(), e.getMessage());
            broadcaster.sendError(connection, ErrorCode.PROTOCOL_ERROR, e.getMessage());
            return;
        }

        metrics.recordEvent(type.wireName());
        long startNanos = System.nanoTime();
        try {
            handle(connection, type, envelope.data);
        } catch (CollaborationException e) {
            logFailure(connection, type, e);
            broadcaster.sendError(connection, ErrorCode.forEvent(type), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {} on {}", type.wireName(), connection.getConnectionId(), e);
            broadcaster.sendError(connection, ErrorCode.forEvent(type), "Internal error");
        } finally {
            metrics.recordHandlerLatency(type.wireName(), System.nanoTime() - startNanos);
        }
    }

    private void handle(ClientConnection connection, EventType type, JsonNode data) {
        switch (type) {
            case JOIN_WORKSPACE -> handleJoin(connection, data);
            case LEAVE_WORKSPACE -> handleLeave(connection, data);
            case PRESENCE_UPDATE -> handlePresenceUpdate(connection, data);
            case REQUEST_ORDER_LOCK -> handleLockRequest(connection, data);
            case RELEASE_ORDER_LOCK -> handleLockRelease(connection, data);
            case ORDER_EDIT -> handleOrderEdit(connection, data);
            case CHAT_MESSAGE -> handleChatMessage(connection, data);
            case TYPING_START -> handleTyping(connection, data, true);
            case TYPING_STOP -> handleTyping(connection, data, false);
            default -> throw new ProtocolException("Event not accepted from clients: " + type.wireName());
        }
    }

    private void handleJoin(ClientConnection connection, JsonNode data) {
        ClientMessages.WorkspaceRef req = ClientMessages.bind(data, ClientMessages.WorkspaceRef.class);
        String workspaceId = validator.requireId("workspaceId", req.workspaceId);
        presenceTracker.join(connection, workspaceId);
    }

    private void handleLeave(ClientConnection connection, JsonNode data) {
        ClientMessages.WorkspaceRef req = ClientMessages.bind(data, ClientMessages.WorkspaceRef.class);
        String workspaceId = validator.requireId("workspaceId", req.workspaceId);
        if (!connection.hasJoined(workspaceId)) {
            return;
        }
        presenceTracker.leave(connection, workspaceId);
    }

    private void handlePresenceUpdate(ClientConnection connection, JsonNode data) {
        ClientMessages.PresenceUpdate req = ClientMessages.bind(data, ClientMessages.PresenceUpdate.class);
        String workspaceId = validator.requireId("workspaceId", req.workspaceId);
        requireJoined(connection, workspaceId);

        PresenceStatus status;
        try {
            status = PresenceStatus.fromWire(req.status);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Unknown presence status: " + req.status);
        }

        presenceTracker.update(connection, workspaceId, status,
            validator.optionalPage(req.currentPage), ClientMessages.nullable(req.cursorPosition));
    }

    private void handleLockRequest(ClientConnection connection, JsonNode data) {
        ClientMessages.LockRequest req = ClientMessages.bind(data, ClientMessages.LockRequest.class);
        String workspaceId = validator.requireId("workspaceId", req.workspaceId);
        String orderId = validator.requireId("orderId", req.orderId);
        WorkspaceMember member = requireJoined(connection, workspaceId);
        if (!member.canEditOrders()) {
            throw new AuthorizationException(connection.getUserId(), workspaceId, "Not allowed to edit orders");
        }

        LockResult result = lockManager.requestLock(orderId, connection.getUserId(), workspaceId,
            req.lockDurationMinutes);
        broadcaster.sendTo(connection, EventType.ORDER_LOCK_RESPONSE, Payloads.lockResponse(orderId, result));
    }

    private void handleLockRelease(ClientConnection connection, JsonNode data) {
        ClientMessages.LockRelease req = ClientMessages.bind(data, ClientMessages.LockRelease.class);
        String workspaceId = validator.requireId("workspaceId", req.workspaceId);
        String orderId = validator.requireId("orderId", req.orderId);
        requireJoined(connection, workspaceId);

        ReleaseOutcome outcome = lockManager.releaseLock(orderId, connection.getUserId());
        log.debug("Release order={} by user={}: {}", orderId, connection.getUserId(), outcome);
    }

    private void handleOrderEdit(ClientConnection connection, JsonNode data) {
        ClientMessages.OrderEdit req = ClientMessages.bind(data, ClientMessages.OrderEdit.class);
        String workspaceId = validator.requireId("workspaceId", req.workspaceId);
        String orderId = validator.requireId("orderId", req.orderId);
        String fieldPath = validator.requireFieldPath(req.fieldPath);
        if (req.version == null || req.version < 0) {
            throw new ProtocolException("version is required");
        }
        WorkspaceMember member = requireJoined(connection, workspaceId);
        if (!member.canEditOrders()) {
            throw new AuthorizationException(connection.getUserId(), workspaceId, "Not allowed to edit orders");
        }

        editCoordinator.proposeEdit(new EditProposal(orderId, connection.getUserId(), workspaceId, fieldPath,
            ClientMessages.nullable(req.oldValue), ClientMessages.nullable(req.newValue), req.version));
    }

    private void handleChatMessage(ClientConnection connection, JsonNode data) {
        ClientMessages.ChatMessage req = ClientMessages.bind(data, ClientMessages.ChatMessage.class);
        String workspaceId = validator.requireId("workspaceId", req.workspaceId);
        String content = validator.requireChatContent(req.content);
        WorkspaceMember member = requireJoined(connection, workspaceId);
        if (!member.canChat()) {
            throw new AuthorizationException(connection.getUserId(), workspaceId, "Not allowed to chat");
        }

        ChatMessageType messageType;
        try {
            messageType = ChatMessageType.fromWire(req.messageType);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Unknown message type: " + req.messageType);
        }

        chatRelay.post(ChatMessage.draft(workspaceId, connection.getUserId(),
            validator.optionalId("threadId", req.threadId),
            validator.optionalId("parentMessageId", req.parentMessageId),
            messageType, content));
    }

    private void handleTyping(ClientConnection connection, JsonNode data, boolean isTyping) {
        ClientMessages.Typing req = ClientMessages.bind(data, ClientMessages.Typing.class);
        String workspaceId = validator.requireId("workspaceId", req.workspaceId);
        requireJoined(connection, workspaceId);
        chatRelay.typing(connection.getUserId(), workspaceId, validator.optionalId("channelId", req.channelId), isTyping);
    }

    private WorkspaceMember requireJoined(ClientConnection connection, String workspaceId) {
        return connection.membership(workspaceId)
            .orElseThrow(() -> new AuthorizationException(connection.getUserId(), workspaceId,
                "Not joined to workspace " + workspaceId));
    }

    private void logFailure(ClientConnection connection, EventType type, CollaborationException e) {
        if (e instanceof AuthorizationException || e instanceof PersistenceException) {
            log.warn("{} failed for user {} on {}: {}",
                type.wireName(), connection.getUserId(), connection.getConnectionId(), e.getMessage());
        } else if (e instanceof EditRejectedException) {
            log.info("{} rejected for user {}: {}", type.wireName(), connection.getUserId(), e.getMessage());
        } else {
            log.debug("{} failed for user {}: {}", type.wireName(), connection.getUserId(), e.getMessage());
        }
    }
}
