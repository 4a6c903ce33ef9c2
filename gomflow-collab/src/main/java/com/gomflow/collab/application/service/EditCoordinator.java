package com.gomflow.collab.application.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gomflow.collab.application.port.output.EditRepository;
import com.gomflow.collab.domain.activity.ActivityEntry;
import com.gomflow.collab.domain.activity.ActivityType;
import com.gomflow.collab.domain.common.EditRejectedException;
import com.gomflow.collab.domain.common.EditRejectedException.Reason;
import com.gomflow.collab.domain.common.EventType;
import com.gomflow.collab.domain.common.PersistenceException;
import com.gomflow.collab.domain.edit.EditProposal;
import com.gomflow.collab.domain.edit.EditRecord;
import com.gomflow.collab.infrastructure.metrics.CollabMetrics;
import com.gomflow.collab.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * EditCoordinator - accepts field-level edits and fans them out.
 *
 * Runs on the order's lane, the same lane the lock manager uses, so the lock
 * check and the version check see a stable view. The store assigns and checks
 * versions: an edit is applied only if the order is still at the proposal's
 * version, and the order then moves to version + 1.
 *
 * Nothing is broadcast unless the edit was appended and applied.
 */
public final class EditCoordinator {
    private static final Logger log = LoggerFactory.getLogger(EditCoordinator.class);

    private final EditRepository repository;
    private final OrderLockManager lockManager;
    private final RoomBroadcaster broadcaster;
    private final ActivityRecorder activityRecorder;
    private final KeyedExecutor orderLanes;
    private final CollabMetrics metrics;
    private final Clock clock;
    private final boolean editRequiresLock;

    public EditCoordinator(EditRepository repository,
                           OrderLockManager lockManager,
                           RoomBroadcaster broadcaster,
                           ActivityRecorder activityRecorder,
                           KeyedExecutor orderLanes,
                           CollabMetrics metrics,
                           Clock clock,
                           boolean editRequiresLock) {
        this.repository = repository;
        this.lockManager = lockManager;
        this.broadcaster = broadcaster;
        this.activityRecorder = activityRecorder;
        this.orderLanes = orderLanes;
        this.metrics = metrics;
        this.clock = clock;
        this.editRequiresLock = editRequiresLock;
    }

    /**
     * Persist, apply and broadcast an edit.
     *
     * @return the stored record; its applied version is {@code version + 1}
     * @throws EditRejectedException if the sender lacks the lock or the version is stale
     * @throws PersistenceException if the store fails; nothing is broadcast
     */
    public EditRecord proposeEdit(EditProposal proposal) {
        return orderLanes.call(proposal.orderId(), () -> apply(proposal));
    }

    private EditRecord apply(EditProposal proposal) {
        String orderId = proposal.orderId();

        if (editRequiresLock && !lockManager.isHeldBy(orderId, proposal.userId())) {
            metrics.recordEdit("rejected");
            throw new EditRejectedException(orderId, Reason.EDIT_LOCK_REQUIRED,
                "Order " + orderId + " must be locked by you before editing");
        }

        EditRecord stored;
        boolean applied;
        try {
            stored = repository.append(EditRecord.replace(proposal, clock.instant()));
            applied = repository.apply(stored);
        } catch (PersistenceException e) {
            metrics.recordEdit("failed");
            throw e;
        }

        if (!applied) {
            metrics.recordEdit("rejected");
            log.info("Edit {} on order {} rejected: version {} is stale", stored.editId(), orderId, stored.version());
            throw new EditRejectedException(orderId, Reason.VERSION_CONFLICT,
                "Order " + orderId + " is no longer at version " + stored.version());
        }

        metrics.recordEdit("applied");
        log.debug("Edit applied: order={} field={} v{} -> v{}",
            orderId, stored.fieldPath(), stored.version(), stored.appliedVersion());

        broadcaster.broadcast(stored.workspaceId(), EventType.ORDER_EDIT, Payloads.orderEdit(stored), stored.userId());

        ObjectNode metadata = Json.MAPPER.createObjectNode();
        metadata.put("fieldPath", stored.fieldPath());
        metadata.put("version", stored.appliedVersion());
        activityRecorder.record(ActivityEntry.of(stored.workspaceId(), stored.userId(), ActivityType.ORDER_UPDATED,
            "order", orderId, metadata, "Updated " + stored.fieldPath()));

        return stored;
    }
}
