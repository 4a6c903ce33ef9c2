package com.gomflow.collab.application.service;

import com.gomflow.collab.application.port.output.ActivityFeedRepository;
import com.gomflow.collab.domain.activity.ActivityEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget writer for the workspace activity feed.
 *
 * Writes run on the supplied executor. Failures are logged and never reach
 * the caller.
 */
public final class ActivityRecorder {
    private static final Logger log = LoggerFactory.getLogger(ActivityRecorder.class);

    private final ActivityFeedRepository repository;
    private final Executor executor;

    public ActivityRecorder(ActivityFeedRepository repository, Executor executor) {
        this.repository = repository;
        this.executor = executor;
    }

    public void record(ActivityEntry entry) {
        try {
            executor.execute(() -> write(entry));
        } catch (RejectedExecutionException e) {
            log.warn("Activity {} dropped for workspace {}: executor rejected", entry.activityType(), entry.workspaceId());
        }
    }

    private void write(ActivityEntry entry) {
        try {
            repository.log(entry);
        } catch (RuntimeException e) {
            log.warn("Activity {} write failed for workspace {}: {}",
                entry.activityType(), entry.workspaceId(), e.getMessage());
        }
    }
}
