package com.gomflow.collab.application.port.output;

import com.gomflow.collab.domain.activity.ActivityEntry;

import java.util.List;

public interface ActivityFeedRepository {

    /**
     * Most recent activity for a workspace, newest first.
     */
    List<ActivityEntry> findRecent(String workspaceId, int limit);

    void log(ActivityEntry entry);
}
