package com.gomflow.collab.domain.workspace;

import com.gomflow.collab.domain.activity.ActivityEntry;
import com.gomflow.collab.domain.lock.OrderLock;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * State shipped to a connection right after it joins a workspace, so a
 * reconnecting client can resynchronize without replaying history.
 */
public record WorkspaceSnapshot(
    String workspaceId,
    List<MemberPresence> members,
    Set<String> onlineUserIds,
    List<ActivityEntry> activities,
    List<OrderLock> orderLocks,
    Instant timestamp
) {}
