package com.gomflow.collab.application.service;

import com.gomflow.collab.application.port.output.ActivityFeedRepository;
import com.gomflow.collab.application.port.output.WorkspaceMemberRepository;
import com.gomflow.collab.domain.activity.ActivityEntry;
import com.gomflow.collab.domain.workspace.MemberPresence;
import com.gomflow.collab.domain.workspace.WorkspaceSnapshot;

import java.time.Clock;
import java.util.List;

/**
 * Builds the workspace_state snapshot sent to a connection after it joins:
 * roster with persisted presence, users live right now, recent activity and
 * live locks.
 */
public final class WorkspaceStateAssembler {

    private final WorkspaceMemberRepository memberRepository;
    private final ActivityFeedRepository activityRepository;
    private final ConnectionRegistry registry;
    private final OrderLockManager lockManager;
    private final Clock clock;
    private final int recentActivityLimit;

    public WorkspaceStateAssembler(WorkspaceMemberRepository memberRepository,
                                   ActivityFeedRepository activityRepository,
                                   ConnectionRegistry registry,
                                   OrderLockManager lockManager,
                                   Clock clock,
                                   int recentActivityLimit) {
        this.memberRepository = memberRepository;
        this.activityRepository = activityRepository;
        this.registry = registry;
        this.lockManager = lockManager;
        this.clock = clock;
        this.recentActivityLimit = recentActivityLimit;
    }

    public WorkspaceSnapshot assemble(String workspaceId) {
        List<MemberPresence> members = memberRepository.findPresenceRoster(workspaceId);
        List<ActivityEntry> activities = activityRepository.findRecent(workspaceId, recentActivityLimit);
        return new WorkspaceSnapshot(
            workspaceId,
            members,
            registry.onlineUserIds(workspaceId),
            activities,
            lockManager.activeLocks(workspaceId),
            clock.instant()
        );
    }
}
