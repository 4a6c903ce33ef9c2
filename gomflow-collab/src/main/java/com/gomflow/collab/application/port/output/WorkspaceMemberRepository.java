package com.gomflow.collab.application.port.output;

import com.gomflow.collab.domain.workspace.MemberPresence;
import com.gomflow.collab.domain.workspace.WorkspaceMember;

import java.util.List;
import java.util.Optional;

/**
 * Workspace membership store. Read on every join, never cached locally.
 */
public interface WorkspaceMemberRepository {

    /**
     * Find the membership of a user if it is active (not invited, suspended or left).
     */
    Optional<WorkspaceMember> findActiveMember(String workspaceId, String userId);

    /**
     * All active members of a workspace with their last persisted presence.
     */
    List<MemberPresence> findPresenceRoster(String workspaceId);
}
