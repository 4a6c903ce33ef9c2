package com.gomflow.collab.domain.common;

/**
 * The authenticated user may not perform the action in the given workspace.
 */
public class AuthorizationException extends CollaborationException {

    private final String userId;
    private final String workspaceId;

    public AuthorizationException(String userId, String workspaceId, String message) {
        super(message);
        this.userId = userId;
        this.workspaceId = workspaceId;
    }

    public String getUserId() {
        return userId;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }
}
