package com.gomflow.collab.domain.workspace;

/**
 * Active membership of a user in a workspace, read from the membership store on join.
 */
public record WorkspaceMember(
    String workspaceId,
    String userId,
    WorkspaceRole role,
    WorkspacePermissions permissions
) {
    public boolean canEditOrders() {
        return permissions != null ? permissions.canEditOrders() : role.defaultPermissions().canEditOrders();
    }

    public boolean canChat() {
        return permissions != null ? permissions.canChat() : role.defaultPermissions().canChat();
    }
}
