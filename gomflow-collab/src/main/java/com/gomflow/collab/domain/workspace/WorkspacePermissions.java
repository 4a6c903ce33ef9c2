package com.gomflow.collab.domain.workspace;

/**
 * Per-member permission flags stored alongside the membership row.
 */
public record WorkspacePermissions(
    boolean canCreateOrders,
    boolean canEditOrders,
    boolean canDeleteOrders,
    boolean canViewAnalytics,
    boolean canManagePayments,
    boolean canInviteMembers,
    boolean canChat
) {}
