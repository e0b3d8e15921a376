package com.titiplex.frost.core.model;

/**
 * Answer of the permission service for one (group, member, event type) request.
 *
 * @param permissionId key used later to look up which roles may approve; null when no approval flow applies
 */
public record PermissionDecision(
        boolean allowed,
        boolean requiresApproval,
        int approvalThreshold,
        String reason,
        String permissionId
) {
    public static PermissionDecision deny(String reason) {
        return new PermissionDecision(false, false, 0, reason, null);
    }
}
