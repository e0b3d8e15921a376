package com.titiplex.frost.core.model;

import java.util.List;

/**
 * Queued request for a signing ceremony that needs approvals before a session is created.
 * The full {@link CreateSessionRequest} is kept so the session can be opened as soon as the
 * approval threshold is reached.
 */
public record PendingApproval(
        String id,
        String groupId,
        String requesterId,
        String eventType,
        String permissionId,
        CreateSessionRequest request,
        int requiredApprovals,
        List<String> approvedBy,
        ApprovalStatus status,
        long requestedAt,
        long expiresAt,
        String sessionId,
        String reason
) {
    public PendingApproval {
        approvedBy = List.copyOf(approvedBy);
    }

    public boolean isExpiredAt(long now) {
        return expiresAt < now;
    }
}
