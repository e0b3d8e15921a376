package com.titiplex.frost.core.approval;

import com.titiplex.frost.core.model.ApprovalStatus;
import com.titiplex.frost.core.model.PendingApproval;

import java.util.List;

/**
 * Records signing requests waiting for approval and tallies the approvals they collect.
 */
public interface ApprovalAuditService {
    void open(PendingApproval approval);

    /**
     * @return the request or null
     */
    PendingApproval find(String approvalId);

    /**
     * Adds {@code approverId} to a pending request; adding the same approver twice is a no-op.
     *
     * @return the request after the update, or null if it is no longer pending
     */
    PendingApproval addApproval(String approvalId, String approverId);

    /**
     * Moves a pending request to a final status.
     *
     * @return false if the request was not pending any more
     */
    boolean resolve(String approvalId, ApprovalStatus status, String sessionId, String reason);

    List<PendingApproval> listPending(String groupId);
}
