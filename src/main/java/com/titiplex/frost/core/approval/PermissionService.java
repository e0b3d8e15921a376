package com.titiplex.frost.core.approval;

import com.titiplex.frost.core.model.FederationRole;
import com.titiplex.frost.core.model.PermissionDecision;

import java.util.Set;

/**
 * Permission tables of the federation, seen only through the decisions they return.
 * Implementations may throw on lookup failure; callers treat that as a denial.
 */
public interface PermissionService {
    PermissionDecision canSign(String groupId, String memberId, String eventType);

    /**
     * Roles allowed to approve or reject requests under {@code permissionId}.
     */
    Set<FederationRole> approverRoles(String permissionId);
}
