package com.titiplex.frost.core.approval;

import com.titiplex.frost.core.model.FederationRole;
import com.titiplex.frost.core.model.PermissionDecision;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Property-driven permissions: event types listed under {@code allowed-event-types} are
 * signed directly, those under {@code approval-event-types} go through the approval queue,
 * everything else is denied. The permission id is the event type.
 */
@Service
public class ConfiguredPermissionService implements PermissionService {
    private final Set<String> allowed;
    private final Set<String> needsApproval;
    private final int approvalThreshold;
    private final Set<FederationRole> approvers;

    public ConfiguredPermissionService(
            @Value("${frost.permissions.allowed-event-types:}") List<String> allowed,
            @Value("${frost.permissions.approval-event-types:}") List<String> needsApproval,
            @Value("${frost.permissions.approval-threshold:1}") int approvalThreshold,
            @Value("${frost.permissions.approver-roles:guardian,steward}") List<String> approverRoles) {
        this.allowed = clean(allowed);
        this.needsApproval = clean(needsApproval);
        this.approvalThreshold = Math.max(1, approvalThreshold);
        this.approvers = EnumSet.noneOf(FederationRole.class);
        for (String r : clean(approverRoles)) approvers.add(FederationRole.parse(r));
    }

    @Override
    public PermissionDecision canSign(String groupId, String memberId, String eventType) {
        if (eventType == null) return PermissionDecision.deny("No event type given");
        if (needsApproval.contains(eventType))
            return new PermissionDecision(true, true, approvalThreshold, "Approval required for " + eventType, eventType);
        if (allowed.contains(eventType))
            return new PermissionDecision(true, false, 0, "Allowed", eventType);
        return PermissionDecision.deny("Event type " + eventType + " is not permitted");
    }

    @Override
    public Set<FederationRole> approverRoles(String permissionId) {
        if (permissionId == null || !needsApproval.contains(permissionId)) return Set.of();
        return EnumSet.copyOf(approvers);
    }

    private static Set<String> clean(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values == null) return out;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return out;
    }
}
