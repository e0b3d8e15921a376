package com.titiplex.frost.core.approval;

import com.titiplex.frost.core.error.FrostException;
import com.titiplex.frost.core.model.ApprovalStatus;
import com.titiplex.frost.core.model.CreateSessionRequest;
import com.titiplex.frost.core.model.FederationRole;
import com.titiplex.frost.core.model.GateResult;
import com.titiplex.frost.core.model.PendingApproval;
import com.titiplex.frost.core.model.PermissionDecision;
import com.titiplex.frost.core.model.SigningRequestNotice;
import com.titiplex.frost.core.model.SigningSession;
import com.titiplex.frost.core.publish.SigningRequestNotifier;
import com.titiplex.frost.core.session.FrostSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Decides, before any session exists, whether a requester may start a signing ceremony for
 * an event type. Every authorization lookup fails closed.
 */
@Service
public class ApprovalGate {
    private static final Logger log = LoggerFactory.getLogger(ApprovalGate.class);

    private final PermissionService permissions;
    private final ApprovalAuditService audit;
    private final FrostSessionManager sessions;
    private final SigningRequestNotifier requests;
    private final Clock clock;
    private final long approvalTtlMs;

    public ApprovalGate(PermissionService permissions,
                        ApprovalAuditService audit,
                        FrostSessionManager sessions,
                        SigningRequestNotifier requests,
                        Clock clock,
                        @Value("${frost.approval.expiration-hours:24}") int approvalExpirationHours) {
        this.permissions = permissions;
        this.audit = audit;
        this.sessions = sessions;
        this.requests = requests;
        this.clock = clock;
        this.approvalTtlMs = Duration.ofHours(approvalExpirationHours).toMillis();
    }

    /**
     * Creates the session right away, queues it for approval, or denies it. A created session
     * is announced to its participants.
     *
     * @throws FrostException VALIDATION if the request itself is malformed; nothing is stored
     */
    public GateResult requestSession(CreateSessionRequest req) {
        PermissionDecision decision;
        try {
            decision = permissions.canSign(req.groupId(), req.createdBy(), req.eventType());
        } catch (RuntimeException e) {
            log.warn("Permission lookup failed for {} in group {}: {}", req.createdBy(), req.groupId(), e.getMessage());
            return GateResult.denied("Permission lookup failed");
        }
        if (decision == null || !decision.allowed())
            return GateResult.denied("Permission denied: " + (decision == null ? "no decision" : decision.reason()));

        if (!decision.requiresApproval()) {
            SigningSession s = sessions.createSession(req);
            announce(s);
            return GateResult.created(s, null);
        }

        sessions.validateRequest(req);
        long now = clock.millis();
        PendingApproval pending = new PendingApproval(UUID.randomUUID().toString(), req.groupId(), req.createdBy(),
                req.eventType(), decision.permissionId(), req, Math.max(1, decision.approvalThreshold()), List.of(),
                ApprovalStatus.PENDING, now, now + approvalTtlMs, null, null);
        audit.open(pending);
        log.info("Signing request {} for {} queued, {} approval(s) required",
                pending.id(), req.eventType(), pending.requiredApprovals());
        return GateResult.pending(pending, decision.reason());
    }

    public GateResult approve(String approvalId, String approverId, FederationRole approverRole) {
        PendingApproval a = audit.find(approvalId);
        String refusal = checkAuthority(a, approverRole, "approve");
        if (refusal != null) return GateResult.denied(a, refusal);

        PendingApproval updated = audit.addApproval(approvalId, approverId);
        if (updated == null) return GateResult.denied(a, "Pending approval not found or already processed");
        int count = updated.approvedBy().size();
        if (count < updated.requiredApprovals())
            return GateResult.pending(updated, "Approval " + count + "/" + updated.requiredApprovals());

        SigningSession s;
        try {
            s = sessions.createSession(updated.request());
        } catch (FrostException e) {
            String why = "Session creation failed: " + e.getMessage();
            audit.resolve(approvalId, ApprovalStatus.REJECTED, null, why);
            log.warn("Signing request {} closed: {}", approvalId, why);
            return GateResult.denied(audit.find(approvalId), why);
        }
        if (!audit.resolve(approvalId, ApprovalStatus.APPROVED, s.sessionId(), "Approval threshold met")) {
            // a concurrent approver resolved it first and created its own session
            sessions.failSession(s.sessionId(), "Duplicate session for approval " + approvalId);
            return GateResult.denied(audit.find(approvalId), "Approval already processed");
        }
        log.info("Signing request {} approved by {}, session {} created", approvalId, updated.approvedBy(), s.sessionId());
        announce(s);
        return GateResult.created(s, audit.find(approvalId));
    }

    public GateResult reject(String approvalId, String rejecterId, FederationRole rejecterRole, String reason) {
        PendingApproval a = audit.find(approvalId);
        String refusal = checkAuthority(a, rejecterRole, "reject");
        if (refusal != null) return GateResult.denied(a, refusal);

        String why = reason == null || reason.isBlank() ? "Rejected by approver" : reason;
        if (!audit.resolve(approvalId, ApprovalStatus.REJECTED, null, why))
            return GateResult.denied(a, "Pending approval not found or already processed");
        log.info("Signing request {} rejected by {}: {}", approvalId, rejecterId, why);
        return GateResult.denied(audit.find(approvalId), why);
    }

    /**
     * Pending requests of a federation; overdue ones are marked expired and left out.
     */
    public List<PendingApproval> listPendingApprovals(String groupId) {
        long now = clock.millis();
        return audit.listPending(groupId).stream()
                .filter(a -> {
                    if (!a.isExpiredAt(now)) return true;
                    audit.resolve(a.id(), ApprovalStatus.EXPIRED, null, "Approval window elapsed");
                    return false;
                })
                .toList();
    }

    private void announce(SigningSession s) {
        try {
            requests.send(SigningRequestNotice.of(s, clock.millis()));
        } catch (RuntimeException e) {
            // participants can still find the session through listPendingSessions
            log.warn("Signing request for session {} not delivered: {}", s.sessionId(), e.getMessage());
        }
    }

    private String checkAuthority(PendingApproval a, FederationRole role, String verb) {
        if (a == null || a.status() != ApprovalStatus.PENDING) return "Pending approval not found or already processed";
        if (a.isExpiredAt(clock.millis())) {
            audit.resolve(a.id(), ApprovalStatus.EXPIRED, null, "Approval window elapsed");
            return "Approval request expired";
        }
        Set<FederationRole> roles;
        try {
            roles = permissions.approverRoles(a.permissionId());
        } catch (RuntimeException e) {
            log.error("Approver role lookup failed for permission {}: {}", a.permissionId(), e.getMessage());
            return "Permission configuration not found - cannot verify " + verb + " authority";
        }
        if (roles == null || roles.isEmpty())
            return "Permission configuration not found - cannot verify " + verb + " authority";
        if (role == null || !roles.contains(role))
            return "Role '" + role + "' is not authorized to " + verb + " this event type";
        return null;
    }
}
