package com.titiplex.frost.core.model;

public record GateResult(Outcome outcome, SigningSession session, PendingApproval approval, String reason) {

    public enum Outcome {CREATED, PENDING_APPROVAL, DENIED}

    public static GateResult created(SigningSession s, PendingApproval approval) {
        return new GateResult(Outcome.CREATED, s, approval, null);
    }

    public static GateResult pending(PendingApproval approval, String reason) {
        return new GateResult(Outcome.PENDING_APPROVAL, null, approval, reason);
    }

    public static GateResult denied(String reason) {
        return new GateResult(Outcome.DENIED, null, null, reason);
    }

    public static GateResult denied(PendingApproval approval, String reason) {
        return new GateResult(Outcome.DENIED, null, approval, reason);
    }
}
