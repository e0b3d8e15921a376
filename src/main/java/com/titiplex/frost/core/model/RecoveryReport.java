package com.titiplex.frost.core.model;

import java.util.List;

public record RecoveryReport(
        SigningSession session,
        List<String> missingCommitments,
        List<String> missingSignatures,
        boolean canAggregate,
        boolean expired
) {
}
