package com.titiplex.frost.core.model;

/**
 * One row of the append-only nonce ledger. {@code usedAt} is null until the
 * participant's signature share consumed the commitment.
 */
public record NonceCommitment(
        String sessionId,
        String participantId,
        String commitment,
        boolean used,
        long createdAt,
        Long usedAt
) {
}
