package com.titiplex.frost.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One signing ceremony. Immutable: every round produces a new instance which the store
 * writes back under the {@link #updatedAt()} optimistic-lock token it was derived from.
 */
public record SigningSession(
        String sessionId,
        String groupId,
        String messageHash,
        String messageTemplate,
        String eventType,
        String createdBy,
        List<String> participants,
        int threshold,
        Map<String, String> nonceCommitments,
        Map<String, String> partialSignatures,
        FinalSignature finalSignature,
        SessionStatus status,
        String publicationId,
        long createdAt,
        long updatedAt,
        long expiresAt,
        Long nonceCollectionStartedAt,
        Long signingStartedAt,
        Long completedAt,
        Long failedAt,
        String errorMessage
) {
    public SigningSession {
        participants = List.copyOf(participants);
        nonceCommitments = Collections.unmodifiableMap(new LinkedHashMap<>(nonceCommitments));
        partialSignatures = Collections.unmodifiableMap(new LinkedHashMap<>(partialSignatures));
    }

    public static SigningSession open(String sessionId, CreateSessionRequest req, long now, long expiresAt) {
        return new SigningSession(sessionId, req.groupId(), req.messageHash(), req.messageTemplate(),
                req.eventType(), req.createdBy(), req.participants(), req.threshold(),
                Map.of(), Map.of(), null, SessionStatus.PENDING, null,
                now, now, expiresAt, null, null, null, null, null);
    }

    public boolean isExpiredAt(long now) {
        return expiresAt < now;
    }

    public boolean hasParticipant(String participantId) {
        return participants.contains(participantId);
    }

    /**
     * Next optimistic-lock token. Strictly greater than the current one so that two writes
     * landing in the same millisecond never share a token.
     */
    public long nextToken(long now) {
        return Math.max(now, updatedAt + 1);
    }

    public SigningSession withNonceRound(Map<String, String> commitments, SessionStatus newStatus,
                                         Long ncStartedAt, Long sigStartedAt, long token) {
        return new SigningSession(sessionId, groupId, messageHash, messageTemplate, eventType, createdBy,
                participants, threshold, commitments, partialSignatures, finalSignature, newStatus,
                publicationId, createdAt, token, expiresAt, ncStartedAt, sigStartedAt, completedAt,
                failedAt, errorMessage);
    }

    public SigningSession withSignatureRound(Map<String, String> shares, SessionStatus newStatus, long token) {
        return new SigningSession(sessionId, groupId, messageHash, messageTemplate, eventType, createdBy,
                participants, threshold, nonceCommitments, shares, finalSignature, newStatus,
                publicationId, createdAt, token, expiresAt, nonceCollectionStartedAt, signingStartedAt,
                completedAt, failedAt, errorMessage);
    }
}
