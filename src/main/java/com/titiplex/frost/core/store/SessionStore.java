package com.titiplex.frost.core.store;

import com.titiplex.frost.core.model.FinalSignature;
import com.titiplex.frost.core.model.NonceCommitment;
import com.titiplex.frost.core.model.SessionStatus;
import com.titiplex.frost.core.model.SigningSession;

import java.util.List;

/**
 * Durable storage of signing sessions and the nonce ledger. Every session mutation is
 * conditional: on the {@code updatedAt} token the caller read, or on the current status.
 */
public interface SessionStore {
    void init();

    void insertSession(SigningSession s);

    /**
     * @return the session or null
     */
    SigningSession findById(String sessionId);

    /**
     * Inserts the ledger row and writes {@code next} in one transaction, only if the stored
     * token still equals {@code expectedUpdatedAt}. Nothing is written unless the result is
     * {@link WriteOutcome#APPLIED}.
     */
    WriteOutcome commitNonce(NonceCommitment row, SigningSession next, long expectedUpdatedAt);

    /**
     * Marks the participant's unused ledger row as used and writes {@code next} in one
     * transaction, conditional on {@code expectedUpdatedAt}.
     */
    WriteOutcome commitSignatureShare(String participantId, String commitment, long usedAt,
                                      SigningSession next, long expectedUpdatedAt);

    boolean updateSession(SigningSession next, long expectedUpdatedAt);

    /**
     * Conditional on status and on the session not being overdue at {@code now}. Exactly one
     * concurrent caller sees true.
     */
    boolean transitionStatus(String sessionId, SessionStatus from, SessionStatus to, long now);

    /**
     * Stores the signature and moves aggregating to completed. False if the session is no
     * longer aggregating.
     */
    boolean completeSession(String sessionId, FinalSignature signature, long now);

    boolean markFailed(String sessionId, String reason, long now);

    boolean markExpired(String sessionId, long now);

    int expireSessions(long now);

    /**
     * Deletes terminal sessions created before {@code cutoff}. Ledger rows stay so their
     * commitment values remain blocked.
     */
    int deleteTerminalSessionsCreatedBefore(long cutoff);

    List<NonceCommitment> listNonceCommitments(String sessionId);

    boolean isCommitmentKnown(String commitment);

    List<SigningSession> listActiveSessions(String groupId);

    List<SigningSession> listPendingSessionsFor(String participantId);

    boolean recordPublication(String sessionId, String publicationId, long expectedUpdatedAt, long now);
}
