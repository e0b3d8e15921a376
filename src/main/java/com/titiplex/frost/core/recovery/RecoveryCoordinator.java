package com.titiplex.frost.core.recovery;

import com.titiplex.frost.core.error.ErrorKind;
import com.titiplex.frost.core.error.FrostException;
import com.titiplex.frost.core.model.NonceCommitment;
import com.titiplex.frost.core.model.RecoveryReport;
import com.titiplex.frost.core.model.ResumeAction;
import com.titiplex.frost.core.model.SessionStatus;
import com.titiplex.frost.core.model.SigningSession;
import com.titiplex.frost.core.session.FrostSessionManager;
import com.titiplex.frost.core.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Rebuilds the progress of an interrupted ceremony from persisted state, e.g. after a
 * coordinator restart.
 */
@Service
public class RecoveryCoordinator {
    private static final Logger log = LoggerFactory.getLogger(RecoveryCoordinator.class);

    private final SessionStore store;
    private final FrostSessionManager sessions;
    private final Clock clock;

    public RecoveryCoordinator(SessionStore store, FrostSessionManager sessions, Clock clock) {
        this.store = store;
        this.sessions = sessions;
        this.clock = clock;
    }

    /**
     * Commitments are counted from the nonce ledger, shares from the session record.
     * {@code canAggregate} looks at the share count only, so it holds even while the status
     * column still lags behind.
     */
    public RecoveryReport recoverSession(String sessionId) {
        SigningSession s = sessions.getSession(sessionId);
        Set<String> committed = new HashSet<>();
        for (NonceCommitment c : store.listNonceCommitments(sessionId)) committed.add(c.participantId());

        List<String> missingCommitments = new ArrayList<>();
        List<String> missingSignatures = new ArrayList<>();
        for (String p : s.participants()) {
            if (!committed.contains(p)) missingCommitments.add(p);
            if (!s.partialSignatures().containsKey(p)) missingSignatures.add(p);
        }
        boolean canAggregate = s.participants().size() - missingSignatures.size() >= s.threshold();
        return new RecoveryReport(s, missingCommitments, missingSignatures, canAggregate, s.isExpiredAt(clock.millis()));
    }

    /**
     * Pushes the ceremony as far as persisted state allows.
     */
    public ResumeAction resumeSession(String sessionId) {
        RecoveryReport r = recoverSession(sessionId);
        SigningSession s = r.session();
        switch (s.status()) {
            case COMPLETED -> {
                return ResumeAction.ALREADY_COMPLETED;
            }
            case FAILED -> {
                return ResumeAction.FAILED;
            }
            case EXPIRED -> {
                return ResumeAction.EXPIRED;
            }
            default -> {
            }
        }
        if (r.expired()) {
            store.markExpired(sessionId, clock.millis());
            return ResumeAction.EXPIRED;
        }
        if (!r.canAggregate()) {
            int committed = s.participants().size() - r.missingCommitments().size();
            return committed < s.threshold() ? ResumeAction.AWAITING_COMMITMENTS : ResumeAction.AWAITING_SIGNATURES;
        }
        if (s.status() == SessionStatus.SIGNING && !sessions.transitionToAggregating(sessionId)) {
            return ResumeAction.AGGREGATION_CLAIMED_ELSEWHERE;
        }
        try {
            sessions.aggregateSignatures(sessionId);
        } catch (FrostException e) {
            if (e.kind() == ErrorKind.CONCURRENCY || e.kind() == ErrorKind.STATE) {
                log.info("Session {} was finished by another coordinator: {}", sessionId, e.getMessage());
                return ResumeAction.AGGREGATION_CLAIMED_ELSEWHERE;
            }
            throw e;
        }
        log.info("Resumed and completed session {}", sessionId);
        return ResumeAction.COMPLETED;
    }
}
