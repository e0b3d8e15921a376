package com.titiplex.frost.core.session;

import com.titiplex.frost.core.crypto.SchnorrVerifier;
import com.titiplex.frost.core.crypto.Secp256k1;
import com.titiplex.frost.core.crypto.SignatureAggregator;
import com.titiplex.frost.core.error.ErrorKind;
import com.titiplex.frost.core.error.FrostException;
import com.titiplex.frost.core.federation.FederationDirectory;
import com.titiplex.frost.core.model.CreateSessionRequest;
import com.titiplex.frost.core.model.FinalSignature;
import com.titiplex.frost.core.model.NonceCommitment;
import com.titiplex.frost.core.model.SessionStatus;
import com.titiplex.frost.core.model.SigningSession;
import com.titiplex.frost.core.model.ThresholdProgress;
import com.titiplex.frost.core.store.SessionStore;
import com.titiplex.frost.core.store.WriteOutcome;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Drives FROST signing sessions through their rounds:
 * {@code pending -> nonce_collection -> signing -> aggregating -> completed}, with
 * {@code failed} and {@code expired} reachable from every non-terminal state.
 * <p>
 * Participants call in concurrently from separate processes. Every session write is
 * conditional on the {@code updatedAt} token read at the start of the call; a lost race
 * surfaces as {@link ErrorKind#CONCURRENCY} and the caller re-reads and retries. No call
 * blocks waiting for other participants.
 */
@Service
public class FrostSessionManager {
    private static final Logger log = LoggerFactory.getLogger(FrostSessionManager.class);

    public static final int MIN_THRESHOLD = 1;
    public static final int MAX_THRESHOLD = 7;
    private static final SecureRandom RNG = new SecureRandom();

    private final SessionStore store;
    private final SignatureAggregator aggregator;
    private final FederationDirectory federations;
    private final Clock clock;
    private final int defaultExpirationSeconds;

    public FrostSessionManager(SessionStore store,
                               SignatureAggregator aggregator,
                               FederationDirectory federations,
                               Clock clock,
                               @Value("${frost.session.default-expiration-seconds:600}") int defaultExpirationSeconds) {
        this.store = store;
        this.aggregator = aggregator;
        this.federations = federations;
        this.clock = clock;
        this.defaultExpirationSeconds = defaultExpirationSeconds;
    }

    // ---------- Lifecycle ----------

    public SigningSession createSession(CreateSessionRequest req) {
        validateRequest(req);
        long now = clock.millis();
        int ttl = req.expirationSeconds() != null ? req.expirationSeconds() : defaultExpirationSeconds;
        CreateSessionRequest normalized = new CreateSessionRequest(req.groupId(), req.messageHash().toLowerCase(Locale.ROOT),
                req.participants(), req.threshold(), req.createdBy(), req.messageTemplate(), req.eventType(), ttl);
        SigningSession s = SigningSession.open(newSessionId(), normalized, now, now + ttl * 1000L);
        store.insertSession(s);
        log.info("Created session {} for group {} ({}-of-{}, expires in {}s)",
                s.sessionId(), s.groupId(), s.threshold(), s.participants().size(), ttl);
        return s;
    }

    /**
     * Checks a creation request without persisting anything.
     *
     * @throws FrostException VALIDATION on a bad threshold, participant set, group or message hash
     */
    public void validateRequest(CreateSessionRequest req) {
        if (req.threshold() < MIN_THRESHOLD || req.threshold() > MAX_THRESHOLD)
            throw invalid("Threshold must be between " + MIN_THRESHOLD + " and " + MAX_THRESHOLD);
        List<String> participants = req.participants();
        if (participants == null || participants.size() < req.threshold())
            throw invalid("Participants (" + (participants == null ? 0 : participants.size())
                    + ") must be >= threshold (" + req.threshold() + ")");
        Set<String> seen = new HashSet<>();
        for (String p : participants) {
            if (p == null || p.isBlank()) throw invalid("Participant identifiers must not be blank");
            if (!seen.add(p)) throw invalid("Duplicate participant " + p);
        }
        if (req.groupId() == null || req.groupId().isBlank()) throw invalid("Group id is required");
        if (!Secp256k1.isHex(req.messageHash()) || req.messageHash().length() != 64)
            throw invalid("Message hash must be 64 hex chars");
        if (req.expirationSeconds() != null && req.expirationSeconds() <= 0)
            throw invalid("Expiration must be positive");
    }

    public SigningSession getSession(String sessionId) {
        SigningSession s = store.findById(sessionId);
        if (s == null) throw new FrostException(ErrorKind.NOT_FOUND, "Session not found: " + sessionId);
        return s;
    }

    public void failSession(String sessionId, String reason) {
        String why = reason == null || reason.isBlank() ? "Failed without reason" : reason;
        if (store.markFailed(sessionId, why, clock.millis())) {
            log.info("Session {} failed: {}", sessionId, why);
            return;
        }
        SigningSession s = getSession(sessionId);
        throw new FrostException(ErrorKind.STATE, "Session already " + s.status().dbValue());
    }

    public int expireStaleSessions() {
        int n = store.expireSessions(clock.millis());
        if (n > 0) log.info("Expired {} stale session(s)", n);
        return n;
    }

    public int cleanupOldSessions(int retentionDays) {
        if (retentionDays < 1) throw invalid("Retention must be at least one day");
        long cutoff = clock.millis() - Duration.ofDays(retentionDays).toMillis();
        int n = store.deleteTerminalSessionsCreatedBefore(cutoff);
        if (n > 0) log.info("Deleted {} terminal session(s) older than {} days", n, retentionDays);
        return n;
    }

    public List<SigningSession> listActiveSessions(String groupId) {
        return store.listActiveSessions(groupId);
    }

    /**
     * Sessions still waiting for this participant's nonce commitment.
     */
    public List<SigningSession> listPendingSessions(String participantId) {
        long now = clock.millis();
        List<SigningSession> out = new ArrayList<>();
        for (SigningSession s : store.listPendingSessionsFor(participantId)) {
            if (!s.isExpiredAt(now)) out.add(s);
        }
        return out;
    }

    // ---------- Round 1 ----------

    public ThresholdProgress submitNonceCommitment(String sessionId, String participantId, String commitment) {
        SigningSession s = loadLive(sessionId, "submit nonce commitment");
        if (s.status() != SessionStatus.PENDING && s.status() != SessionStatus.NONCE_COLLECTION)
            throw new FrostException(ErrorKind.STATE, "Invalid session status: " + s.status().dbValue()
                    + ". Expected pending or nonce_collection");
        requireParticipant(s, participantId);
        if (s.nonceCommitments().containsKey(participantId))
            throw new FrostException(ErrorKind.STATE, "Participant has already submitted nonce commitment");

        String canonical;
        try {
            canonical = Secp256k1.canonical(commitment);
        } catch (IllegalArgumentException e) {
            throw invalid("Nonce commitment is not a secp256k1 point: " + e.getMessage());
        }

        long now = clock.millis();
        Map<String, String> merged = new LinkedHashMap<>(s.nonceCommitments());
        merged.put(participantId, canonical);
        boolean met = merged.size() >= s.threshold();
        SessionStatus next = met ? SessionStatus.SIGNING : SessionStatus.NONCE_COLLECTION;
        Long ncStarted = s.nonceCollectionStartedAt() != null ? s.nonceCollectionStartedAt() : Long.valueOf(now);
        Long sigStarted = s.signingStartedAt();
        if (met && sigStarted == null) sigStarted = now;

        SigningSession updated = s.withNonceRound(merged, next, ncStarted, sigStarted, s.nextToken(now));
        NonceCommitment row = new NonceCommitment(sessionId, participantId, canonical, false, now, null);
        WriteOutcome outcome = store.commitNonce(row, updated, s.updatedAt());
        switch (outcome) {
            case APPLIED -> {
            }
            case DUPLICATE_NONCE -> {
                log.warn("SECURITY: nonce reuse rejected for participant {} in session {}", participantId, sessionId);
                throw new FrostException(ErrorKind.SECURITY,
                        "Nonce reuse detected. This nonce commitment has already been used.");
            }
            case DUPLICATE_PARTICIPANT ->
                    throw new FrostException(ErrorKind.STATE, "Participant has already submitted nonce commitment");
            case STALE -> throw concurrent();
            default -> throw new IllegalStateException("unexpected outcome " + outcome);
        }
        if (met && s.status() != SessionStatus.SIGNING)
            log.info("Session {} reached nonce threshold {}/{}, now signing", sessionId, merged.size(), s.threshold());
        return new ThresholdProgress(merged.size(), s.threshold(), met, next);
    }

    // ---------- Round 2 ----------

    public ThresholdProgress submitPartialSignature(String sessionId, String participantId, String share) {
        SigningSession s = loadLive(sessionId, "submit partial signature");
        if (s.status() != SessionStatus.SIGNING)
            throw new FrostException(ErrorKind.STATE, "Invalid session status: " + s.status().dbValue() + ". Expected signing");
        requireParticipant(s, participantId);
        String commitment = s.nonceCommitments().get(participantId);
        if (commitment == null)
            throw new FrostException(ErrorKind.STATE, "Participant must submit nonce commitment before signing");
        if (s.partialSignatures().containsKey(participantId))
            throw new FrostException(ErrorKind.STATE, "Participant has already submitted partial signature");
        if (!Secp256k1.isHex(share) || share.length() > 64)
            throw invalid("Signature share must be 1 to 64 hex chars");

        long now = clock.millis();
        Map<String, String> merged = new LinkedHashMap<>(s.partialSignatures());
        merged.put(participantId, share.toLowerCase(Locale.ROOT));
        boolean met = merged.size() >= s.threshold();
        SessionStatus next = met ? SessionStatus.AGGREGATING : SessionStatus.SIGNING;

        SigningSession updated = s.withSignatureRound(merged, next, s.nextToken(now));
        WriteOutcome outcome = store.commitSignatureShare(participantId, commitment, now, updated, s.updatedAt());
        switch (outcome) {
            case APPLIED -> {
            }
            case NONCE_ALREADY_USED -> {
                log.warn("SECURITY: consumed nonce presented again by participant {} in session {}", participantId, sessionId);
                throw new FrostException(ErrorKind.SECURITY, "Nonce commitment already used or missing from ledger");
            }
            case STALE -> throw concurrent();
            default -> throw new IllegalStateException("unexpected outcome " + outcome);
        }
        if (met) log.info("Session {} reached signature threshold {}/{}, now aggregating", sessionId, merged.size(), s.threshold());
        return new ThresholdProgress(merged.size(), s.threshold(), met, next);
    }

    /**
     * Atomically moves a signing session to aggregating.
     *
     * @return true for the single caller that performed the transition, false if the session
     * was not in signing (already aggregating, or further along)
     * @throws FrostException EXPIRATION if the session is overdue; it is marked expired
     */
    public boolean transitionToAggregating(String sessionId) {
        loadLive(sessionId, "start aggregation");
        if (store.transitionStatus(sessionId, SessionStatus.SIGNING, SessionStatus.AGGREGATING, clock.millis())) {
            log.info("Session {} moved to aggregating", sessionId);
            return true;
        }
        return false;
    }

    // ---------- Aggregation ----------

    /**
     * Combines the session's shares and commitments into {@code (R, s)} and completes it.
     * On a malformed share or commitment the session stays aggregating so an operator can
     * retry or fail it explicitly.
     */
    public FinalSignature aggregateSignatures(String sessionId) {
        SigningSession s = loadLive(sessionId, "aggregate signatures");
        if (s.status() != SessionStatus.AGGREGATING)
            throw new FrostException(ErrorKind.STATE, "Invalid session status: " + s.status().dbValue() + ". Expected aggregating");
        int count = s.partialSignatures().size();
        if (count < s.threshold())
            throw new FrostException(ErrorKind.AGGREGATION, "Insufficient signatures: " + count + "/" + s.threshold());

        List<String> signers = new ArrayList<>();
        for (String p : s.participants()) {
            if (s.partialSignatures().containsKey(p)) signers.add(p);
        }
        FinalSignature sig;
        try {
            sig = aggregator.aggregate(signers, s.partialSignatures(), s.nonceCommitments());
        } catch (FrostException e) {
            log.warn("Aggregation failed for session {}: {}", sessionId, e.getMessage());
            throw e;
        }
        if (!store.completeSession(sessionId, sig, clock.millis()))
            throw new FrostException(ErrorKind.CONCURRENCY, "Session left aggregating state during aggregation");
        log.info("Session {} completed with {} share(s)", sessionId, signers.size());
        return sig;
    }

    /**
     * Verifies the stored signature against the group key on record for the session's
     * federation. The key is never taken from the caller.
     */
    public boolean verifyAggregatedSignature(String sessionId, String messageHash) {
        SigningSession s = getSession(sessionId);
        if (s.status() != SessionStatus.COMPLETED || s.finalSignature() == null)
            throw new FrostException(ErrorKind.STATE, "Session not in completed status");
        if (!Secp256k1.isHex(messageHash) || messageHash.length() != 64)
            throw invalid("Invalid message hash format");
        String groupKey = federations.findGroupPublicKey(s.groupId());
        if (groupKey == null)
            throw new FrostException(ErrorKind.NOT_FOUND, "No group public key on record for " + s.groupId());
        try {
            return SchnorrVerifier.verify(s.finalSignature(), groupKey, messageHash);
        } catch (IllegalArgumentException e) {
            throw invalid("Cannot verify: " + e.getMessage());
        }
    }

    // ---------- helpers ----------

    /**
     * Loads a session for a mutating call. Expiry is checked before any state check; an
     * overdue session is moved to expired on the way out.
     */
    private SigningSession loadLive(String sessionId, String action) {
        SigningSession s = getSession(sessionId);
        long now = clock.millis();
        if (s.isExpiredAt(now)) {
            if (store.markExpired(sessionId, now)) log.info("Session {} expired", sessionId);
            throw new FrostException(ErrorKind.EXPIRATION, "Session has expired. Cannot " + action + ".");
        }
        return s;
    }

    private static void requireParticipant(SigningSession s, String participantId) {
        if (participantId == null || !s.hasParticipant(participantId))
            throw invalid("Participant not authorized for this session");
    }

    private static FrostException invalid(String reason) {
        return new FrostException(ErrorKind.VALIDATION, reason);
    }

    private static FrostException concurrent() {
        return new FrostException(ErrorKind.CONCURRENCY, "Session was updated by another participant. Please retry.");
    }

    private static String newSessionId() {
        byte[] b = new byte[16];
        RNG.nextBytes(b);
        return Hex.toHexString(b);
    }
}
