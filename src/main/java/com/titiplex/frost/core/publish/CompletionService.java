package com.titiplex.frost.core.publish;

import com.titiplex.frost.core.error.ErrorKind;
import com.titiplex.frost.core.error.FrostException;
import com.titiplex.frost.core.federation.FederationDirectory;
import com.titiplex.frost.core.model.CompletionNotice;
import com.titiplex.frost.core.model.SessionStatus;
import com.titiplex.frost.core.model.SigningSession;
import com.titiplex.frost.core.session.FrostSessionManager;
import com.titiplex.frost.core.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Last step of a ceremony: publish the signed message and tell every participant how it ended.
 */
@Service
public class CompletionService {
    private static final Logger log = LoggerFactory.getLogger(CompletionService.class);

    private final FrostSessionManager sessions;
    private final SessionStore store;
    private final FederationDirectory federations;
    private final PublicationAdapter publisher;
    private final CompletionNotifier notifier;
    private final Clock clock;

    public CompletionService(FrostSessionManager sessions, SessionStore store, FederationDirectory federations,
                             PublicationAdapter publisher, CompletionNotifier notifier, Clock clock) {
        this.sessions = sessions;
        this.store = store;
        this.federations = federations;
        this.publisher = publisher;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * @return the publication id
     * @throws PublicationException if the adapter could not publish; the session stays completed
     */
    public String publishSignedEvent(String sessionId) {
        SigningSession s = sessions.getSession(sessionId);
        if (s.status() != SessionStatus.COMPLETED || s.finalSignature() == null)
            throw new FrostException(ErrorKind.STATE, "Session not in completed status");
        if (s.publicationId() != null) return s.publicationId();

        String groupKey = federations.findGroupPublicKey(s.groupId());
        if (groupKey == null)
            throw new FrostException(ErrorKind.NOT_FOUND, "No group public key on record for " + s.groupId());

        String publicationId = publisher.publish(sessionId, s.finalSignature(), s.messageTemplate(), groupKey);
        if (!store.recordPublication(sessionId, publicationId, s.updatedAt(), clock.millis()))
            log.warn("Session {} changed while publishing; publication {} not recorded on it", sessionId, publicationId);
        log.info("Session {} published as {}", sessionId, publicationId);

        deliver(CompletionNotice.completed(s, publicationId));
        return publicationId;
    }

    public void reportFailure(String sessionId, String reason) {
        sessions.failSession(sessionId, reason);
        deliver(CompletionNotice.failed(sessions.getSession(sessionId), reason));
    }

    private void deliver(CompletionNotice notice) {
        try {
            notifier.send(notice);
        } catch (RuntimeException e) {
            // the ceremony outcome is already stored; delivery is best effort
            log.warn("Completion notice for session {} not delivered: {}", notice.sessionId(), e.getMessage());
        }
    }
}
