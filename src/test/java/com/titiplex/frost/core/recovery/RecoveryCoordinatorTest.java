package com.titiplex.frost.core.recovery;

import com.titiplex.frost.core.model.RecoveryReport;
import com.titiplex.frost.core.model.ResumeAction;
import com.titiplex.frost.core.model.SessionStatus;
import com.titiplex.frost.core.model.SigningSession;
import com.titiplex.frost.support.CoordinatorFixture;
import com.titiplex.frost.support.ThresholdSigner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.titiplex.frost.support.CoordinatorFixture.request;
import static org.assertj.core.api.Assertions.assertThat;

class RecoveryCoordinatorTest {
    private static final List<String> ABC = List.of("A", "B", "C");

    private CoordinatorFixture fx;
    private RecoveryCoordinator recovery;
    private ThresholdSigner signer;

    @BeforeEach
    void setUp() {
        fx = new CoordinatorFixture();
        recovery = new RecoveryCoordinator(fx.store, fx.sessions, fx.clock);
        signer = new ThresholdSigner(ABC, 3);
        fx.federations.registerFederation("g", "Family", signer.groupPublicKey());
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void reportsTheMissingCommitment() {
        String id = fx.sessions.createSession(request("g", ThresholdSigner.randomHash(), ABC, 3)).sessionId();
        fx.sessions.submitNonceCommitment(id, "A", signer.commit("A"));
        fx.sessions.submitNonceCommitment(id, "C", signer.commit("C"));

        RecoveryReport r = recovery.recoverSession(id);

        assertThat(r.missingCommitments()).containsExactly("B");
        assertThat(r.missingSignatures()).containsExactly("A", "B", "C");
        assertThat(r.canAggregate()).isFalse();
        assertThat(r.expired()).isFalse();
        assertThat(recovery.resumeSession(id)).isEqualTo(ResumeAction.AWAITING_COMMITMENTS);

        fx.sessions.submitNonceCommitment(id, "B", signer.commit("B"));
        assertThat(recovery.recoverSession(id).missingCommitments()).isEmpty();
        assertThat(recovery.resumeSession(id)).isEqualTo(ResumeAction.AWAITING_SIGNATURES);
    }

    @Test
    void laggingStatusStillAllowsAggregation() {
        String hash = ThresholdSigner.randomHash();
        String id = fx.sessions.createSession(request("g", hash, ABC, 3)).sessionId();
        for (String p : ABC) fx.sessions.submitNonceCommitment(id, p, signer.commit(p));
        fx.sessions.submitPartialSignature(id, "A", signer.share("A", ABC, hash));
        fx.sessions.submitPartialSignature(id, "B", signer.share("B", ABC, hash));

        // the third share landed but the process died before the status moved on
        SigningSession s = fx.sessions.getSession(id);
        Map<String, String> shares = new LinkedHashMap<>(s.partialSignatures());
        shares.put("C", signer.share("C", ABC, hash));
        SigningSession lagging = s.withSignatureRound(shares, SessionStatus.SIGNING, s.nextToken(fx.clock.millis()));
        assertThat(fx.store.updateSession(lagging, s.updatedAt())).isTrue();

        RecoveryReport r = recovery.recoverSession(id);
        assertThat(r.session().status()).isEqualTo(SessionStatus.SIGNING);
        assertThat(r.missingSignatures()).isEmpty();
        assertThat(r.canAggregate()).isTrue();

        assertThat(recovery.resumeSession(id)).isEqualTo(ResumeAction.COMPLETED);
        assertThat(fx.sessions.getSession(id).status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(fx.sessions.verifyAggregatedSignature(id, hash)).isTrue();
        assertThat(recovery.resumeSession(id)).isEqualTo(ResumeAction.ALREADY_COMPLETED);
    }

    @Test
    void aggregationAlreadyClaimedIsReported() {
        String hash = ThresholdSigner.randomHash();
        String id = fx.sessions.createSession(request("g", hash, ABC, 3)).sessionId();
        for (String p : ABC) fx.sessions.submitNonceCommitment(id, p, signer.commit(p));
        for (String p : ABC) fx.sessions.submitPartialSignature(id, p, signer.share(p, ABC, hash));
        fx.sessions.aggregateSignatures(id);

        assertThat(recovery.resumeSession(id)).isEqualTo(ResumeAction.ALREADY_COMPLETED);
    }

    @Test
    void overdueSessionIsExpiredOnResume() {
        String id = fx.sessions.createSession(request("g", ThresholdSigner.randomHash(), ABC, 3)).sessionId();
        fx.clock.advance(Duration.ofMinutes(15));

        assertThat(recovery.recoverSession(id).expired()).isTrue();
        assertThat(recovery.resumeSession(id)).isEqualTo(ResumeAction.EXPIRED);
        assertThat(fx.sessions.getSession(id).status()).isEqualTo(SessionStatus.EXPIRED);
    }

    @Test
    void failedSessionStaysFailed() {
        String id = fx.sessions.createSession(request("g", ThresholdSigner.randomHash(), ABC, 3)).sessionId();
        fx.sessions.failSession(id, "cancelled");

        assertThat(recovery.resumeSession(id)).isEqualTo(ResumeAction.FAILED);
    }
}
