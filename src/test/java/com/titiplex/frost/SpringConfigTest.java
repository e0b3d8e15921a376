package com.titiplex.frost;

import com.titiplex.frost.core.approval.ApprovalGate;
import com.titiplex.frost.core.maintenance.SessionMaintenanceService;
import com.titiplex.frost.core.model.CreateSessionRequest;
import com.titiplex.frost.core.model.GateResult;
import com.titiplex.frost.core.publish.CompletionService;
import com.titiplex.frost.core.recovery.RecoveryCoordinator;
import com.titiplex.frost.core.session.FrostSessionManager;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = SpringConfig.class, properties = {
        "frost.store.url=jdbc:sqlite::memory:",
        "frost.maintenance.enabled=false"
})
class SpringConfigTest {

    @Autowired
    FrostSessionManager sessions;
    @Autowired
    ApprovalGate gate;
    @Autowired
    RecoveryCoordinator recovery;
    @Autowired
    CompletionService completion;
    @Autowired
    SessionMaintenanceService maintenance;

    @Test
    void contextWiresTheCoordinator() {
        GateResult r = gate.requestSession(new CreateSessionRequest("g", "ab".repeat(32), List.of("A", "B"), 2,
                "A", null, "payment", null));

        assertThat(r.outcome()).isEqualTo(GateResult.Outcome.CREATED);
        assertThat(recovery.recoverSession(r.session().sessionId()).missingCommitments()).containsExactly("A", "B");
        assertThat(sessions.getSession(r.session().sessionId()).expiresAt() - r.session().createdAt()).isEqualTo(600_000L);
        assertThat(completion).isNotNull();
        assertThat(maintenance.isRunning()).isFalse();
    }
}
