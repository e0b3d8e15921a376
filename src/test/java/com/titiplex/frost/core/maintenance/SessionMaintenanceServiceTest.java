package com.titiplex.frost.core.maintenance;

import com.titiplex.frost.core.model.SessionStatus;
import com.titiplex.frost.core.session.FrostSessionManager;
import com.titiplex.frost.core.store.StoreException;
import com.titiplex.frost.support.CoordinatorFixture;
import com.titiplex.frost.support.ThresholdSigner;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.titiplex.frost.support.CoordinatorFixture.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SessionMaintenanceServiceTest {

    @Test
    void runOnceExpiresAndDeletes() {
        try (CoordinatorFixture fx = new CoordinatorFixture()) {
            SessionMaintenanceService maintenance = new SessionMaintenanceService(fx.sessions, true, 60, 24, 90);
            String old = fx.sessions.createSession(request("g", ThresholdSigner.randomHash(), List.of("A", "B"), 2)).sessionId();
            fx.sessions.failSession(old, "cancelled");
            fx.clock.advance(Duration.ofDays(91));
            String stale = fx.sessions.createSession(request("g", ThresholdSigner.randomHash(), List.of("A", "B"), 2)).sessionId();
            fx.clock.advance(Duration.ofMinutes(11));

            assertThat(maintenance.runOnce()).isEqualTo(2);
            assertThat(fx.store.findById(old)).isNull();
            assertThat(fx.sessions.getSession(stale).status()).isEqualTo(SessionStatus.EXPIRED);
        }
    }

    @Test
    void failingSweepsAreContained() {
        FrostSessionManager broken = mock(FrostSessionManager.class);
        when(broken.expireStaleSessions()).thenThrow(new StoreException("disk full", null));
        when(broken.cleanupOldSessions(anyInt())).thenReturn(3);

        assertThat(new SessionMaintenanceService(broken, true, 60, 24, 90).runOnce()).isEqualTo(3);
    }

    @Test
    void disabledServiceNeverSchedules() {
        SessionMaintenanceService maintenance = new SessionMaintenanceService(mock(FrostSessionManager.class), false, 60, 24, 90);
        maintenance.start();
        assertThat(maintenance.isRunning()).isFalse();
    }

    @Test
    void startAndStop() {
        FrostSessionManager sessions = mock(FrostSessionManager.class);
        SessionMaintenanceService maintenance = new SessionMaintenanceService(sessions, true, 3600, 24, 90);
        maintenance.start();
        maintenance.start();
        assertThat(maintenance.isRunning()).isTrue();
        maintenance.stop();
        assertThat(maintenance.isRunning()).isFalse();
    }
}
