package com.titiplex.frost.core.maintenance;

import com.titiplex.frost.core.session.FrostSessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background sweeps: overdue sessions are marked expired, and terminal sessions past the
 * retention window are deleted (their nonce ledger rows stay).
 */
@Service
public class SessionMaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(SessionMaintenanceService.class);

    private final FrostSessionManager sessions;
    private final boolean enabled;
    private final long expireIntervalSeconds;
    private final long cleanupIntervalHours;
    private final int retentionDays;
    private ScheduledExecutorService ses;

    public SessionMaintenanceService(FrostSessionManager sessions,
                                     @Value("${frost.maintenance.enabled:true}") boolean enabled,
                                     @Value("${frost.maintenance.expire-interval-seconds:60}") long expireIntervalSeconds,
                                     @Value("${frost.maintenance.cleanup-interval-hours:24}") long cleanupIntervalHours,
                                     @Value("${frost.session.retention-days:90}") int retentionDays) {
        this.sessions = sessions;
        this.enabled = enabled;
        this.expireIntervalSeconds = expireIntervalSeconds;
        this.cleanupIntervalHours = cleanupIntervalHours;
        this.retentionDays = retentionDays;
    }

    public synchronized void start() {
        if (ses != null) return;
        if (!enabled) {
            log.info("Session maintenance disabled");
            return;
        }
        ses = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "frost-maintenance");
            t.setDaemon(true);
            return t;
        });
        ses.scheduleAtFixedRate(this::expireDue, 0, expireIntervalSeconds, TimeUnit.SECONDS);
        ses.scheduleAtFixedRate(this::cleanupOld, cleanupIntervalHours, cleanupIntervalHours, TimeUnit.HOURS);
        log.info("Session maintenance started: expiry every {}s, cleanup every {}h ({} days retention)",
                expireIntervalSeconds, cleanupIntervalHours, retentionDays);
    }

    public synchronized boolean isRunning() {
        return ses != null && !ses.isShutdown();
    }

    public synchronized void stop() {
        if (ses == null) return;
        ses.shutdownNow();
        ses = null;
    }

    /**
     * One expiry sweep followed by one cleanup sweep, on the calling thread.
     *
     * @return sessions expired plus sessions deleted
     */
    public int runOnce() {
        return expireDue() + cleanupOld();
    }

    // a failing sweep is logged and retried on the next tick; an exception would cancel the schedule
    private int expireDue() {
        try {
            return sessions.expireStaleSessions();
        } catch (RuntimeException e) {
            log.error("Expiry sweep failed", e);
            return 0;
        }
    }

    private int cleanupOld() {
        try {
            return sessions.cleanupOldSessions(retentionDays);
        } catch (RuntimeException e) {
            log.error("Cleanup sweep failed", e);
            return 0;
        }
    }
}
