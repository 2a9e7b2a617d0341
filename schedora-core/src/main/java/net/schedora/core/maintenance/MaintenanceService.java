package net.schedora.core.maintenance;

import net.schedora.core.spi.Clock;
import net.schedora.core.spi.ScheduleExecutionRepository;
import net.schedora.core.spi.ScheduleRepository;
import net.schedora.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final ScheduleRepository schedules;
    private final ScheduleExecutionRepository executions;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(ScheduleRepository schedules,
                              ScheduleExecutionRepository executions,
                              TxRunner tx,
                              Clock clock) {
        this.schedules = schedules;
        this.executions = executions;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검.
     * - lease 만료된 선점 해제 (죽은 poller)
     * - 보관 기간 지난 ExecutionRecord 삭제 (retention 이 null/0 이하면 생략)
     */
    public MaintenanceReport runOnce(Duration executionRetention) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        r.releasedClaims = tx.required(() -> schedules.releaseExpiredClaims(now));

        if (executionRetention != null && !executionRetention.isZero() && !executionRetention.isNegative()) {
            Instant threshold = now.minus(executionRetention);
            r.purgedExecutions = tx.required(() -> executions.purgeOlderThan(threshold));
        }

        r.timestamp = now;
        if (r.releasedClaims > 0) {
            log.warn("Released {} expired schedule claim(s); a poller may have died mid-tick", r.releasedClaims);
        }
        log.debug("Maintenance done: {}", r);
        return r;
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public int releasedClaims;
        public int purgedExecutions;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", releasedClaims=" + releasedClaims +
                    ", purgedExecutions=" + purgedExecutions +
                    '}';
        }
    }
}
