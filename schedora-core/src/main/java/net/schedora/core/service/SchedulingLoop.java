package net.schedora.core.service;

import net.schedora.core.exception.ScheduleConcurrencyException;
import net.schedora.core.model.Schedule;
import net.schedora.core.spi.Clock;
import net.schedora.core.spi.JobDispatcher;
import net.schedora.core.spi.JobDispatcher.DispatchRequest;
import net.schedora.core.spi.JobDispatcher.DispatchResult;
import net.schedora.core.spi.ScheduleRepository;
import net.schedora.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 한 번의 poll 틱: due 조회 → (스케줄마다) 선점 → 디스패치 → markExecuted.
 * 스케줄 하나의 실패는 로그만 남기고 다음으로 넘어간다.
 */
public final class SchedulingLoop {
    private static final Logger log = LoggerFactory.getLogger(SchedulingLoop.class);

    private final DueScheduleFinder finder;
    private final ExecutionTracker tracker;
    private final ScheduleRepository schedules;
    private final JobDispatcher dispatcher;
    private final TxRunner tx;
    private final Clock clock;
    private final String owner;
    private final Duration claimLease;

    public SchedulingLoop(DueScheduleFinder finder,
                          ExecutionTracker tracker,
                          ScheduleRepository schedules,
                          JobDispatcher dispatcher,
                          TxRunner tx,
                          Clock clock,
                          String owner,
                          Duration claimLease) {
        if (claimLease == null || claimLease.isNegative() || claimLease.isZero()) {
            throw new IllegalArgumentException("claimLease must be positive: " + claimLease);
        }
        this.finder = finder;
        this.tracker = tracker;
        this.schedules = schedules;
        this.dispatcher = dispatcher;
        this.tx = tx;
        this.clock = clock;
        this.owner = owner;
        this.claimLease = claimLease;
    }

    public TickReport tick() throws Exception {
        Instant now = clock.now();
        TickReport r = new TickReport();
        r.timestamp = now;

        List<Schedule> due = finder.dueSchedules(now);
        r.due = due.size();

        for (Schedule s : due) {
            try {
                fire(s, r);
            } catch (ScheduleConcurrencyException e) {
                r.skipped++;
                log.debug("Schedule {} skipped: {}", s.id(), e.getMessage());
            } catch (Exception e) {
                r.failed++;
                log.error("Schedule {} (job {}) failed during tick", s.id(), s.jobId(), e);
            }
        }
        if (r.due > 0) log.info("Scheduling tick done: {}", r);
        return r;
    }

    private void fire(Schedule due, TickReport r) throws Exception {
        Instant firedAt = clock.now();
        Schedule claimed = tx.requiresNew(() -> schedules.claim(due, owner, firedAt.plus(claimLease), firedAt))
                .orElseThrow(() -> new ScheduleConcurrencyException(due.id(),
                        "schedule " + due.id() + " already claimed by another poller"));

        DispatchResult result;
        try {
            result = dispatcher.dispatch(new DispatchRequest(claimed.id(), claimed.jobId(), claimed.nextRun(), firedAt));
        } catch (Exception e) {
            releaseAfterFailure(claimed, e);
            throw e;
        }

        if (result == null || !result.accepted()) {
            // 횟수/nextRun 을 건드리지 않고 선점만 해제 → 다음 틱에 재시도
            tracker.release(claimed);
            r.rejected++;
            log.warn("Job {} dispatch rejected for schedule {}: {}", claimed.jobId(), claimed.id(),
                    result == null ? "no result" : result.reason());
            return;
        }

        Schedule after;
        try {
            after = tracker.markExecuted(claimed, firedAt, result.reference());
        } catch (ScheduleConcurrencyException e) {
            // 잡은 이미 나갔다. lease 가 만료되어 다른 쪽이 행을 바꾼 경우
            r.unrecorded++;
            log.warn("Job {} dispatched for schedule {} (ref={}) but the firing could not be recorded: {}",
                    claimed.jobId(), claimed.id(), result.reference(), e.getMessage());
            return;
        }
        r.fired++;
        if (after.status() == Schedule.Status.ERROR) r.errored++;
    }

    private void releaseAfterFailure(Schedule claimed, Exception cause) {
        try {
            tracker.release(claimed);
        } catch (Exception releaseError) {
            // lease 만료로 회수된다
            cause.addSuppressed(releaseError);
        }
    }

    /** 틱 결과 요약 */
    public static final class TickReport {
        public Instant timestamp;
        public int due;
        public int fired;
        public int rejected;
        public int skipped;
        /** 디스패치는 수락됐지만 version 충돌로 기록하지 못한 발화 */
        public int unrecorded;
        public int errored;
        public int failed;

        @Override public String toString() {
            return "TickReport{" +
                    "timestamp=" + timestamp +
                    ", due=" + due +
                    ", fired=" + fired +
                    ", rejected=" + rejected +
                    ", skipped=" + skipped +
                    ", unrecorded=" + unrecorded +
                    ", errored=" + errored +
                    ", failed=" + failed +
                    '}';
        }
    }
}
