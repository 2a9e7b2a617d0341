package net.schedora.core.service;

import net.schedora.core.exception.ScheduleComputationException;
import net.schedora.core.model.ExecutionRecord;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleType;
import net.schedora.core.spi.ScheduleEventSink;
import net.schedora.core.spi.ScheduleExecutionRepository;
import net.schedora.core.spi.ScheduleRepository;
import net.schedora.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 발화 기록 + 생명주기 전진/종료.
 * 종료 판정 순서: 횟수 소진 → 종료일 경과 → ONCE → nextRun 재계산
 */
public final class ExecutionTracker {
    private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

    private final ScheduleRepository schedules;
    private final ScheduleExecutionRepository executions;
    private final ScheduleCalculator calculator;
    private final TxRunner tx;
    private final ScheduleEventSink events;

    public ExecutionTracker(ScheduleRepository schedules,
                            ScheduleExecutionRepository executions,
                            ScheduleCalculator calculator,
                            TxRunner tx,
                            ScheduleEventSink events) {
        this.schedules = schedules;
        this.executions = executions;
        this.calculator = calculator;
        this.tx = tx;
        this.events = events == null ? ScheduleEventSink.NOOP : events;
    }

    public Schedule markExecuted(Schedule schedule, Instant firedAt) throws Exception {
        return markExecuted(schedule, firedAt, null);
    }

    /**
     * 한 트랜잭션: 스케줄 갱신(version 조건부, lease 해제) + ExecutionRecord 추가.
     * version 이 바뀌었으면 ScheduleConcurrencyException 으로 전체 롤백.
     */
    public Schedule markExecuted(Schedule schedule, Instant firedAt, String dispatchRef) throws Exception {
        Objects.requireNonNull(schedule.id(), "schedule must be persisted");
        Objects.requireNonNull(firedAt, "firedAt");

        Schedule next = advance(schedule.fired(firedAt), firedAt).released();

        record Outcome(Schedule schedule, ExecutionRecord record) {}
        Outcome outcome = tx.required(() -> {
            Schedule saved = schedules.update(next);
            ExecutionRecord rec = executions.append(
                    ExecutionRecord.completed(schedule.id(), schedule.nextRun(), firedAt, dispatchRef));
            return new Outcome(saved, rec);
        });

        Schedule saved = outcome.schedule();
        events.scheduleFired(saved, outcome.record());
        if (!saved.enabled()) {
            events.scheduleDisabled(saved, saved.status());
            log.info("Schedule {} {} after {} execution(s){}", saved.id(), saved.status(), saved.executionCount(),
                    saved.lastError() == null ? "" : ": " + saved.lastError());
        } else {
            log.debug("Schedule {} fired at {}, next run {}", saved.id(), firedAt, saved.nextRun());
        }
        return saved;
    }

    /** 선점만 풀고 횟수/nextRun 은 그대로 (다음 틱에 다시 due) */
    public Schedule release(Schedule claimed) throws Exception {
        return tx.required(() -> schedules.update(claimed.released()));
    }

    Schedule advance(Schedule fired, Instant firedAt) {
        if (fired.isExhausted()) {
            return fired.terminated(Schedule.Status.EXHAUSTED, null);
        }
        if (fired.isExpiredAt(firedAt)) {
            return fired.terminated(Schedule.Status.EXPIRED, null);
        }
        if (fired.type() == ScheduleType.ONCE) {
            return fired.terminated(Schedule.Status.COMPLETED, null);
        }

        Optional<Instant> next;
        try {
            next = calculator.nextRun(fired, firedAt);
        } catch (ScheduleComputationException e) {
            // 계산 실패는 "정책상 종료"와 구분해서 ERROR 로 남긴다
            log.warn("Schedule {} moved to ERROR: {}", fired.id(), e.getMessage());
            return fired.terminated(Schedule.Status.ERROR, e.getMessage());
        }

        if (next.isEmpty()) {
            return fired.terminated(Schedule.Status.COMPLETED, null);
        }
        if (fired.endDate() != null && !next.get().isBefore(fired.endDate())) {
            return fired.terminated(Schedule.Status.EXPIRED, null);
        }
        return fired.rescheduled(next.get());
    }
}
