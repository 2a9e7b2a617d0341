package net.schedora.core.service;

import net.schedora.core.exception.ScheduleComputationException;
import net.schedora.core.exception.ScheduleConcurrencyException;
import net.schedora.core.exception.ScheduleNotFoundException;
import net.schedora.core.exception.ScheduleValidationException;
import net.schedora.core.model.ExecutionRecord;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleDraft;
import net.schedora.core.model.ScheduleType;
import net.schedora.core.spi.Clock;
import net.schedora.core.spi.ScheduleEventSink;
import net.schedora.core.spi.ScheduleExecutionRepository;
import net.schedora.core.spi.ScheduleRepository;
import net.schedora.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 스케줄 생성/조회/수정/활성화/삭제. 생성·수정 시 nextRun 을 즉시 계산한다.
 */
public final class ScheduleService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final ScheduleRepository schedules;
    private final ScheduleExecutionRepository executions;
    private final ScheduleCalculator calculator;
    private final ScheduleValidator validator;
    private final TxRunner tx;
    private final Clock clock;
    private final ScheduleEventSink events;

    public ScheduleService(ScheduleRepository schedules,
                           ScheduleExecutionRepository executions,
                           ScheduleCalculator calculator,
                           ScheduleValidator validator,
                           TxRunner tx,
                           Clock clock,
                           ScheduleEventSink events) {
        this.schedules = schedules;
        this.executions = executions;
        this.calculator = calculator;
        this.validator = validator;
        this.tx = tx;
        this.clock = clock;
        this.events = events == null ? ScheduleEventSink.NOOP : events;
    }

    public Schedule create(ScheduleDraft draft) throws Exception {
        Instant now = clock.now();
        validator.validate(draft, now);

        Schedule fresh = Schedule.ofNew(draft.jobId(), draft.definition(), draft.timezone(), draft.enabled(),
                draft.maxExecutions(), draft.endDate(), null, draft.description(), draft.createdBy());
        Schedule settled = settle(fresh, now);

        Schedule saved = tx.required(() -> schedules.insert(settled));
        events.scheduleCreated(saved);
        log.info("Created schedule {} for job {}: type={}, nextRun={}", saved.id(), saved.jobId(), saved.type(),
                saved.nextRun());
        return saved;
    }

    public Schedule get(long id) throws Exception {
        return tx.required(() -> schedules.findById(id)).orElseThrow(() -> new ScheduleNotFoundException(id));
    }

    public List<Schedule> listByJob(long jobId) throws Exception {
        return tx.required(() -> schedules.findByJob(jobId));
    }

    /** 정의 교체. 실행 이력(횟수, lastRun)은 유지하고 nextRun 재계산 */
    public Schedule update(long id, ScheduleDraft draft) throws Exception {
        Instant now = clock.now();
        validator.validate(draft, now);

        Schedule saved = tx.required(() -> {
            Schedule existing = unclaimed(id, now);
            Schedule replaced = new Schedule(existing.id(), draft.jobId(), draft.definition(), draft.timezone(),
                    draft.enabled(), existing.executionCount(), draft.maxExecutions(), draft.endDate(),
                    null, existing.lastRun(), Schedule.Status.SCHEDULED, null, draft.description(),
                    existing.createdBy(), existing.version(), null, null,
                    existing.createdAt(), existing.updatedAt());
            return schedules.update(settle(replaced, now));
        });
        log.info("Updated schedule {}: enabled={}, nextRun={}", id, saved.enabled(), saved.nextRun());
        return saved;
    }

    public Schedule enable(long id) throws Exception {
        Instant now = clock.now();
        Schedule saved = tx.required(() -> {
            Schedule existing = unclaimed(id, now);
            if (existing.enabled()) return existing;
            if (existing.isExhausted()) {
                throw new ScheduleValidationException("schedule " + id + " has exhausted maxExecutions=" + existing.maxExecutions());
            }
            if (existing.isExpiredAt(now)) {
                throw new ScheduleValidationException("schedule " + id + " ended at " + existing.endDate());
            }
            Schedule reopened = new Schedule(existing.id(), existing.jobId(), existing.definition(),
                    existing.timezone(), true, existing.executionCount(), existing.maxExecutions(),
                    existing.endDate(), null, existing.lastRun(), Schedule.Status.SCHEDULED, null,
                    existing.description(), existing.createdBy(), existing.version(), null, null,
                    existing.createdAt(), existing.updatedAt());
            return schedules.update(settle(reopened, now));
        });
        log.info("Enabled schedule {}: nextRun={}", id, saved.nextRun());
        return saved;
    }

    /** 다음 틱부터 due 에서 빠진다. 이미 디스패치된 발화는 되돌리지 않음 */
    public Schedule disable(long id) throws Exception {
        Instant now = clock.now();
        Schedule existing = tx.required(() -> unclaimed(id, now));
        if (!existing.enabled()) return existing;

        // version 조건부라 그 사이 poller 가 선점했으면 ScheduleConcurrencyException
        Schedule saved = tx.required(() -> schedules.update(
                existing.terminated(Schedule.Status.DISABLED, null).released()));
        events.scheduleDisabled(saved, Schedule.Status.DISABLED);
        log.info("Disabled schedule {}", id);
        return saved;
    }

    public void delete(long id) throws Exception {
        boolean deleted = tx.required(() -> schedules.delete(id));
        if (!deleted) throw new ScheduleNotFoundException(id);
        log.info("Deleted schedule {}", id);
    }

    public List<ExecutionRecord> executions(long id, int limit) throws Exception {
        return tx.required(() -> {
            if (schedules.findById(id).isEmpty()) throw new ScheduleNotFoundException(id);
            return executions.findRecent(id, limit);
        });
    }

    /** 살아있는 lease(발화 중)가 있으면 ScheduleConcurrencyException. lease 가 끝난 뒤 다시 시도 */
    private Schedule unclaimed(long id, Instant now) throws Exception {
        Schedule existing = schedules.findById(id).orElseThrow(() -> new ScheduleNotFoundException(id));
        if (existing.isLeasedAt(now)) {
            throw new ScheduleConcurrencyException(id, "schedule " + id + " is being fired by "
                    + existing.leaseOwner() + " until " + existing.leaseUntil());
        }
        return existing;
    }

    /** enabled/소진/만료를 반영해서 status, nextRun 을 맞춘다 */
    private Schedule settle(Schedule s, Instant now) {
        if (!s.enabled()) return s.terminated(Schedule.Status.DISABLED, null);
        if (s.isExhausted()) return s.terminated(Schedule.Status.EXHAUSTED, null);
        if (s.isExpiredAt(now)) return s.terminated(Schedule.Status.EXPIRED, null);

        Optional<Instant> next;
        try {
            next = calculator.nextRun(s, now);
        } catch (ScheduleComputationException e) {
            throw new ScheduleValidationException("cannot compute next run: " + e.getMessage(), e);
        }
        if (next.isEmpty() && s.type() == ScheduleType.ONCE) {
            return s.terminated(Schedule.Status.COMPLETED, null);
        }
        // 요일이 빈 WEEKLY 는 enabled 이지만 발화하지 않는다
        return s.rescheduled(next.orElse(null));
    }
}
