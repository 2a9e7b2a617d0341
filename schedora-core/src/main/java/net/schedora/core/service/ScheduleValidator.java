package net.schedora.core.service;

import net.schedora.core.exception.ScheduleValidationException;
import net.schedora.core.model.ScheduleDefinition;
import net.schedora.core.model.ScheduleDraft;
import net.schedora.core.model.TimeOfDay;
import net.schedora.core.spi.CronCalculator;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;

/** 생성/수정 시점 검증. 문제 있으면 ScheduleValidationException, 기본값으로 덮지 않음 */
public final class ScheduleValidator {
    private final CronCalculator cron;

    public ScheduleValidator(CronCalculator cron) {
        this.cron = cron;
    }

    public void validate(ScheduleDraft draft, Instant now) {
        if (draft == null) throw new ScheduleValidationException("schedule is required");
        if (draft.definition() == null) throw new ScheduleValidationException("schedule definition is required");
        if (draft.jobId() <= 0) throw new ScheduleValidationException("jobId must be positive: " + draft.jobId());

        if (draft.timezone() != null) {
            try {
                ZoneId.of(draft.timezone());
            } catch (DateTimeException e) {
                throw new ScheduleValidationException("invalid timezone '" + draft.timezone() + "'", e);
            }
        }
        if (draft.maxExecutions() != null && draft.maxExecutions() < 1) {
            throw new ScheduleValidationException("maxExecutions must be at least 1: " + draft.maxExecutions());
        }
        if (draft.endDate() != null && !draft.endDate().isAfter(now)) {
            throw new ScheduleValidationException("endDate must be in the future: " + draft.endDate());
        }

        ScheduleDefinition def = draft.definition();
        if (def instanceof ScheduleDefinition.Once once) {
            if (!once.executeAt().isAfter(now)) {
                throw new ScheduleValidationException("executeAt must be in the future: " + once.executeAt());
            }
        } else if (def instanceof ScheduleDefinition.Recurring r) {
            validateRecurring(r);
        } else if (def instanceof ScheduleDefinition.Cron c) {
            try {
                cron.validate(c.expression());
            } catch (IllegalArgumentException e) {
                throw new ScheduleValidationException("invalid cron expression '" + c.expression() + "': " + e.getMessage(), e);
            }
        }
    }

    private static void validateRecurring(ScheduleDefinition.Recurring r) {
        if (r.recurringType().requiresTimeOfDay()) {
            try {
                TimeOfDay.parse(r.timeOfDay());
            } catch (IllegalArgumentException e) {
                throw new ScheduleValidationException(e.getMessage(), e);
            }
        }
        if (r.dayOfMonth() != null && (r.dayOfMonth() < 1 || r.dayOfMonth() > 31)) {
            throw new ScheduleValidationException("dayOfMonth must be 1..31: " + r.dayOfMonth());
        }
    }
}
