package net.schedora.core.model;

import java.time.Instant;
import java.util.Objects;

public record Schedule(
        Long id,
        Long jobId,
        ScheduleDefinition definition,
        String timezone,        // IANA zone id
        boolean enabled,
        int executionCount,
        Integer maxExecutions,
        Instant endDate,
        Instant nextRun,
        Instant lastRun,
        Status status,
        String lastError,
        String description,
        Long createdBy,
        long version,           // 낙관적 잠금 토큰
        String leaseOwner,
        Instant leaseUntil,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String DEFAULT_TIMEZONE = "UTC";

    public enum Status {
        SCHEDULED, COMPLETED, EXHAUSTED, EXPIRED, ERROR, DISABLED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }

        public boolean isTerminal() { return this != SCHEDULED && this != UNKNOWN; }
    }

    public Schedule {
        Objects.requireNonNull(definition, "definition");
        if (timezone == null || timezone.isBlank()) timezone = DEFAULT_TIMEZONE;
        if (status == null) status = Status.SCHEDULED;
    }

    public static Schedule ofNew(long jobId, ScheduleDefinition definition, String timezone, boolean enabled,
                                 Integer maxExecutions, Instant endDate, Instant nextRun,
                                 String description, Long createdBy) {
        return new Schedule(null, jobId, definition, timezone, enabled, 0, maxExecutions, endDate,
                nextRun, null, enabled ? Status.SCHEDULED : Status.DISABLED, null, description, createdBy,
                0L, null, null, null, null);
    }

    public ScheduleType type() { return definition.type(); }

    public boolean isExhausted() {
        return maxExecutions != null && executionCount >= maxExecutions;
    }

    public boolean isExpiredAt(Instant asOf) {
        return endDate != null && !endDate.isAfter(asOf);
    }

    public boolean isLeasedAt(Instant asOf) {
        return leaseUntil != null && leaseUntil.isAfter(asOf);
    }

    /** due 판정: enabled, nextRun <= asOf, 횟수/종료일 미도달, 다른 poller가 선점 중 아님 */
    public boolean isDueAt(Instant asOf) {
        return enabled
                && nextRun != null
                && !nextRun.isAfter(asOf)
                && !isExhausted()
                && !isExpiredAt(asOf)
                && !isLeasedAt(asOf);
    }

    /** 발화 반영: 횟수 증가 + lastRun */
    public Schedule fired(Instant firedAt) {
        return new Schedule(id, jobId, definition, timezone, enabled, executionCount + 1, maxExecutions, endDate,
                nextRun, firedAt, status, lastError, description, createdBy, version, leaseOwner, leaseUntil,
                createdAt, updatedAt);
    }

    public Schedule rescheduled(Instant next) {
        return new Schedule(id, jobId, definition, timezone, enabled, executionCount, maxExecutions, endDate,
                next, lastRun, Status.SCHEDULED, null, description, createdBy, version, leaseOwner, leaseUntil,
                createdAt, updatedAt);
    }

    /** 종료 상태 전이: enabled=false, nextRun=null */
    public Schedule terminated(Status terminal, String error) {
        return new Schedule(id, jobId, definition, timezone, false, executionCount, maxExecutions, endDate,
                null, lastRun, terminal, error, description, createdBy, version, leaseOwner, leaseUntil,
                createdAt, updatedAt);
    }

    public Schedule claimed(String owner, Instant until) {
        return new Schedule(id, jobId, definition, timezone, enabled, executionCount, maxExecutions, endDate,
                nextRun, lastRun, status, lastError, description, createdBy, version, owner, until,
                createdAt, updatedAt);
    }

    public Schedule released() {
        return claimed(null, null);
    }

    public Schedule withVersion(long newVersion, Instant touchedAt) {
        return new Schedule(id, jobId, definition, timezone, enabled, executionCount, maxExecutions, endDate,
                nextRun, lastRun, status, lastError, description, createdBy, newVersion, leaseOwner, leaseUntil,
                createdAt, touchedAt);
    }
}
