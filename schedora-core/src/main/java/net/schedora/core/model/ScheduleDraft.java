package net.schedora.core.model;

import java.time.Instant;

/** 생성/수정 요청 내용. nextRun, executionCount 등 엔진 소유 필드는 없다 */
public record ScheduleDraft(
        long jobId,
        ScheduleDefinition definition,
        String timezone,
        boolean enabled,
        Integer maxExecutions,
        Instant endDate,
        String description,
        Long createdBy
) {
    public static ScheduleDraft of(long jobId, ScheduleDefinition definition) {
        return new ScheduleDraft(jobId, definition, Schedule.DEFAULT_TIMEZONE, true, null, null, null, null);
    }

    public ScheduleDraft inZone(String zone) {
        return new ScheduleDraft(jobId, definition, zone, enabled, maxExecutions, endDate, description, createdBy);
    }

    public ScheduleDraft limitedTo(Integer max, Instant until) {
        return new ScheduleDraft(jobId, definition, timezone, enabled, max, until, description, createdBy);
    }

    public ScheduleDraft describedAs(String text) {
        return new ScheduleDraft(jobId, definition, timezone, enabled, maxExecutions, endDate, text, createdBy);
    }

    public ScheduleDraft disabled() {
        return new ScheduleDraft(jobId, definition, timezone, false, maxExecutions, endDate, description, createdBy);
    }
}
