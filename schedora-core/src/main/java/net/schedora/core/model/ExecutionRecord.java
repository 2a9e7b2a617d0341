package net.schedora.core.model;

import java.time.Instant;

/** 스케줄이 한 번 발화했다는 불변 사실. 잡 자체의 결과는 디스패처 소관 */
public record ExecutionRecord(
        Long id,
        Long scheduleId,
        Instant scheduledAt,   // 발화를 일으킨 nextRun 값
        Instant startedAt,
        Status status,
        String dispatchRef,    // 디스패처가 돌려준 참조 (없을 수 있음)
        Instant createdAt
) {
    public enum Status {
        COMPLETED, UNKNOWN;

        public static Status from(String s) {
            if (s == null) return UNKNOWN;
            try { return Status.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
        }
        public String code() { return name(); }
    }

    public static ExecutionRecord completed(long scheduleId, Instant scheduledAt, Instant startedAt, String dispatchRef) {
        return new ExecutionRecord(null, scheduleId, scheduledAt, startedAt, Status.COMPLETED, dispatchRef, null);
    }
}
