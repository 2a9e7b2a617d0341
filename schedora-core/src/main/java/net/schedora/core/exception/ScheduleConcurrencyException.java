package net.schedora.core.exception;

/** 다른 poller가 이미 처리 중 (선점 실패, version 불일치). 이번 틱은 건너뛴다 */
public class ScheduleConcurrencyException extends SchedoraException {
    private final long scheduleId;

    public ScheduleConcurrencyException(long scheduleId, String message) {
        super(message);
        this.scheduleId = scheduleId;
    }

    public long scheduleId() { return scheduleId; }
}
