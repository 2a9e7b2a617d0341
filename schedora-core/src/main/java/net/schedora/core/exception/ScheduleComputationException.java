package net.schedora.core.exception;

/** 정의는 그럴듯하지만 nextRun을 구할 수 없음 (존재하지 않는 날짜, 깨진 cron 등) */
public class ScheduleComputationException extends SchedoraException {
    public ScheduleComputationException(String message) { super(message); }
    public ScheduleComputationException(String message, Throwable cause) { super(message, cause); }
}
