package net.schedora.core.exception;

/** 생성/수정 시점의 잘못된 스케줄 정의. 호출자에게 동기적으로 전달, 기본값으로 덮지 않는다 */
public class ScheduleValidationException extends SchedoraException {
    public ScheduleValidationException(String message) { super(message); }
    public ScheduleValidationException(String message, Throwable cause) { super(message, cause); }
}
