package net.schedora.core.exception;

public class ScheduleNotFoundException extends SchedoraException {
    private final long scheduleId;

    public ScheduleNotFoundException(long scheduleId) {
        super("schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }

    public long scheduleId() { return scheduleId; }
}
