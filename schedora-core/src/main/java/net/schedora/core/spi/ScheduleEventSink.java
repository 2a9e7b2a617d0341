package net.schedora.core.spi;

import net.schedora.core.model.ExecutionRecord;
import net.schedora.core.model.Schedule;

/** 생명주기 알림 수신 (관찰 전용, 스케줄링 판단에 되먹임 없음) */
public interface ScheduleEventSink {
    ScheduleEventSink NOOP = new ScheduleEventSink() {};

    default void scheduleCreated(Schedule schedule) {}

    default void scheduleFired(Schedule schedule, ExecutionRecord record) {}

    default void scheduleDisabled(Schedule schedule, Schedule.Status reason) {}
}
