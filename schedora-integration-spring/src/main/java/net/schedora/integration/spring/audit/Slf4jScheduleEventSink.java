package net.schedora.integration.spring.audit;

import net.schedora.core.model.ExecutionRecord;
import net.schedora.core.model.Schedule;
import net.schedora.core.spi.ScheduleEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 생명주기 이벤트를 "schedora.audit" 로거로 남긴다. 로그 설정으로 분리 수집 */
public class Slf4jScheduleEventSink implements ScheduleEventSink {
    private static final Logger audit = LoggerFactory.getLogger("schedora.audit");

    @Override
    public void scheduleCreated(Schedule s) {
        audit.info("created schedule={} job={} type={} tz={} nextRun={}",
                s.id(), s.jobId(), s.type(), s.timezone(), s.nextRun());
    }

    @Override
    public void scheduleFired(Schedule s, ExecutionRecord r) {
        audit.info("fired schedule={} job={} scheduledAt={} startedAt={} ref={} count={}",
                s.id(), s.jobId(), r.scheduledAt(), r.startedAt(), r.dispatchRef(), s.executionCount());
    }

    @Override
    public void scheduleDisabled(Schedule s, Schedule.Status reason) {
        if (reason == Schedule.Status.ERROR) {
            audit.warn("disabled schedule={} job={} reason={} error={}", s.id(), s.jobId(), reason, s.lastError());
        } else {
            audit.info("disabled schedule={} job={} reason={}", s.id(), s.jobId(), reason);
        }
    }
}
