package net.schedora.app.dispatch;

import net.schedora.core.spi.JobDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 데모용 디스패처. 실제 작업 실행 대신 로그만 남기고 수락한다.
 * 실제 배포에서는 큐 발행 등 다른 JobDispatcher 빈으로 교체.
 */
@Component
public class LoggingJobDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(LoggingJobDispatcher.class);

    private final AtomicLong seq = new AtomicLong();

    @Override
    public DispatchResult dispatch(DispatchRequest request) {
        String ref = "log-" + seq.incrementAndGet();
        log.info("Dispatch job={} schedule={} scheduledAt={} firedAt={} ref={}",
                request.jobId(), request.scheduleId(), request.scheduledAt(), request.firedAt(), ref);
        return DispatchResult.accepted(ref);
    }
}
