package net.schedora.core.service;

import net.schedora.core.spi.JobDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 실제 디스패치를 Executor 로 넘기고 바로 수락 응답. 느린 디스패처가 틱의 다음 스케줄을 막지 않게 한다.
 * Executor 가 받지 않으면 rejected.
 */
public final class AsyncJobDispatcher implements JobDispatcher {
    private static final Logger log = LoggerFactory.getLogger(AsyncJobDispatcher.class);

    private final JobDispatcher delegate;
    private final Executor executor;

    public AsyncJobDispatcher(JobDispatcher delegate, Executor executor) {
        this.delegate = delegate;
        this.executor = executor;
    }

    @Override
    public DispatchResult dispatch(DispatchRequest request) {
        String ref = "async-" + UUID.randomUUID();
        try {
            executor.execute(() -> runDelegate(request, ref));
        } catch (RejectedExecutionException e) {
            return DispatchResult.rejected("dispatch queue full: " + e.getMessage());
        }
        return DispatchResult.accepted(ref);
    }

    private void runDelegate(DispatchRequest request, String ref) {
        try {
            DispatchResult result = delegate.dispatch(request);
            if (result == null || !result.accepted()) {
                log.warn("Async dispatch {} of job {} (schedule {}) rejected downstream: {}", ref, request.jobId(),
                        request.scheduleId(), result == null ? "no result" : result.reason());
            }
        } catch (Exception e) {
            log.error("Async dispatch {} of job {} (schedule {}) failed", ref, request.jobId(), request.scheduleId(), e);
        }
    }
}
