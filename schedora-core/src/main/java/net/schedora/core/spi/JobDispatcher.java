package net.schedora.core.spi;

import java.time.Instant;

/**
 * 외부 잡 실행 엔진으로의 발화 창구. 수락/거절만 돌려주고 잡 결과는 기다리지 않는다.
 */
@FunctionalInterface
public interface JobDispatcher {

    DispatchResult dispatch(DispatchRequest request) throws Exception;

    record DispatchRequest(long scheduleId, long jobId, Instant scheduledAt, Instant firedAt) {}

    record DispatchResult(boolean accepted, String reference, String reason) {
        public static DispatchResult accepted(String reference) { return new DispatchResult(true, reference, null); }
        public static DispatchResult rejected(String reason) { return new DispatchResult(false, null, reason); }
    }
}
