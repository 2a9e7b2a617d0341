package net.schedora.core.spi;

import net.schedora.core.model.ExecutionRecord;

import java.time.Instant;
import java.util.List;

public interface ScheduleExecutionRepository {
    ExecutionRecord append(ExecutionRecord record) throws Exception;

    /** 최근 것부터 */
    List<ExecutionRecord> findRecent(long scheduleId, int limit) throws Exception;

    int purgeOlderThan(Instant threshold) throws Exception;
}
