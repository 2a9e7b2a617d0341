package net.schedora.core.spi;

import net.schedora.core.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface ScheduleRepository {
    /** 신규 저장. id/version/createdAt 이 채워진 행을 돌려준다 */
    Schedule insert(Schedule schedule) throws Exception;

    Optional<Schedule> findById(long id) throws Exception;

    List<Schedule> findByJob(long jobId) throws Exception;

    /**
     * version 조건부 UPDATE (version+1, lease 필드 포함).
     * 행이 없으면 ScheduleNotFoundException, version 불일치면 ScheduleConcurrencyException
     */
    Schedule update(Schedule schedule) throws Exception;

    boolean delete(long id) throws Exception;

    /**
     * due 집합: nextRun ASC, id ASC. 선점(lease) 중인 행은 제외.
     * 정의를 읽을 수 없는 행은 결과에서 빼고 ERROR 로 옮긴다 (배치 전체를 실패시키지 않음)
     */
    List<Schedule> dueSchedules(Instant asOf, int limit) throws Exception;

    /**
     * 관측한 version/nextRun 그대로이고 살아있는 lease가 없을 때만 선점.
     * 다른 poller가 먼저 가져갔으면 empty
     */
    Optional<Schedule> claim(Schedule observed, String owner, Instant leaseUntil, Instant asOf) throws Exception;

    /** lease_until 지난 선점 해제 (죽은 poller 회수) */
    int releaseExpiredClaims(Instant asOf) throws Exception;
}
