package net.schedora.core.service;

import net.schedora.core.model.Schedule;
import net.schedora.core.spi.ScheduleRepository;
import net.schedora.core.spi.TxRunner;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/** 발화할 스케줄 조회 (읽기 전용) */
public final class DueScheduleFinder {
    public static final int DEFAULT_BATCH_LIMIT = 500;

    /** nextRun ASC, 동률이면 id ASC */
    public static final Comparator<Schedule> DUE_ORDER = Comparator
            .comparing(Schedule::nextRun)
            .thenComparing(Schedule::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private final ScheduleRepository schedules;
    private final TxRunner tx;
    private final int batchLimit;

    public DueScheduleFinder(ScheduleRepository schedules, TxRunner tx, int batchLimit) {
        if (batchLimit < 1) throw new IllegalArgumentException("batchLimit must be positive: " + batchLimit);
        this.schedules = schedules;
        this.tx = tx;
        this.batchLimit = batchLimit;
    }

    public DueScheduleFinder(ScheduleRepository schedules, TxRunner tx) {
        this(schedules, tx, DEFAULT_BATCH_LIMIT);
    }

    public List<Schedule> dueSchedules(Instant asOf) throws Exception {
        List<Schedule> rows = tx.required(() -> schedules.dueSchedules(asOf, batchLimit));
        // 저장소 쿼리와 같은 조건을 도메인 쪽에서 한 번 더 적용
        return rows.stream()
                .filter(s -> s.isDueAt(asOf))
                .sorted(DUE_ORDER)
                .toList();
    }
}
