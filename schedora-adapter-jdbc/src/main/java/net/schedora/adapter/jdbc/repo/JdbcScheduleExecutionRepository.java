package net.schedora.adapter.jdbc.repo;

import net.schedora.adapter.jdbc.TxContext;
import net.schedora.adapter.jdbc.mapper.RowMappers;
import net.schedora.core.model.ExecutionRecord;
import net.schedora.core.spi.ScheduleExecutionRepository;

import javax.sql.DataSource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static net.schedora.adapter.jdbc.JdbcUtil.setInstant;

/** TB_SCHEDULE_EXECUTION: append-only 발화 이력 */
public final class JdbcScheduleExecutionRepository implements ScheduleExecutionRepository {
    private final DataSource ds;

    public JdbcScheduleExecutionRepository(DataSource ds) { this.ds = ds; }

    @Override
    public ExecutionRecord append(ExecutionRecord r) throws Exception {
        // CREATED_AT 은 보관 기간 계산 기준이라 앱 시계 값(발화 시각)으로 넣는다
        Instant createdAt = r.createdAt() != null ? r.createdAt() : r.startedAt();
        try (var ps = TxContext.require().prepareStatement("""
                INSERT INTO TB_SCHEDULE_EXECUTION
                    (SCHEDULE_ID, SCHEDULED_AT, STARTED_AT, STATUS, DISPATCH_REF, CREATED_AT)
                VALUES (?, ?, ?, ?, ?, ?)
            """, new String[]{"ID"})) {
            ps.setLong(1, r.scheduleId());
            setInstant(ps, 2, r.scheduledAt());
            setInstant(ps, 3, r.startedAt());
            ps.setString(4, r.status().code());
            ps.setString(5, r.dispatchRef());
            setInstant(ps, 6, createdAt);
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("TB_SCHEDULE_EXECUTION insert returned no key");
                return new ExecutionRecord(keys.getLong(1), r.scheduleId(), r.scheduledAt(), r.startedAt(),
                        r.status(), r.dispatchRef(), createdAt);
            }
        }
    }

    @Override
    public List<ExecutionRecord> findRecent(long scheduleId, int limit) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_SCHEDULE_EXECUTION
                WHERE SCHEDULE_ID = ?
                ORDER BY ID DESC
                FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setLong(1, scheduleId);
            ps.setInt(2, limit);
            try (var rs = ps.executeQuery()) {
                List<ExecutionRecord> out = new ArrayList<>();
                while (rs.next()) out.add(RowMappers.toExecutionRecord(rs));
                return out;
            }
        }
    }

    @Override
    public int purgeOlderThan(Instant threshold) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                DELETE FROM TB_SCHEDULE_EXECUTION
                 WHERE CREATED_AT < ?
            """)) {
            setInstant(ps, 1, threshold);
            return ps.executeUpdate();
        }
    }
}
