package net.schedora.adapter.jdbc.repo;

import net.schedora.adapter.jdbc.TxContext;
import net.schedora.adapter.jdbc.mapper.RowMappers;
import net.schedora.core.exception.SchedoraException;
import net.schedora.core.exception.ScheduleConcurrencyException;
import net.schedora.core.exception.ScheduleNotFoundException;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleDefinition;
import net.schedora.core.model.Weekdays;
import net.schedora.core.spi.ScheduleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.schedora.adapter.jdbc.JdbcUtil.setInstant;
import static net.schedora.adapter.jdbc.JdbcUtil.setNullableInt;
import static net.schedora.adapter.jdbc.JdbcUtil.setNullableLong;
import static net.schedora.adapter.jdbc.JdbcUtil.yn;

/**
 * TB_SCHEDULE (Oracle). 모든 쓰기는 VERSION 조건부이고 성공 시 VERSION+1.
 */
public final class JdbcScheduleRepository implements ScheduleRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcScheduleRepository.class);

    private final DataSource ds;

    public JdbcScheduleRepository(DataSource ds) { this.ds = ds; }

    @Override
    public Schedule insert(Schedule s) throws Exception {
        var sql = """
            INSERT INTO TB_SCHEDULE
                (JOB_ID, SCHEDULE_TYPE, EXECUTE_AT, RECURRING_TYPE, INTERVAL_VALUE, TIME_OF_DAY, DAYS_OF_WEEK,
                 DAY_OF_MONTH, CRON_EXPR, TIMEZONE, ENABLED, EXECUTION_COUNT, MAX_EXECUTIONS, END_DATE,
                 NEXT_RUN, LAST_RUN, STATUS, LAST_ERROR, DESCRIPTION, CREATED_BY, VERSION,
                 LEASE_OWNER, LEASE_UNTIL, CREATED_AT, UPDATED_AT)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0, ?, ?, SYSTIMESTAMP, SYSTIMESTAMP)
            """;
        long id;
        try (var ps = TxContext.require().prepareStatement(sql, new String[]{"ID"})) {
            int i = 1;
            ps.setLong(i++, s.jobId());
            i = bindDefinition(ps, i, s.definition());
            i = bindState(ps, i, s);
            ps.setString(i++, s.description());
            setNullableLong(ps, i++, s.createdBy());
            ps.setString(i++, s.leaseOwner());
            setInstant(ps, i, s.leaseUntil());
            ps.executeUpdate();
            try (var keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new IllegalStateException("TB_SCHEDULE insert returned no key");
                id = keys.getLong(1);
            }
        }
        return findById(id).orElseThrow(() -> new IllegalStateException("inserted schedule vanished: " + id));
    }

    @Override
    public Optional<Schedule> findById(long id) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_SCHEDULE
                WHERE ID = ?
            """)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(RowMappers.toSchedule(rs));
            }
        }
    }

    @Override
    public List<Schedule> findByJob(long jobId) throws Exception {
        try (PreparedStatement ps = TxContext.require().prepareStatement("""
                SELECT *
                FROM TB_SCHEDULE
                WHERE JOB_ID = ?
                ORDER BY ID
            """)) {
            ps.setLong(1, jobId);
            return list(ps);
        }
    }

    @Override
    public Schedule update(Schedule s) throws Exception {
        var sql = """
            UPDATE TB_SCHEDULE
               SET JOB_ID = ?, SCHEDULE_TYPE = ?, EXECUTE_AT = ?, RECURRING_TYPE = ?, INTERVAL_VALUE = ?,
                   TIME_OF_DAY = ?, DAYS_OF_WEEK = ?, DAY_OF_MONTH = ?, CRON_EXPR = ?,
                   TIMEZONE = ?, ENABLED = ?, EXECUTION_COUNT = ?, MAX_EXECUTIONS = ?, END_DATE = ?,
                   NEXT_RUN = ?, LAST_RUN = ?, STATUS = ?, LAST_ERROR = ?, DESCRIPTION = ?,
                   LEASE_OWNER = ?, LEASE_UNTIL = ?,
                   VERSION = VERSION + 1,
                   UPDATED_AT = SYSTIMESTAMP
             WHERE ID = ? AND VERSION = ?
            """;
        int updated;
        try (var ps = TxContext.require().prepareStatement(sql)) {
            int i = 1;
            ps.setLong(i++, s.jobId());
            i = bindDefinition(ps, i, s.definition());
            i = bindState(ps, i, s);
            ps.setString(i++, s.description());
            ps.setString(i++, s.leaseOwner());
            setInstant(ps, i++, s.leaseUntil());
            ps.setLong(i++, s.id());
            ps.setLong(i, s.version());
            updated = ps.executeUpdate();
        }
        if (updated == 0) {
            Schedule current = findById(s.id()).orElseThrow(() -> new ScheduleNotFoundException(s.id()));
            throw new ScheduleConcurrencyException(s.id(),
                    "version mismatch: expected " + s.version() + " but was " + current.version());
        }
        return findById(s.id()).orElseThrow(() -> new ScheduleNotFoundException(s.id()));
    }

    @Override
    public boolean delete(long id) throws Exception {
        try (var ps = TxContext.require().prepareStatement("DELETE FROM TB_SCHEDULE WHERE ID = ?")) {
            ps.setLong(1, id);
            return ps.executeUpdate() > 0;
        }
    }

    @Override
    public List<Schedule> dueSchedules(Instant asOf, int limit) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                SELECT  s.*
                FROM    TB_SCHEDULE s
                WHERE   s.ENABLED = 'Y'
                  AND   s.NEXT_RUN IS NOT NULL
                  AND   s.NEXT_RUN <= ?
                  AND  (s.MAX_EXECUTIONS IS NULL OR s.EXECUTION_COUNT < s.MAX_EXECUTIONS)
                  AND  (s.END_DATE IS NULL OR s.END_DATE > ?)
                  AND  (s.LEASE_UNTIL IS NULL OR s.LEASE_UNTIL <= ?)
                ORDER BY s.NEXT_RUN ASC, s.ID ASC
                FETCH FIRST ? ROWS ONLY
            """)) {
            setInstant(ps, 1, asOf);
            setInstant(ps, 2, asOf);
            setInstant(ps, 3, asOf);
            ps.setInt(4, limit);

            List<Schedule> due = new ArrayList<>();
            List<Malformed> malformed = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    try {
                        due.add(RowMappers.toSchedule(rs));
                    } catch (SchedoraException | IllegalArgumentException e) {
                        malformed.add(new Malformed(rs.getLong("ID"), rs.getLong("VERSION"), e.getMessage()));
                    }
                }
            }
            for (Malformed m : malformed) quarantine(m);
            return due;
        }
    }

    private record Malformed(long id, long version, String reason) {}

    /** 도메인으로 읽을 수 없는 행은 ERROR 로 내려서 다음 조회부터 빠지게 한다 */
    private void quarantine(Malformed m) throws SQLException {
        log.warn("Schedule {} has a malformed definition, moving to ERROR: {}", m.id(), m.reason());
        try (var ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET ENABLED     = 'N',
                       NEXT_RUN    = NULL,
                       STATUS      = 'ERROR',
                       LAST_ERROR  = ?,
                       LEASE_OWNER = NULL,
                       LEASE_UNTIL = NULL,
                       VERSION     = VERSION + 1,
                       UPDATED_AT  = SYSTIMESTAMP
                 WHERE ID = ? AND VERSION = ?
            """)) {
            ps.setString(1, truncate("malformed definition: " + m.reason(), 1000));
            ps.setLong(2, m.id());
            ps.setLong(3, m.version());
            if (ps.executeUpdate() == 0) {
                log.debug("Schedule {} changed before it could be moved to ERROR", m.id());
            }
        }
    }

    @Override
    public Optional<Schedule> claim(Schedule observed, String owner, Instant leaseUntil, Instant asOf) throws Exception {
        if (observed.nextRun() == null) return Optional.empty();
        int updated;
        try (var ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET LEASE_OWNER = ?,
                       LEASE_UNTIL = ?,
                       VERSION     = VERSION + 1,
                       UPDATED_AT  = SYSTIMESTAMP
                 WHERE ID = ?
                   AND VERSION = ?
                   AND NEXT_RUN = ?
                   AND ENABLED = 'Y'
                   AND (LEASE_UNTIL IS NULL OR LEASE_UNTIL <= ?)
            """)) {
            ps.setString(1, owner);
            setInstant(ps, 2, leaseUntil);
            ps.setLong(3, observed.id());
            ps.setLong(4, observed.version());
            setInstant(ps, 5, observed.nextRun());
            setInstant(ps, 6, asOf);
            updated = ps.executeUpdate();
        }
        if (updated == 0) return Optional.empty();
        return findById(observed.id());
    }

    @Override
    public int releaseExpiredClaims(Instant asOf) throws Exception {
        try (var ps = TxContext.require().prepareStatement("""
                UPDATE TB_SCHEDULE
                   SET LEASE_OWNER = NULL,
                       LEASE_UNTIL = NULL,
                       VERSION     = VERSION + 1,
                       UPDATED_AT  = SYSTIMESTAMP
                 WHERE LEASE_UNTIL IS NOT NULL
                   AND LEASE_UNTIL <= ?
            """)) {
            setInstant(ps, 1, asOf);
            return ps.executeUpdate();
        }
    }

    /** SCHEDULE_TYPE .. CRON_EXPR (8개) */
    private static int bindDefinition(PreparedStatement ps, int i, ScheduleDefinition def) throws SQLException {
        ps.setString(i++, def.type().code());
        if (def instanceof ScheduleDefinition.Once once) {
            setInstant(ps, i++, once.executeAt());
        } else {
            ps.setNull(i++, Types.TIMESTAMP);
        }
        if (def instanceof ScheduleDefinition.Recurring r) {
            ps.setString(i++, r.recurringType().code());
            ps.setInt(i++, r.interval());
            ps.setString(i++, r.timeOfDay());
            ps.setString(i++, Weekdays.format(r.daysOfWeek()));
            setNullableInt(ps, i++, r.dayOfMonth());
        } else {
            ps.setNull(i++, Types.VARCHAR);
            ps.setNull(i++, Types.INTEGER);
            ps.setNull(i++, Types.VARCHAR);
            ps.setNull(i++, Types.VARCHAR);
            ps.setNull(i++, Types.INTEGER);
        }
        ps.setString(i++, def instanceof ScheduleDefinition.Cron c ? c.expression() : null);
        return i;
    }

    /** TIMEZONE .. LAST_ERROR (9개) */
    private static int bindState(PreparedStatement ps, int i, Schedule s) throws SQLException {
        ps.setString(i++, s.timezone());
        ps.setString(i++, yn(s.enabled()));
        ps.setInt(i++, s.executionCount());
        setNullableInt(ps, i++, s.maxExecutions());
        setInstant(ps, i++, s.endDate());
        setInstant(ps, i++, s.nextRun());
        setInstant(ps, i++, s.lastRun());
        ps.setString(i++, s.status().code());
        ps.setString(i++, truncate(s.lastError(), 1000));
        return i;
    }

    private static List<Schedule> list(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            List<Schedule> out = new ArrayList<>();
            while (rs.next()) out.add(RowMappers.toSchedule(rs));
            return out;
        }
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }
}
