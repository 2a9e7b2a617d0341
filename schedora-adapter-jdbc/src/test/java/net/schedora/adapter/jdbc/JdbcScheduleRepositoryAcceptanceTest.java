package net.schedora.adapter.jdbc;

import net.schedora.adapter.jdbc.repo.JdbcScheduleExecutionRepository;
import net.schedora.adapter.jdbc.repo.JdbcScheduleRepository;
import net.schedora.core.exception.ScheduleConcurrencyException;
import net.schedora.core.exception.ScheduleNotFoundException;
import net.schedora.core.model.ExecutionRecord;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleDefinition;
import net.schedora.core.model.ScheduleDefinition.Recurring;
import net.schedora.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcScheduleRepositoryAcceptanceTest extends TestSupport {

    static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    TxRunner tx;
    JdbcScheduleRepository schedules;
    JdbcScheduleExecutionRepository executions;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        schedules = new JdbcScheduleRepository(ds);
        executions = new JdbcScheduleExecutionRepository(ds);
    }

    Schedule insert(long jobId, ScheduleDefinition def, Instant nextRun) throws Exception {
        return tx.required(() -> schedules.insert(
                Schedule.ofNew(jobId, def, "Asia/Seoul", true, null, null, nextRun, "job " + jobId, 7L)));
    }

    @Test
    void insertAndFind_roundTripsEveryDefinitionShape() throws Exception {
        List<ScheduleDefinition> defs = List.of(
                new ScheduleDefinition.Once(T0.plusSeconds(3600)),
                Recurring.minutes(15),
                Recurring.weekly(2, "08:30", EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.FRIDAY)),
                Recurring.weekly(1, "08:30", EnumSet.noneOf(DayOfWeek.class)),
                Recurring.monthly(1, "23:59", 31),
                new ScheduleDefinition.Cron("0 * * * *"));

        for (ScheduleDefinition def : defs) {
            Schedule saved = insert(1, def, T0);
            Schedule loaded = tx.required(() -> schedules.findById(saved.id()).orElseThrow());

            assertEquals(def, loaded.definition());
            assertEquals("Asia/Seoul", loaded.timezone());
            assertEquals(T0, loaded.nextRun());
            assertEquals(0L, loaded.version());
            assertEquals("job 1", loaded.description());
            assertEquals(7L, loaded.createdBy());
            assertNotNull(loaded.createdAt());
        }
        assertEquals(defs.size(), tx.required(() -> schedules.findByJob(1)).size());
    }

    @Test
    void update_isVersionConditional() throws Exception {
        Schedule s = insert(1, Recurring.hours(1), T0);

        Schedule moved = tx.required(() -> schedules.update(s.rescheduled(T0.plusSeconds(3600))));
        assertEquals(1L, moved.version());
        assertEquals(T0.plusSeconds(3600), moved.nextRun());

        assertThrows(ScheduleConcurrencyException.class,
                () -> tx.required(() -> schedules.update(s.rescheduled(T0.plusSeconds(7200)))));
        Schedule ghost = new Schedule(999_999L, 1L, Recurring.hours(1), "UTC", true, 0, null, null, null, null,
                null, null, null, null, 0L, null, null, null, null);
        assertThrows(ScheduleNotFoundException.class, () -> tx.required(() -> schedules.update(ghost)));
    }

    @Test
    void dueSchedules_appliesAllExclusionsAndOrder() throws Exception {
        Schedule b = insert(2, Recurring.minutes(5), T0.minusSeconds(60));
        Schedule a = insert(1, Recurring.minutes(5), T0.minusSeconds(120));
        Schedule tie = insert(3, Recurring.minutes(5), T0.minusSeconds(60));
        insert(4, Recurring.minutes(5), T0.plusSeconds(1));
        tx.required(() -> {
            // 비활성, 소진, 만료, 선점 중
            schedules.insert(Schedule.ofNew(5, Recurring.minutes(5), "UTC", false, null, null, T0.minusSeconds(5), null, null));
            Schedule ex = schedules.insert(Schedule.ofNew(6, Recurring.minutes(5), "UTC", true, 1, null, T0.minusSeconds(5), null, null));
            schedules.update(ex.fired(T0.minusSeconds(300)));
            schedules.insert(Schedule.ofNew(7, Recurring.minutes(5), "UTC", true, null, T0, T0.minusSeconds(5), null, null));
            Schedule leased = schedules.insert(Schedule.ofNew(8, Recurring.minutes(5), "UTC", true, null, null, T0.minusSeconds(5), null, null));
            schedules.claim(leased, "other", T0.plusSeconds(30), T0);
            return null;
        });

        List<Long> ids = tx.required(() -> schedules.dueSchedules(T0, 100)).stream().map(Schedule::id).toList();

        assertEquals(List.of(a.id(), b.id(), tie.id()), ids);
        assertEquals(1, tx.required(() -> schedules.dueSchedules(T0, 1)).size());
    }

    @Test
    void claim_succeedsOnceAndBumpsVersion() throws Exception {
        Schedule s = insert(1, Recurring.minutes(5), T0);

        var first = tx.requiresNew(() -> schedules.claim(s, "poller-a", T0.plusSeconds(30), T0));
        var second = tx.requiresNew(() -> schedules.claim(s, "poller-b", T0.plusSeconds(30), T0));

        assertTrue(first.isPresent());
        assertEquals("poller-a", first.get().leaseOwner());
        assertEquals(T0.plusSeconds(30), first.get().leaseUntil());
        assertEquals(s.version() + 1, first.get().version());
        assertTrue(second.isEmpty());
    }

    @Test
    void releaseExpiredClaims_onlyTouchesPastLeases() throws Exception {
        Schedule dead = insert(1, Recurring.minutes(5), T0);
        Schedule live = insert(2, Recurring.minutes(5), T0);
        tx.required(() -> {
            schedules.claim(dead, "crashed", T0.plusSeconds(10), T0);
            schedules.claim(live, "busy", T0.plusSeconds(120), T0);
            return null;
        });

        int released = tx.required(() -> schedules.releaseExpiredClaims(T0.plusSeconds(60)));

        assertEquals(1, released);
        assertNull(tx.required(() -> schedules.findById(dead.id()).orElseThrow()).leaseOwner());
        assertEquals("busy", tx.required(() -> schedules.findById(live.id()).orElseThrow()).leaseOwner());
    }

    @Test
    void executions_appendFindPurgeAndCascade() throws Exception {
        Schedule s = insert(1, Recurring.minutes(5), T0);
        tx.required(() -> {
            executions.append(ExecutionRecord.completed(s.id(), T0.minus(Duration.ofDays(40)), T0.minus(Duration.ofDays(40)), "old"));
            executions.append(ExecutionRecord.completed(s.id(), T0.minusSeconds(300), T0.minusSeconds(299), "a"));
            executions.append(ExecutionRecord.completed(s.id(), T0, T0.plusMillis(5), "b"));
            return null;
        });

        List<ExecutionRecord> recent = tx.required(() -> executions.findRecent(s.id(), 2));
        assertEquals(List.of("b", "a"), recent.stream().map(ExecutionRecord::dispatchRef).toList());
        assertEquals(T0.plusMillis(5), recent.get(0).startedAt());

        assertEquals(1, tx.required(() -> executions.purgeOlderThan(T0.minus(Duration.ofDays(30)))));

        assertTrue(tx.required(() -> schedules.delete(s.id())));
        assertFalse(tx.required(() -> schedules.delete(s.id())));
        assertTrue(tx.required(() -> executions.findRecent(s.id(), 10)).isEmpty());
    }

    @Test
    void rollbackDiscardsPartialWork() throws Exception {
        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            insert(9, Recurring.hours(1), T0);
            throw new IllegalStateException("boom");
        }));
        assertTrue(tx.required(() -> schedules.findByJob(9)).isEmpty());
    }

    /** 외부 CRUD 계층이 쓴 것처럼 RECURRING 행을 직접 넣는다 */
    long insertRawRecurring(long jobId, String recurringType, String timeOfDay, String daysOfWeek,
                            Integer dayOfMonth, Instant nextRun) throws Exception {
        return tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement("""
                    INSERT INTO TB_SCHEDULE
                        (JOB_ID, SCHEDULE_TYPE, RECURRING_TYPE, INTERVAL_VALUE, TIME_OF_DAY, DAYS_OF_WEEK,
                         DAY_OF_MONTH, TIMEZONE, ENABLED, NEXT_RUN)
                    VALUES (?, 'RECURRING', ?, 1, ?, ?, ?, 'UTC', 'Y', ?)
                    """, new String[]{"ID"})) {
                ps.setLong(1, jobId);
                ps.setString(2, recurringType);
                ps.setString(3, timeOfDay);
                ps.setString(4, daysOfWeek);
                JdbcUtil.setNullableInt(ps, 5, dayOfMonth);
                JdbcUtil.setInstant(ps, 6, nextRun);
                ps.executeUpdate();
                try (var keys = ps.getGeneratedKeys()) {
                    keys.next();
                    return keys.getLong(1);
                }
            }
        });
    }

    @Test
    void checkConstraints_rejectRecurringRowsTheDomainCannotRead() {
        // DAILY 시각 없음, MONTHLY 일자 없음, 요일 범위 밖, 알 수 없는 타입, 잘못된 시각
        assertThrows(SQLException.class, () -> insertRawRecurring(1, "DAILY", null, null, null, T0));
        assertThrows(SQLException.class, () -> insertRawRecurring(1, "MONTHLY", "09:00", null, null, T0));
        assertThrows(SQLException.class, () -> insertRawRecurring(1, "MONTHLY", "09:00", null, 32, T0));
        assertThrows(SQLException.class, () -> insertRawRecurring(1, "WEEKLY", "09:00", "7", null, T0));
        assertThrows(SQLException.class, () -> insertRawRecurring(1, "YEARLY", null, null, null, T0));
        assertThrows(SQLException.class, () -> insertRawRecurring(1, "DAILY", "9:00", null, null, T0));
    }

    @Test
    void dueSchedules_movesUnreadableRowToErrorAndReturnsTheRest() throws Exception {
        Schedule first = insert(1, Recurring.minutes(5), T0.minusSeconds(120));
        // 제약은 통과하지만 MINUTES 에 시각이 붙어 있어 도메인으로 읽을 수 없는 행
        long broken = insertRawRecurring(2, "MINUTES", "09:00", null, null, T0.minusSeconds(90));
        Schedule last = insert(3, Recurring.minutes(5), T0.minusSeconds(60));

        List<Long> ids = tx.required(() -> schedules.dueSchedules(T0, 100)).stream().map(Schedule::id).toList();

        assertEquals(List.of(first.id(), last.id()), ids);
        Map<String, Object> row = tx.required(() -> {
            try (var ps = TxContext.require().prepareStatement(
                    "SELECT ENABLED, STATUS, NEXT_RUN, LAST_ERROR FROM TB_SCHEDULE WHERE ID = ?")) {
                ps.setLong(1, broken);
                try (var rs = ps.executeQuery()) {
                    assertTrue(rs.next());
                    return Map.<String, Object>of(
                            "ENABLED", rs.getString("ENABLED"),
                            "STATUS", rs.getString("STATUS"),
                            "NEXT_RUN_NULL", rs.getTimestamp("NEXT_RUN") == null,
                            "LAST_ERROR", rs.getString("LAST_ERROR"));
                }
            }
        });
        assertEquals("N", row.get("ENABLED"));
        assertEquals("ERROR", row.get("STATUS"));
        assertEquals(true, row.get("NEXT_RUN_NULL"));
        assertTrue(((String) row.get("LAST_ERROR")).contains("timeOfDay"));

        // 다음 조회부터는 아예 보이지 않는다
        assertEquals(List.of(first.id(), last.id()),
                tx.required(() -> schedules.dueSchedules(T0, 100)).stream().map(Schedule::id).toList());
    }
}
