package net.schedora.adapter.jdbc;

import net.schedora.adapter.jdbc.repo.JdbcScheduleExecutionRepository;
import net.schedora.adapter.jdbc.repo.JdbcScheduleRepository;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleDefinition.Recurring;
import net.schedora.core.service.DueScheduleFinder;
import net.schedora.core.service.ExecutionTracker;
import net.schedora.core.service.ScheduleCalculator;
import net.schedora.core.service.SchedulingLoop;
import net.schedora.core.spi.Clock;
import net.schedora.core.spi.JobDispatcher;
import net.schedora.core.spi.TxRunner;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 여러 poller 가 같은 due 집합을 놓고 경쟁하는 상황
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class ConcurrentClaimAcceptanceTest extends TestSupport {

    static final Instant T0 = Instant.parse("2025-01-01T10:00:00Z");

    TxRunner tx;
    JdbcScheduleRepository schedules;
    JdbcScheduleExecutionRepository executions;
    Clock clock;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        schedules = new JdbcScheduleRepository(ds);
        executions = new JdbcScheduleExecutionRepository(ds);
        clock = () -> T0;
    }

    // ========== t1: 같은 스케줄 선점, 한 스레드만 ==========
    @Test
    void t1_concurrentClaim_onlyOneWins() throws Exception {
        Schedule s = tx.required(() -> schedules.insert(
                Schedule.ofNew(1, Recurring.minutes(5), "UTC", true, null, null, T0.minusSeconds(60), null, null)));

        int threads = 6;
        ExecutorService es = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Optional<Schedule>>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String owner = "poller-" + i;
            futures.add(es.submit(() -> {
                start.await();
                return tx.requiresNew(() -> schedules.claim(s, owner, T0.plusSeconds(30), T0));
            }));
        }
        start.countDown();

        int wins = 0;
        for (Future<Optional<Schedule>> f : futures) wins += f.get(60, TimeUnit.SECONDS).isPresent() ? 1 : 0;
        es.shutdown();
        assertEquals(1, wins, "exactly one poller should claim the schedule");

        Schedule after = tx.required(() -> schedules.findById(s.id()).orElseThrow());
        assertNotNull(after.leaseOwner());
        assertEquals(1L, after.version());
    }

    // ========== t2: poller 4개가 due 20건을 나눠 발화, 중복 없이 정확히 20 ==========
    @Test
    void t2_parallelLoops_fireEachScheduleExactlyOnce() throws Exception {
        List<Long> ids = new ArrayList<>();
        tx.required(() -> {
            for (long job = 1; job <= 20; job++) {
                ids.add(schedules.insert(Schedule.ofNew(job, Recurring.minutes(5), "UTC", true, null, null,
                        T0.minusSeconds(job), null, null)).id());
            }
            return null;
        });

        List<Long> dispatched = Collections.synchronizedList(new ArrayList<>());
        JobDispatcher dispatcher = req -> {
            dispatched.add(req.scheduleId());
            return JobDispatcher.DispatchResult.accepted("ref-" + req.scheduleId());
        };

        int pollers = 4;
        ExecutorService es = Executors.newFixedThreadPool(pollers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SchedulingLoop.TickReport>> futures = new ArrayList<>();
        for (int i = 0; i < pollers; i++) {
            SchedulingLoop loop = loop("poller-" + i, dispatcher);
            futures.add(es.submit(() -> { start.await(); return loop.tick(); }));
        }
        start.countDown();

        int fired = 0;
        for (Future<SchedulingLoop.TickReport> f : futures) {
            SchedulingLoop.TickReport r = f.get(120, TimeUnit.SECONDS);
            assertEquals(0, r.failed, r.toString());
            fired += r.fired;
        }
        es.shutdown();

        assertEquals(20, fired);
        assertEquals(20, dispatched.size());
        assertEquals(new HashSet<>(ids), new HashSet<>(dispatched));
        for (Long id : ids) {
            Schedule s = tx.required(() -> schedules.findById(id).orElseThrow());
            assertEquals(1, s.executionCount(), "schedule " + id);
            assertNull(s.leaseOwner());
            assertEquals(1, tx.required(() -> executions.findRecent(id, 10)).size());
        }
    }

    private SchedulingLoop loop(String owner, JobDispatcher dispatcher) {
        var calc = new ScheduleCalculator(HOURLY_CRON);
        var tracker = new ExecutionTracker(schedules, executions, calc, tx, null);
        return new SchedulingLoop(new DueScheduleFinder(schedules, tx), tracker, schedules, dispatcher, tx, clock,
                owner, Duration.ofSeconds(30));
    }
}
