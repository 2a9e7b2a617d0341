package net.schedora.core.service;

import net.schedora.core.exception.ScheduleComputationException;
import net.schedora.core.model.RecurringType;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleDefinition;
import net.schedora.core.model.TimeOfDay;
import net.schedora.core.spi.CronCalculator;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 스케줄 정의와 기준 시각으로 다음 실행 시각을 구한다. I/O, 상태 변경 없음.
 * <ul>
 *   <li>empty: 정책상 더 이상 실행 없음 (소진된 ONCE, 요일이 빈 WEEKLY)</li>
 *   <li>{@link ScheduleComputationException}: 계산 자체가 불가 (잘못된 시각/존/cron, 찾을 수 없는 월)</li>
 * </ul>
 * 달력 계산은 모두 스케줄의 timezone 에서 한다.
 */
public final class ScheduleCalculator {
    /** SKIP 정책에서 유효 월을 찾는 최대 step 수 (윤년 2/29 + interval 12 까지 커버) */
    static final int MAX_MONTH_STEPS = 48;

    private final CronCalculator cron;
    private final MonthlyOverflowPolicy overflow;

    public ScheduleCalculator(CronCalculator cron, MonthlyOverflowPolicy overflow) {
        this.cron = cron;
        this.overflow = overflow == null ? MonthlyOverflowPolicy.CLAMP : overflow;
    }

    public ScheduleCalculator(CronCalculator cron) {
        this(cron, MonthlyOverflowPolicy.CLAMP);
    }

    public Optional<Instant> nextRun(Schedule schedule, Instant reference) {
        return nextRun(schedule.definition(), schedule.timezone(), schedule.executionCount(), reference);
    }

    public Optional<Instant> nextRun(ScheduleDefinition definition, String timezone, int executionCount,
                                     Instant reference) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(reference, "reference");
        ZoneId zone = zoneOf(timezone);

        if (definition instanceof ScheduleDefinition.Once once) {
            // 한 번 발화했으면 끝
            return executionCount > 0 ? Optional.empty() : Optional.of(once.executeAt());
        }
        if (definition instanceof ScheduleDefinition.Recurring recurring) {
            return recurring(recurring, zone, reference);
        }
        if (definition instanceof ScheduleDefinition.Cron c) {
            return Optional.of(cron(c.expression(), zone, reference));
        }
        throw new IllegalStateException("unsupported definition: " + definition);
    }

    private Optional<Instant> recurring(ScheduleDefinition.Recurring r, ZoneId zone, Instant reference) {
        ZonedDateTime base = reference.atZone(zone);
        RecurringType type = r.recurringType();
        return switch (type) {
            case MINUTES, HOURS -> Optional.of(
                    base.plus(r.interval(), type.unit()).truncatedTo(type.unit()).toInstant());
            case DAILY -> Optional.of(daily(r, zone, base, reference));
            case WEEKLY -> weekly(r, zone, base, reference);
            case MONTHLY -> Optional.of(monthly(r, zone, base, reference));
        };
    }

    private Instant daily(ScheduleDefinition.Recurring r, ZoneId zone, ZonedDateTime base, Instant reference) {
        LocalTime time = timeOf(r);
        LocalDate date = base.toLocalDate();
        Instant candidate = at(date, time, zone);
        if (!candidate.isAfter(reference)) {
            candidate = at(date.plusDays(r.interval()), time, zone);
        }
        return candidate;
    }

    private Optional<Instant> weekly(ScheduleDefinition.Recurring r, ZoneId zone, ZonedDateTime base,
                                     Instant reference) {
        Set<DayOfWeek> days = r.daysOfWeek();
        if (days.isEmpty()) return Optional.empty();

        LocalTime time = timeOf(r);
        LocalDate today = base.toLocalDate();

        // 오늘 포함 7일 안에서 먼저 찾고
        for (int i = 0; i < 7; i++) {
            LocalDate d = today.plusDays(i);
            if (days.contains(d.getDayOfWeek())) {
                Instant candidate = at(d, time, zone);
                if (candidate.isAfter(reference)) return Optional.of(candidate);
            }
        }
        // 없으면 interval 주 뒤 그 주에서
        LocalDate weekStart = today.plusWeeks(r.interval());
        for (int i = 0; i < 7; i++) {
            LocalDate d = weekStart.plusDays(i);
            if (days.contains(d.getDayOfWeek())) return Optional.of(at(d, time, zone));
        }
        throw new ScheduleComputationException("no weekday matched " + days);
    }

    private Instant monthly(ScheduleDefinition.Recurring r, ZoneId zone, ZonedDateTime base, Instant reference) {
        int dayOfMonth = r.dayOfMonth();
        if (dayOfMonth < 1 || dayOfMonth > 31) {
            throw new ScheduleComputationException("dayOfMonth must be 1..31: " + dayOfMonth);
        }
        LocalTime time = timeOf(r);
        YearMonth month = YearMonth.from(base);

        Optional<Instant> candidate = monthlyCandidate(month, dayOfMonth, time, zone);
        if (candidate.isPresent() && candidate.get().isAfter(reference)) return candidate.get();

        for (int step = 1; step <= MAX_MONTH_STEPS; step++) {
            YearMonth target = month.plusMonths((long) r.interval() * step);
            candidate = monthlyCandidate(target, dayOfMonth, time, zone);
            if (candidate.isPresent()) return candidate.get();
        }
        throw new ScheduleComputationException("no month with day " + dayOfMonth + " reachable every "
                + r.interval() + " month(s) from " + month);
    }

    private Optional<Instant> monthlyCandidate(YearMonth month, int dayOfMonth, LocalTime time, ZoneId zone) {
        if (month.isValidDay(dayOfMonth)) {
            return Optional.of(at(month.atDay(dayOfMonth), time, zone));
        }
        if (overflow == MonthlyOverflowPolicy.CLAMP) {
            return Optional.of(at(month.atEndOfMonth(), time, zone));
        }
        return Optional.empty();
    }

    private Instant cron(String expression, ZoneId zone, Instant reference) {
        Instant next;
        try {
            next = cron.next(reference, expression, zone);
        } catch (IllegalArgumentException e) {
            throw new ScheduleComputationException("invalid cron expression '" + expression + "'", e);
        }
        if (next == null) {
            throw new ScheduleComputationException("cron expression '" + expression + "' has no execution after " + reference);
        }
        if (!next.isAfter(reference)) {
            throw new ScheduleComputationException("cron evaluator returned " + next + " not after " + reference);
        }
        return next;
    }

    private static LocalTime timeOf(ScheduleDefinition.Recurring r) {
        try {
            return TimeOfDay.parse(r.timeOfDay());
        } catch (IllegalArgumentException e) {
            throw new ScheduleComputationException(e.getMessage(), e);
        }
    }

    /** DST gap 에 걸리면 ZonedDateTime 규칙대로 뒤로 밀린다 */
    private static Instant at(LocalDate date, LocalTime time, ZoneId zone) {
        return ZonedDateTime.of(date, time, zone).toInstant();
    }

    static ZoneId zoneOf(String timezone) {
        try {
            return ZoneId.of(timezone == null || timezone.isBlank() ? Schedule.DEFAULT_TIMEZONE : timezone);
        } catch (DateTimeException e) {
            throw new ScheduleComputationException("invalid timezone '" + timezone + "'", e);
        }
    }
}
