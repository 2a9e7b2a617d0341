package net.schedora.core.model;

import net.schedora.core.exception.ScheduleValidationException;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 스케줄 정책의 변형(variant) 페이로드. ONCE / RECURRING / CRON 중 정확히 하나.
 * 필드 조합 검증은 각 record 생성자에서 끝난다.
 */
public sealed interface ScheduleDefinition
        permits ScheduleDefinition.Once, ScheduleDefinition.Recurring, ScheduleDefinition.Cron {

    ScheduleType type();

    /** 단발 실행 */
    record Once(Instant executeAt) implements ScheduleDefinition {
        public Once {
            if (executeAt == null) throw new ScheduleValidationException("executeAt is required for ONCE schedules");
        }

        @Override
        public ScheduleType type() { return ScheduleType.ONCE; }
    }

    /**
     * 반복 실행. timeOfDay는 DAILY/WEEKLY/MONTHLY에서만, daysOfWeek는 WEEKLY에서만,
     * dayOfMonth는 MONTHLY에서만 채워진다.
     */
    record Recurring(RecurringType recurringType,
                     int interval,
                     String timeOfDay,
                     Set<DayOfWeek> daysOfWeek,
                     Integer dayOfMonth) implements ScheduleDefinition {
        public Recurring {
            if (recurringType == null) {
                throw new ScheduleValidationException("recurringType is required for RECURRING schedules");
            }
            if (interval < 1) {
                throw new ScheduleValidationException("interval must be at least 1: " + interval);
            }
            if (recurringType.requiresTimeOfDay()) {
                if (timeOfDay == null || timeOfDay.isBlank()) {
                    throw new ScheduleValidationException("timeOfDay is required for " + recurringType + " schedules");
                }
            } else if (timeOfDay != null) {
                throw new ScheduleValidationException("timeOfDay is not allowed for " + recurringType + " schedules");
            }

            boolean hasDays = daysOfWeek != null && !daysOfWeek.isEmpty();
            if (recurringType != RecurringType.WEEKLY && hasDays) {
                throw new ScheduleValidationException("daysOfWeek is only allowed for WEEKLY schedules");
            }
            if (recurringType == RecurringType.MONTHLY) {
                if (dayOfMonth == null) {
                    throw new ScheduleValidationException("dayOfMonth is required for MONTHLY schedules");
                }
            } else if (dayOfMonth != null) {
                throw new ScheduleValidationException("dayOfMonth is only allowed for MONTHLY schedules");
            }

            // WEEKLY는 빈 집합 허용 (nextRun=null, 발화 불가)
            daysOfWeek = recurringType == RecurringType.WEEKLY
                    ? Collections.unmodifiableSet(daysOfWeek == null || daysOfWeek.isEmpty()
                        ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(daysOfWeek))
                    : Set.of();
        }

        @Override
        public ScheduleType type() { return ScheduleType.RECURRING; }

        public static Recurring minutes(int interval) {
            return new Recurring(RecurringType.MINUTES, interval, null, null, null);
        }

        public static Recurring hours(int interval) {
            return new Recurring(RecurringType.HOURS, interval, null, null, null);
        }

        public static Recurring daily(int interval, String timeOfDay) {
            return new Recurring(RecurringType.DAILY, interval, timeOfDay, null, null);
        }

        public static Recurring weekly(int interval, String timeOfDay, Set<DayOfWeek> daysOfWeek) {
            return new Recurring(RecurringType.WEEKLY, interval, timeOfDay, daysOfWeek, null);
        }

        public static Recurring monthly(int interval, String timeOfDay, int dayOfMonth) {
            return new Recurring(RecurringType.MONTHLY, interval, timeOfDay, null, dayOfMonth);
        }
    }

    /** 5필드 cron 표현식 */
    record Cron(String expression) implements ScheduleDefinition {
        public Cron {
            if (expression == null || expression.isBlank()) {
                throw new ScheduleValidationException("cronExpression is required for CRON schedules");
            }
            expression = expression.trim();
        }

        @Override
        public ScheduleType type() { return ScheduleType.CRON; }
    }
}
