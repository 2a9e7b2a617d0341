package net.schedora.core.model;

import net.schedora.core.exception.ScheduleValidationException;
import net.schedora.core.model.ScheduleDefinition.Recurring;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static java.time.DayOfWeek.*;
import static org.junit.jupiter.api.Assertions.*;

class ScheduleDefinitionTest {

    @Test
    void variantsReportTheirType() {
        assertEquals(ScheduleType.ONCE, new ScheduleDefinition.Once(Instant.EPOCH).type());
        assertEquals(ScheduleType.RECURRING, Recurring.hours(1).type());
        assertEquals(ScheduleType.CRON, new ScheduleDefinition.Cron("0 9 * * *").type());
    }

    @Test
    void missingRequiredFieldsAreRejected() {
        assertThrows(ScheduleValidationException.class, () -> new ScheduleDefinition.Once(null));
        assertThrows(ScheduleValidationException.class, () -> new ScheduleDefinition.Cron("  "));
        assertThrows(ScheduleValidationException.class, () -> new Recurring(null, 1, null, null, null));
        assertThrows(ScheduleValidationException.class, () -> Recurring.daily(1, null));
        assertThrows(ScheduleValidationException.class,
                () -> new Recurring(RecurringType.MONTHLY, 1, "09:00", null, null));
    }

    @Test
    void intervalMustBePositive() {
        assertThrows(ScheduleValidationException.class, () -> Recurring.minutes(0));
        assertThrows(ScheduleValidationException.class, () -> Recurring.daily(-1, "09:00"));
    }

    @Test
    void fieldsOutsideTheirTypeAreRejected() {
        assertThrows(ScheduleValidationException.class,
                () -> new Recurring(RecurringType.MINUTES, 5, "09:00", null, null));
        assertThrows(ScheduleValidationException.class,
                () -> new Recurring(RecurringType.DAILY, 1, "09:00", EnumSet.of(MONDAY), null));
        assertThrows(ScheduleValidationException.class,
                () -> new Recurring(RecurringType.WEEKLY, 1, "09:00", EnumSet.of(MONDAY), 3));
    }

    @Test
    void weeklyDaysAreCopiedAndImmutable() {
        Set<DayOfWeek> days = EnumSet.of(FRIDAY, MONDAY);
        Recurring r = Recurring.weekly(1, "09:00", days);
        days.add(SUNDAY);

        assertEquals(EnumSet.of(MONDAY, FRIDAY), r.daysOfWeek());
        assertThrows(UnsupportedOperationException.class, () -> r.daysOfWeek().add(TUESDAY));
        assertTrue(Recurring.weekly(1, "09:00", null).daysOfWeek().isEmpty());
    }

    @Test
    void cronExpressionIsTrimmed() {
        assertEquals("*/5 * * * *", new ScheduleDefinition.Cron("  */5 * * * *\n").expression());
    }

    @Test
    void weekdayIndicesAreMondayBased() {
        assertEquals(MONDAY, Weekdays.fromIndex(0));
        assertEquals(SUNDAY, Weekdays.fromIndex(6));
        assertEquals(EnumSet.of(MONDAY, WEDNESDAY, SUNDAY), Weekdays.fromIndices(List.of(6, 0, 2)));
        assertThrows(IllegalArgumentException.class, () -> Weekdays.fromIndex(7));
        assertThrows(IllegalArgumentException.class, () -> Weekdays.fromIndex(-1));
    }

    @Test
    void weekdayCsvFormat() {
        assertEquals("0,2,6", Weekdays.format(EnumSet.of(SUNDAY, MONDAY, WEDNESDAY)));
        assertNull(Weekdays.format(Set.of()));
        assertEquals(EnumSet.of(TUESDAY, SATURDAY), Weekdays.parse(" 1, 5 "));
        assertTrue(Weekdays.parse(null).isEmpty());
    }

    @Test
    void timeOfDayIsStrictHhMm() {
        assertEquals(LocalTime.of(0, 0), TimeOfDay.parse("00:00"));
        assertEquals(LocalTime.of(23, 59), TimeOfDay.parse("23:59"));
        for (String bad : List.of("9:00", "24:00", "12:60", "12:00:00", "noon", "")) {
            assertThrows(IllegalArgumentException.class, () -> TimeOfDay.parse(bad), bad);
        }
    }

    @Test
    void scheduleStatusParsingFallsBackToUnknown() {
        assertEquals(Schedule.Status.EXPIRED, Schedule.Status.from("expired"));
        assertEquals(Schedule.Status.UNKNOWN, Schedule.Status.from("PAUSED"));
        assertEquals(Schedule.Status.UNKNOWN, Schedule.Status.from(null));
        assertFalse(Schedule.Status.SCHEDULED.isTerminal());
        assertTrue(Schedule.Status.EXHAUSTED.isTerminal());
    }
}
