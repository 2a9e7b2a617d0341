package net.schedora.core.model;

import java.time.temporal.ChronoUnit;

public enum RecurringType {
    MINUTES(ChronoUnit.MINUTES),
    HOURS(ChronoUnit.HOURS),
    DAILY(ChronoUnit.DAYS),
    WEEKLY(ChronoUnit.WEEKS),
    MONTHLY(ChronoUnit.MONTHS);

    private final ChronoUnit unit;

    RecurringType(ChronoUnit unit) { this.unit = unit; }

    public ChronoUnit unit() { return unit; }

    /** 하루 중 시각(HH:MM)이 필요한 타입인지 */
    public boolean requiresTimeOfDay() {
        return this == DAILY || this == WEEKLY || this == MONTHLY;
    }

    public static RecurringType from(String s) {
        if (s == null) return null;
        return RecurringType.valueOf(s.trim().toUpperCase());
    }
    public String code() { return name(); }
}
