package net.schedora.core.model;

public enum ScheduleType {
    ONCE, RECURRING, CRON;

    public static ScheduleType from(String s) {
        if (s == null) throw new IllegalArgumentException("schedule type is null");
        return ScheduleType.valueOf(s.trim().toUpperCase());
    }
    public String code() { return name(); }
}
