package net.schedora.core.model;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 24시간제 "HH:MM" */
public final class TimeOfDay {
    private static final Pattern HH_MM = Pattern.compile("^(\\d{2}):(\\d{2})$");

    private TimeOfDay() {}

    public static LocalTime parse(String text) {
        if (text == null) throw new IllegalArgumentException("time of day is null");
        Matcher m = HH_MM.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("time of day must be HH:MM (24h): '" + text + "'");
        }
        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        if (hour > 23 || minute > 59) {
            throw new IllegalArgumentException("time of day out of range: '" + text + "'");
        }
        return LocalTime.of(hour, minute);
    }
}
