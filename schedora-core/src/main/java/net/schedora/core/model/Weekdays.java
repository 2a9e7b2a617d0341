package net.schedora.core.model;

import java.time.DayOfWeek;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/** ISO 요일 인덱스(월=0 .. 일=6) 변환. 저장 포맷은 "0,2,4" */
public final class Weekdays {
    private Weekdays() {}

    public static DayOfWeek fromIndex(int index) {
        if (index < 0 || index > 6) {
            throw new IllegalArgumentException("weekday index must be 0..6 (Monday=0): " + index);
        }
        return DayOfWeek.of(index + 1);
    }

    public static int toIndex(DayOfWeek day) { return day.getValue() - 1; }

    public static Set<DayOfWeek> fromIndices(Collection<Integer> indices) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (indices != null) {
            for (Integer i : indices) days.add(fromIndex(i));
        }
        return days;
    }

    public static Set<DayOfWeek> parse(String csv) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (csv == null || csv.isBlank()) return days;
        for (String part : csv.split(",")) {
            String p = part.trim();
            if (!p.isEmpty()) days.add(fromIndex(Integer.parseInt(p)));
        }
        return days;
    }

    public static String format(Set<DayOfWeek> days) {
        if (days == null || days.isEmpty()) return null;
        return days.stream()
                .sorted()
                .map(d -> String.valueOf(toIndex(d)))
                .collect(Collectors.joining(","));
    }
}
