package com.example.cronishe.domain.schedule;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

/**
 * Packs a set of weekdays into an int, Monday in bit 0 through Sunday in bit 6.
 */
public final class WeekdayMask {

    private WeekdayMask() {
    }

    public static int of(Set<DayOfWeek> days) {
        var mask = 0;
        for (var day : days) {
            mask |= bit(day);
        }
        return mask;
    }

    public static Set<DayOfWeek> toDays(int mask) {
        var days = EnumSet.noneOf(DayOfWeek.class);
        for (var day : DayOfWeek.values()) {
            if ((mask & bit(day)) != 0) {
                days.add(day);
            }
        }
        return days;
    }

    private static int bit(DayOfWeek day) {
        return 1 << (day.getValue() - 1);
    }
}
