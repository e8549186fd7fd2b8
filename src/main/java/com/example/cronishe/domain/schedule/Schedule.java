package com.example.cronishe.domain.schedule;

import java.time.DayOfWeek;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * When a job fires: either a fixed interval since the last run, or a weekly
 * wall-clock time in the job's timezone.
 */
public sealed interface Schedule permits Schedule.Interval, Schedule.Weekly {

    /**
     * Fires every {@code minutes} minutes since the last run.
     */
    record Interval(int minutes) implements Schedule {

        public Interval {
            if (minutes <= 0) {
                throw new IllegalArgumentException("Interval must be positive: " + minutes);
            }
        }
    }

    /**
     * Fires at {@code hour:minute} local time on each of {@code days}.
     */
    record Weekly(Set<DayOfWeek> days, int hour, int minute, ZoneId zone) implements Schedule {

        public Weekly {
            if (hour < 0 || hour > 23) {
                throw new IllegalArgumentException("Hour out of range: " + hour);
            }
            if (minute < 0 || minute > 59) {
                throw new IllegalArgumentException("Minute out of range: " + minute);
            }
            days = days.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(days));
        }

        public boolean runsOn(DayOfWeek day) {
            return days.contains(day);
        }
    }
}
