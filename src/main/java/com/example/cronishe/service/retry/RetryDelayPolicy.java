package com.example.cronishe.service.retry;

import com.example.cronishe.domain.schedule.Schedule;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Backoff between a failed origin run and each of its retry attempts.
 * <p>
 * Delays are chosen so a cascade finishes before the job's next natural run:
 * <ul>
 *   <li>interval of 1-2 min: 1 min for every attempt</li>
 *   <li>interval of 3-5 min: 1, 2, 3 min</li>
 *   <li>longer intervals: 2^(attempt-1) min, capped at half the interval</li>
 *   <li>weekly: 1, 2, 4 min</li>
 * </ul>
 * Table entries past the end repeat the last entry. A null schedule uses the
 * weekly table.
 */
@Component
public class RetryDelayPolicy {

    private static final List<Integer> SHORT_INTERVAL_MINUTES = List.of(1, 2, 3);
    private static final List<Integer> WEEKLY_MINUTES = List.of(1, 2, 4);

    /**
     * Delay before retry {@code attempt}
     *
     * @param schedule the job's schedule
     * @param attempt  1-based attempt number
     */
    public Duration delay(Schedule schedule, int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be at least 1: " + attempt);
        }
        if (schedule instanceof Schedule.Interval interval) {
            return Duration.ofMinutes(intervalDelayMinutes(interval.minutes(), attempt));
        }
        return Duration.ofMinutes(fromTable(WEEKLY_MINUTES, attempt));
    }

    private long intervalDelayMinutes(int intervalMinutes, int attempt) {
        if (intervalMinutes <= 2) {
            return 1;
        }
        if (intervalMinutes <= 5) {
            return fromTable(SHORT_INTERVAL_MINUTES, attempt);
        }
        var cap = intervalMinutes / 2;
        // cap is below 2^31, so larger shifts cannot change the result
        var exponential = 1L << Math.min(attempt - 1, 32);
        return Math.min(exponential, cap);
    }

    private static int fromTable(List<Integer> table, int attempt) {
        return table.get(Math.min(attempt, table.size()) - 1);
    }
}
