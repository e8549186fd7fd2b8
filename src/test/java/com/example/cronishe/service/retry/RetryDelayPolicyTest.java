package com.example.cronishe.service.retry;

import com.example.cronishe.domain.schedule.Schedule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryDelayPolicy Tests")
class RetryDelayPolicyTest {

    private final RetryDelayPolicy policy = new RetryDelayPolicy();

    private List<Long> delays(Schedule schedule, int attempts) {
        return IntStream.rangeClosed(1, attempts)
                .mapToObj(attempt -> policy.delay(schedule, attempt).toMinutes())
                .toList();
    }

    @Test
    @DisplayName("Ten minute interval backs off exponentially, capped at half the interval")
    void tenMinuteInterval() {
        assertThat(delays(new Schedule.Interval(10), 3)).containsExactly(1L, 2L, 4L);
        assertThat(delays(new Schedule.Interval(10), 5)).containsExactly(1L, 2L, 4L, 5L, 5L);
    }

    @Test
    @DisplayName("Four minute interval uses the short table")
    void fourMinuteInterval() {
        assertThat(delays(new Schedule.Interval(4), 3)).containsExactly(1L, 2L, 3L);
    }

    @Test
    @DisplayName("Short table repeats its last entry")
    void shortTableRepeats() {
        assertThat(delays(new Schedule.Interval(5), 5)).containsExactly(1L, 2L, 3L, 3L, 3L);
    }

    @ParameterizedTest
    @CsvSource({"1", "2"})
    @DisplayName("One and two minute intervals retry every minute")
    void veryShortInterval(int minutes) {
        assertThat(delays(new Schedule.Interval(minutes), 4)).containsOnly(1L);
    }

    @Test
    @DisplayName("Large attempt numbers stay at the cap")
    void largeAttemptStaysCapped() {
        assertThat(policy.delay(new Schedule.Interval(1440), 100)).isEqualTo(Duration.ofMinutes(720));
    }

    @Test
    @DisplayName("Weekly jobs use 1, 2, 4 minutes")
    void weeklyTable() {
        var weekly = new Schedule.Weekly(Set.of(DayOfWeek.MONDAY), 9, 0, ZoneOffset.UTC);

        assertThat(delays(weekly, 4)).containsExactly(1L, 2L, 4L, 4L);
    }

    @Test
    @DisplayName("Missing schedule uses the weekly table")
    void nullScheduleUsesWeeklyTable() {
        assertThat(delays(null, 3)).containsExactly(1L, 2L, 4L);
    }

    @Test
    @DisplayName("Attempt numbers start at one")
    void rejectsAttemptZero() {
        assertThatThrownBy(() -> policy.delay(new Schedule.Interval(10), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
