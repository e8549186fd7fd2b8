package com.example.cronishe.domain.entity;

import com.example.cronishe.domain.enums.RunOutcome;
import com.example.cronishe.domain.enums.ScheduleType;
import com.example.cronishe.domain.schedule.Schedule;
import com.example.cronishe.domain.schedule.WeekdayMask;
import jakarta.persistence.*;
import lombok.*;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

/**
 * A user-defined job: a shell command plus the schedule it fires on.
 * <p>
 * Created, edited and deleted outside the scheduler. The scheduler only reads
 * job definitions and writes {@link #lastRunAt}/{@link #lastRunOutcome}.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_active", columnList = "active")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Job {

    public static final int DEFAULT_RETRY_LIMIT = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /**
     * Command line, interpreted by the shell
     */
    @Column(name = "command", nullable = false, columnDefinition = "TEXT")
    private String command;

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", nullable = false, length = 20)
    private ScheduleType scheduleType;

    /**
     * Minutes between runs, INTERVAL jobs only
     */
    @Column(name = "interval_minutes")
    private Integer intervalMinutes;

    /**
     * Enabled weekdays, WEEKLY jobs only. See {@link WeekdayMask}.
     */
    @Column(name = "weekday_mask")
    @Builder.Default
    private Integer weekdayMask = 0;

    @Column(name = "schedule_hour")
    private Integer scheduleHour;

    @Column(name = "schedule_minute")
    private Integer scheduleMinute;

    /**
     * IANA zone name the weekly time is expressed in
     */
    @Column(name = "timezone_id", length = 64)
    @Builder.Default
    private String timezone = "UTC";

    @Column(name = "active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "retry_limit", nullable = false)
    @Builder.Default
    private int retryLimit = DEFAULT_RETRY_LIMIT;

    @Column(name = "on_start_url", length = 1000)
    private String onStartUrl;

    @Column(name = "on_success_url", length = 1000)
    private String onSuccessUrl;

    @Column(name = "on_fail_url", length = 1000)
    private String onFailUrl;

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_run_outcome", length = 20)
    private RunOutcome lastRunOutcome;

    /**
     * Typed view of the schedule columns.
     *
     * @return empty if a field the schedule type needs is missing or out of range
     */
    public Optional<Schedule> toSchedule() {
        if (scheduleType == null) {
            return Optional.empty();
        }
        try {
            if (scheduleType == ScheduleType.INTERVAL) {
                return intervalMinutes == null ? Optional.empty() : Optional.of(new Schedule.Interval(intervalMinutes));
            }
            if (scheduleHour == null || scheduleMinute == null) {
                return Optional.empty();
            }
            return Optional.of(new Schedule.Weekly(getWeekdays(), scheduleHour, scheduleMinute, resolveZone()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    public Set<DayOfWeek> getWeekdays() {
        return WeekdayMask.toDays(weekdayMask != null ? weekdayMask : 0);
    }

    public void setWeekdays(Set<DayOfWeek> days) {
        this.weekdayMask = WeekdayMask.of(days);
    }

    /**
     * Check if the configured timezone is a zone id the JDK recognises
     */
    public boolean hasValidTimezone() {
        if (timezone == null || timezone.isBlank()) {
            return false;
        }
        try {
            ZoneId.of(timezone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    /**
     * Configured zone, or UTC when it is missing or unrecognised
     */
    public ZoneId resolveZone() {
        return hasValidTimezone() ? ZoneId.of(timezone) : ZoneOffset.UTC;
    }

    public boolean hasRun() {
        return lastRunAt != null;
    }
}
