package com.example.cronishe.service.schedule;

import com.example.cronishe.domain.entity.Job;
import com.example.cronishe.domain.schedule.Schedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Decides which jobs fire on a tick.
 * <p>
 * Stateless: the decision depends only on the job definition, its last run and
 * the tick instant. Due jobs are returned in input order with no priority.
 */
@Slf4j
@Component
public class DueJobSelector {

    /**
     * A weekly job that ran less than this long ago is not fired again
     */
    static final Duration WEEKLY_REFIRE_GUARD = Duration.ofSeconds(60);

    /**
     * Select the jobs that must fire at {@code now}.
     *
     * @param jobs candidate jobs, normally the active ones
     * @param now  tick instant, truncated to the minute
     * @return due jobs
     */
    public List<Job> selectDue(List<Job> jobs, Instant now) {
        var due = jobs.stream()
                .filter(job -> isDue(job, now))
                .toList();

        if (due.isEmpty()) {
            log.info("No jobs due at {} ({} checked)", now, jobs.size());
        } else {
            log.info("Found {} of {} job(s) due at {}", due.size(), jobs.size(), now);
        }
        return due;
    }

    public boolean isDue(Job job, Instant now) {
        if (!job.isActive()) {
            log.debug("Job '{}' (ID: {}) is inactive, skipping", job.getName(), job.getId());
            return false;
        }

        var schedule = job.toSchedule().orElse(null);
        if (schedule == null) {
            log.debug("Job '{}' (ID: {}) has an incomplete schedule, skipping", job.getName(), job.getId());
            return false;
        }

        if (schedule instanceof Schedule.Interval interval) {
            return isIntervalDue(job, interval, now);
        }
        return isWeeklyDue(job, (Schedule.Weekly) schedule, now);
    }

    private boolean isIntervalDue(Job job, Schedule.Interval interval, Instant now) {
        if (!job.hasRun()) {
            log.info("Job '{}' (ID: {}) has never run, scheduling now", job.getName(), job.getId());
            return true;
        }

        var lastRun = job.getLastRunAt();
        if (lastRun.isAfter(now)) {
            log.warn("Job '{}' (ID: {}) has last run {} in the future, scheduling now to reset", job.getName(), job.getId(), lastRun);
            return true;
        }

        var elapsed = Duration.between(lastRun, now);
        if (elapsed.compareTo(Duration.ofMinutes(interval.minutes())) >= 0) {
            log.info("Job '{}' (ID: {}) is due (every {} min, last run {}s ago)",
                    job.getName(), job.getId(), interval.minutes(), elapsed.getSeconds());
            return true;
        }
        return false;
    }

    private boolean isWeeklyDue(Job job, Schedule.Weekly weekly, Instant now) {
        if (!job.hasValidTimezone()) {
            log.warn("Job '{}' (ID: {}) has unrecognised timezone '{}', using UTC", job.getName(), job.getId(), job.getTimezone());
        }

        var local = now.atZone(weekly.zone());
        if (!weekly.runsOn(local.getDayOfWeek())) {
            log.debug("Job '{}' (ID: {}) not scheduled on {}", job.getName(), job.getId(), local.getDayOfWeek());
            return false;
        }

        if (local.getHour() != weekly.hour() || local.getMinute() != weekly.minute()) {
            return false;
        }

        if (job.hasRun() && Duration.between(job.getLastRunAt(), now).compareTo(WEEKLY_REFIRE_GUARD) < 0) {
            log.debug("Job '{}' (ID: {}) already ran in the last minute, skipping", job.getName(), job.getId());
            return false;
        }

        log.info("Job '{}' (ID: {}) is due (scheduled at {}:{} {})",
                job.getName(), job.getId(), String.format("%02d", weekly.hour()), String.format("%02d", weekly.minute()), weekly.zone());
        return true;
    }
}
