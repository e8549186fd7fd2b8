package com.example.cronishe.domain.enums;

/**
 * How a job's firing time is expressed.
 */
public enum ScheduleType {

    /**
     * Every N minutes since the last run.
     */
    INTERVAL,

    /**
     * At a fixed local hour and minute on selected weekdays.
     */
    WEEKLY
}
