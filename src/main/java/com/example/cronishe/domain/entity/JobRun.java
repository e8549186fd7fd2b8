package com.example.cronishe.domain.entity;

import com.example.cronishe.domain.enums.RunOutcome;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * One execution attempt of a job.
 * <p>
 * A run with a null {@link #finishAt} is open. At most one open run may exist per job.
 */
@Entity
@Table(name = "job_runs", indexes = {
        @Index(name = "idx_job_runs_job_id", columnList = "job_id"),
        @Index(name = "idx_job_runs_job_open", columnList = "job_id, finish_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "start_at", nullable = false)
    private Instant startAt;

    @Column(name = "finish_at")
    private Instant finishAt;

    /**
     * Measured wall-clock seconds, independent of startAt/finishAt
     */
    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 20)
    @Builder.Default
    private RunOutcome outcome = RunOutcome.RUNNING;

    /**
     * OS pid of the spawned process, cleared once the run is closed
     */
    @Column(name = "process_id")
    private Long processId;

    @Column(name = "is_retry", nullable = false)
    @Builder.Default
    private boolean retry = false;

    /**
     * 1-based retry attempt, 0 for an origin run
     */
    @Column(name = "attempt_number", nullable = false)
    @Builder.Default
    private int attemptNumber = 0;

    /**
     * Seconds elapsed between {@link #startAt} and {@code now}, never negative
     */
    public long elapsedSeconds(Instant now) {
        if (startAt == null) {
            return 0;
        }
        return Math.max(0, Duration.between(startAt, now).getSeconds());
    }
}
