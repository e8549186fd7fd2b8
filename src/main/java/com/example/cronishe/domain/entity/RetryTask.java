package com.example.cronishe.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * A queued re-execution of a failed origin run.
 * <p>
 * All attempts of a cascade are created together when the origin run fails and
 * are removed when fired, when the job succeeds, or when the job is gone.
 */
@Entity
@Table(name = "retry_tasks", indexes = {
        @Index(name = "idx_retry_tasks_fire_at", columnList = "fire_at"),
        @Index(name = "idx_retry_tasks_job_id", columnList = "job_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetryTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    /**
     * The failed non-retry run this cascade belongs to
     */
    @Column(name = "origin_run_id", nullable = false)
    private Long originRunId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(name = "fire_at", nullable = false)
    private Instant fireAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
