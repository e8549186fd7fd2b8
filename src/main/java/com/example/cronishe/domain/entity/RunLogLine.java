package com.example.cronishe.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One line of output (or a synthetic scheduler note) belonging to a run.
 * Lines are append-only; id order is arrival order.
 */
@Entity
@Table(name = "run_logs", indexes = {
        @Index(name = "idx_run_logs_run_id", columnList = "run_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunLogLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "run_id", nullable = false)
    private Long runId;

    @Column(name = "logged_at", nullable = false)
    private Instant loggedAt;

    @Column(name = "log_line", nullable = false, columnDefinition = "TEXT")
    private String line;
}
