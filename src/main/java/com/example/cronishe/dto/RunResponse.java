package com.example.cronishe.dto;

import com.example.cronishe.domain.enums.RunOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for run data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResponse {

    private Long id;
    private Long jobId;
    private Instant startAt;
    private Instant finishAt;
    private Long durationSeconds;
    private RunOutcome outcome;
    private boolean retry;
    private int attemptNumber;
}
