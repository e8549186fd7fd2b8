package com.example.cronishe.controller;

import com.example.cronishe.dto.ApiResponse;
import com.example.cronishe.dto.RunResponse;
import com.example.cronishe.exception.JobAlreadyRunningException;
import com.example.cronishe.exception.JobNotFoundException;
import com.example.cronishe.mapper.RunMapper;
import com.example.cronishe.service.executor.JobDispatcher;
import com.example.cronishe.service.executor.RunStopService;
import com.example.cronishe.service.store.JobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * The two actions an operator can trigger on the scheduler: run a job now, and
 * stop a running run. Job definitions and history are managed elsewhere.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
@Tag(name = "Scheduler", description = "Manual run and stop of scheduled jobs")
public class SchedulerController {

    private final JobStore jobStore;
    private final JobDispatcher jobDispatcher;
    private final RunStopService runStopService;
    private final RunMapper runMapper;

    @PostMapping("/jobs/{jobId}/run")
    @Operation(summary = "Run a job now", description = "Start an out-of-schedule run of the job on its own worker")
    public ResponseEntity<ApiResponse<Void>> runJob(@Parameter(description = "Job ID") @PathVariable Long jobId) {
        log.info("API: Run job {}", jobId);

        var job = jobStore.findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        if (jobStore.isRunning(jobId)) {
            throw new JobAlreadyRunningException(jobId);
        }

        jobDispatcher.runNow(job);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.success(null, "Job started"));
    }

    @PostMapping("/runs/{runId}/stop")
    @Operation(summary = "Stop a run", description = "Terminate the process of an open run and mark the run aborted")
    public ResponseEntity<ApiResponse<RunResponse>> stopRun(@Parameter(description = "Run ID") @PathVariable Long runId) {
        log.info("API: Stop run {}", runId);

        var run = runStopService.stop(runId);
        return ResponseEntity.ok(ApiResponse.success(runMapper.toResponse(run), "Run stopped"));
    }
}
