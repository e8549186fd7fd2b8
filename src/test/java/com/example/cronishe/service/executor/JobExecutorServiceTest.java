package com.example.cronishe.service.executor;

import com.example.cronishe.config.MetricsConfig;
import com.example.cronishe.domain.entity.Job;
import com.example.cronishe.domain.enums.RunOutcome;
import com.example.cronishe.domain.enums.ScheduleType;
import com.example.cronishe.domain.enums.WebhookStage;
import com.example.cronishe.service.retry.RetryCascadeService;
import com.example.cronishe.service.store.JobStore;
import com.example.cronishe.service.webhook.WebhookNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobExecutorService Tests")
class JobExecutorServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:00:05Z");

    @Mock
    private JobStore jobStore;

    @Mock
    private ShellCommandRunner commandRunner;

    @Mock
    private WebhookNotifier webhookNotifier;

    @Mock
    private RetryCascadeService retryCascadeService;

    @Mock
    private MetricsConfig metricsConfig;

    private JobExecutorService jobExecutorService;

    private Job job;

    @BeforeEach
    void setUp() {
        jobExecutorService = new JobExecutorService(jobStore, commandRunner, webhookNotifier, retryCascadeService,
                metricsConfig, Clock.fixed(NOW, ZoneOffset.UTC));

        job = Job.builder()
                .id(1L)
                .name("backup")
                .command("./backup.sh")
                .scheduleType(ScheduleType.INTERVAL)
                .intervalMinutes(5)
                .retryLimit(3)
                .onStartUrl("http://hooks.test/start")
                .onSuccessUrl("http://hooks.test/success")
                .onFailUrl("http://hooks.test/fail")
                .build();
    }

    private void processExits(int exitCode, String... lines) throws Exception {
        when(commandRunner.run(eq("./backup.sh"), any(), any())).thenAnswer(inv -> {
            LongConsumer onSpawn = inv.getArgument(1);
            Consumer<String> onLine = inv.getArgument(2);
            onSpawn.accept(4242L);
            for (var line : lines) {
                onLine.accept(line);
            }
            return exitCode;
        });
    }

    @Nested
    @DisplayName("Origin Run Tests")
    class OriginRunTests {

        @Test
        @DisplayName("Should record a successful run end to end")
        void shouldRecordSuccess() throws Exception {
            when(jobStore.isRunning(1L)).thenReturn(false);
            when(jobStore.createRun(1L, false, 0)).thenReturn(10L);
            processExits(0, "dumping", "done");
            when(jobStore.finishRun(eq(10L), eq(RunOutcome.SUCCESS), anyLong())).thenReturn(true);

            var result = jobExecutorService.execute(job, false, 0);

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getRunId()).isEqualTo(10L);
            assertThat(result.getExitCode()).isZero();

            var inOrder = inOrder(jobStore, webhookNotifier, retryCascadeService);
            inOrder.verify(jobStore).createRun(1L, false, 0);
            inOrder.verify(webhookNotifier).deliverAsync("http://hooks.test/start", "backup", WebhookStage.START);
            inOrder.verify(jobStore).recordProcessId(10L, 4242L);
            inOrder.verify(jobStore).appendLog(10L, "dumping");
            inOrder.verify(jobStore).appendLog(10L, "done");
            inOrder.verify(jobStore).finishRun(eq(10L), eq(RunOutcome.SUCCESS), anyLong());
            inOrder.verify(jobStore).setLastRun(1L, RunOutcome.SUCCESS);
            inOrder.verify(webhookNotifier).deliver("http://hooks.test/success", "backup", WebhookStage.SUCCESS);
            inOrder.verify(retryCascadeService).onRunFinished(job, 10L, RunOutcome.SUCCESS, false, 0, NOW);
            verify(metricsConfig).recordRun(any(), eq(RunOutcome.SUCCESS), eq(false));
        }

        @Test
        @DisplayName("Non-zero exit is a failure that reaches the retry engine")
        void nonZeroExitFails() throws Exception {
            when(jobStore.isRunning(1L)).thenReturn(false);
            when(jobStore.createRun(1L, false, 0)).thenReturn(10L);
            processExits(3, "disk full");
            when(jobStore.finishRun(eq(10L), eq(RunOutcome.FAIL), anyLong())).thenReturn(true);

            var result = jobExecutorService.execute(job, false, 0);

            assertThat(result.getOutcome()).isEqualTo(RunOutcome.FAIL);
            assertThat(result.getExitCode()).isEqualTo(3);
            verify(jobStore).setLastRun(1L, RunOutcome.FAIL);
            verify(webhookNotifier).deliver("http://hooks.test/fail", "backup", WebhookStage.FAIL);
            verify(retryCascadeService).onRunFinished(job, 10L, RunOutcome.FAIL, false, 0, NOW);
        }

        @Test
        @DisplayName("Spawn error is recorded as a failed run")
        void spawnErrorFails() throws Exception {
            when(jobStore.isRunning(1L)).thenReturn(false);
            when(jobStore.createRun(1L, false, 0)).thenReturn(10L);
            when(commandRunner.run(eq("./backup.sh"), any(), any())).thenThrow(new IOException("No such file"));
            when(jobStore.finishRun(eq(10L), eq(RunOutcome.FAIL), anyLong())).thenReturn(true);

            var result = jobExecutorService.execute(job, false, 0);

            assertThat(result.getOutcome()).isEqualTo(RunOutcome.FAIL);
            assertThat(result.getErrorMessage()).isEqualTo("No such file");
            assertThat(result.getExitCode()).isNull();
            verify(jobStore).appendLog(10L, "ERROR: No such file");
            verify(jobStore, never()).recordProcessId(anyLong(), anyLong());
            verify(retryCascadeService).onRunFinished(job, 10L, RunOutcome.FAIL, false, 0, NOW);
        }

        @Test
        @DisplayName("Job without hooks still runs")
        void noHooks() throws Exception {
            job.setOnStartUrl(null);
            job.setOnSuccessUrl(null);
            when(jobStore.isRunning(1L)).thenReturn(false);
            when(jobStore.createRun(1L, false, 0)).thenReturn(10L);
            processExits(0);
            when(jobStore.finishRun(eq(10L), eq(RunOutcome.SUCCESS), anyLong())).thenReturn(true);

            var result = jobExecutorService.execute(job, false, 0);

            assertThat(result.isSuccess()).isTrue();
            verify(webhookNotifier).deliverAsync(null, "backup", WebhookStage.START);
            verify(webhookNotifier).deliver(null, "backup", WebhookStage.SUCCESS);
        }

        @Test
        @DisplayName("NUL bytes in process output are dropped before the line is stored")
        void nulBytesDropped() throws Exception {
            when(jobStore.isRunning(1L)).thenReturn(false);
            when(jobStore.createRun(1L, false, 0)).thenReturn(10L);
            processExits(0, "bin\0ary\0", "plain");
            when(jobStore.finishRun(eq(10L), eq(RunOutcome.SUCCESS), anyLong())).thenReturn(true);

            var result = jobExecutorService.execute(job, false, 0);

            assertThat(result.isSuccess()).isTrue();
            verify(jobStore).appendLog(10L, "binary");
            verify(jobStore).appendLog(10L, "plain");
            verify(jobStore, never()).appendLog(anyLong(), contains("\0"));
        }
    }

    @Nested
    @DisplayName("Retry Run Tests")
    class RetryRunTests {

        @Test
        @DisplayName("Retry run logs its attempt number first")
        void retryLogsAttempt() throws Exception {
            when(jobStore.isRunning(1L)).thenReturn(false);
            when(jobStore.createRun(1L, true, 2)).thenReturn(11L);
            processExits(0);
            when(jobStore.finishRun(eq(11L), eq(RunOutcome.SUCCESS), anyLong())).thenReturn(true);

            jobExecutorService.execute(job, true, 2);

            var inOrder = inOrder(jobStore);
            inOrder.verify(jobStore).appendLog(11L, "Retry attempt 2 of 3");
            inOrder.verify(jobStore).recordProcessId(11L, 4242L);
            verify(jobStore).setLastRun(1L, RunOutcome.SUCCESS);
            verify(retryCascadeService).onRunFinished(job, 11L, RunOutcome.SUCCESS, true, 2, NOW);
        }

        @Test
        @DisplayName("Failed retry with attempts left does not touch the last run")
        void failedRetryKeepsLastRun() throws Exception {
            when(jobStore.isRunning(1L)).thenReturn(false);
            when(jobStore.createRun(1L, true, 1)).thenReturn(11L);
            processExits(1);
            when(jobStore.finishRun(eq(11L), eq(RunOutcome.FAIL), anyLong())).thenReturn(true);
            when(jobStore.hasPendingRetries(1L)).thenReturn(true);

            jobExecutorService.execute(job, true, 1);

            verify(jobStore, never()).setLastRun(anyLong(), any());
            verify(retryCascadeService).onRunFinished(job, 11L, RunOutcome.FAIL, true, 1, NOW);
        }

        @Test
        @DisplayName("Failed final retry records the last run")
        void failedFinalRetryRecordsLastRun() throws Exception {
            when(jobStore.isRunning(1L)).thenReturn(false);
            when(jobStore.createRun(1L, true, 3)).thenReturn(12L);
            processExits(1);
            when(jobStore.finishRun(eq(12L), eq(RunOutcome.FAIL), anyLong())).thenReturn(true);
            when(jobStore.hasPendingRetries(1L)).thenReturn(false);

            jobExecutorService.execute(job, true, 3);

            verify(jobStore).setLastRun(1L, RunOutcome.FAIL);
        }
    }

    @Test
    @DisplayName("Should skip a job that already has an open run")
    void shouldSkipRunningJob() throws Exception {
        when(jobStore.isRunning(1L)).thenReturn(true);

        var result = jobExecutorService.execute(job, false, 0);

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getRunId()).isNull();
        verify(jobStore, never()).createRun(anyLong(), anyBoolean(), anyInt());
        verify(commandRunner, never()).run(any(), any(), any());
        verify(metricsConfig).recordSkippedRun();
        verifyNoInteractions(webhookNotifier, retryCascadeService);
    }

    @Test
    @DisplayName("Run stopped while the process was running is left as aborted")
    void stoppedRunIsLeftAlone() throws Exception {
        when(jobStore.isRunning(1L)).thenReturn(false);
        when(jobStore.createRun(1L, false, 0)).thenReturn(10L);
        processExits(143);
        when(jobStore.finishRun(eq(10L), eq(RunOutcome.FAIL), anyLong())).thenReturn(false);

        var result = jobExecutorService.execute(job, false, 0);

        assertThat(result.getOutcome()).isEqualTo(RunOutcome.ABORTED);
        verify(jobStore, never()).setLastRun(anyLong(), any());
        verify(webhookNotifier, never()).deliver(any(), any(), any());
        verifyNoInteractions(retryCascadeService);
    }
}
