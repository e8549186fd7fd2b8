package com.example.cronishe.service.executor;

import com.example.cronishe.domain.entity.JobRun;
import com.example.cronishe.domain.enums.RunOutcome;
import com.example.cronishe.exception.RunNotFoundException;
import com.example.cronishe.service.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RunStopService Tests")
class RunStopServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-13T10:05:00Z");

    @Mock
    private JobStore jobStore;

    @Mock
    private ProcessTreeTerminator processTreeTerminator;

    private RunStopService runStopService;

    @BeforeEach
    void setUp() {
        runStopService = new RunStopService(jobStore, processTreeTerminator, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JobRun openRun(Long processId) {
        return JobRun.builder()
                .id(7L)
                .jobId(1L)
                .startAt(NOW.minusSeconds(42))
                .processId(processId)
                .build();
    }

    @Test
    @DisplayName("Should abort the run before signalling the process")
    void shouldAbortThenSignal() {
        var aborted = openRun(null);
        aborted.setOutcome(RunOutcome.ABORTED);
        aborted.setFinishAt(NOW);
        aborted.setDurationSeconds(42L);

        when(jobStore.getOpenRun(7L)).thenReturn(Optional.of(openRun(4242L)));
        when(jobStore.abortRun(7L, 42L)).thenReturn(true);
        when(jobStore.findRun(7L)).thenReturn(Optional.of(aborted));

        var result = runStopService.stop(7L);

        assertThat(result.getOutcome()).isEqualTo(RunOutcome.ABORTED);
        var inOrder = inOrder(jobStore, processTreeTerminator);
        inOrder.verify(jobStore).abortRun(7L, 42L);
        inOrder.verify(jobStore).appendLog(7L, "Job stopped by user");
        inOrder.verify(processTreeTerminator).terminate(4242L);
    }

    @Test
    @DisplayName("Run stays aborted even when the process is already gone")
    void processAlreadyGone() {
        when(jobStore.getOpenRun(7L)).thenReturn(Optional.of(openRun(4242L)));
        when(jobStore.abortRun(7L, 42L)).thenReturn(true);
        when(processTreeTerminator.terminate(4242L)).thenReturn(false);
        when(jobStore.findRun(7L)).thenReturn(Optional.empty());

        var result = runStopService.stop(7L);

        assertThat(result.getId()).isEqualTo(7L);
        verify(jobStore).abortRun(7L, 42L);
    }

    @Test
    @DisplayName("Run that finished on its own before the abort is not reported as stopped")
    void runFinishedBeforeAbort() {
        when(jobStore.getOpenRun(7L)).thenReturn(Optional.of(openRun(4242L)));
        when(jobStore.abortRun(7L, 42L)).thenReturn(false);

        assertThatThrownBy(() -> runStopService.stop(7L)).isInstanceOf(RunNotFoundException.class);

        verify(jobStore, never()).appendLog(anyLong(), anyString());
        verify(jobStore, never()).findRun(anyLong());
        verifyNoInteractions(processTreeTerminator);
    }

    @Test
    @DisplayName("Run without a recorded process cannot be stopped")
    void noProcessIdIsRejected() {
        when(jobStore.getOpenRun(7L)).thenReturn(Optional.of(openRun(null)));

        assertThatThrownBy(() -> runStopService.stop(7L))
                .isInstanceOf(RunNotFoundException.class)
                .hasMessageContaining("7");

        verify(jobStore, never()).appendLog(anyLong(), anyString());
        verify(jobStore, never()).abortRun(anyLong(), anyLong());
        verifyNoInteractions(processTreeTerminator);
    }

    @Test
    @DisplayName("Closed or unknown run cannot be stopped")
    void unknownRunIsRejected() {
        when(jobStore.getOpenRun(7L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> runStopService.stop(7L)).isInstanceOf(RunNotFoundException.class);

        verify(jobStore, never()).abortRun(anyLong(), anyLong());
        verifyNoInteractions(processTreeTerminator);
    }
}
