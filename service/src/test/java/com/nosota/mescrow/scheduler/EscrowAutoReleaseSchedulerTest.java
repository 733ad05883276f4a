package com.nosota.mescrow.scheduler;

import com.nosota.mescrow.service.EscrowService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Escrow auto-release scheduler")
class EscrowAutoReleaseSchedulerTest {

    @Mock
    private EscrowService escrowService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    private EscrowAutoReleaseScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new EscrowAutoReleaseScheduler(escrowService, taskScheduler, 5000);
    }

    @Test
    @DisplayName("SCH-001: start schedules the sweep once with the configured delay")
    void startSchedulesSweep() {
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMillis(5000)));

        scheduler.start();
        scheduler.start();

        assertThat(scheduler.isRunning()).isTrue();
        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMillis(5000)));
    }

    @Test
    @DisplayName("SCH-002: stop cancels the scheduled sweep")
    void stopCancelsSweep() {
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));

        scheduler.start();
        scheduler.stop();

        assertThat(scheduler.isRunning()).isFalse();
        verify(future).cancel(false);
    }

    @Test
    @DisplayName("SCH-003: scheduled task delegates to the escrow service")
    void scheduledTaskRunsSweep() {
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        when(escrowService.processAutoReleases()).thenReturn(2);

        scheduler.start();

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).scheduleWithFixedDelay(task.capture(), any(Duration.class));
        task.getValue().run();

        verify(escrowService).processAutoReleases();
    }

    @Test
    @DisplayName("SCH-004: a failing sweep does not propagate")
    void failingSweepIsContained() {
        when(escrowService.processAutoReleases()).thenThrow(new IllegalStateException("database unavailable"));

        assertThatCode(() -> scheduler.releaseDueEscrows()).doesNotThrowAnyException();
    }
}
