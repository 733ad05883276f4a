package com.nosota.mescrow.scheduler;

import com.nosota.mescrow.service.EscrowService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Periodic sweep releasing escrows past their hold deadline.
 *
 * <p>Started with the application context and stopped with it: {@link #stop()} cancels the
 * scheduled task, so no new sweep starts after shutdown begins. Safe to run on several instances
 * at once, since a release only succeeds on a HELD escrow under its row lock.
 *
 * <p>Configuration:
 * <pre>
 * scheduler:
 *   escrow-auto-release:
 *     enabled: true        # enable/disable scheduler
 *     interval-ms: 60000   # delay between sweeps
 * </pre>
 */
@Component
@Slf4j
@ConditionalOnProperty(
        value = "scheduler.escrow-auto-release.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class EscrowAutoReleaseScheduler implements SmartLifecycle {

    private final EscrowService escrowService;
    private final TaskScheduler taskScheduler;
    private final Duration interval;

    private volatile ScheduledFuture<?> future;

    public EscrowAutoReleaseScheduler(EscrowService escrowService,
                                      @Qualifier("escrowTaskScheduler") TaskScheduler taskScheduler,
                                      @Value("${scheduler.escrow-auto-release.interval-ms:60000}") long intervalMs) {
        this.escrowService = escrowService;
        this.taskScheduler = taskScheduler;
        this.interval = Duration.ofMillis(intervalMs);
    }

    @Override
    public synchronized void start() {
        if (future != null) {
            return;
        }
        future = taskScheduler.scheduleWithFixedDelay(this::releaseDueEscrows, interval);
        log.info("Escrow auto-release scheduler started: interval={}", interval);
    }

    @Override
    public synchronized void stop() {
        if (future == null) {
            return;
        }
        future.cancel(false);
        future = null;
        log.info("Escrow auto-release scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return future != null;
    }

    /**
     * One sweep. Failures are logged and the next sweep runs as scheduled.
     */
    public void releaseDueEscrows() {
        log.debug("Starting scheduled job: escrow auto-release");

        try {
            int releasedCount = escrowService.processAutoReleases();

            if (releasedCount > 0) {
                log.info("Auto-released {} escrows", releasedCount);
            } else {
                log.debug("No escrows due for auto-release");
            }

        } catch (Exception e) {
            log.error("Failed to auto-release escrows: {}", e.getMessage(), e);
        }
    }
}
