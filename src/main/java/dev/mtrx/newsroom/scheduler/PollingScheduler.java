package dev.mtrx.newsroom.scheduler;

import dev.mtrx.newsroom.service.PollingCycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Triggers polling cycles and the summary backfill.
 * A tick that arrives while the previous run is still going is skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PollingScheduler {

    private final PollingCycleService pollingCycleService;

    private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
    private final AtomicBoolean backfillRunning = new AtomicBoolean(false);

    @Scheduled(fixedRateString = "${pipeline.polling.rate-ms:900000}", initialDelayString = "${pipeline.polling.initial-delay-ms:30000}")
    public void pollFeeds() {
        if (!cycleRunning.compareAndSet(false, true)) {
            log.debug("Skipping polling cycle: previous cycle still running");
            return;
        }
        pollingCycleService.runCycle()
                .doFinally(signal -> cycleRunning.set(false))
                .subscribe(
                        report -> log.debug("Polling cycle report: {}", report),
                        error -> log.error("Polling cycle failed: {}", error.getMessage())
                );
    }

    @Scheduled(fixedRateString = "${pipeline.polling.backfill-rate-ms:300000}", initialDelayString = "${pipeline.polling.backfill-initial-delay-ms:120000}")
    public void backfillSummaries() {
        if (!backfillRunning.compareAndSet(false, true)) {
            log.debug("Skipping summary backfill: previous run still going");
            return;
        }
        pollingCycleService.backfillSummaries()
                .doFinally(signal -> backfillRunning.set(false))
                .subscribe(
                        result -> { },
                        error -> log.error("Summary backfill failed: {}", error.getMessage())
                );
    }

    boolean isCycleRunning() {
        return cycleRunning.get();
    }
}
