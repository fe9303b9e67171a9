package dev.mtrx.newsroom.scheduler;

import dev.mtrx.newsroom.service.TranslationJobWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the translation job worker and the lease reaper.
 */
@Component
@Slf4j
public class TranslationJobScheduler {

    private final TranslationJobWorker worker;
    private final int batchSize;
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public TranslationJobScheduler(TranslationJobWorker worker,
                                   @Value("${pipeline.jobs.batch-size:5}") int batchSize) {
        this.worker = worker;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${pipeline.jobs.poll-ms:10000}", initialDelayString = "${pipeline.jobs.initial-delay-ms:15000}")
    public void processJobs() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        worker.processAvailable(batchSize)
                .doFinally(signal -> draining.set(false))
                .subscribe(
                        processed -> {
                            if (processed > 0) {
                                log.info("Processed {} translation job(s)", processed);
                            }
                        },
                        error -> log.error("Translation job processing failed: {}", error.getMessage())
                );
    }

    @Scheduled(fixedRateString = "${pipeline.jobs.reaper-ms:60000}", initialDelayString = "${pipeline.jobs.initial-delay-ms:15000}")
    public void reapExpiredLeases() {
        worker.reapExpiredLeases()
                .subscribe(
                        touched -> log.debug("Lease reaper touched {} job(s)", touched),
                        error -> log.error("Lease reaper failed: {}", error.getMessage())
                );
    }
}
