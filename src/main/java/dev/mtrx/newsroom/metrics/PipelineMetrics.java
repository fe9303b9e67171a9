package dev.mtrx.newsroom.metrics;

import dev.mtrx.newsroom.entity.JobStatus;
import dev.mtrx.newsroom.repository.ArticleRepository;
import dev.mtrx.newsroom.repository.TranslationJobRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicLong;

@Component
@RequiredArgsConstructor
@Slf4j
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final TranslationJobRepository translationJobRepository;
    private final ArticleRepository articleRepository;

    private final AtomicLong pendingJobs = new AtomicLong(0);
    private final AtomicLong runningJobs = new AtomicLong(0);
    private final AtomicLong articlesAwaitingReview = new AtomicLong(0);

    private Counter articlesIngestedCounter;
    private Counter duplicatesSkippedCounter;
    private Counter invalidSkippedCounter;
    private Counter feedFailuresCounter;
    private Counter enrichmentSuccessCounter;
    private Counter enrichmentFailureCounter;
    private Counter jobsSucceededCounter;
    private Counter jobsFailedCounter;
    private Counter issuesPublishedCounter;

    @PostConstruct
    public void init() {
        Gauge.builder("pipeline.jobs.pending", pendingJobs, AtomicLong::get)
                .description("Translation jobs waiting for a worker")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("pipeline.jobs.running", runningJobs, AtomicLong::get)
                .description("Translation jobs currently leased by a worker")
                .tag("status", "running")
                .register(meterRegistry);

        Gauge.builder("pipeline.articles.review", articlesAwaitingReview, AtomicLong::get)
                .description("Articles flagged for manual language review")
                .register(meterRegistry);

        articlesIngestedCounter = meterRegistry.counter("pipeline.articles.ingested");
        duplicatesSkippedCounter = meterRegistry.counter("pipeline.articles.duplicates");
        invalidSkippedCounter = meterRegistry.counter("pipeline.articles.invalid");
        feedFailuresCounter = meterRegistry.counter("pipeline.feeds.failures");
        enrichmentSuccessCounter = meterRegistry.counter("pipeline.enrichment", "outcome", "success");
        enrichmentFailureCounter = meterRegistry.counter("pipeline.enrichment", "outcome", "failure");
        jobsSucceededCounter = meterRegistry.counter("pipeline.jobs.completed", "status", "succeeded");
        jobsFailedCounter = meterRegistry.counter("pipeline.jobs.completed", "status", "failed");
        issuesPublishedCounter = meterRegistry.counter("pipeline.issues.published");
    }

    @Scheduled(fixedRateString = "${pipeline.metrics.update-ms:60000}", initialDelayString = "${pipeline.metrics.initial-delay-ms:30000}")
    public void updateGauges() {
        Mono.zip(
                translationJobRepository.countByStatus(JobStatus.PENDING.name()).onErrorReturn(0L),
                translationJobRepository.countByStatus(JobStatus.RUNNING.name()).onErrorReturn(0L),
                articleRepository.countNeedingLanguageReview().onErrorReturn(0L)
        ).subscribe(
                tuple -> {
                    pendingJobs.set(tuple.getT1());
                    runningJobs.set(tuple.getT2());
                    articlesAwaitingReview.set(tuple.getT3());
                },
                error -> log.warn("Failed to update pipeline metrics: {}", error.getMessage())
        );
    }

    public void recordIngested(int count) {
        articlesIngestedCounter.increment(count);
    }

    public void recordDuplicates(int count) {
        duplicatesSkippedCounter.increment(count);
    }

    public void recordInvalid(int count) {
        invalidSkippedCounter.increment(count);
    }

    public void recordFeedFailure() {
        feedFailuresCounter.increment();
    }

    public void recordEnrichment(int successes, int failures) {
        enrichmentSuccessCounter.increment(successes);
        enrichmentFailureCounter.increment(failures);
    }

    public void recordJobOutcome(JobStatus status) {
        if (status == JobStatus.SUCCEEDED) {
            jobsSucceededCounter.increment();
        } else if (status == JobStatus.FAILED) {
            jobsFailedCounter.increment();
        }
    }

    public void recordIssuePublished() {
        issuesPublishedCounter.increment();
    }
}
