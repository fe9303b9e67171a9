package dev.mtrx.newsroom.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mtrx.newsroom.dto.TranslatedArticle;
import dev.mtrx.newsroom.dto.TranslationJobResult;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.entity.JobScopeType;
import dev.mtrx.newsroom.entity.JobStatus;
import dev.mtrx.newsroom.entity.TranslationJob;
import dev.mtrx.newsroom.exception.DatabaseException;
import dev.mtrx.newsroom.metrics.PipelineMetrics;
import dev.mtrx.newsroom.repository.ArticleRepository;
import dev.mtrx.newsroom.repository.SectionAssignmentRepository;
import dev.mtrx.newsroom.repository.TranslationJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Executes translation jobs.
 * <p>
 * A worker claims the oldest PENDING job, holds it under a lease while every article in the job's scope
 * is translated, then records SUCCEEDED with a JSON payload or FAILED with the error detail.
 * Completion updates are fenced on the claiming attempt: a job that was cancelled, or whose
 * lease expired and was handed to another worker, is left alone.
 */
@Service
@Slf4j
public class TranslationJobWorker {

    private static final int MAX_ERROR_DETAIL = 2000;

    private final TranslationJobRepository translationJobRepository;
    private final SectionAssignmentRepository sectionAssignmentRepository;
    private final ArticleRepository articleRepository;
    private final EnrichmentService enrichmentService;
    private final PipelineMetrics pipelineMetrics;
    private final ObjectMapper objectMapper;
    private final Duration leaseDuration;
    private final Duration jobTimeout;
    private final int maxAttempts;
    private final int concurrency;

    public TranslationJobWorker(
            TranslationJobRepository translationJobRepository,
            SectionAssignmentRepository sectionAssignmentRepository,
            ArticleRepository articleRepository,
            EnrichmentService enrichmentService,
            PipelineMetrics pipelineMetrics,
            ObjectMapper objectMapper,
            @Value("${pipeline.jobs.lease-seconds:600}") long leaseSeconds,
            @Value("${pipeline.jobs.timeout-seconds:540}") long timeoutSeconds,
            @Value("${pipeline.jobs.max-attempts:3}") int maxAttempts,
            @Value("${pipeline.jobs.article-concurrency:2}") int concurrency) {
        this.translationJobRepository = translationJobRepository;
        this.sectionAssignmentRepository = sectionAssignmentRepository;
        this.articleRepository = articleRepository;
        this.enrichmentService = enrichmentService;
        this.pipelineMetrics = pipelineMetrics;
        this.objectMapper = objectMapper;
        this.leaseDuration = Duration.ofSeconds(leaseSeconds);
        this.jobTimeout = Duration.ofSeconds(timeoutSeconds);
        this.maxAttempts = maxAttempts;
        this.concurrency = concurrency;
    }

    /**
     * Claims and runs the next PENDING job. Empty when the queue is empty.
     * Emits the job in the state this worker recorded.
     */
    public Mono<TranslationJob> processNext() {
        LocalDateTime now = LocalDateTime.now();
        return translationJobRepository.claimNextPending(now, now.plus(leaseDuration))
                .onErrorMap(DatabaseException.wrap("translation_jobs.claimNextPending"))
                .flatMap(this::run);
    }

    /**
     * Runs up to {@code maxJobs} jobs one after another, stopping early when the queue drains.
     */
    public Mono<Integer> processAvailable(int maxJobs) {
        return Flux.range(0, maxJobs)
                .concatMap(i -> processNext().map(Optional::of).defaultIfEmpty(Optional.empty()))
                .takeWhile(Optional::isPresent)
                .count()
                .map(Long::intValue);
    }

    /**
     * RUNNING jobs with an expired lease go back to PENDING, or to FAILED once they used up
     * their attempts. Returns the number of jobs touched.
     */
    public Mono<Integer> reapExpiredLeases() {
        LocalDateTime now = LocalDateTime.now();
        return translationJobRepository.failExpiredExhausted(now, maxAttempts)
                .zipWith(translationJobRepository.requeueExpired(now, maxAttempts))
                .doOnNext(tuple -> {
                    if (tuple.getT1() + tuple.getT2() > 0) {
                        log.warn("Lease reaper: {} job(s) failed after {} attempts, {} job(s) requeued",
                                tuple.getT1(), maxAttempts, tuple.getT2());
                    }
                })
                .map(tuple -> tuple.getT1() + tuple.getT2())
                .onErrorMap(DatabaseException.wrap("translation_jobs.reap"));
    }

    Mono<TranslationJob> run(TranslationJob job) {
        log.info("Running translation job {} ({} -> {}, attempt {})",
                job.getId(), job.scopeRef(), job.getTargetLanguage(), job.getAttempts());

        return loadScope(job)
                .flatMap(articles -> translateAll(job, articles))
                .timeout(jobTimeout)
                .flatMap(result -> succeed(job, result))
                .onErrorResume(error -> fail(job, describe(error)));
    }

    private Mono<List<Article>> loadScope(TranslationJob job) {
        if (JobScopeType.ARTICLE.matches(job.getScopeType())) {
            return articleRepository.findById(job.getScopeId())
                    .onErrorMap(DatabaseException.wrap("articles.findById"))
                    .map(List::of)
                    .switchIfEmpty(Mono.error(new IllegalStateException(
                            "Article " + job.getScopeId() + " no longer exists")));
        }
        return sectionAssignmentRepository.findArticleIdsByIssueId(job.getScopeId())
                .collect(Collectors.toCollection(LinkedHashSet::new))
                .flatMap(ids -> ids.isEmpty()
                        ? Mono.just(List.<Article>of())
                        : articleRepository.findByIdIn(ids).collectList()
                                .flatMap(found -> orderAndCheck(ids, found)))
                .onErrorMap(e -> !(e instanceof IllegalStateException), DatabaseException.wrap("issue.articles"));
    }

    private static Mono<List<Article>> orderAndCheck(Set<Long> ids, List<Article> found) {
        Map<Long, Article> byId = found.stream().collect(Collectors.toMap(Article::getId, Function.identity()));
        List<Long> missing = ids.stream().filter(id -> !byId.containsKey(id)).toList();
        if (!missing.isEmpty()) {
            return Mono.error(new IllegalStateException("Assigned articles no longer exist: " + missing));
        }
        return Mono.just(ids.stream().map(byId::get).toList());
    }

    private Mono<TranslationJobResult> translateAll(TranslationJob job, List<Article> articles) {
        String target = job.getTargetLanguage();
        return Flux.fromIterable(articles)
                .flatMapSequential(article -> enrichmentService.translate(article, target)
                        .map(ArticleOutcome::done)
                        .onErrorResume(e -> {
                            log.warn("Job {}: translation of article {} failed: {}", job.getId(), article.getId(), e.getMessage());
                            return Mono.just(ArticleOutcome.failure(article.getId(), describe(e)));
                        }), concurrency)
                .collectList()
                .flatMap(outcomes -> {
                    List<ArticleOutcome> failures = outcomes.stream().filter(ArticleOutcome::failed).toList();
                    if (!failures.isEmpty()) {
                        List<Long> failedIds = failures.stream().map(ArticleOutcome::articleId).toList();
                        return Mono.error(new IllegalStateException("Translation failed for articles " + failedIds
                                + ": " + failures.get(0).error()));
                    }
                    List<Long> translated = new ArrayList<>();
                    List<Long> unchanged = new ArrayList<>();
                    for (ArticleOutcome outcome : outcomes) {
                        (outcome.translated() ? translated : unchanged).add(outcome.articleId());
                    }
                    return Mono.just(new TranslationJobResult(target, translated, unchanged));
                });
    }

    private Mono<TranslationJob> succeed(TranslationJob job, TranslationJobResult result) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return fail(job, "Could not serialise job result: " + e.getMessage());
        }
        LocalDateTime now = LocalDateTime.now();
        return translationJobRepository.markSucceeded(job.getId(), job.getAttempts(), payload, now)
                .onErrorMap(DatabaseException.wrap("translation_jobs.markSucceeded"))
                .map(updated -> {
                    if (updated == 0) {
                        log.warn("Translation job {} was no longer held by this worker; result discarded", job.getId());
                        return job;
                    }
                    pipelineMetrics.recordJobOutcome(JobStatus.SUCCEEDED);
                    log.info("Translation job {} succeeded: {} translated, {} unchanged", job.getId(),
                            result.translatedArticleIds().size(), result.unchangedArticleIds().size());
                    job.setStatus(JobStatus.SUCCEEDED.name());
                    job.setResultPayload(payload);
                    job.setCompletedAt(now);
                    return job;
                });
    }

    private Mono<TranslationJob> fail(TranslationJob job, String detail) {
        String truncated = detail.length() > MAX_ERROR_DETAIL ? detail.substring(0, MAX_ERROR_DETAIL) : detail;
        LocalDateTime now = LocalDateTime.now();
        return translationJobRepository.markFailed(job.getId(), job.getAttempts(), truncated, now)
                .onErrorMap(DatabaseException.wrap("translation_jobs.markFailed"))
                .map(updated -> {
                    if (updated == 0) {
                        log.warn("Translation job {} was no longer held by this worker; failure not recorded", job.getId());
                        return job;
                    }
                    pipelineMetrics.recordJobOutcome(JobStatus.FAILED);
                    log.error("Translation job {} failed: {}", job.getId(), truncated);
                    job.setStatus(JobStatus.FAILED.name());
                    job.setErrorDetail(truncated);
                    job.setCompletedAt(now);
                    return job;
                });
    }

    private String describe(Throwable error) {
        if (error instanceof TimeoutException) {
            return "timed out after " + jobTimeout.toSeconds() + "s";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record ArticleOutcome(Long articleId, boolean translated, boolean failed, String error) {

        static ArticleOutcome done(TranslatedArticle article) {
            return new ArticleOutcome(article.articleId(), article.translated(), false, null);
        }

        static ArticleOutcome failure(Long articleId, String error) {
            return new ArticleOutcome(articleId, false, true, error);
        }
    }
}
