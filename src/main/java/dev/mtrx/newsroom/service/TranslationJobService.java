package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.PageResponse;
import dev.mtrx.newsroom.dto.TranslationJobFilter;
import dev.mtrx.newsroom.entity.JobScopeType;
import dev.mtrx.newsroom.entity.JobStatus;
import dev.mtrx.newsroom.entity.TranslationJob;
import dev.mtrx.newsroom.exception.DatabaseException;
import dev.mtrx.newsroom.exception.InvalidStateTransitionException;
import dev.mtrx.newsroom.exception.ResourceNotFoundException;
import dev.mtrx.newsroom.exception.ValidationException;
import dev.mtrx.newsroom.repository.ArticleRepository;
import dev.mtrx.newsroom.repository.NewsletterIssueRepository;
import dev.mtrx.newsroom.repository.TranslationJobQueryRepository;
import dev.mtrx.newsroom.repository.TranslationJobRepository;
import dev.mtrx.newsroom.util.LanguageNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;

/**
 * Queue side of translation jobs: enqueue, inspect, cancel.
 * Execution lives in {@link TranslationJobWorker}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranslationJobService {

    static final int MAX_PAGE_SIZE = 100;
    static final String CANCELLED = "cancelled";

    private final TranslationJobRepository translationJobRepository;
    private final TranslationJobQueryRepository translationJobQueryRepository;
    private final NewsletterIssueRepository newsletterIssueRepository;
    private final ArticleRepository articleRepository;
    private final IdService idService;

    /**
     * Queues a translation of an issue or article. While a PENDING or RUNNING job exists for the
     * same scope and target language, that job is returned instead of creating a second one.
     */
    public Mono<TranslationJob> enqueue(JobScopeType scopeType, Long scopeId, String targetLanguage) {
        if (scopeType == null || scopeId == null) {
            return Mono.error(new ValidationException("Job scope type and id are required"));
        }
        String target = LanguageNames.normalize(targetLanguage).orElse(null);
        if (target == null) {
            return Mono.error(new ValidationException("Unsupported target language: " + targetLanguage));
        }

        return requireScope(scopeType, scopeId)
                .then(Mono.defer(() -> translationJobRepository.findActive(scopeType.name(), scopeId, target))
                        .onErrorMap(DatabaseException.wrap("translation_jobs.findActive")))
                .doOnNext(existing -> log.info("Translation job {} already active for {} -> {}",
                        existing.getId(), existing.scopeRef(), target))
                .switchIfEmpty(Mono.defer(() -> insert(scopeType, scopeId, target)));
    }

    public Mono<TranslationJob> getStatus(Long jobId) {
        return translationJobRepository.findById(jobId)
                .onErrorMap(DatabaseException.wrap("translation_jobs.findById"))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("TranslationJob", "id", jobId)));
    }

    public Mono<PageResponse<TranslationJob>> list(TranslationJobFilter filter, int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            return Mono.error(new ValidationException(
                    "Page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE));
        }
        TranslationJobFilter effective = filter != null ? filter : TranslationJobFilter.any();
        return Mono.zip(
                        translationJobQueryRepository.findByFilter(effective, size, page * size).collectList(),
                        translationJobQueryRepository.countByFilter(effective))
                .map(tuple -> PageResponse.of(tuple.getT1(), page, size, tuple.getT2()))
                .onErrorMap(DatabaseException.wrap("translation_jobs.list"));
    }

    /**
     * Job counts for every status, zero included.
     */
    public Mono<Map<JobStatus, Long>> stats() {
        return translationJobRepository.countGroupedByStatus()
                .collectList()
                .map(rows -> {
                    Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
                    for (JobStatus status : JobStatus.values()) {
                        counts.put(status, 0L);
                    }
                    rows.forEach(row -> counts.put(JobStatus.from(row.getStatus()), row.getCnt()));
                    return counts;
                })
                .onErrorMap(DatabaseException.wrap("translation_jobs.countGroupedByStatus"));
    }

    /**
     * PENDING or RUNNING -> FAILED with detail "cancelled". A worker still running the job
     * loses its fenced completion update.
     */
    public Mono<TranslationJob> cancel(Long jobId) {
        return getStatus(jobId)
                .flatMap(job -> {
                    if (!job.statusValue().canTransitionTo(JobStatus.FAILED)) {
                        return Mono.error(new InvalidStateTransitionException(
                                "translation job", jobId, job.getStatus(), "cancel"));
                    }
                    LocalDateTime now = LocalDateTime.now();
                    return translationJobRepository.failIfActive(jobId, CANCELLED, now)
                            .onErrorMap(DatabaseException.wrap("translation_jobs.failIfActive"))
                            .flatMap(updated -> updated > 0
                                    ? getStatus(jobId)
                                    : getStatus(jobId).flatMap(current -> Mono.<TranslationJob>error(
                                            new InvalidStateTransitionException(
                                                    "translation job", jobId, current.getStatus(), "cancel"))));
                })
                .doOnSuccess(job -> log.info("Translation job {} cancelled", jobId));
    }

    private Mono<TranslationJob> insert(JobScopeType scopeType, Long scopeId, String target) {
        LocalDateTime now = LocalDateTime.now();
        TranslationJob job = TranslationJob.builder()
                .id(idService.nextId())
                .scopeType(scopeType.name())
                .scopeId(scopeId)
                .targetLanguage(target)
                .status(JobStatus.PENDING.name())
                .attempts(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return translationJobRepository.save(job)
                .doOnSuccess(saved -> log.info("Enqueued translation job {} for {} -> {}",
                        saved.getId(), saved.scopeRef(), target))
                // Lost an insert race against another enqueue; the active-job index kept theirs
                .onErrorResume(DuplicateKeyException.class, e -> translationJobRepository
                        .findActive(scopeType.name(), scopeId, target)
                        .switchIfEmpty(Mono.error(new DatabaseException("translation_jobs.insert", e))))
                .onErrorMap(DatabaseException.wrap("translation_jobs.insert"));
    }

    /**
     * The scope must exist. A single article must also have a confirmed language.
     */
    private Mono<Void> requireScope(JobScopeType scopeType, Long scopeId) {
        if (scopeType == JobScopeType.ISSUE) {
            return newsletterIssueRepository.existsById(scopeId)
                    .onErrorMap(DatabaseException.wrap("newsletter_issues.existsById"))
                    .flatMap(exists -> exists
                            ? Mono.<Void>empty()
                            : Mono.<Void>error(new ResourceNotFoundException(scopeLabel(scopeType), "id", scopeId)));
        }
        return articleRepository.findById(scopeId)
                .onErrorMap(DatabaseException.wrap("articles.findById"))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException(scopeLabel(scopeType), "id", scopeId)))
                .flatMap(article -> article.isNeedsManualLanguageReview()
                        ? Mono.<Void>error(new ValidationException(
                                "Article " + scopeId + " is awaiting language review"))
                        : Mono.<Void>empty());
    }

    private static String scopeLabel(JobScopeType scopeType) {
        return scopeType == JobScopeType.ISSUE ? "NewsletterIssue" : "Article";
    }
}
