package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.config.ResilienceConfig;
import dev.mtrx.newsroom.dto.BatchResult;
import dev.mtrx.newsroom.dto.LanguageClassification;
import dev.mtrx.newsroom.dto.PollingCycleReport;
import dev.mtrx.newsroom.dto.PollingCycleReport.FeedReport;
import dev.mtrx.newsroom.dto.RawArticle;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.entity.Feed;
import dev.mtrx.newsroom.exception.DatabaseException;
import dev.mtrx.newsroom.metrics.PipelineMetrics;
import dev.mtrx.newsroom.repository.ArticleRepository;
import dev.mtrx.newsroom.repository.FeedRepository;
import dev.mtrx.newsroom.util.UrlCanonicalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * One polling cycle over all active feeds.
 * <p>
 * Per feed: fetch (own timeout) -> validate and canonicalise -> deduplicate -> classify language ->
 * persist -> summarise. A feed that cannot be fetched is reported and contributes no articles;
 * other feeds are unaffected. Summaries are best-effort and articles flagged for manual language
 * review are stored without one.
 */
@Service
@Slf4j
public class PollingCycleService {

    static final int MAX_TITLE_LENGTH = 500;

    private final FeedRepository feedRepository;
    private final ArticleRepository articleRepository;
    private final FeedFetcher feedFetcher;
    private final ArticleDeduplicationService deduplicationService;
    private final LanguageClassifier languageClassifier;
    private final EnrichmentService enrichmentService;
    private final IdService idService;
    private final PipelineMetrics pipelineMetrics;
    private final Duration feedTimeout;
    private final int feedConcurrency;
    private final int backfillLimit;

    public PollingCycleService(
            FeedRepository feedRepository,
            ArticleRepository articleRepository,
            FeedFetcher feedFetcher,
            ArticleDeduplicationService deduplicationService,
            LanguageClassifier languageClassifier,
            EnrichmentService enrichmentService,
            IdService idService,
            PipelineMetrics pipelineMetrics,
            ResilienceConfig resilienceConfig,
            @Value("${pipeline.polling.feed-concurrency:4}") int feedConcurrency,
            @Value("${pipeline.polling.backfill-limit:20}") int backfillLimit) {
        this.feedRepository = feedRepository;
        this.articleRepository = articleRepository;
        this.feedFetcher = feedFetcher;
        this.deduplicationService = deduplicationService;
        this.languageClassifier = languageClassifier;
        this.enrichmentService = enrichmentService;
        this.idService = idService;
        this.pipelineMetrics = pipelineMetrics;
        this.feedTimeout = resilienceConfig.getFeedTimeout();
        this.feedConcurrency = feedConcurrency;
        this.backfillLimit = backfillLimit;
    }

    public Mono<PollingCycleReport> runCycle() {
        return feedRepository.findAllActive()
                .onErrorMap(DatabaseException.wrap("feeds.findAllActive"))
                .flatMap(this::pollFeed, feedConcurrency)
                .map(PollingCycleReport::forFeed)
                .reduce(PollingCycleReport.empty(), PollingCycleReport::merge)
                .doOnSuccess(report -> log.info(
                        "Polling cycle complete: {} feed(s), {} failed, {} ingested, {} duplicate(s), {} invalid, {} enrichment failure(s)",
                        report.getFeedsPolled(), report.getFeedsFailed(), report.getArticlesIngested(),
                        report.getDuplicatesSkipped(), report.getInvalidSkipped(), report.getEnrichmentFailures()))
                .doOnError(e -> log.error("Polling cycle aborted: {}", e.getMessage()));
    }

    /**
     * Summarises stored articles that are still missing a summary, oldest first.
     */
    public Mono<BatchResult<Article>> backfillSummaries() {
        return articleRepository.findUnsummarized(backfillLimit)
                .collectList()
                .onErrorMap(DatabaseException.wrap("articles.findUnsummarized"))
                .flatMap(articles -> enrichmentService.enrichBatch(articles, null))
                .doOnSuccess(result -> {
                    if (result.processed() > 0) {
                        log.info("Summary backfill: {} summarised, {} failed", result.successes().size(), result.failed());
                    }
                });
    }

    /**
     * Only fetch failures and timeouts are reported per feed. Store failures while ingesting
     * propagate and abort the cycle.
     */
    Mono<FeedReport> pollFeed(Feed feed) {
        return Flux.defer(() -> feedFetcher.fetchRaw(feed))
                .collectList()
                .timeout(feedTimeout)
                .map(raws -> Mono.defer(() -> ingest(feed, raws)))
                .onErrorResume(error -> Mono.just(fetchFailed(feed, error)))
                .flatMap(Function.identity());
    }

    private Mono<FeedReport> fetchFailed(Feed feed, Throwable error) {
        String detail = error instanceof TimeoutException
                ? "fetch timed out after " + feedTimeout.toSeconds() + "s"
                : error.getMessage();
        log.warn("Feed {} ({}) failed: {}", feed.getId(), feed.getName(), detail);
        pipelineMetrics.recordFeedFailure();
        return Mono.just(FeedReport.failed(feed.getId(), detail));
    }

    private Mono<FeedReport> ingest(Feed feed, List<RawArticle> raws) {
        LocalDateTime now = LocalDateTime.now();
        List<Article> candidates = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        int invalid = 0;
        int inBatchDuplicates = 0;
        for (RawArticle raw : raws) {
            Optional<Article> article = toArticle(feed, raw, now);
            if (article.isEmpty()) {
                invalid++;
            } else if (!seenUrls.add(article.get().getUrl())) {
                inBatchDuplicates++;
            } else {
                candidates.add(article.get());
            }
        }
        int invalidCount = invalid;
        int batchDuplicates = inBatchDuplicates;
        if (invalidCount > 0) {
            log.debug("Feed {}: skipped {} invalid record(s)", feed.getId(), invalidCount);
        }

        return deduplicationService.filterNew(candidates)
                .flatMap(fresh -> Flux.fromIterable(fresh)
                        .map(article -> classify(article, feed))
                        .concatMap(this::insert)
                        .collectList()
                        .flatMap(saved -> {
                            int storeDuplicates = fresh.size() - saved.size();
                            int duplicates = batchDuplicates + (candidates.size() - fresh.size()) + storeDuplicates;
                            return summarise(saved)
                                    .flatMap(enrichmentFailures -> markFetched(feed, now)
                                            .thenReturn(new FeedReport(feed.getId(), saved.size(), duplicates,
                                                    invalidCount, enrichmentFailures, null)));
                        }))
                .doOnSuccess(report -> {
                    pipelineMetrics.recordIngested(report.ingested());
                    pipelineMetrics.recordDuplicates(report.duplicates());
                    pipelineMetrics.recordInvalid(report.invalid());
                    log.info("Feed {} ({}): {} new, {} duplicate(s), {} invalid", feed.getId(), feed.getName(),
                            report.ingested(), report.duplicates(), report.invalid());
                });
    }

    Optional<Article> toArticle(Feed feed, RawArticle raw, LocalDateTime now) {
        if (raw == null || raw.title() == null || raw.title().isBlank()) {
            return Optional.empty();
        }
        return UrlCanonicalizer.canonicalize(raw.url())
                .map(url -> Article.builder()
                        .feedId(feed.getId())
                        .title(truncate(raw.title().trim()))
                        .author(raw.author())
                        .description(raw.description())
                        .content(raw.content())
                        .url(url)
                        .imageUrl(raw.imageUrl())
                        .publishedAt(raw.publishedAt() != null ? raw.publishedAt() : now)
                        .build());
    }

    private Article classify(Article article, Feed feed) {
        LanguageClassification classification = languageClassifier.classify(article, feed.getLanguage());
        if (classification.needsManualReview()) {
            log.debug("Article {} flagged for language review (detected={}, confidence={}, feed={})",
                    article.getUrl(), classification.language(), classification.confidence(), feed.getLanguage());
        }
        LocalDateTime now = LocalDateTime.now();
        return article.toBuilder()
                .id(idService.nextId())
                .detectedLanguage(classification.language())
                .languageConfidence(classification.confidence())
                .needsManualLanguageReview(classification.needsManualReview())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Empty when another writer stored the same URL since the duplicate check.
     */
    private Mono<Article> insert(Article article) {
        return articleRepository.save(article)
                .onErrorResume(DuplicateKeyException.class, e -> {
                    log.debug("Article {} was stored concurrently, counting as duplicate", article.getUrl());
                    return Mono.empty();
                })
                .onErrorMap(DatabaseException.wrap("articles.insert"));
    }

    private Mono<Integer> summarise(List<Article> saved) {
        List<Article> eligible = saved.stream().filter(a -> !a.isNeedsManualLanguageReview()).toList();
        if (eligible.isEmpty()) {
            return Mono.just(0);
        }
        return enrichmentService.enrichBatch(eligible, null)
                .map(BatchResult::failed)
                .onErrorResume(e -> !(e instanceof DatabaseException), e -> {
                    log.warn("Summarising {} article(s) failed: {}", eligible.size(), e.getMessage());
                    return Mono.just(eligible.size());
                });
    }

    private Mono<Void> markFetched(Feed feed, LocalDateTime fetchedAt) {
        return feedRepository.markFetched(feed.getId(), fetchedAt)
                .doOnError(e -> log.warn("Could not update last fetch time of feed {}: {}", feed.getId(), e.getMessage()))
                .onErrorResume(e -> Mono.just(0))
                .then();
    }

    private static String truncate(String title) {
        return title.length() > MAX_TITLE_LENGTH ? title.substring(0, MAX_TITLE_LENGTH) : title;
    }
}
