package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.ArticleSummary;
import dev.mtrx.newsroom.dto.BatchFailure;
import dev.mtrx.newsroom.dto.BatchResult;
import dev.mtrx.newsroom.dto.Completion;
import dev.mtrx.newsroom.dto.CompletionOptions;
import dev.mtrx.newsroom.dto.TranslatedArticle;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.entity.ArticleTranslation;
import dev.mtrx.newsroom.exception.DatabaseException;
import dev.mtrx.newsroom.exception.EnrichmentException;
import dev.mtrx.newsroom.exception.PipelineException;
import dev.mtrx.newsroom.exception.ResourceNotFoundException;
import dev.mtrx.newsroom.exception.ValidationException;
import dev.mtrx.newsroom.metrics.PipelineMetrics;
import dev.mtrx.newsroom.repository.ArticleRepository;
import dev.mtrx.newsroom.repository.ArticleTranslationRepository;
import dev.mtrx.newsroom.util.LanguageNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * AI summaries and translations for articles.
 * <p>
 * Summaries are written onto the article itself. Translations are stored as separate
 * {@link ArticleTranslation} variants; the original article is never overwritten.
 * Every language-model failure surfaces as {@link EnrichmentException}.
 * </p>
 */
@Service
@Slf4j
public class EnrichmentService {

    private final LanguageModelClient languageModelClient;
    private final ArticleRepository articleRepository;
    private final ArticleTranslationRepository articleTranslationRepository;
    private final PipelineMetrics pipelineMetrics;
    private final int concurrency;
    private final int summaryMaxLength;

    public EnrichmentService(
            LanguageModelClient languageModelClient,
            ArticleRepository articleRepository,
            ArticleTranslationRepository articleTranslationRepository,
            PipelineMetrics pipelineMetrics,
            @Value("${pipeline.enrichment.concurrency:4}") int concurrency,
            @Value("${pipeline.enrichment.summary-max-length:600}") int summaryMaxLength) {
        this.languageModelClient = languageModelClient;
        this.articleRepository = articleRepository;
        this.articleTranslationRepository = articleTranslationRepository;
        this.pipelineMetrics = pipelineMetrics;
        this.concurrency = concurrency;
        this.summaryMaxLength = summaryMaxLength;
    }

    /**
     * Summary of the article in {@code language}. When that differs from the article's own
     * language the title is translated as well.
     */
    public Mono<ArticleSummary> summarize(Article article, String language) {
        if (article == null) {
            return Mono.error(new ValidationException("Article is required"));
        }
        String target;
        try {
            target = requireLanguage(language);
        } catch (ValidationException e) {
            return Mono.error(e);
        }

        String prompt = PromptBuilder.buildSummaryPrompt(article, target, summaryMaxLength);
        CompletionOptions options = new CompletionOptions(null, Math.max(64, summaryMaxLength / 2));

        Mono<String> summary = generate(article.getId(), prompt, options, "summary");
        Mono<String> title = target.equals(article.getDetectedLanguage()) || isBlank(article.getTitle())
                ? Mono.just("")
                : translateText(article.getId(), article.getTitle(), article.getDetectedLanguage(), target);

        return Mono.zip(summary, title)
                .map(tuple -> new ArticleSummary(tuple.getT1(), tuple.getT2().isEmpty() ? null : tuple.getT2()))
                .doOnSuccess(result -> log.debug("Summarised article {} in {}", article.getId(), target));
    }

    /**
     * Content of the article in {@code targetLanguage}. Already in that language: the original
     * content is returned and nothing is stored. Otherwise the translated variant is persisted.
     */
    public Mono<TranslatedArticle> translate(Article article, String targetLanguage) {
        if (article == null) {
            return Mono.error(new ValidationException("Article is required"));
        }
        String target;
        try {
            target = requireLanguage(targetLanguage);
        } catch (ValidationException e) {
            return Mono.error(e);
        }

        if (target.equals(article.getDetectedLanguage())) {
            log.info("Article {} is already in {}, returning original content", article.getId(), target);
            return Mono.just(TranslatedArticle.original(article));
        }

        String source = article.getDetectedLanguage();
        Long articleId = article.getId();
        log.info("Translating article {} from {} to {}", articleId, source, target);

        return Mono.zip(
                        translateText(articleId, article.getTitle(), source, target),
                        translateText(articleId, article.getDescription(), source, target),
                        translateText(articleId, article.getContent(), source, target),
                        translateText(articleId, article.getSummary(), source, target))
                .map(tuple -> ArticleTranslation.builder()
                        .articleId(articleId)
                        .language(target)
                        .title(tuple.getT1())
                        .description(tuple.getT2())
                        .content(tuple.getT3())
                        .summary(tuple.getT4())
                        .translatedAt(LocalDateTime.now())
                        .build())
                .flatMap(translation -> articleTranslationRepository.upsert(translation)
                        .onErrorMap(DatabaseException.wrap("article_translations.upsert")))
                .map(TranslatedArticle::of)
                .doOnSuccess(t -> log.info("Article {} translated to {}", articleId, target));
    }

    /**
     * Summarises and persists every article. Failures are isolated per article and reported
     * in the result; the batch always completes. Output order follows input order.
     *
     * @param language summary language, or null to summarise each article in its own language
     */
    public Mono<BatchResult<Article>> enrichBatch(List<Article> articles, String language) {
        if (articles == null || articles.isEmpty()) {
            return Mono.just(BatchResult.empty());
        }
        return Flux.fromIterable(articles)
                .flatMapSequential(article -> enrichOne(article, language), concurrency)
                .collectList()
                .map(outcomes -> {
                    List<Article> successes = new ArrayList<>();
                    List<BatchFailure> failures = new ArrayList<>();
                    for (EnrichOutcome outcome : outcomes) {
                        if (outcome.failure() != null) {
                            failures.add(outcome.failure());
                        } else {
                            successes.add(outcome.article());
                        }
                    }
                    pipelineMetrics.recordEnrichment(successes.size(), failures.size());
                    if (!failures.isEmpty()) {
                        log.warn("Enrichment batch finished with {} failure(s) out of {}: {}",
                                failures.size(), outcomes.size(), failures.stream().map(BatchFailure::itemId).toList());
                    }
                    return new BatchResult<>(successes, failures);
                });
    }

    /**
     * Regenerates the summary and returns an updated copy. Nothing is written.
     */
    public Mono<Article> reprocess(Long articleId, String language) {
        return articleRepository.findById(articleId)
                .onErrorMap(DatabaseException.wrap("articles.findById"))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Article", "id", articleId)))
                .flatMap(article -> summarize(article, language != null ? language : languageOf(article))
                        .map(summary -> article.toBuilder()
                                .summary(summary.summary())
                                .updatedAt(LocalDateTime.now())
                                .build()));
    }

    public Mono<Article> saveReprocessed(Article article) {
        if (article == null || article.getId() == null || !article.isEnriched()) {
            return Mono.error(new ValidationException("Reprocessed article must have an id and a summary"));
        }
        LocalDateTime now = LocalDateTime.now();
        return articleRepository.updateSummary(article.getId(), article.getSummary(), now)
                .onErrorMap(DatabaseException.wrap("articles.updateSummary"))
                .flatMap(updated -> updated == 0
                        ? Mono.<Article>error(new ResourceNotFoundException("Article", "id", article.getId()))
                        : Mono.just(article.toBuilder().updatedAt(now).build()));
    }

    private Mono<EnrichOutcome> enrichOne(Article article, String language) {
        String target = language != null ? language : languageOf(article);
        LocalDateTime now = LocalDateTime.now();
        return summarize(article, target)
                .flatMap(summary -> articleRepository.updateSummary(article.getId(), summary.summary(), now)
                        .onErrorMap(DatabaseException.wrap("articles.updateSummary"))
                        .thenReturn(article.toBuilder().summary(summary.summary()).updatedAt(now).build()))
                .map(EnrichOutcome::success)
                .onErrorResume(error -> {
                    log.warn("Enrichment failed for article {}: {}", article.getId(), error.getMessage());
                    return Mono.just(EnrichOutcome.failed(BatchFailure.of(article.getId(), error)));
                });
    }

    private Mono<String> translateText(Long articleId, String text, String source, String target) {
        if (isBlank(text)) {
            return Mono.just("");
        }
        return generate(articleId, PromptBuilder.buildTranslationPrompt(text, source, target),
                CompletionOptions.defaults(), "translation");
    }

    private Mono<String> generate(Long articleId, String prompt, CompletionOptions options, String purpose) {
        return languageModelClient.complete(prompt, options)
                .map(Completion::text)
                .filter(text -> !isBlank(text))
                .switchIfEmpty(Mono.error(new EnrichmentException(articleId,
                        "Language model returned no " + purpose + " for article " + articleId)))
                .onErrorMap(e -> !(e instanceof PipelineException),
                        e -> new EnrichmentException(articleId,
                                "Language model " + purpose + " failed for article " + articleId + ": " + e.getMessage(), e));
    }

    private static String languageOf(Article article) {
        return article.getDetectedLanguage() != null ? article.getDetectedLanguage() : LanguageNames.ENGLISH;
    }

    private static String requireLanguage(String language) {
        return LanguageNames.normalize(language)
                .orElseThrow(() -> new ValidationException("Unsupported language: " + language));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record EnrichOutcome(Article article, BatchFailure failure) {

        static EnrichOutcome success(Article article) {
            return new EnrichOutcome(article, null);
        }

        static EnrichOutcome failed(BatchFailure failure) {
            return new EnrichOutcome(null, failure);
        }
    }
}
