package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.config.ResilienceConfig;
import dev.mtrx.newsroom.dto.DuplicationStats;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.exception.DatabaseException;
import dev.mtrx.newsroom.exception.ValidationException;
import dev.mtrx.newsroom.repository.ArticleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Suppresses articles whose canonical URL is already stored. Read-only: nothing is written.
 * <p>
 * Lookups for a batch run concurrently (bounded by {@code pipeline.dedup.concurrency}) and the
 * result keeps the input order. A single failed lookup fails the whole batch; a partially
 * filtered list is never returned.
 */
@Service
@Slf4j
public class ArticleDeduplicationService {

    private final ArticleRepository articleRepository;
    private final ResilienceConfig resilienceConfig;
    private final int concurrency;

    public ArticleDeduplicationService(ArticleRepository articleRepository,
                                       ResilienceConfig resilienceConfig,
                                       @Value("${pipeline.dedup.concurrency:8}") int concurrency) {
        this.articleRepository = articleRepository;
        this.resilienceConfig = resilienceConfig;
        this.concurrency = concurrency;
    }

    public Mono<List<Article>> filterNew(List<Article> articles) {
        try {
            validate(articles);
        } catch (ValidationException e) {
            return Mono.error(e);
        }
        if (articles.isEmpty()) {
            return Mono.just(List.of());
        }
        return lookup(articles)
                .filter(checked -> !checked.duplicate())
                .map(Checked::article)
                .collectList()
                .doOnSuccess(kept -> log.debug("Dedup kept {} of {} articles", kept.size(), articles.size()));
    }

    public Mono<Boolean> isDuplicate(Article article) {
        if (article == null) {
            return Mono.error(new ValidationException("Article is required"));
        }
        if (isBlank(article.getUrl())) {
            return Mono.error(new ValidationException("Article URL is required for duplicate check"));
        }
        return exists(article.getUrl())
                .onErrorMap(DatabaseException.wrap("articles.existsByUrl"));
    }

    public Mono<DuplicationStats> stats(List<Article> articles) {
        try {
            validate(articles);
        } catch (ValidationException e) {
            return Mono.error(e);
        }
        if (articles.isEmpty()) {
            return Mono.just(new DuplicationStats(0, 0, 0));
        }
        return lookup(articles)
                .filter(Checked::duplicate)
                .count()
                .map(duplicates -> new DuplicationStats(articles.size(), duplicates.intValue(),
                        articles.size() - duplicates.intValue()));
    }

    private Flux<Checked> lookup(List<Article> articles) {
        return Flux.fromIterable(articles)
                .flatMapSequential(article -> exists(article.getUrl())
                        .map(found -> new Checked(article, found)), concurrency)
                .onErrorMap(DatabaseException.wrap("articles.existsByUrl"));
    }

    private Mono<Boolean> exists(String url) {
        return Mono.defer(() -> articleRepository.existsByUrl(url))
                .timeout(resilienceConfig.getDatabaseTimeout())
                .retryWhen(resilienceConfig.databaseReadRetry())
                .defaultIfEmpty(false);
    }

    private static void validate(List<Article> articles) {
        if (articles == null) {
            throw new ValidationException("Article list is required");
        }
        for (int i = 0; i < articles.size(); i++) {
            Article article = articles.get(i);
            if (article == null) {
                throw new ValidationException("Article at index " + i + " is null");
            }
            if (isBlank(article.getUrl())) {
                throw new ValidationException("Article at index " + i + " has no URL");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Checked(Article article, boolean duplicate) {
    }
}
