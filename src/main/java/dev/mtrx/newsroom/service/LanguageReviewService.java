package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.PageResponse;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.exception.DatabaseException;
import dev.mtrx.newsroom.exception.ResourceNotFoundException;
import dev.mtrx.newsroom.exception.ValidationException;
import dev.mtrx.newsroom.repository.ArticleRepository;
import dev.mtrx.newsroom.util.LanguageNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Editor queue for articles whose language could not be detected with confidence.
 * <p>
 * Flagged articles are neither summarised, assigned to an issue nor translated on their own.
 * Confirming a language clears the flag; the summary backfill then picks the article up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LanguageReviewService {

    static final int MAX_PAGE_SIZE = 100;

    private final ArticleRepository articleRepository;

    /**
     * Articles awaiting review, newest first.
     */
    public Mono<PageResponse<Article>> listPending(int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            return Mono.error(new ValidationException(
                    "Page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE));
        }
        return Mono.zip(
                        articleRepository.findNeedingLanguageReview(size, (long) page * size).collectList(),
                        articleRepository.countNeedingLanguageReview())
                .map(tuple -> PageResponse.of(tuple.getT1(), page, size, tuple.getT2()))
                .onErrorMap(DatabaseException.wrap("articles.findNeedingLanguageReview"));
    }

    public Mono<Article> confirmLanguage(Long articleId, String language) {
        if (articleId == null) {
            return Mono.error(new ValidationException("Article id is required"));
        }
        String confirmed = LanguageNames.normalize(language).orElse(null);
        if (confirmed == null) {
            return Mono.error(new ValidationException("Unsupported language: " + language));
        }
        LocalDateTime now = LocalDateTime.now();
        return articleRepository.confirmLanguage(articleId, confirmed, now)
                .onErrorMap(DatabaseException.wrap("articles.confirmLanguage"))
                .flatMap(updated -> updated == 0
                        ? Mono.<Article>error(new ResourceNotFoundException("Article", "id", articleId))
                        : articleRepository.findById(articleId)
                                .onErrorMap(DatabaseException.wrap("articles.findById")))
                .doOnSuccess(article -> log.info("Article {} language confirmed as {}", articleId, confirmed));
    }
}
