package dev.mtrx.newsroom.repository;

import dev.mtrx.newsroom.entity.Article;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface ArticleRepository extends ReactiveCrudRepository<Article, Long> {

    Mono<Boolean> existsByUrl(String url);

    @Query("SELECT * FROM articles WHERE id IN (:ids)")
    Flux<Article> findByIdIn(Collection<Long> ids);

    /**
     * Articles that were persisted but never summarised, oldest first.
     * Manual-review articles are left for an editor.
     */
    @Query("""
            SELECT * FROM articles
            WHERE summary IS NULL AND needs_manual_language_review = FALSE
            ORDER BY created_at ASC
            LIMIT :limit
            """)
    Flux<Article> findUnsummarized(int limit);

    @Query("SELECT COUNT(*) FROM articles WHERE needs_manual_language_review = TRUE")
    Mono<Long> countNeedingLanguageReview();

    @Query("""
            SELECT * FROM articles
            WHERE needs_manual_language_review = TRUE
            ORDER BY created_at DESC
            LIMIT :limit OFFSET :offset
            """)
    Flux<Article> findNeedingLanguageReview(int limit, long offset);

    /**
     * Records an editor's language decision and clears the review flag.
     */
    @Modifying
    @Query("""
            UPDATE articles
            SET detected_language = :language, needs_manual_language_review = FALSE, updated_at = :now
            WHERE id = :id
            """)
    Mono<Integer> confirmLanguage(Long id, String language, LocalDateTime now);

    @Modifying
    @Query("UPDATE articles SET selected = TRUE, updated_at = :now WHERE id IN (:ids)")
    Mono<Integer> markSelected(Collection<Long> ids, LocalDateTime now);

    @Modifying
    @Query("UPDATE articles SET summary = :summary, updated_at = :now WHERE id = :id")
    Mono<Integer> updateSummary(Long id, String summary, LocalDateTime now);
}
