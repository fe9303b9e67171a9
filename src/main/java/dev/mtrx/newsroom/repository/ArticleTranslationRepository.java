package dev.mtrx.newsroom.repository;

import dev.mtrx.newsroom.entity.ArticleTranslation;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Language-scoped article variants, keyed by (article_id, language). Re-translating overwrites the variant.
 */
@Repository
public class ArticleTranslationRepository {

    private final DatabaseClient databaseClient;

    public ArticleTranslationRepository(R2dbcEntityTemplate r2dbcTemplate) {
        this.databaseClient = r2dbcTemplate.getDatabaseClient();
    }

    public Mono<ArticleTranslation> upsert(ArticleTranslation translation) {
        LocalDateTime translatedAt = translation.getTranslatedAt() != null
                ? translation.getTranslatedAt() : LocalDateTime.now();
        return databaseClient
                .sql("""
                        INSERT INTO article_translations (article_id, language, title, description, content,
                            summary, translated_at)
                        VALUES (:articleId, :language, :title, :description, :content, :summary, :translatedAt)
                        ON CONFLICT (article_id, language)
                        DO UPDATE SET title = :title, description = :description, content = :content,
                            summary = :summary, translated_at = :translatedAt
                        """)
                .bind("articleId", translation.getArticleId())
                .bind("language", translation.getLanguage())
                .bind("title", translation.getTitle() != null ? translation.getTitle() : "")
                .bind("description", translation.getDescription() != null ? translation.getDescription() : "")
                .bind("content", translation.getContent() != null ? translation.getContent() : "")
                .bind("summary", translation.getSummary() != null ? translation.getSummary() : "")
                .bind("translatedAt", translatedAt)
                .fetch()
                .rowsUpdated()
                .thenReturn(translation.toBuilder().translatedAt(translatedAt).build());
    }
}
