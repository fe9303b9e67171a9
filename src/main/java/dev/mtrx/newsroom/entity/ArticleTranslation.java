package dev.mtrx.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Language-scoped variant of an {@link Article}. Keyed by (articleId, language);
 * the original article keeps its own language tag and content.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ArticleTranslation {

    private Long articleId;
    private String language;
    private String title;
    private String description;
    private String content;
    private String summary;
    private LocalDateTime translatedAt;
}
