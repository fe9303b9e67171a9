package dev.mtrx.newsroom.dto;

import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.entity.ArticleTranslation;

/**
 * Article content in a requested language. {@code translated} is false when the article
 * was already in that language and the original text is returned as-is.
 */
public record TranslatedArticle(
        Long articleId,
        String language,
        String title,
        String description,
        String content,
        String summary,
        boolean translated
) {

    public static TranslatedArticle original(Article article) {
        return new TranslatedArticle(article.getId(), article.getDetectedLanguage(), article.getTitle(),
                article.getDescription(), article.getContent(), article.getSummary(), false);
    }

    public static TranslatedArticle of(ArticleTranslation translation) {
        return new TranslatedArticle(translation.getArticleId(), translation.getLanguage(), translation.getTitle(),
                translation.getDescription(), translation.getContent(), translation.getSummary(), true);
    }
}
