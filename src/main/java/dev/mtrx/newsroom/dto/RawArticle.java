package dev.mtrx.newsroom.dto;

import java.time.LocalDateTime;

/**
 * One record as returned by the feed bridge, before validation and URL canonicalisation.
 */
public record RawArticle(
        String title,
        String author,
        String description,
        String content,
        String url,
        String imageUrl,
        LocalDateTime publishedAt
) {
}
