package dev.mtrx.newsroom.dto;

/**
 * @param translatedTitle null unless the summary was produced in a language other than the article's
 */
public record ArticleSummary(String summary, String translatedTitle) {
}
