package dev.mtrx.newsroom.dto;

import java.util.List;

/**
 * JSON payload stored on a SUCCEEDED job.
 */
public record TranslationJobResult(String targetLanguage, List<Long> translatedArticleIds,
                                   List<Long> unchangedArticleIds) {
}
