package dev.mtrx.newsroom.dto;

import dev.mtrx.newsroom.entity.JobScopeType;
import dev.mtrx.newsroom.entity.JobStatus;

/**
 * Optional filters for listing jobs; null means "any".
 */
public record TranslationJobFilter(JobStatus status, JobScopeType scopeType, String targetLanguage) {

    public static TranslationJobFilter any() {
        return new TranslationJobFilter(null, null, null);
    }
}
