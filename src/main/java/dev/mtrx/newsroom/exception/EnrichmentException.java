package dev.mtrx.newsroom.exception;

import lombok.Getter;

/**
 * Language-model call failed, timed out or returned an empty completion.
 * Isolated per article; never aborts a batch.
 */
@Getter
public class EnrichmentException extends PipelineException {

    private final Long articleId;

    public EnrichmentException(Long articleId, String message) {
        super(ErrorKind.ENRICHMENT, message);
        this.articleId = articleId;
    }

    public EnrichmentException(Long articleId, String message, Throwable cause) {
        super(ErrorKind.ENRICHMENT, message, cause);
        this.articleId = articleId;
    }
}
