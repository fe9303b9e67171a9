package dev.mtrx.newsroom.exception;

/**
 * Classification carried by every {@link PipelineException}.
 */
public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    DATABASE,
    ENRICHMENT,
    INVALID_STATE_TRANSITION
}
