package dev.mtrx.newsroom.exception;

import lombok.Getter;

/**
 * Base type for all errors surfaced by the pipeline.
 * Callers switch on {@link #getKind()} and show {@link #getMessage()} as the human-readable detail.
 */
@Getter
public abstract class PipelineException extends RuntimeException {

    private final ErrorKind kind;

    protected PipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
