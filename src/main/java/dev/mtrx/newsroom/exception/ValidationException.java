package dev.mtrx.newsroom.exception;

/**
 * Malformed input rejected before any I/O. Never retried.
 */
public class ValidationException extends PipelineException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
