package dev.mtrx.newsroom.dto;

import dev.mtrx.newsroom.exception.ErrorKind;
import dev.mtrx.newsroom.exception.PipelineException;

/**
 * One item that failed inside a batch operation. The batch itself carried on.
 */
public record BatchFailure(Long itemId, ErrorKind kind, String detail) {

    public static BatchFailure of(Long itemId, Throwable error) {
        ErrorKind kind = error instanceof PipelineException pe ? pe.getKind() : ErrorKind.ENRICHMENT;
        return new BatchFailure(itemId, kind, error.getMessage());
    }
}
