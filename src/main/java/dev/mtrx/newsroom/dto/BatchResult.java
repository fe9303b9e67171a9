package dev.mtrx.newsroom.dto;

import java.util.List;

/**
 * Outcome of a batch where items fail independently.
 */
public record BatchResult<T>(List<T> successes, List<BatchFailure> failures) {

    public BatchResult {
        successes = List.copyOf(successes);
        failures = List.copyOf(failures);
    }

    public static <T> BatchResult<T> empty() {
        return new BatchResult<>(List.of(), List.of());
    }

    public int processed() {
        return successes.size() + failures.size();
    }

    public int failed() {
        return failures.size();
    }

    public List<Long> failedIds() {
        return failures.stream().map(BatchFailure::itemId).toList();
    }
}
