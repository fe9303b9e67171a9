package dev.mtrx.newsroom.dto;

/**
 * Per-call generation settings. Null fields fall back to the client's configured defaults.
 */
public record CompletionOptions(Double temperature, Integer maxTokens) {

    public static CompletionOptions defaults() {
        return new CompletionOptions(null, null);
    }
}
