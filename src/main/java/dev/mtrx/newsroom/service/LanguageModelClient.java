package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.Completion;
import dev.mtrx.newsroom.dto.CompletionOptions;
import reactor.core.publisher.Mono;

/**
 * Text generation backend used for summaries and translations.
 * Implementations signal failures as errors and never emit an empty completion as success.
 */
public interface LanguageModelClient {

    Mono<Completion> complete(String prompt, CompletionOptions options);
}
