package dev.mtrx.newsroom.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mtrx.newsroom.config.ResilienceConfig;
import dev.mtrx.newsroom.dto.Completion;
import dev.mtrx.newsroom.dto.CompletionOptions;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@link LanguageModelClient} backed by an Ollama server ({@code POST /api/generate}, non-streaming).
 */
@Service
@Slf4j
public class OllamaLanguageModelClient implements LanguageModelClient {

    private final WebClient webClient;
    private final String model;
    private final double defaultTemperature;
    private final int defaultMaxTokens;
    private final Duration timeout;
    private final CircuitBreaker circuitBreaker;

    public OllamaLanguageModelClient(
            WebClient.Builder webClientBuilder,
            ResilienceConfig resilienceConfig,
            @Value("${llm.base-url:http://localhost:11434}") String baseUrl,
            @Value("${llm.model:llama3.1}") String model,
            @Value("${llm.temperature:0.3}") double temperature,
            @Value("${llm.max-tokens:1024}") int maxTokens) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.model = model;
        this.defaultTemperature = temperature;
        this.defaultMaxTokens = maxTokens;
        this.timeout = resilienceConfig.getLlmTimeout();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .build();
        this.circuitBreaker = CircuitBreaker.of("ollama-generate", cbConfig);
        log.info("Ollama client initialised (baseUrl={}, model={}, timeout={}s)", baseUrl, model, timeout.toSeconds());
    }

    @Override
    public Mono<Completion> complete(String prompt, CompletionOptions options) {
        CompletionOptions effective = options != null ? options : CompletionOptions.defaults();
        GenerateRequest request = new GenerateRequest();
        request.setModel(model);
        request.setPrompt(prompt);
        request.setStream(false);
        request.setOptions(new GenerateOptions(
                effective.temperature() != null ? effective.temperature() : defaultTemperature,
                effective.maxTokens() != null ? effective.maxTokens() : defaultMaxTokens));

        log.debug("Ollama request: model={}, prompt={} chars", model, prompt.length());

        return webClient.post()
                .uri("/api/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GenerateResponse.class)
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .flatMap(response -> {
                    String text = response.getResponse() != null ? response.getResponse().trim() : "";
                    if (text.isEmpty()) {
                        return Mono.error(new IllegalStateException("Ollama returned an empty completion"));
                    }
                    return Mono.just(new Completion(text, response.getModel() != null ? response.getModel() : model));
                })
                .doOnError(e -> log.warn("Ollama completion failed: {}", e.getMessage()));
    }

    @Data
    static class GenerateRequest {
        private String model;
        private String prompt;
        private boolean stream;
        private GenerateOptions options;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class GenerateOptions {
        private final double temperature;
        @JsonProperty("num_predict")
        private final int numPredict;
    }

    @Data
    static class GenerateResponse {
        private String model;
        private String response;
        private boolean done;
    }
}
