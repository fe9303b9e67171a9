package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.RawArticle;
import dev.mtrx.newsroom.entity.Feed;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * {@link FeedFetcher} that asks an external feed bridge to fetch and parse a feed.
 * The bridge answers {@code GET /api/items?url=<feed url>} with a JSON array of article records.
 */
@Service
@Slf4j
public class FeedBridgeClient implements FeedFetcher {

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;

    public FeedBridgeClient(WebClient.Builder webClientBuilder,
                            @Value("${feed-bridge.base-url:http://localhost:8085}") String baseUrl) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(60))
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .build();
        this.circuitBreaker = CircuitBreaker.of("feed-bridge", cbConfig);
        log.info("Feed bridge client initialised (baseUrl={})", baseUrl);
    }

    @Override
    public Flux<RawArticle> fetchRaw(Feed feed) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder.path("/api/items").queryParam("url", feed.getUrl()).build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToFlux(RawArticle.class)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .doOnError(e -> log.warn("Feed bridge fetch failed for feed {} ({}): {}",
                        feed.getId(), feed.getUrl(), e.getMessage()));
    }
}
