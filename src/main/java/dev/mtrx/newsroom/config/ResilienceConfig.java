package dev.mtrx.newsroom.config;

import io.r2dbc.spi.R2dbcTransientException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Centralised timeouts and retry strategies for the store, the language model and feed fetches.
 *
 * <pre>
 * return feedFetcher.fetchRaw(feed)
 *         .timeout(resilience.getFeedTimeout());
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration databaseTimeout;
    private final Duration llmTimeout;
    private final Duration feedTimeout;
    private final int databaseRetryMaxAttempts;
    private final Duration databaseRetryMinBackoff;
    private final Duration databaseRetryMaxBackoff;

    public ResilienceConfig(
            @Value("${resilience.database.timeout-seconds:10}") int databaseTimeoutSeconds,
            @Value("${resilience.database.retry-max-attempts:3}") int databaseRetryMaxAttempts,
            @Value("${resilience.database.retry-min-backoff-ms:100}") int databaseRetryMinBackoffMs,
            @Value("${resilience.database.retry-max-backoff-ms:1000}") int databaseRetryMaxBackoffMs,
            @Value("${resilience.llm.timeout-seconds:60}") int llmTimeoutSeconds,
            @Value("${resilience.feed.timeout-seconds:20}") int feedTimeoutSeconds
    ) {
        this.databaseTimeout = Duration.ofSeconds(databaseTimeoutSeconds);
        this.llmTimeout = Duration.ofSeconds(llmTimeoutSeconds);
        this.feedTimeout = Duration.ofSeconds(feedTimeoutSeconds);
        this.databaseRetryMaxAttempts = databaseRetryMaxAttempts;
        this.databaseRetryMinBackoff = Duration.ofMillis(databaseRetryMinBackoffMs);
        this.databaseRetryMaxBackoff = Duration.ofMillis(databaseRetryMaxBackoffMs);
        log.info("Resilience configuration initialized (db={}s, llm={}s, feed={}s)",
                databaseTimeoutSeconds, llmTimeoutSeconds, feedTimeoutSeconds);
    }

    /**
     * Retry for idempotent reads against the store. Writes are not retried here;
     * a failed write surfaces and the article is picked up again on the next cycle.
     */
    public Retry databaseReadRetry() {
        return Retry.backoff(databaseRetryMaxAttempts, databaseRetryMinBackoff)
                .maxBackoff(databaseRetryMaxBackoff)
                .jitter(0.5)
                .filter(ResilienceConfig::isTransient)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure())
                .doBeforeRetry(signal -> log.warn("Retrying database read, attempt {}/{}: {}",
                        signal.totalRetries() + 1, databaseRetryMaxAttempts, signal.failure().getMessage()));
    }

    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof R2dbcTransientException || throwable instanceof TransientDataAccessException) {
            return true;
        }
        String message = throwable.getMessage();
        if (message == null) return false;
        String lower = message.toLowerCase();
        return lower.contains("connection") || lower.contains("timeout")
                || lower.contains("temporarily unavailable") || lower.contains("deadlock");
    }
}
