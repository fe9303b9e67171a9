package dev.mtrx.newsroom.dto;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate counts for one polling cycle over all active feeds.
 */
@Value
@Builder(toBuilder = true)
public class PollingCycleReport {
    int feedsPolled;
    int feedsFailed;
    int articlesIngested;
    int duplicatesSkipped;
    int invalidSkipped;
    int enrichmentFailures;
    @Builder.Default
    List<FeedFailure> feedFailures = List.of();

    public static PollingCycleReport empty() {
        return PollingCycleReport.builder().build();
    }

    public static PollingCycleReport forFeed(FeedReport feed) {
        return PollingCycleReport.builder()
                .feedsPolled(1)
                .feedsFailed(feed.failure() != null ? 1 : 0)
                .articlesIngested(feed.ingested())
                .duplicatesSkipped(feed.duplicates())
                .invalidSkipped(feed.invalid())
                .enrichmentFailures(feed.enrichmentFailures())
                .feedFailures(feed.failure() != null ? List.of(feed.failure()) : List.of())
                .build();
    }

    public PollingCycleReport merge(PollingCycleReport other) {
        List<FeedFailure> failures = new ArrayList<>(feedFailures);
        failures.addAll(other.feedFailures);
        return PollingCycleReport.builder()
                .feedsPolled(feedsPolled + other.feedsPolled)
                .feedsFailed(feedsFailed + other.feedsFailed)
                .articlesIngested(articlesIngested + other.articlesIngested)
                .duplicatesSkipped(duplicatesSkipped + other.duplicatesSkipped)
                .invalidSkipped(invalidSkipped + other.invalidSkipped)
                .enrichmentFailures(enrichmentFailures + other.enrichmentFailures)
                .feedFailures(List.copyOf(failures))
                .build();
    }

    /**
     * Per-feed counts, folded into the cycle report.
     */
    public record FeedReport(Long feedId, int ingested, int duplicates, int invalid,
                             int enrichmentFailures, FeedFailure failure) {

        public static FeedReport failed(Long feedId, String detail) {
            return new FeedReport(feedId, 0, 0, 0, 0, new FeedFailure(feedId, detail));
        }
    }
}
