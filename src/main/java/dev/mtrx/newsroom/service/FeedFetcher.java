package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.RawArticle;
import dev.mtrx.newsroom.entity.Feed;
import reactor.core.publisher.Flux;

/**
 * Source of raw article records for a feed. Wire-format parsing happens behind this port.
 */
public interface FeedFetcher {

    Flux<RawArticle> fetchRaw(Feed feed);
}
