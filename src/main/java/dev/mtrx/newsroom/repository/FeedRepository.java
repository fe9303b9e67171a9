package dev.mtrx.newsroom.repository;

import dev.mtrx.newsroom.entity.Feed;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface FeedRepository extends ReactiveCrudRepository<Feed, Long> {

    @Query("SELECT * FROM feeds WHERE is_active = TRUE ORDER BY id")
    Flux<Feed> findAllActive();

    @Modifying
    @Query("UPDATE feeds SET last_fetched_at = :fetchedAt WHERE id = :id")
    Mono<Integer> markFetched(Long id, LocalDateTime fetchedAt);
}
