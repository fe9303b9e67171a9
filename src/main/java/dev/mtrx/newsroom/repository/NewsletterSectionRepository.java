package dev.mtrx.newsroom.repository;

import dev.mtrx.newsroom.entity.NewsletterSection;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface NewsletterSectionRepository extends ReactiveCrudRepository<NewsletterSection, Long> {

    @Query("SELECT * FROM newsletter_sections WHERE issue_id = :issueId ORDER BY position")
    Flux<NewsletterSection> findByIssueIdOrdered(Long issueId);

    @Modifying
    @Query("DELETE FROM newsletter_sections WHERE issue_id = :issueId")
    Mono<Integer> deleteByIssueId(Long issueId);
}
