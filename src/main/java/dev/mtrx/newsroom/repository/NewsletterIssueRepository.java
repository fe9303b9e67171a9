package dev.mtrx.newsroom.repository;

import dev.mtrx.newsroom.entity.NewsletterIssue;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface NewsletterIssueRepository extends ReactiveCrudRepository<NewsletterIssue, Long> {

    @Query("SELECT * FROM newsletter_issues ORDER BY issue_number DESC LIMIT :limit OFFSET :offset")
    Flux<NewsletterIssue> findAllPaginated(int limit, int offset);

    @Query("SELECT * FROM newsletter_issues WHERE status = :status ORDER BY issue_number DESC LIMIT :limit OFFSET :offset")
    Flux<NewsletterIssue> findByStatusPaginated(String status, int limit, int offset);

    @Query("SELECT COUNT(*) FROM newsletter_issues WHERE status = :status")
    Mono<Long> countByStatus(String status);

    /**
     * DRAFT -> PUBLISHED. Zero rows updated means the issue was not a draft (or does not exist).
     */
    @Modifying
    @Query("UPDATE newsletter_issues SET status = 'PUBLISHED', published_at = :now, updated_at = :now " +
            "WHERE id = :id AND status = 'DRAFT'")
    Mono<Integer> publishIfDraft(Long id, LocalDateTime now);

    @Modifying
    @Query("UPDATE newsletter_issues SET status = 'ARCHIVED', archived_at = :now, updated_at = :now " +
            "WHERE id = :id AND status IN ('DRAFT', 'PUBLISHED')")
    Mono<Integer> archiveIfActive(Long id, LocalDateTime now);

    @Modifying
    @Query("UPDATE newsletter_issues SET updated_at = :now WHERE id = :id AND status = 'DRAFT'")
    Mono<Integer> touchIfDraft(Long id, LocalDateTime now);
}
