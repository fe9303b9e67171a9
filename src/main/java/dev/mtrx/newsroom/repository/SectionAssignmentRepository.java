package dev.mtrx.newsroom.repository;

import dev.mtrx.newsroom.entity.SectionAssignment;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface SectionAssignmentRepository extends ReactiveCrudRepository<SectionAssignment, Long> {

    @Query("SELECT * FROM section_assignments WHERE issue_id = :issueId ORDER BY section_id, position")
    Flux<SectionAssignment> findByIssueIdOrdered(Long issueId);

    @Query("SELECT article_id FROM section_assignments WHERE issue_id = :issueId")
    Flux<Long> findArticleIdsByIssueId(Long issueId);

    @Modifying
    @Query("UPDATE section_assignments SET override_title = :overrideTitle, override_summary = :overrideSummary " +
            "WHERE issue_id = :issueId AND article_id = :articleId")
    Mono<Integer> updateOverride(Long issueId, Long articleId, String overrideTitle, String overrideSummary);

    @Modifying
    @Query("DELETE FROM section_assignments WHERE issue_id = :issueId")
    Mono<Integer> deleteByIssueId(Long issueId);
}
