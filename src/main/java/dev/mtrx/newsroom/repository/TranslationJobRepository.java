package dev.mtrx.newsroom.repository;

import dev.mtrx.newsroom.entity.TranslationJob;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Every status change is a single conditional UPDATE on the expected source state.
 * An update count of 0 means the job was not in that state and nothing changed.
 */
@Repository
public interface TranslationJobRepository extends ReactiveCrudRepository<TranslationJob, Long> {

    @Query("SELECT * FROM translation_jobs WHERE scope_type = :scopeType AND scope_id = :scopeId " +
            "AND target_language = :targetLanguage AND status IN ('PENDING', 'RUNNING') LIMIT 1")
    Mono<TranslationJob> findActive(String scopeType, Long scopeId, String targetLanguage);

    /**
     * Claims the oldest PENDING job. Concurrent workers skip rows another worker has locked.
     */
    @Query("""
            UPDATE translation_jobs
            SET status = 'RUNNING', attempts = attempts + 1, started_at = :now,
                lease_expires_at = :leaseExpiresAt, updated_at = :now
            WHERE id = (
                SELECT id FROM translation_jobs
                WHERE status = 'PENDING'
                ORDER BY created_at, id
                LIMIT 1
                FOR UPDATE SKIP LOCKED
            )
            RETURNING *
            """)
    Mono<TranslationJob> claimNextPending(LocalDateTime now, LocalDateTime leaseExpiresAt);

    /**
     * RUNNING -> SUCCEEDED, fenced on the attempt that claimed the job.
     */
    @Modifying
    @Query("UPDATE translation_jobs SET status = 'SUCCEEDED', result_payload = :payload, error_detail = NULL, " +
            "completed_at = :now, updated_at = :now, lease_expires_at = NULL " +
            "WHERE id = :id AND status = 'RUNNING' AND attempts = :attempt")
    Mono<Integer> markSucceeded(Long id, int attempt, String payload, LocalDateTime now);

    @Modifying
    @Query("UPDATE translation_jobs SET status = 'FAILED', error_detail = :errorDetail, " +
            "completed_at = :now, updated_at = :now, lease_expires_at = NULL " +
            "WHERE id = :id AND status = 'RUNNING' AND attempts = :attempt")
    Mono<Integer> markFailed(Long id, int attempt, String errorDetail, LocalDateTime now);

    /**
     * PENDING | RUNNING -> FAILED regardless of attempt; used for cancellation.
     */
    @Modifying
    @Query("UPDATE translation_jobs SET status = 'FAILED', error_detail = :errorDetail, " +
            "completed_at = :now, updated_at = :now, lease_expires_at = NULL " +
            "WHERE id = :id AND status IN ('PENDING', 'RUNNING')")
    Mono<Integer> failIfActive(Long id, String errorDetail, LocalDateTime now);

    @Modifying
    @Query("UPDATE translation_jobs SET status = 'FAILED', " +
            "error_detail = 'lease expired after ' || attempts || ' attempts', " +
            "completed_at = :now, updated_at = :now, lease_expires_at = NULL " +
            "WHERE status = 'RUNNING' AND lease_expires_at < :now AND attempts >= :maxAttempts")
    Mono<Integer> failExpiredExhausted(LocalDateTime now, int maxAttempts);

    @Modifying
    @Query("UPDATE translation_jobs SET status = 'PENDING', lease_expires_at = NULL, started_at = NULL, " +
            "updated_at = :now " +
            "WHERE status = 'RUNNING' AND lease_expires_at < :now AND attempts < :maxAttempts")
    Mono<Integer> requeueExpired(LocalDateTime now, int maxAttempts);

    @Query("SELECT status, COUNT(*) AS cnt FROM translation_jobs GROUP BY status")
    Flux<StatusCount> countGroupedByStatus();

    @Query("SELECT COUNT(*) FROM translation_jobs WHERE status = :status")
    Mono<Long> countByStatus(String status);

    interface StatusCount {
        String getStatus();

        Long getCnt();
    }
}
