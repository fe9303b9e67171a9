package dev.mtrx.newsroom.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mtrx.newsroom.dto.TranslatedArticle;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.entity.JobScopeType;
import dev.mtrx.newsroom.entity.JobStatus;
import dev.mtrx.newsroom.entity.TranslationJob;
import dev.mtrx.newsroom.exception.EnrichmentException;
import dev.mtrx.newsroom.metrics.PipelineMetrics;
import dev.mtrx.newsroom.repository.ArticleRepository;
import dev.mtrx.newsroom.repository.SectionAssignmentRepository;
import dev.mtrx.newsroom.repository.TranslationJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TranslationJobWorkerTest {

    @Mock private TranslationJobRepository translationJobRepository;
    @Mock private SectionAssignmentRepository sectionAssignmentRepository;
    @Mock private ArticleRepository articleRepository;
    @Mock private EnrichmentService enrichmentService;
    @Mock private PipelineMetrics pipelineMetrics;

    private TranslationJobWorker worker;

    @BeforeEach
    void setUp() {
        worker = new TranslationJobWorker(translationJobRepository, sectionAssignmentRepository,
                articleRepository, enrichmentService, pipelineMetrics, new ObjectMapper(), 600, 540, 3, 2);
    }

    private static TranslationJob runningJob(JobScopeType scopeType, long scopeId) {
        return TranslationJob.builder()
                .id(100L)
                .scopeType(scopeType.name())
                .scopeId(scopeId)
                .targetLanguage("french")
                .status(JobStatus.RUNNING.name())
                .attempts(1)
                .newRecord(false)
                .build();
    }

    private static Article article(long id, String language) {
        return Article.builder().id(id).title("Title " + id).detectedLanguage(language).newRecord(false).build();
    }

    private static TranslatedArticle translated(long id) {
        return new TranslatedArticle(id, "french", "Titre " + id, null, null, null, true);
    }

    @Nested
    @DisplayName("processNext")
    class ProcessNext {

        @Test
        @DisplayName("Should complete empty when no job is pending")
        void shouldCompleteEmptyWhenQueueEmpty() {
            when(translationJobRepository.claimNextPending(any(), any())).thenReturn(Mono.empty());

            StepVerifier.create(worker.processNext()).verifyComplete();
        }

        @Test
        @DisplayName("Should translate every article of an issue and record the result payload")
        void shouldSucceedForIssue() {
            when(translationJobRepository.claimNextPending(any(), any()))
                    .thenReturn(Mono.just(runningJob(JobScopeType.ISSUE, 10L)));
            when(sectionAssignmentRepository.findArticleIdsByIssueId(10L)).thenReturn(Flux.just(2L, 1L, 3L));
            when(articleRepository.findByIdIn(any()))
                    .thenReturn(Flux.just(article(1, "english"), article(2, "spanish"), article(3, "french")));
            when(enrichmentService.translate(any(Article.class), eq("french"))).thenAnswer(inv -> {
                Article a = inv.getArgument(0);
                return Mono.just("french".equals(a.getDetectedLanguage())
                        ? TranslatedArticle.original(a)
                        : translated(a.getId()));
            });
            when(translationJobRepository.markSucceeded(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(1));

            StepVerifier.create(worker.processNext())
                    .assertNext(job -> {
                        assertThat(job.statusValue()).isEqualTo(JobStatus.SUCCEEDED);
                        assertThat(job.getResultPayload())
                                .contains("\"targetLanguage\":\"french\"")
                                .contains("\"translatedArticleIds\":[2,1]")
                                .contains("\"unchangedArticleIds\":[3]");
                        assertThat(job.getCompletedAt()).isNotNull();
                    })
                    .verifyComplete();

            verify(pipelineMetrics).recordJobOutcome(JobStatus.SUCCEEDED);
        }

        @Test
        @DisplayName("Should fail the job and name every article that could not be translated")
        void shouldFailWithArticleIds() {
            when(translationJobRepository.claimNextPending(any(), any()))
                    .thenReturn(Mono.just(runningJob(JobScopeType.ISSUE, 10L)));
            when(sectionAssignmentRepository.findArticleIdsByIssueId(10L)).thenReturn(Flux.just(1L, 2L, 3L));
            when(articleRepository.findByIdIn(any()))
                    .thenReturn(Flux.just(article(1, "english"), article(2, "english"), article(3, "english")));
            when(enrichmentService.translate(any(Article.class), eq("french"))).thenAnswer(inv -> {
                Article a = inv.getArgument(0);
                return a.getId() == 1L
                        ? Mono.just(translated(1L))
                        : Mono.error(new EnrichmentException(a.getId(), "model unavailable"));
            });
            when(translationJobRepository.markFailed(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(1));

            StepVerifier.create(worker.processNext())
                    .assertNext(job -> {
                        assertThat(job.statusValue()).isEqualTo(JobStatus.FAILED);
                        assertThat(job.getErrorDetail()).contains("[2, 3]").contains("model unavailable");
                    })
                    .verifyComplete();

            verify(translationJobRepository, never()).markSucceeded(any(), anyInt(), any(), any());
            verify(pipelineMetrics).recordJobOutcome(JobStatus.FAILED);
        }

        @Test
        @DisplayName("Should fail the job when an assigned article disappeared")
        void shouldFailWhenArticleMissing() {
            when(translationJobRepository.claimNextPending(any(), any()))
                    .thenReturn(Mono.just(runningJob(JobScopeType.ISSUE, 10L)));
            when(sectionAssignmentRepository.findArticleIdsByIssueId(10L)).thenReturn(Flux.just(1L, 2L));
            when(articleRepository.findByIdIn(any())).thenReturn(Flux.just(article(1, "english")));
            when(translationJobRepository.markFailed(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(1));

            StepVerifier.create(worker.processNext())
                    .assertNext(job -> assertThat(job.getErrorDetail()).contains("no longer exist").contains("2"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should translate a single article scope")
        void shouldSucceedForArticle() {
            when(translationJobRepository.claimNextPending(any(), any()))
                    .thenReturn(Mono.just(runningJob(JobScopeType.ARTICLE, 7L)));
            when(articleRepository.findById(7L)).thenReturn(Mono.just(article(7, "english")));
            when(enrichmentService.translate(any(Article.class), eq("french"))).thenReturn(Mono.just(translated(7L)));
            when(translationJobRepository.markSucceeded(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(1));

            StepVerifier.create(worker.processNext())
                    .assertNext(job -> assertThat(job.getResultPayload()).contains("\"translatedArticleIds\":[7]"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail the job when a translation error carries no message")
        void shouldFailOnErrorWithoutMessage() {
            when(translationJobRepository.claimNextPending(any(), any()))
                    .thenReturn(Mono.just(runningJob(JobScopeType.ARTICLE, 7L)));
            when(articleRepository.findById(7L)).thenReturn(Mono.just(article(7, "english")));
            when(enrichmentService.translate(any(Article.class), eq("french")))
                    .thenReturn(Mono.error(new NullPointerException()));
            when(translationJobRepository.markFailed(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(1));

            StepVerifier.create(worker.processNext())
                    .assertNext(job -> {
                        assertThat(job.statusValue()).isEqualTo(JobStatus.FAILED);
                        assertThat(job.getErrorDetail()).contains("[7]").contains("NullPointerException");
                    })
                    .verifyComplete();

            verify(translationJobRepository, never()).markSucceeded(any(), anyInt(), any(), any());
        }

        @Test
        @DisplayName("Should leave the job alone when its lease was lost before completion")
        void shouldDiscardResultWhenLeaseLost() {
            when(translationJobRepository.claimNextPending(any(), any()))
                    .thenReturn(Mono.just(runningJob(JobScopeType.ARTICLE, 7L)));
            when(articleRepository.findById(7L)).thenReturn(Mono.just(article(7, "english")));
            when(enrichmentService.translate(any(Article.class), eq("french"))).thenReturn(Mono.just(translated(7L)));
            when(translationJobRepository.markSucceeded(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(0));

            StepVerifier.create(worker.processNext())
                    .assertNext(job -> {
                        assertThat(job.statusValue()).isEqualTo(JobStatus.RUNNING);
                        assertThat(job.getResultPayload()).isNull();
                    })
                    .verifyComplete();

            verify(pipelineMetrics, never()).recordJobOutcome(any());
        }
    }

    @Test
    @DisplayName("Should fail a job that runs past its timeout")
    void shouldFailOnTimeout() {
        TranslationJob job = runningJob(JobScopeType.ARTICLE, 7L);
        when(articleRepository.findById(7L)).thenReturn(Mono.just(article(7, "english")));
        when(enrichmentService.translate(any(Article.class), eq("french"))).thenReturn(Mono.never());
        when(translationJobRepository.markFailed(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(1));

        StepVerifier.withVirtualTime(() -> worker.run(job))
                .thenAwait(Duration.ofSeconds(541))
                .assertNext(result -> assertThat(result.getErrorDetail()).isEqualTo("timed out after 540s"))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should run jobs until the queue drains")
    void shouldProcessAvailableUntilEmpty() {
        when(translationJobRepository.claimNextPending(any(), any()))
                .thenReturn(Mono.just(runningJob(JobScopeType.ARTICLE, 7L)))
                .thenReturn(Mono.empty());
        when(articleRepository.findById(7L)).thenReturn(Mono.just(article(7, "english")));
        when(enrichmentService.translate(any(Article.class), eq("french"))).thenReturn(Mono.just(translated(7L)));
        when(translationJobRepository.markSucceeded(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(1));

        StepVerifier.create(worker.processAvailable(5))
                .expectNext(1)
                .verifyComplete();
    }

    @Test
    @DisplayName("Should requeue and fail expired leases in one pass")
    void shouldReapExpiredLeases() {
        when(translationJobRepository.failExpiredExhausted(any(LocalDateTime.class), eq(3))).thenReturn(Mono.just(1));
        when(translationJobRepository.requeueExpired(any(LocalDateTime.class), eq(3))).thenReturn(Mono.just(2));

        StepVerifier.create(worker.reapExpiredLeases())
                .expectNext(3)
                .verifyComplete();

        ArgumentCaptor<LocalDateTime> failNow = ArgumentCaptor.forClass(LocalDateTime.class);
        ArgumentCaptor<LocalDateTime> requeueNow = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(translationJobRepository).failExpiredExhausted(failNow.capture(), eq(3));
        verify(translationJobRepository).requeueExpired(requeueNow.capture(), eq(3));
        assertThat(failNow.getValue()).isEqualTo(requeueNow.getValue());
    }

    @Test
    @DisplayName("Should succeed with empty lists for an issue without articles")
    void shouldSucceedForEmptyIssue() {
        when(sectionAssignmentRepository.findArticleIdsByIssueId(10L)).thenReturn(Flux.empty());
        when(translationJobRepository.markSucceeded(eq(100L), eq(1), anyString(), any())).thenReturn(Mono.just(1));

        StepVerifier.create(worker.run(runningJob(JobScopeType.ISSUE, 10L)))
                .assertNext(job -> assertThat(job.getResultPayload()).contains("\"translatedArticleIds\":[]"))
                .verifyComplete();

        verify(articleRepository, never()).findByIdIn(List.of());
    }
}
