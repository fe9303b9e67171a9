package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.IssueView;
import dev.mtrx.newsroom.dto.NewsletterDraftRequest;
import dev.mtrx.newsroom.dto.SectioningStrategy;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.entity.Feed;
import dev.mtrx.newsroom.entity.IssueStatus;
import dev.mtrx.newsroom.entity.NewsletterIssue;
import dev.mtrx.newsroom.entity.NewsletterSection;
import dev.mtrx.newsroom.entity.SectionAssignment;
import dev.mtrx.newsroom.exception.InvalidStateTransitionException;
import dev.mtrx.newsroom.exception.ResourceNotFoundException;
import dev.mtrx.newsroom.exception.ValidationException;
import dev.mtrx.newsroom.metrics.PipelineMetrics;
import dev.mtrx.newsroom.repository.ArticleRepository;
import dev.mtrx.newsroom.repository.FeedRepository;
import dev.mtrx.newsroom.repository.IssueCounterRepository;
import dev.mtrx.newsroom.repository.NewsletterIssueRepository;
import dev.mtrx.newsroom.repository.NewsletterSectionRepository;
import dev.mtrx.newsroom.repository.SectionAssignmentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NewsletterAssemblyServiceTest {

    @Mock private NewsletterIssueRepository newsletterIssueRepository;
    @Mock private NewsletterSectionRepository newsletterSectionRepository;
    @Mock private SectionAssignmentRepository sectionAssignmentRepository;
    @Mock private IssueCounterRepository issueCounterRepository;
    @Mock private ArticleRepository articleRepository;
    @Mock private FeedRepository feedRepository;
    @Mock private IdService idService;
    @Mock private PipelineMetrics pipelineMetrics;

    @InjectMocks
    private NewsletterAssemblyService service;

    private final Map<Long, NewsletterIssue> issues = new ConcurrentHashMap<>();
    private final List<NewsletterSection> sections = new ArrayList<>();
    private final List<SectionAssignment> assignments = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong(1000);

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        lenient().when(idService.nextId()).thenAnswer(inv -> ids.incrementAndGet());
        lenient().when(newsletterIssueRepository.findById(anyLong()))
                .thenAnswer(inv -> Mono.justOrEmpty(issues.get(inv.<Long>getArgument(0))));
        lenient().when(newsletterIssueRepository.save(any(NewsletterIssue.class))).thenAnswer(inv -> {
            NewsletterIssue issue = inv.getArgument(0);
            issues.put(issue.getId(), issue);
            return Mono.just(issue);
        });
        lenient().when(newsletterIssueRepository.publishIfDraft(anyLong(), any(LocalDateTime.class)))
                .thenAnswer(inv -> Mono.fromCallable(() -> {
                    NewsletterIssue issue = issues.get(inv.<Long>getArgument(0));
                    if (issue == null || !IssueStatus.DRAFT.matches(issue.getStatus())) return 0;
                    issue.setStatus(IssueStatus.PUBLISHED.name());
                    issue.setPublishedAt(inv.getArgument(1));
                    return 1;
                }));
        lenient().when(newsletterIssueRepository.archiveIfActive(anyLong(), any(LocalDateTime.class)))
                .thenAnswer(inv -> Mono.fromCallable(() -> {
                    NewsletterIssue issue = issues.get(inv.<Long>getArgument(0));
                    if (issue == null || IssueStatus.ARCHIVED.matches(issue.getStatus())) return 0;
                    issue.setStatus(IssueStatus.ARCHIVED.name());
                    issue.setArchivedAt(inv.getArgument(1));
                    return 1;
                }));
        lenient().when(newsletterIssueRepository.touchIfDraft(anyLong(), any(LocalDateTime.class)))
                .thenAnswer(inv -> Mono.fromCallable(() -> {
                    NewsletterIssue issue = issues.get(inv.<Long>getArgument(0));
                    return issue != null && IssueStatus.DRAFT.matches(issue.getStatus()) ? 1 : 0;
                }));
        lenient().when(sectionAssignmentRepository.deleteByIssueId(anyLong())).thenAnswer(inv -> Mono.fromCallable(() -> {
            int n = assignments.size();
            assignments.clear();
            return n;
        }));
        lenient().when(newsletterSectionRepository.deleteByIssueId(anyLong())).thenAnswer(inv -> Mono.fromCallable(() -> {
            int n = sections.size();
            sections.clear();
            return n;
        }));
        lenient().when(newsletterSectionRepository.saveAll(anyIterable())).thenAnswer(inv -> {
            Iterable<NewsletterSection> saved = inv.getArgument(0);
            saved.forEach(sections::add);
            return Flux.fromIterable(saved);
        });
        lenient().when(sectionAssignmentRepository.saveAll(anyIterable())).thenAnswer(inv -> {
            Iterable<SectionAssignment> saved = inv.getArgument(0);
            saved.forEach(assignments::add);
            return Flux.fromIterable(saved);
        });
        lenient().when(newsletterSectionRepository.findByIssueIdOrdered(anyLong()))
                .thenAnswer(inv -> Flux.defer(() -> Flux.fromIterable(List.copyOf(sections))));
        lenient().when(sectionAssignmentRepository.findByIssueIdOrdered(anyLong()))
                .thenAnswer(inv -> Flux.defer(() -> Flux.fromIterable(List.copyOf(assignments))));
        lenient().when(articleRepository.markSelected(any(), any(LocalDateTime.class))).thenReturn(Mono.just(1));
    }

    private NewsletterIssue storedIssue(long id, IssueStatus status) {
        NewsletterIssue issue = NewsletterIssue.builder()
                .id(id)
                .issueNumber(id)
                .title("Morning Brief")
                .language("english")
                .status(status.name())
                .newRecord(false)
                .build();
        issues.put(id, issue);
        return issue;
    }

    private static Article article(long id, long feedId, String language) {
        return Article.builder().id(id).feedId(feedId).title("Title " + id).detectedLanguage(language)
                .newRecord(false).build();
    }

    private static NewsletterDraftRequest draft(String title) {
        return NewsletterDraftRequest.builder().title(title).language("en").metadata(Map.of("editor", "ana")).build();
    }

    @Nested
    @DisplayName("createDraft")
    class CreateDraft {

        @Test
        @DisplayName("Should create a DRAFT issue with the next counter value")
        void shouldCreateDraft() {
            when(issueCounterRepository.increment(IssueCounterRepository.NEWSLETTER_ISSUE)).thenReturn(Mono.just(12L));

            StepVerifier.create(service.createDraft(draft("  Morning Brief  ")))
                    .assertNext(issue -> {
                        assertThat(issue.getIssueNumber()).isEqualTo(12L);
                        assertThat(issue.getTitle()).isEqualTo("Morning Brief");
                        assertThat(issue.getLanguage()).isEqualTo("english");
                        assertThat(issue.statusValue()).isEqualTo(IssueStatus.DRAFT);
                        assertThat(issue.getPublishedAt()).isNull();
                        assertThat(issue.getMetadata().get("editor")).isEqualTo("ana");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should hand out distinct gap-free numbers to concurrent drafts")
        void shouldNumberConcurrentDraftsWithoutGaps() {
            AtomicLong counter = new AtomicLong();
            when(issueCounterRepository.increment(IssueCounterRepository.NEWSLETTER_ISSUE))
                    .thenAnswer(inv -> Mono.fromCallable(counter::incrementAndGet));

            List<Long> numbers = Flux.range(0, 25)
                    .flatMap(i -> service.createDraft(draft("Issue " + i)).subscribeOn(Schedulers.parallel()))
                    .map(NewsletterIssue::getIssueNumber)
                    .collectList()
                    .block();

            assertThat(numbers).hasSize(25).doesNotHaveDuplicates();
            assertThat(numbers).containsExactlyInAnyOrderElementsOf(
                    LongStream.rangeClosed(1, 25).boxed().toList());
        }

        @Test
        @DisplayName("Should reject a blank title")
        void shouldRejectBlankTitle() {
            StepVerifier.create(service.createDraft(draft("  ")))
                    .expectError(ValidationException.class)
                    .verify();

            verifyNoInteractions(issueCounterRepository);
        }

        @Test
        @DisplayName("Should predict the next number without reserving it")
        void shouldPredictNextNumber() {
            when(issueCounterRepository.current(IssueCounterRepository.NEWSLETTER_ISSUE)).thenReturn(Mono.just(41L));

            StepVerifier.create(service.nextIssueNumber())
                    .expectNext(42L)
                    .verifyComplete();

            verify(issueCounterRepository, never()).increment(anyString());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should publish a draft once and reject a second publish")
        void shouldPublishOnce() {
            storedIssue(1L, IssueStatus.DRAFT);

            StepVerifier.create(service.publish(1L))
                    .assertNext(issue -> {
                        assertThat(issue.statusValue()).isEqualTo(IssueStatus.PUBLISHED);
                        assertThat(issue.getPublishedAt()).isNotNull();
                    })
                    .verifyComplete();
            LocalDateTime firstPublishedAt = issues.get(1L).getPublishedAt();

            StepVerifier.create(service.publish(1L))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(InvalidStateTransitionException.class);
                        assertThat(e.getMessage()).isEqualTo("Cannot publish newsletter issue 1 in state PUBLISHED");
                    })
                    .verify();

            assertThat(issues.get(1L).getPublishedAt()).isEqualTo(firstPublishedAt);
            verify(pipelineMetrics).recordIssuePublished();
        }

        @Test
        @DisplayName("Should archive a published issue and then reject every further change")
        void shouldFreezeArchivedIssue() {
            storedIssue(2L, IssueStatus.PUBLISHED);

            StepVerifier.create(service.archive(2L))
                    .assertNext(issue -> {
                        assertThat(issue.statusValue()).isEqualTo(IssueStatus.ARCHIVED);
                        assertThat(issue.getArchivedAt()).isNotNull();
                    })
                    .verifyComplete();

            StepVerifier.create(service.publish(2L)).expectError(InvalidStateTransitionException.class).verify();
            StepVerifier.create(service.archive(2L)).expectError(InvalidStateTransitionException.class).verify();
            StepVerifier.create(service.assignArticles(2L, List.of(), SectioningStrategy.SINGLE_SECTION))
                    .expectError(InvalidStateTransitionException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should allow archiving an abandoned draft")
        void shouldArchiveDraft() {
            storedIssue(3L, IssueStatus.DRAFT);

            StepVerifier.create(service.archive(3L))
                    .assertNext(issue -> {
                        assertThat(issue.statusValue()).isEqualTo(IssueStatus.ARCHIVED);
                        assertThat(issue.getPublishedAt()).isNull();
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail with ResourceNotFoundException for unknown issue")
        void shouldFailForUnknownIssue() {
            StepVerifier.create(service.publish(99L))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Nested
    @DisplayName("assignArticles")
    class AssignArticles {

        @Test
        @DisplayName("Should put every article in one section in the given order")
        void shouldAssignSingleSection() {
            storedIssue(1L, IssueStatus.DRAFT);
            when(articleRepository.findByIdIn(any()))
                    .thenReturn(Flux.just(article(10, 1, "english"), article(11, 1, "english"), article(12, 2, "french")));

            StepVerifier.create(service.assignArticles(1L, List.of(12L, 10L, 11L), SectioningStrategy.SINGLE_SECTION))
                    .assertNext(view -> {
                        assertThat(view.sections()).hasSize(1);
                        assertThat(view.sections().get(0).section().getName()).isEqualTo("headlines");
                        assertThat(view.articleIds()).containsExactly(12L, 10L, 11L);
                        assertThat(view.sections().get(0).assignments())
                                .extracting(SectionAssignment::getPosition).containsExactly(0, 1, 2);
                    })
                    .verifyComplete();

            verify(articleRepository).markSelected(eq(List.of(12L, 10L, 11L)), any(LocalDateTime.class));
        }

        @Test
        @DisplayName("Should group by detected language in first-seen order")
        void shouldGroupByLanguage() {
            storedIssue(1L, IssueStatus.DRAFT);
            Article unknown = article(13, 1, null);
            when(articleRepository.findByIdIn(any())).thenReturn(Flux.just(
                    article(10, 1, "french"), article(11, 1, "english"), article(12, 2, "french"), unknown));

            StepVerifier.create(service.assignArticles(1L, List.of(10L, 11L, 12L, 13L), SectioningStrategy.BY_LANGUAGE))
                    .assertNext(view -> {
                        assertThat(view.sections()).extracting(s -> s.section().getName())
                                .containsExactly("french", "english", "unknown");
                        assertThat(view.sections()).extracting(s -> s.section().getDisplayName())
                                .containsExactly("French", "English", "Other languages");
                        assertThat(view.sections().get(0).assignments())
                                .extracting(SectionAssignment::getArticleId).containsExactly(10L, 12L);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should group by feed category with a fallback section")
        void shouldGroupByCategory() {
            storedIssue(1L, IssueStatus.DRAFT);
            when(articleRepository.findByIdIn(any())).thenReturn(Flux.just(
                    article(10, 1, "english"), article(11, 2, "english"), article(12, 3, "english")));
            when(feedRepository.findAllById(anyIterable())).thenReturn(Flux.just(
                    Feed.builder().id(1L).category("Markets").build(),
                    Feed.builder().id(2L).category(" ").build()));

            StepVerifier.create(service.assignArticles(1L, List.of(10L, 11L, 12L), SectioningStrategy.BY_CATEGORY))
                    .assertNext(view -> {
                        assertThat(view.sections()).extracting(s -> s.section().getName())
                                .containsExactly("markets", "general");
                        assertThat(view.sections().get(1).assignments())
                                .extracting(SectionAssignment::getArticleId).containsExactly(11L, 12L);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should replace the previous layout")
        void shouldReplaceLayout() {
            storedIssue(1L, IssueStatus.DRAFT);
            when(articleRepository.findByIdIn(any()))
                    .thenReturn(Flux.just(article(10, 1, "english"), article(11, 1, "english")))
                    .thenReturn(Flux.just(article(11, 1, "english")));

            service.assignArticles(1L, List.of(10L, 11L), SectioningStrategy.SINGLE_SECTION).block();
            IssueView view = service.assignArticles(1L, List.of(11L), SectioningStrategy.SINGLE_SECTION).block();

            assertThat(view).isNotNull();
            assertThat(view.articleIds()).containsExactly(11L);
            assertThat(sections).hasSize(1);
        }

        @Test
        @DisplayName("Should reject unknown article ids without touching the layout")
        void shouldRejectUnknownIds() {
            storedIssue(1L, IssueStatus.DRAFT);
            when(articleRepository.findByIdIn(any())).thenReturn(Flux.just(article(10, 1, "english")));

            StepVerifier.create(service.assignArticles(1L, List.of(10L, 404L), SectioningStrategy.SINGLE_SECTION))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(ValidationException.class);
                        assertThat(e.getMessage()).contains("404");
                    })
                    .verify();

            verify(sectionAssignmentRepository, never()).deleteByIssueId(anyLong());
        }

        @Test
        @DisplayName("Should reject articles whose language still awaits review")
        void shouldRejectArticlesAwaitingReview() {
            storedIssue(1L, IssueStatus.DRAFT);
            Article flagged = article(11, 1, "french").toBuilder().needsManualLanguageReview(true).build();
            when(articleRepository.findByIdIn(any())).thenReturn(Flux.just(article(10, 1, "english"), flagged));

            StepVerifier.create(service.assignArticles(1L, List.of(10L, 11L), SectioningStrategy.SINGLE_SECTION))
                    .expectErrorSatisfies(e -> {
                        assertThat(e).isInstanceOf(ValidationException.class);
                        assertThat(e.getMessage()).isEqualTo("Articles awaiting language review: [11]");
                    })
                    .verify();

            verify(sectionAssignmentRepository, never()).deleteByIssueId(anyLong());
            verify(articleRepository, never()).markSelected(any(), any());
        }

        @Test
        @DisplayName("Should reject duplicate article ids")
        void shouldRejectDuplicates() {
            StepVerifier.create(service.assignArticles(1L, List.of(10L, 10L), SectioningStrategy.SINGLE_SECTION))
                    .expectError(ValidationException.class)
                    .verify();
        }

        @Test
        @DisplayName("Should reject edits to a published issue")
        void shouldRejectEditOfPublishedIssue() {
            storedIssue(1L, IssueStatus.PUBLISHED);

            StepVerifier.create(service.overrideAssignment(1L, 10L, "New title", null))
                    .expectError(InvalidStateTransitionException.class)
                    .verify();

            verify(sectionAssignmentRepository, never()).updateOverride(any(), any(), any(), any());
        }
    }

    @Nested
    @DisplayName("overrideAssignment")
    class OverrideAssignment {

        @Test
        @DisplayName("Should store a display override on a draft")
        void shouldOverride() {
            storedIssue(1L, IssueStatus.DRAFT);
            when(sectionAssignmentRepository.updateOverride(1L, 10L, "Short title", null)).thenReturn(Mono.just(1));

            StepVerifier.create(service.overrideAssignment(1L, 10L, "Short title", "  "))
                    .assertNext(view -> assertThat(view.issue().getId()).isEqualTo(1L))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail when the article is not in the issue")
        void shouldFailForUnassignedArticle() {
            storedIssue(1L, IssueStatus.DRAFT);
            when(sectionAssignmentRepository.updateOverride(1L, 10L, "Short title", null)).thenReturn(Mono.just(0));

            StepVerifier.create(service.overrideAssignment(1L, 10L, "Short title", null))
                    .expectError(ResourceNotFoundException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("Should list issues filtered by status")
    void shouldListByStatus() {
        NewsletterIssue published = storedIssue(5L, IssueStatus.PUBLISHED);
        when(newsletterIssueRepository.findByStatusPaginated("PUBLISHED", 10, 0)).thenReturn(Flux.just(published));
        when(newsletterIssueRepository.countByStatus("PUBLISHED")).thenReturn(Mono.just(1L));

        StepVerifier.create(service.listIssues(IssueStatus.PUBLISHED, 0, 10))
                .assertNext(page -> {
                    assertThat(page.getContent()).containsExactly(published);
                    assertThat(page.isLast()).isTrue();
                })
                .verifyComplete();
    }
}
