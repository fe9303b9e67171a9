package dev.mtrx.newsroom.service;

import dev.mtrx.newsroom.dto.IssueView;
import dev.mtrx.newsroom.dto.NewsletterDraftRequest;
import dev.mtrx.newsroom.dto.PageResponse;
import dev.mtrx.newsroom.dto.SectioningStrategy;
import dev.mtrx.newsroom.entity.Article;
import dev.mtrx.newsroom.entity.Feed;
import dev.mtrx.newsroom.entity.IssueMetadata;
import dev.mtrx.newsroom.entity.IssueStatus;
import dev.mtrx.newsroom.entity.NewsletterIssue;
import dev.mtrx.newsroom.entity.NewsletterSection;
import dev.mtrx.newsroom.entity.SectionAssignment;
import dev.mtrx.newsroom.exception.DatabaseException;
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
import dev.mtrx.newsroom.util.LanguageNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds newsletter issues and drives their lifecycle.
 * <p>
 * Issue numbers come from a counter row incremented in the same transaction as the insert, so they are
 * unique, strictly increasing and gap-free. Every status change is a conditional UPDATE on the expected
 * source state; a losing concurrent caller gets {@link InvalidStateTransitionException} and nothing changes.
 * Only DRAFT issues accept content edits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NewsletterAssemblyService {

    static final int MAX_PAGE_SIZE = 100;
    static final String ENTITY = "newsletter issue";
    static final String SINGLE_SECTION_NAME = "headlines";
    static final String UNCATEGORIZED = "general";
    static final String UNKNOWN_LANGUAGE = "unknown";

    private final NewsletterIssueRepository newsletterIssueRepository;
    private final NewsletterSectionRepository newsletterSectionRepository;
    private final SectionAssignmentRepository sectionAssignmentRepository;
    private final IssueCounterRepository issueCounterRepository;
    private final ArticleRepository articleRepository;
    private final FeedRepository feedRepository;
    private final IdService idService;
    private final PipelineMetrics pipelineMetrics;

    @Transactional
    public Mono<NewsletterIssue> createDraft(NewsletterDraftRequest request) {
        if (request == null || request.getTitle() == null || request.getTitle().isBlank()) {
            return Mono.error(new ValidationException("Issue title is required"));
        }
        String language = LanguageNames.normalize(request.getLanguage()).orElse(null);
        if (language == null) {
            return Mono.error(new ValidationException("Unsupported issue language: " + request.getLanguage()));
        }

        return issueCounterRepository.increment(IssueCounterRepository.NEWSLETTER_ISSUE)
                .switchIfEmpty(Mono.error(new IllegalStateException(
                        "Counter row '" + IssueCounterRepository.NEWSLETTER_ISSUE + "' is missing")))
                .flatMap(number -> {
                    LocalDateTime now = LocalDateTime.now();
                    NewsletterIssue issue = NewsletterIssue.builder()
                            .id(idService.nextId())
                            .issueNumber(number)
                            .title(request.getTitle().trim())
                            .subtitle(request.getSubtitle())
                            .language(language)
                            .status(IssueStatus.DRAFT.name())
                            .metadata(new IssueMetadata(request.getMetadata()))
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return newsletterIssueRepository.save(issue);
                })
                .onErrorMap(DatabaseException.wrap("newsletter_issues.createDraft"))
                .doOnSuccess(issue -> log.info("Created draft issue #{} ({})", issue.getIssueNumber(), issue.getId()));
    }

    /**
     * Number the next draft will get, absent concurrent drafts. Not a reservation.
     */
    public Mono<Long> nextIssueNumber() {
        return issueCounterRepository.current(IssueCounterRepository.NEWSLETTER_ISSUE)
                .map(current -> current + 1)
                .onErrorMap(DatabaseException.wrap("counters.current"));
    }

    /**
     * Replaces the issue's sections and assignments with the given articles, grouped by {@code strategy}.
     * Within a section articles keep the order of {@code articleIds}.
     */
    @Transactional
    public Mono<IssueView> assignArticles(Long issueId, List<Long> articleIds, SectioningStrategy strategy) {
        if (articleIds == null || strategy == null) {
            return Mono.error(new ValidationException("Article ids and sectioning strategy are required"));
        }
        if (articleIds.stream().anyMatch(id -> id == null)) {
            return Mono.error(new ValidationException("Article ids must not contain null"));
        }
        if (new HashSet<>(articleIds).size() != articleIds.size()) {
            return Mono.error(new ValidationException("Article ids must not contain duplicates"));
        }

        return requireDraft(issueId, "assign articles to")
                .flatMap(issue -> loadOrdered(articleIds)
                        .flatMap(articles -> buildLayout(issueId, articles, strategy))
                        .flatMap(layout -> replaceLayout(issueId, articleIds, layout)))
                .onErrorMap(DatabaseException.wrap("newsletter.assignArticles"))
                .then(Mono.defer(() -> getIssue(issueId)))
                .doOnSuccess(view -> log.info("Issue {}: assigned {} article(s) in {} section(s) using {}",
                        issueId, articleIds.size(), view.sections().size(), strategy));
    }

    public Mono<IssueView> overrideAssignment(Long issueId, Long articleId, String overrideTitle, String overrideSummary) {
        if (articleId == null) {
            return Mono.error(new ValidationException("Article id is required"));
        }
        return requireDraft(issueId, "edit")
                .flatMap(issue -> sectionAssignmentRepository.updateOverride(issueId, articleId,
                        blankToNull(overrideTitle), blankToNull(overrideSummary)))
                .onErrorMap(DatabaseException.wrap("section_assignments.updateOverride"))
                .flatMap(updated -> updated == 0
                        ? Mono.<IssueView>error(new ResourceNotFoundException(
                                "Article " + articleId + " is not assigned to issue " + issueId))
                        : getIssue(issueId));
    }

    /**
     * DRAFT -> PUBLISHED. Sets publishedAt exactly once; publishing again is rejected.
     */
    public Mono<NewsletterIssue> publish(Long issueId) {
        return transition(issueId, "publish",
                now -> newsletterIssueRepository.publishIfDraft(issueId, now))
                .doOnSuccess(issue -> {
                    pipelineMetrics.recordIssuePublished();
                    log.info("Published issue #{} ({})", issue.getIssueNumber(), issueId);
                });
    }

    /**
     * DRAFT | PUBLISHED -> ARCHIVED. Archived issues are frozen.
     */
    public Mono<NewsletterIssue> archive(Long issueId) {
        return transition(issueId, "archive",
                now -> newsletterIssueRepository.archiveIfActive(issueId, now))
                .doOnSuccess(issue -> log.info("Archived issue #{} ({})", issue.getIssueNumber(), issueId));
    }

    public Mono<IssueView> getIssue(Long issueId) {
        return findIssue(issueId)
                .flatMap(issue -> Mono.zip(
                                newsletterSectionRepository.findByIssueIdOrdered(issueId).collectList(),
                                sectionAssignmentRepository.findByIssueIdOrdered(issueId).collectList())
                        .onErrorMap(DatabaseException.wrap("newsletter.getIssue"))
                        .map(tuple -> {
                            Map<Long, List<SectionAssignment>> bySection = tuple.getT2().stream()
                                    .collect(Collectors.groupingBy(SectionAssignment::getSectionId));
                            List<IssueView.SectionView> sections = tuple.getT1().stream()
                                    .map(section -> new IssueView.SectionView(section,
                                            bySection.getOrDefault(section.getId(), List.of())))
                                    .toList();
                            return new IssueView(issue, sections);
                        }));
    }

    public Mono<PageResponse<NewsletterIssue>> listIssues(IssueStatus status, int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            return Mono.error(new ValidationException(
                    "Page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE));
        }
        int offset = page * size;
        Flux<NewsletterIssue> content = status != null
                ? newsletterIssueRepository.findByStatusPaginated(status.name(), size, offset)
                : newsletterIssueRepository.findAllPaginated(size, offset);
        Mono<Long> total = status != null
                ? newsletterIssueRepository.countByStatus(status.name())
                : newsletterIssueRepository.count();
        return Mono.zip(content.collectList(), total)
                .map(tuple -> PageResponse.of(tuple.getT1(), page, size, tuple.getT2()))
                .onErrorMap(DatabaseException.wrap("newsletter_issues.list"));
    }

    private Mono<NewsletterIssue> transition(Long issueId, String action,
                                             Function<LocalDateTime, Mono<Integer>> conditionalUpdate) {
        LocalDateTime now = LocalDateTime.now();
        return conditionalUpdate.apply(now)
                .onErrorMap(DatabaseException.wrap("newsletter_issues." + action))
                .flatMap(updated -> updated > 0
                        ? findIssue(issueId)
                        : findIssue(issueId).flatMap(current -> Mono.<NewsletterIssue>error(
                                new InvalidStateTransitionException(ENTITY, issueId, current.getStatus(), action))));
    }

    private Mono<NewsletterIssue> findIssue(Long issueId) {
        return newsletterIssueRepository.findById(issueId)
                .onErrorMap(DatabaseException.wrap("newsletter_issues.findById"))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("NewsletterIssue", "id", issueId)));
    }

    private Mono<NewsletterIssue> requireDraft(Long issueId, String action) {
        return findIssue(issueId)
                .flatMap(issue -> issue.statusValue().isEditable()
                        ? Mono.just(issue)
                        : Mono.<NewsletterIssue>error(new InvalidStateTransitionException(
                                ENTITY, issueId, issue.getStatus(), action)));
    }

    private Mono<List<Article>> loadOrdered(List<Long> articleIds) {
        if (articleIds.isEmpty()) {
            return Mono.just(List.of());
        }
        return articleRepository.findByIdIn(articleIds)
                .collectMap(Article::getId)
                .flatMap(byId -> {
                    List<Long> unknown = articleIds.stream().filter(id -> !byId.containsKey(id)).toList();
                    if (!unknown.isEmpty()) {
                        return Mono.error(new ValidationException("Unknown article ids: " + unknown));
                    }
                    List<Long> awaitingReview = articleIds.stream()
                            .filter(id -> byId.get(id).isNeedsManualLanguageReview())
                            .toList();
                    if (!awaitingReview.isEmpty()) {
                        return Mono.error(new ValidationException("Articles awaiting language review: " + awaitingReview));
                    }
                    return Mono.just(articleIds.stream().map(byId::get).toList());
                });
    }

    private Mono<Layout> buildLayout(Long issueId, List<Article> articles, SectioningStrategy strategy) {
        Mono<Function<Article, String>> keyFn = switch (strategy) {
            case SINGLE_SECTION -> Mono.just(article -> SINGLE_SECTION_NAME);
            case BY_LANGUAGE -> Mono.just(article -> article.getDetectedLanguage() != null
                    ? article.getDetectedLanguage() : UNKNOWN_LANGUAGE);
            case BY_CATEGORY -> categoriesByFeed(articles)
                    .<Function<Article, String>>map(categories -> article -> categories.getOrDefault(article.getFeedId(), UNCATEGORIZED));
        };
        return keyFn.map(fn -> {
            Map<String, List<Article>> grouped = new LinkedHashMap<>();
            for (Article article : articles) {
                grouped.computeIfAbsent(fn.apply(article), k -> new ArrayList<>()).add(article);
            }
            List<NewsletterSection> sections = new ArrayList<>();
            List<SectionAssignment> assignments = new ArrayList<>();
            int sectionPosition = 0;
            for (Map.Entry<String, List<Article>> entry : grouped.entrySet()) {
                NewsletterSection section = NewsletterSection.builder()
                        .id(idService.nextId())
                        .issueId(issueId)
                        .name(entry.getKey())
                        .displayName(displayName(entry.getKey(), strategy))
                        .position(sectionPosition++)
                        .build();
                sections.add(section);
                int articlePosition = 0;
                for (Article article : entry.getValue()) {
                    assignments.add(SectionAssignment.builder()
                            .id(idService.nextId())
                            .issueId(issueId)
                            .sectionId(section.getId())
                            .articleId(article.getId())
                            .position(articlePosition++)
                            .build());
                }
            }
            return new Layout(sections, assignments);
        });
    }

    private Mono<Map<Long, String>> categoriesByFeed(List<Article> articles) {
        Set<Long> feedIds = articles.stream()
                .map(Article::getFeedId)
                .filter(id -> id != null)
                .collect(Collectors.toSet());
        if (feedIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        return feedRepository.findAllById(feedIds)
                .filter(feed -> feed.getCategory() != null && !feed.getCategory().isBlank())
                .collectMap(Feed::getId, feed -> feed.getCategory().trim().toLowerCase(Locale.ROOT));
    }

    private Mono<Void> replaceLayout(Long issueId, List<Long> articleIds, Layout layout) {
        LocalDateTime now = LocalDateTime.now();
        // Locks the issue row and re-checks DRAFT so a concurrent publish cannot interleave
        return newsletterIssueRepository.touchIfDraft(issueId, now)
                .flatMap(updated -> updated == 0
                        ? findIssue(issueId).flatMap(current -> Mono.<Integer>error(new InvalidStateTransitionException(
                                ENTITY, issueId, current.getStatus(), "assign articles to")))
                        : Mono.just(updated))
                .then(Mono.defer(() -> sectionAssignmentRepository.deleteByIssueId(issueId)))
                .then(Mono.defer(() -> newsletterSectionRepository.deleteByIssueId(issueId)))
                .thenMany(Flux.defer(() -> newsletterSectionRepository.saveAll(layout.sections())))
                .thenMany(Flux.defer(() -> sectionAssignmentRepository.saveAll(layout.assignments())))
                .then(Mono.defer(() -> articleIds.isEmpty()
                        ? Mono.just(0)
                        : articleRepository.markSelected(articleIds, now)))
                .then();
    }

    private static String displayName(String key, SectioningStrategy strategy) {
        return switch (strategy) {
            case SINGLE_SECTION -> "Headlines";
            case BY_LANGUAGE -> UNKNOWN_LANGUAGE.equals(key) ? "Other languages" : LanguageNames.displayName(key);
            case BY_CATEGORY -> LanguageNames.displayName(key);
        };
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record Layout(List<NewsletterSection> sections, List<SectionAssignment> assignments) {
    }
}
