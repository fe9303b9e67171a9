package dev.mtrx.newsroom.dto;

import dev.mtrx.newsroom.entity.NewsletterIssue;
import dev.mtrx.newsroom.entity.NewsletterSection;
import dev.mtrx.newsroom.entity.SectionAssignment;

import java.util.List;

/**
 * An issue with its sections and each section's assignments, all in position order.
 */
public record IssueView(NewsletterIssue issue, List<SectionView> sections) {

    public record SectionView(NewsletterSection section, List<SectionAssignment> assignments) {
    }

    public List<Long> articleIds() {
        return sections.stream()
                .flatMap(s -> s.assignments().stream())
                .map(SectionAssignment::getArticleId)
                .toList();
    }
}
