package dev.mtrx.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("newsletter_issues")
public class NewsletterIssue implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("issue_number")
    private Long issueNumber;

    private String title;

    private String subtitle;

    private String language;

    @Builder.Default
    private String status = IssueStatus.DRAFT.name();

    @Column("published_at")
    private LocalDateTime publishedAt;

    @Column("archived_at")
    private LocalDateTime archivedAt;

    @Builder.Default
    private IssueMetadata metadata = IssueMetadata.empty();

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public IssueStatus statusValue() {
        return IssueStatus.from(status);
    }
}
