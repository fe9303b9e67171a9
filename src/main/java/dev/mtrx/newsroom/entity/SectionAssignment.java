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

/**
 * Places one article at a position inside a section of an issue, with an optional display override.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("section_assignments")
public class SectionAssignment implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("issue_id")
    private Long issueId;

    @Column("section_id")
    private Long sectionId;

    @Column("article_id")
    private Long articleId;

    private Integer position;

    @Column("override_title")
    private String overrideTitle;

    @Column("override_summary")
    private String overrideSummary;
}
