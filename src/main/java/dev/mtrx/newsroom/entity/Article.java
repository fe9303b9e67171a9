package dev.mtrx.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * An ingested news article. {@code url} holds the canonical URL and is the global identity key.
 * Translations never mutate this record; they live in {@link ArticleTranslation}.
 */
@Table("articles")
@Getter
@Setter
@ToString(exclude = {"content", "description"})
@EqualsAndHashCode(of = "id")
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Article implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("feed_id")
    private Long feedId;

    private String title;

    private String author;

    private String description;

    private String content;

    private String url;

    @Column("image_url")
    private String imageUrl;

    @Column("published_at")
    private LocalDateTime publishedAt;

    @Column("detected_language")
    private String detectedLanguage;

    @Column("language_confidence")
    private Double languageConfidence;

    @Column("needs_manual_language_review")
    @Builder.Default
    private boolean needsManualLanguageReview = false;

    private String summary;

    @Builder.Default
    private boolean selected = false;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public boolean isEnriched() {
        return summary != null && !summary.isBlank();
    }
}
