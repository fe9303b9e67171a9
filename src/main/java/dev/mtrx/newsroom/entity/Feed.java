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
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("feeds")
public class Feed implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String name;

    private String url;

    // Declared language, e.g. "French" or "fr"
    private String language;

    private String region;

    private String category;

    @Column("is_active")
    @Builder.Default
    private boolean active = true;

    @Column("last_fetched_at")
    private LocalDateTime lastFetchedAt;

    @Column("created_at")
    private LocalDateTime createdAt;
}
