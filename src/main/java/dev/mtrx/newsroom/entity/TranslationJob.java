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
@Table("translation_jobs")
public class TranslationJob implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    @Column("scope_type")
    private String scopeType;

    @Column("scope_id")
    private Long scopeId;

    @Column("target_language")
    private String targetLanguage;

    @Builder.Default
    private String status = JobStatus.PENDING.name();

    @Column("result_payload")
    private String resultPayload;

    @Column("error_detail")
    private String errorDetail;

    @Builder.Default
    private Integer attempts = 0;

    @Column("lease_expires_at")
    private LocalDateTime leaseExpiresAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("completed_at")
    private LocalDateTime completedAt;

    public JobStatus statusValue() {
        return JobStatus.from(status);
    }

    public String scopeRef() {
        return scopeType + ":" + scopeId;
    }
}
