package dev.mtrx.newsroom.entity;

/**
 * Lifecycle of a newsletter issue: DRAFT -> PUBLISHED -> ARCHIVED, with DRAFT -> ARCHIVED allowed
 * for abandoned issues. Nothing returns to DRAFT.
 * Entity fields remain as String for R2DBC compatibility.
 */
public enum IssueStatus {
    DRAFT,
    PUBLISHED,
    ARCHIVED;

    public boolean matches(String status) {
        return this.name().equals(status);
    }

    public boolean canTransitionTo(IssueStatus target) {
        return switch (this) {
            case DRAFT -> target == PUBLISHED || target == ARCHIVED;
            case PUBLISHED -> target == ARCHIVED;
            case ARCHIVED -> false;
        };
    }

    public boolean isEditable() {
        return this == DRAFT;
    }

    public static IssueStatus from(String status) {
        return IssueStatus.valueOf(status.toUpperCase());
    }
}
