package dev.mtrx.newsroom.entity;

/**
 * Status values for translation jobs. A job moves forward only:
 * PENDING -> RUNNING -> SUCCEEDED | FAILED. Terminal states are never left.
 * The lease reaper's RUNNING -> PENDING reset is the one recovery path and is handled
 * separately from ordinary transitions.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean matches(String status) {
        return this.name().equals(status);
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }

    public boolean isActive() {
        return !isTerminal();
    }

    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == FAILED;
            case RUNNING -> target == SUCCEEDED || target == FAILED;
            case SUCCEEDED, FAILED -> false;
        };
    }

    public static JobStatus from(String status) {
        return JobStatus.valueOf(status.toUpperCase());
    }
}
