package de.mirkosertic.mediashrink.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle states of a {@link Task}.
 * <p>
 * Only the worker moves a task out of an active state. Going backwards is
 * limited to retry (FAILED/CANCELLED to PENDING), rollback (COMPLETED to
 * ROLLED_BACK) and startup recovery (active to PENDING).
 */
public enum TaskStatus {
    PENDING,
    TRANSCODING,
    VERIFYING,
    INSTALLING,
    COMPLETED,
    FAILED,
    CANCELLED,
    ROLLED_BACK;

    public static final Set<TaskStatus> ACTIVE = EnumSet.of(TRANSCODING, VERIFYING, INSTALLING);
    public static final Set<TaskStatus> RETRYABLE = EnumSet.of(FAILED, CANCELLED);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isRetryable() {
        return RETRYABLE.contains(this);
    }

    /**
     * Whether the lifecycle allows a direct transition from this status to {@code target}.
     */
    public boolean canTransitionTo(final TaskStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<TaskStatus> allowedTargets() {
        return switch (this) {
            // COMPLETED from PENDING/FAILED/CANCELLED: the scanner found the processed marker
            case PENDING -> EnumSet.of(TRANSCODING, COMPLETED);
            case TRANSCODING -> EnumSet.of(VERIFYING, FAILED, CANCELLED, PENDING);
            case VERIFYING -> EnumSet.of(INSTALLING, FAILED, CANCELLED, PENDING);
            case INSTALLING -> EnumSet.of(COMPLETED, FAILED, CANCELLED, PENDING);
            case FAILED, CANCELLED -> EnumSet.of(PENDING, COMPLETED);
            case COMPLETED -> EnumSet.of(ROLLED_BACK);
            case ROLLED_BACK -> EnumSet.noneOf(TaskStatus.class);
        };
    }
}
