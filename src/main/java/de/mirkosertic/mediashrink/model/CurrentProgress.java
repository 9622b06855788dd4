package de.mirkosertic.mediashrink.model;

import org.jspecify.annotations.Nullable;

/**
 * Live encode progress of the active task. Never persisted.
 *
 * @param fraction   completion in [0,1]
 * @param etaSeconds remaining seconds, null while the encode speed is unknown
 */
public record CurrentProgress(
        long taskId,
        @Nullable TaskStatus status,
        double fps,
        double speed,
        double fraction,
        @Nullable Double etaSeconds
) {

    public static final CurrentProgress IDLE = new CurrentProgress(0, null, 0, 0, 0, null);

    public boolean isIdle() {
        return status == null;
    }

    public CurrentProgress withStatus(final TaskStatus newStatus) {
        return new CurrentProgress(taskId, newStatus, fps, speed, fraction, etaSeconds);
    }
}
