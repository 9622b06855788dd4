package de.mirkosertic.mediashrink.queue;

import de.mirkosertic.mediashrink.model.CurrentProgress;
import org.jspecify.annotations.Nullable;

/**
 * @param activeTaskId the task currently in TRANSCODING, VERIFYING or INSTALLING, null when idle
 */
public record QueueStatus(
        boolean paused,
        boolean workerRunning,
        @Nullable Long activeTaskId,
        long pendingTasks,
        CurrentProgress progress
) {
}
