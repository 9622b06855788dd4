package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.queue.QueueStatus;

public record QueueStatusResponse(
        boolean success,
        Boolean paused,
        Boolean workerRunning,
        Long activeTaskId,
        Long pendingTasks,
        ProgressResponse progress,
        String error
) {
    public static QueueStatusResponse success(final QueueStatus status) {
        return new QueueStatusResponse(true, status.paused(), status.workerRunning(), status.activeTaskId(),
                status.pendingTasks(), ProgressResponse.from(status.progress()), null);
    }

    public static QueueStatusResponse error(final String errorMessage) {
        return new QueueStatusResponse(false, null, null, null, null, null, errorMessage);
    }
}
