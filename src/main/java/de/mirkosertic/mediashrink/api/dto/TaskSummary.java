package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.model.Task;

/**
 * One row of the task listing.
 */
public record TaskSummary(
        long id,
        String relativePath,
        String status,
        long originalSize,
        Long newSize,
        long savedBytes,
        String errorMessage,
        long createdAt,
        long updatedAt
) {
    public static TaskSummary from(final Task task) {
        return new TaskSummary(
                task.id(),
                task.relativePath(),
                task.status().name(),
                task.originalSize(),
                task.newSize(),
                task.savedBytes(),
                task.errorMessage(),
                task.createdAt(),
                task.updatedAt()
        );
    }
}
