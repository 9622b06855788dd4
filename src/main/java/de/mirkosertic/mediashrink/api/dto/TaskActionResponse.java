package de.mirkosertic.mediashrink.api.dto;

/**
 * Result of cancel, retry and rollback.
 */
public record TaskActionResponse(
        boolean success,
        long taskId,
        String status,
        String message,
        String error
) {
    public static TaskActionResponse success(final long taskId, final String status, final String message) {
        return new TaskActionResponse(true, taskId, status, message, null);
    }

    public static TaskActionResponse error(final long taskId, final String errorMessage) {
        return new TaskActionResponse(false, taskId, null, null, errorMessage);
    }
}
