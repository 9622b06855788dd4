package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.model.TaskLogEntry;

import java.util.List;

/**
 * @param lastSequence pass back as {@code afterSequence} to fetch only newer entries
 */
public record TaskLogsResponse(
        boolean success,
        long taskId,
        List<TaskLogEntry> entries,
        Long lastSequence,
        String error
) {
    public static TaskLogsResponse success(final long taskId, final List<TaskLogEntry> entries,
                                           final long afterSequence) {
        final long last = entries.isEmpty() ? afterSequence : entries.get(entries.size() - 1).sequence();
        return new TaskLogsResponse(true, taskId, entries, last, null);
    }

    public static TaskLogsResponse error(final long taskId, final String errorMessage) {
        return new TaskLogsResponse(false, taskId, null, null, errorMessage);
    }
}
