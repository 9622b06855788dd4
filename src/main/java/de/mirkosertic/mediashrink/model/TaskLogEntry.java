package de.mirkosertic.mediashrink.model;

/**
 * One immutable line of a task's log stream.
 *
 * @param sequence monotonically increasing across all tasks, so ordering within a task is by sequence
 */
public record TaskLogEntry(
        long taskId,
        long sequence,
        long timestamp,
        LogLevel level,
        String message
) {
}
