package de.mirkosertic.mediashrink.scanner;

/**
 * Outcome of one completed scan.
 *
 * @param tasksCompleted tasks created or force-completed because the file carries the processed marker
 * @param tasksRefreshed tasks whose stored file signals were updated without a status change
 * @param errors         entries skipped because they could not be read or probed
 */
public record ScanResult(
        long filesFound,
        long filesChecked,
        long skippedUnchanged,
        long tasksCreated,
        long tasksRemoved,
        long tasksCompleted,
        long tasksRefreshed,
        long errors,
        long durationMs
) {
}
