package de.mirkosertic.mediashrink.recovery;

/**
 * @param tasksRequeued   tasks found in an active status and put back to PENDING
 * @param filesDeleted    leftover files removed from the processing area
 * @param statsRepaired   whether the cached savings totals had to be recomputed
 */
public record RecoveryResult(int tasksRequeued, long filesDeleted, boolean statsRepaired) {
}
