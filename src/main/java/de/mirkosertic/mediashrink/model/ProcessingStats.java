package de.mirkosertic.mediashrink.model;

/**
 * Cumulative savings over all COMPLETED tasks.
 */
public record ProcessingStats(long totalSavedBytes, long totalProcessedFiles) {

    public static final ProcessingStats EMPTY = new ProcessingStats(0, 0);

    public ProcessingStats plus(final ProcessingStats other) {
        return new ProcessingStats(totalSavedBytes + other.totalSavedBytes,
                totalProcessedFiles + other.totalProcessedFiles);
    }

    public ProcessingStats minus(final ProcessingStats other) {
        return new ProcessingStats(totalSavedBytes - other.totalSavedBytes,
                totalProcessedFiles - other.totalProcessedFiles);
    }

    /**
     * What a single task contributes to the aggregate in its current state.
     * Marker-completed tasks were never installed by the pipeline and only count with zero savings.
     */
    public static ProcessingStats contributionOf(final Task task) {
        if (task.status() != TaskStatus.COMPLETED || task.newSize() == null) {
            return EMPTY;
        }
        return new ProcessingStats(task.originalSize() - task.newSize(), task.archivedPath() != null ? 1 : 0);
    }
}
