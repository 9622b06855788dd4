package de.mirkosertic.mediashrink.api.dto;

import java.util.Map;

/**
 * Savings totals plus task counts per status and index metadata.
 */
public record StatsResponse(
        boolean success,
        Long totalSavedBytes,
        Long totalProcessedFiles,
        Map<String, Long> tasksByStatus,
        String indexPath,
        Integer schemaVersion,
        String softwareVersion,
        String buildTimestamp,
        String error
) {
    public static StatsResponse success(final long totalSavedBytes, final long totalProcessedFiles,
                                        final Map<String, Long> tasksByStatus, final String indexPath,
                                        final int schemaVersion, final String softwareVersion,
                                        final String buildTimestamp) {
        return new StatsResponse(true, totalSavedBytes, totalProcessedFiles, tasksByStatus, indexPath,
                schemaVersion, softwareVersion, buildTimestamp, null);
    }

    public static StatsResponse error(final String errorMessage) {
        return new StatsResponse(false, null, null, null, null, null, null, null, errorMessage);
    }
}
