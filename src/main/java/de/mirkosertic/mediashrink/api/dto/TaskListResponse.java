package de.mirkosertic.mediashrink.api.dto;

import java.util.List;

public record TaskListResponse(
        boolean success,
        List<TaskSummary> tasks,
        Long total,
        Integer offset,
        Integer limit,
        Boolean hasMore,
        String error
) {
    public static TaskListResponse success(final List<TaskSummary> tasks, final long total, final int offset,
                                           final int limit, final boolean hasMore) {
        return new TaskListResponse(true, tasks, total, offset, limit, hasMore, null);
    }

    public static TaskListResponse error(final String errorMessage) {
        return new TaskListResponse(false, null, null, null, null, null, errorMessage);
    }
}
