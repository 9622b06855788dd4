package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.model.TaskQuery;
import de.mirkosertic.mediashrink.model.TaskStatus;
import org.jspecify.annotations.Nullable;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Request for the task listing.
 *
 * @param statuses status names to include, null or empty for all
 * @param search   words that must all prefix-match the relative path
 */
public record ListTasksRequest(
        @Nullable List<String> statuses,
        @Nullable String search,
        @Nullable Integer offset,
        @Nullable Integer limit
) {

    public static final int DEFAULT_LIMIT = 50;

    public static ListTasksRequest fromMap(final Map<String, Object> args) {
        final List<String> statuses;
        if (args.get("statuses") instanceof List<?> raw) {
            statuses = raw.stream().map(String::valueOf).toList();
        } else if (args.get("status") instanceof String single) {
            statuses = List.of(single);
        } else {
            statuses = null;
        }
        return new ListTasksRequest(
                statuses,
                (String) args.get("search"),
                args.get("offset") != null ? ((Number) args.get("offset")).intValue() : null,
                args.get("limit") != null ? ((Number) args.get("limit")).intValue() : null
        );
    }

    /**
     * @throws IllegalArgumentException on an unknown status name or a window outside the allowed range
     */
    public TaskQuery toQuery() {
        final Set<TaskStatus> parsed = EnumSet.noneOf(TaskStatus.class);
        if (statuses != null) {
            for (final String status : statuses) {
                try {
                    parsed.add(TaskStatus.valueOf(status.trim().toUpperCase(Locale.ROOT)));
                } catch (final IllegalArgumentException e) {
                    throw new IllegalArgumentException("Unknown status: " + status);
                }
            }
        }
        final String effectiveSearch = search == null || search.isBlank() ? null : search.trim();
        return new TaskQuery(parsed, effectiveSearch, offset != null ? offset : 0,
                limit != null ? limit : DEFAULT_LIMIT);
    }
}
