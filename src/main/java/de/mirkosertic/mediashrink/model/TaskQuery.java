package de.mirkosertic.mediashrink.model;

import org.jspecify.annotations.Nullable;

import java.util.Set;

/**
 * Filter and page window for task listings. Results are ordered newest first.
 *
 * @param statuses empty means all statuses
 * @param search   free text matched against the relative path, null for no text filter
 */
public record TaskQuery(Set<TaskStatus> statuses, @Nullable String search, int offset, int limit) {

    public static final int MAX_LIMIT = 500;
    public static final int MAX_OFFSET = Integer.MAX_VALUE - MAX_LIMIT;

    public TaskQuery {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        if (offset < 0 || offset > MAX_OFFSET) {
            throw new IllegalArgumentException("offset must be between 0 and " + MAX_OFFSET + ": " + offset);
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ": " + limit);
        }
    }

    public static TaskQuery all(final int offset, final int limit) {
        return new TaskQuery(Set.of(), null, offset, limit);
    }
}
