package de.mirkosertic.mediashrink.model;

import java.util.List;

public record TaskPage(List<Task> tasks, long total, int offset, int limit) {

    public boolean hasMore() {
        return offset + tasks.size() < total;
    }
}
