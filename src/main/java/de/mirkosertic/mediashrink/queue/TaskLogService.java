package de.mirkosertic.mediashrink.queue;

import de.mirkosertic.mediashrink.model.LogLevel;
import de.mirkosertic.mediashrink.model.TaskLogEntry;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Per-task log: persisted in the task index, mirrored to SLF4J and pushed to live subscribers.
 */
public class TaskLogService {

    private static final Logger logger = LoggerFactory.getLogger(TaskLogService.class);

    private final TaskIndexService store;
    private final Map<Long, List<Consumer<TaskLogEntry>>> subscribers = new ConcurrentHashMap<>();

    public TaskLogService(final TaskIndexService store) {
        this.store = store;
    }

    /**
     * Appends an entry. A failure to persist it is logged and does not affect the caller, so that
     * reporting an error can never mask the error itself.
     */
    public void log(final long taskId, final LogLevel level, final String message) {
        switch (level) {
            case INFO -> logger.info("Task {}: {}", taskId, message);
            case WARNING -> logger.warn("Task {}: {}", taskId, message);
            case ERROR -> logger.error("Task {}: {}", taskId, message);
        }

        final TaskLogEntry entry;
        try {
            entry = store.appendLog(taskId, level, message);
        } catch (final IOException e) {
            logger.error("Could not persist log entry for task {}", taskId, e);
            return;
        }

        final List<Consumer<TaskLogEntry>> listeners = subscribers.get(taskId);
        if (listeners != null) {
            for (final Consumer<TaskLogEntry> listener : listeners) {
                try {
                    listener.accept(entry);
                } catch (final RuntimeException e) {
                    logger.warn("Log subscriber for task {} failed", taskId, e);
                }
            }
        }
    }

    /**
     * Entries with a sequence number greater than {@code afterSequence}, oldest first.
     */
    public List<TaskLogEntry> getLogs(final long taskId, final long afterSequence, final int limit)
            throws IOException {
        return store.getLogs(taskId, afterSequence, limit);
    }

    /**
     * Receives every entry appended to the task's log from now on, on the appending thread.
     */
    public Subscription subscribe(final long taskId, final Consumer<TaskLogEntry> listener) {
        subscribers.computeIfAbsent(taskId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> subscribers.computeIfPresent(taskId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    @FunctionalInterface
    public interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
