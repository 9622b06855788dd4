package de.mirkosertic.mediashrink.recovery;

import de.mirkosertic.mediashrink.model.LogLevel;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskNotFoundException;
import de.mirkosertic.mediashrink.model.TaskStateException;
import de.mirkosertic.mediashrink.model.TaskStatus;
import de.mirkosertic.mediashrink.queue.TaskLogService;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Repairs what an unclean shutdown leaves behind. Runs once before the worker starts.
 */
public class RecoveryService {

    private static final Logger logger = LoggerFactory.getLogger(RecoveryService.class);

    private final TaskIndexService store;
    private final TaskLogService taskLogs;
    private final Path processingDir;

    public RecoveryService(final TaskIndexService store, final TaskLogService taskLogs, final Path processingDir) {
        this.store = store;
        this.taskLogs = taskLogs;
        this.processingDir = processingDir;
    }

    public RecoveryResult recover() throws RecoveryException {
        final int requeued = resetActiveTasks();
        final long deleted = wipeProcessingArea();
        final boolean repaired = repairStats();

        logger.info("Recovery finished: {} tasks requeued, {} leftover files deleted, stats repaired={}",
                requeued, deleted, repaired);
        return new RecoveryResult(requeued, deleted, repaired);
    }

    private int resetActiveTasks() throws RecoveryException {
        int count = 0;
        try {
            for (final Task task : store.findByStatus(TaskStatus.ACTIVE)) {
                try {
                    store.update(task.id(), TaskStatus.ACTIVE, b -> b.status(TaskStatus.PENDING).errorMessage(null));
                } catch (final TaskNotFoundException | TaskStateException e) {
                    // Nothing else runs yet, so this cannot race; report it anyway
                    logger.warn("Could not reset task {}: {}", task.id(), e.getMessage());
                    continue;
                }
                taskLogs.log(task.id(), LogLevel.WARNING,
                        "Processing was interrupted while " + task.status() + ", task returned to the queue");
                count++;
            }
        } catch (final IOException e) {
            throw new RecoveryException("Could not reset interrupted tasks", e);
        }
        return count;
    }

    /**
     * Deletes everything below the processing directory, keeping the directory itself.
     */
    private long wipeProcessingArea() throws RecoveryException {
        final AtomicLong deleted = new AtomicLong();
        try {
            Files.createDirectories(processingDir);
            Files.walkFileTree(processingDir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    deleted.incrementAndGet();
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(final Path dir, final IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    if (!dir.equals(processingDir)) {
                        Files.delete(dir);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (final IOException e) {
            throw new RecoveryException("Could not clean processing directory " + processingDir, e);
        }
        if (deleted.get() > 0) {
            logger.warn("Deleted {} leftover files from {}", deleted.get(), processingDir);
        }
        return deleted.get();
    }

    private boolean repairStats() throws RecoveryException {
        try {
            final TaskIndexService.StatsCheck check = store.checkStatsInvariant();
            if (check.consistent()) {
                return false;
            }
            logger.warn("Processing stats out of sync (cached {}, computed {}), repairing",
                    check.cached(), check.computed());
            store.repairStats();
            return true;
        } catch (final IOException e) {
            throw new RecoveryException("Could not verify processing stats", e);
        }
    }
}
