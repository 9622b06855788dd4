package de.mirkosertic.mediashrink.queue;

import de.mirkosertic.mediashrink.archive.OriginalArchiver;
import de.mirkosertic.mediashrink.archive.RollbackException;
import de.mirkosertic.mediashrink.encoder.ProgressTracker;
import de.mirkosertic.mediashrink.model.LogLevel;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskNotFoundException;
import de.mirkosertic.mediashrink.model.TaskStateException;
import de.mirkosertic.mediashrink.model.TaskStatus;
import de.mirkosertic.mediashrink.scanner.FileFingerprint;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * User actions on tasks and the queue. Every status change is a compare-and-set against the task
 * index, so an action racing the worker or the scanner is rejected instead of overwriting.
 */
public class TaskQueueService {

    private static final Logger logger = LoggerFactory.getLogger(TaskQueueService.class);

    private final TaskIndexService store;
    private final QueueController controller;
    private final TranscodeWorker worker;
    private final OriginalArchiver archiver;
    private final FileFingerprint fingerprint;
    private final ProgressTracker progress;
    private final TaskLogService taskLogs;
    private final Lock pathLock;

    public TaskQueueService(final TaskIndexService store, final QueueController controller,
                            final TranscodeWorker worker, final OriginalArchiver archiver,
                            final FileFingerprint fingerprint, final ProgressTracker progress,
                            final TaskLogService taskLogs, final Lock pathLock) {
        this.store = store;
        this.controller = controller;
        this.worker = worker;
        this.archiver = archiver;
        this.fingerprint = fingerprint;
        this.progress = progress;
        this.taskLogs = taskLogs;
        this.pathLock = pathLock;
    }

    /**
     * Puts a FAILED or CANCELLED task back at the end of the queue with its error cleared.
     */
    public Task retry(final long taskId) throws IOException, TaskNotFoundException, TaskStateException {
        final Task retried = store.requeue(taskId, TaskStatus.RETRYABLE,
                b -> b.status(TaskStatus.PENDING).errorMessage(null));
        taskLogs.log(taskId, LogLevel.INFO, "Retry requested, task queued again");
        controller.signal();
        return retried;
    }

    /**
     * Cancels the active task. The worker stops the encoder, deletes the partial output and records
     * the task as CANCELLED.
     *
     * @throws TaskStateException if the task is not the one being processed
     */
    public void cancel(final long taskId) throws IOException, TaskNotFoundException, TaskStateException {
        final Task task = store.getTask(taskId);
        if (!task.status().isActive()) {
            throw TaskStateException.unexpected(taskId, task.status(), TaskStatus.ACTIVE);
        }
        if (!controller.cancel(taskId, "Cancelled by user")) {
            throw new TaskStateException(taskId, task.status(), "Task " + taskId + " is not being processed");
        }
        logger.info("Cancellation of task {} requested", taskId);
    }

    /**
     * Restores the original of a COMPLETED task and subtracts its savings.
     *
     * @throws RollbackException if the archived original is gone; the task stays COMPLETED
     */
    public Task rollback(final long taskId)
            throws IOException, TaskNotFoundException, TaskStateException, RollbackException {
        pathLock.lock();
        try {
            final Task task = store.getTask(taskId);
            if (task.status() != TaskStatus.COMPLETED) {
                throw TaskStateException.unexpected(taskId, task.status(), EnumSet.of(TaskStatus.COMPLETED));
            }

            try {
                archiver.rollback(task);
            } catch (final RollbackException e) {
                taskLogs.log(taskId, LogLevel.ERROR, "Rollback failed: " + e.getMessage());
                throw e;
            }

            final Path restored = Paths.get(task.sourcePath());
            final BasicFileAttributes attrs = Files.readAttributes(restored, BasicFileAttributes.class);
            final String restoredFingerprint = fingerprint.compute(restored);
            final Task rolledBack = store.update(taskId, Set.of(TaskStatus.COMPLETED), b -> b
                    .status(TaskStatus.ROLLED_BACK)
                    .fileSignals(attrs.lastModifiedTime().toMillis(), attrs.size(), restoredFingerprint));
            taskLogs.log(taskId, LogLevel.INFO, "Rolled back, original restored from " + task.archivedPath());
            return rolledBack;
        } finally {
            pathLock.unlock();
        }
    }

    /**
     * @return true if an active task was interrupted
     */
    public boolean pause(final boolean immediate) {
        return controller.pause(immediate);
    }

    public void resume() {
        controller.resume();
    }

    public QueueStatus status() throws IOException {
        final OptionalLong active = controller.activeTaskId();
        final long pending = store.countByStatus().getOrDefault(TaskStatus.PENDING, 0L);
        return new QueueStatus(
                controller.isPaused(),
                worker.isRunning(),
                active.isPresent() ? active.getAsLong() : null,
                pending,
                progress.current());
    }
}
