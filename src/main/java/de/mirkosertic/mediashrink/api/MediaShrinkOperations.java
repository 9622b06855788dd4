package de.mirkosertic.mediashrink.api;

import de.mirkosertic.mediashrink.api.dto.ArchiveListingResponse;
import de.mirkosertic.mediashrink.api.dto.CommandPreviewResponse;
import de.mirkosertic.mediashrink.api.dto.EmptyTrashResponse;
import de.mirkosertic.mediashrink.api.dto.IgnoredFilesResponse;
import de.mirkosertic.mediashrink.api.dto.ListTasksRequest;
import de.mirkosertic.mediashrink.api.dto.ProgressResponse;
import de.mirkosertic.mediashrink.api.dto.QueueStatusResponse;
import de.mirkosertic.mediashrink.api.dto.ScanStatusResponse;
import de.mirkosertic.mediashrink.api.dto.SettingsResponse;
import de.mirkosertic.mediashrink.api.dto.SimpleMessageResponse;
import de.mirkosertic.mediashrink.api.dto.StatsResponse;
import de.mirkosertic.mediashrink.api.dto.TaskActionResponse;
import de.mirkosertic.mediashrink.api.dto.TaskDetailResponse;
import de.mirkosertic.mediashrink.api.dto.TaskListResponse;
import de.mirkosertic.mediashrink.api.dto.TaskLogsResponse;
import de.mirkosertic.mediashrink.api.dto.TaskSummary;
import de.mirkosertic.mediashrink.archive.OriginalArchiver;
import de.mirkosertic.mediashrink.archive.RollbackException;
import de.mirkosertic.mediashrink.archive.TrashService;
import de.mirkosertic.mediashrink.config.BuildInfo;
import de.mirkosertic.mediashrink.config.ConfigException;
import de.mirkosertic.mediashrink.config.RuntimeSettings;
import de.mirkosertic.mediashrink.config.SettingsManager;
import de.mirkosertic.mediashrink.config.SettingsSnapshot;
import de.mirkosertic.mediashrink.encoder.EncoderCommandBuilder;
import de.mirkosertic.mediashrink.encoder.ProgressTracker;
import de.mirkosertic.mediashrink.model.CurrentProgress;
import de.mirkosertic.mediashrink.model.ProcessingStats;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskLogEntry;
import de.mirkosertic.mediashrink.model.TaskNotFoundException;
import de.mirkosertic.mediashrink.model.TaskPage;
import de.mirkosertic.mediashrink.model.TaskStateException;
import de.mirkosertic.mediashrink.model.TaskStatus;
import de.mirkosertic.mediashrink.queue.TaskLogService;
import de.mirkosertic.mediashrink.queue.TaskQueueService;
import de.mirkosertic.mediashrink.scanner.MediaScanner;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * The operations offered to an outer layer (HTTP, CLI, ...). Every method returns a response record with
 * a {@code success} flag and never throws for expected failures; those are reported in {@code error}.
 */
public class MediaShrinkOperations {

    private static final Logger logger = LoggerFactory.getLogger(MediaShrinkOperations.class);

    private static final int MAX_LOG_ENTRIES = 1000;

    private final TaskIndexService store;
    private final TaskQueueService queueService;
    private final TaskLogService taskLogs;
    private final MediaScanner scanner;
    private final SettingsManager settingsManager;
    private final EncoderCommandBuilder commandBuilder;
    private final TrashService trashService;
    private final OriginalArchiver archiver;
    private final ProgressTracker progress;

    public MediaShrinkOperations(final TaskIndexService store, final TaskQueueService queueService,
                                 final TaskLogService taskLogs, final MediaScanner scanner,
                                 final SettingsManager settingsManager, final EncoderCommandBuilder commandBuilder,
                                 final TrashService trashService, final OriginalArchiver archiver,
                                 final ProgressTracker progress) {
        this.store = store;
        this.queueService = queueService;
        this.taskLogs = taskLogs;
        this.scanner = scanner;
        this.settingsManager = settingsManager;
        this.commandBuilder = commandBuilder;
        this.trashService = trashService;
        this.archiver = archiver;
        this.progress = progress;
    }

    // ==================== Tasks ====================

    public TaskListResponse listTasks(final ListTasksRequest request) {
        try {
            final TaskPage page = store.query(request.toQuery());
            final List<TaskSummary> rows = page.tasks().stream().map(TaskSummary::from).toList();
            return TaskListResponse.success(rows, page.total(), page.offset(), page.limit(), page.hasMore());
        } catch (final IllegalArgumentException e) {
            return TaskListResponse.error("Invalid request: " + e.getMessage());
        } catch (final IOException e) {
            logger.error("Error listing tasks", e);
            return TaskListResponse.error("Error listing tasks: " + e.getMessage());
        }
    }

    public TaskDetailResponse getTask(final long taskId) {
        try {
            final Task task = store.getTask(taskId);
            final CurrentProgress current = progress.current();
            return TaskDetailResponse.success(task, !current.isIdle() && current.taskId() == taskId ? current : null);
        } catch (final TaskNotFoundException e) {
            return TaskDetailResponse.error(e.getMessage());
        } catch (final IOException e) {
            logger.error("Error loading task {}", taskId, e);
            return TaskDetailResponse.error("Error loading task: " + e.getMessage());
        }
    }

    public ProgressResponse getProgress() {
        return ProgressResponse.from(progress.current());
    }

    public StatsResponse getStats() {
        try {
            final ProcessingStats stats = store.getStats();
            final Map<String, Long> byStatus = new LinkedHashMap<>();
            store.countByStatus().forEach((status, count) -> byStatus.put(status.name(), count));
            return StatsResponse.success(stats.totalSavedBytes(), stats.totalProcessedFiles(), byStatus,
                    store.getIndexPath().toString(), store.getIndexSchemaVersion(), BuildInfo.getVersion(),
                    BuildInfo.getBuildTimestamp());
        } catch (final IOException e) {
            logger.error("Error getting stats", e);
            return StatsResponse.error("Error getting stats: " + e.getMessage());
        }
    }

    public TaskActionResponse cancelTask(final long taskId) {
        logger.info("Cancel request for task {}", taskId);
        try {
            queueService.cancel(taskId);
            return TaskActionResponse.success(taskId, TaskStatus.CANCELLED.name(), "Cancellation requested");
        } catch (final TaskNotFoundException | TaskStateException e) {
            return TaskActionResponse.error(taskId, e.getMessage());
        } catch (final IOException e) {
            logger.error("Error cancelling task {}", taskId, e);
            return TaskActionResponse.error(taskId, "Error cancelling task: " + e.getMessage());
        }
    }

    public TaskActionResponse retryTask(final long taskId) {
        logger.info("Retry request for task {}", taskId);
        try {
            final Task task = queueService.retry(taskId);
            return TaskActionResponse.success(taskId, task.status().name(), "Task queued again");
        } catch (final TaskNotFoundException | TaskStateException e) {
            return TaskActionResponse.error(taskId, e.getMessage());
        } catch (final IOException e) {
            logger.error("Error retrying task {}", taskId, e);
            return TaskActionResponse.error(taskId, "Error retrying task: " + e.getMessage());
        }
    }

    public TaskActionResponse rollbackTask(final long taskId) {
        logger.info("Rollback request for task {}", taskId);
        try {
            final Task task = queueService.rollback(taskId);
            return TaskActionResponse.success(taskId, task.status().name(), "Original restored");
        } catch (final TaskNotFoundException | TaskStateException | RollbackException e) {
            return TaskActionResponse.error(taskId, e.getMessage());
        } catch (final IOException e) {
            logger.error("Error rolling back task {}", taskId, e);
            return TaskActionResponse.error(taskId, "Error rolling back task: " + e.getMessage());
        }
    }

    // ==================== Task logs ====================

    public TaskLogsResponse getTaskLogs(final long taskId, final long afterSequence, final int limit) {
        try {
            store.getTask(taskId);
            final int effectiveLimit = limit > 0 ? Math.min(limit, MAX_LOG_ENTRIES) : MAX_LOG_ENTRIES;
            final List<TaskLogEntry> entries = taskLogs.getLogs(taskId, afterSequence, effectiveLimit);
            return TaskLogsResponse.success(taskId, entries, afterSequence);
        } catch (final TaskNotFoundException e) {
            return TaskLogsResponse.error(taskId, e.getMessage());
        } catch (final IOException e) {
            logger.error("Error reading logs of task {}", taskId, e);
            return TaskLogsResponse.error(taskId, "Error reading task logs: " + e.getMessage());
        }
    }

    /**
     * Live log entries for one task until the returned subscription is closed.
     */
    public TaskLogService.Subscription subscribeTaskLogs(final long taskId, final Consumer<TaskLogEntry> listener) {
        return taskLogs.subscribe(taskId, listener);
    }

    // ==================== Scanner ====================

    public SimpleMessageResponse startScan() {
        if (scanner.startScan()) {
            return SimpleMessageResponse.success("Scan started");
        }
        return SimpleMessageResponse.error("A scan is already in progress");
    }

    public ScanStatusResponse getScanStatus() {
        return ScanStatusResponse.from(scanner.getProgress());
    }

    public IgnoredFilesResponse previewIgnoredFiles(final List<String> patterns) {
        try {
            return IgnoredFilesResponse.success(scanner.listIgnoredFiles(patterns));
        } catch (final IllegalArgumentException e) {
            return IgnoredFilesResponse.error("Invalid pattern: " + e.getMessage());
        } catch (final IOException e) {
            logger.error("Error previewing ignored files", e);
            return IgnoredFilesResponse.error("Error listing files: " + e.getMessage());
        }
    }

    // ==================== Queue ====================

    public SimpleMessageResponse pauseQueue(final boolean immediate) {
        final boolean interrupted = queueService.pause(immediate);
        return SimpleMessageResponse.success(interrupted ? "Queue paused, active task interrupted" : "Queue paused");
    }

    public SimpleMessageResponse resumeQueue() {
        queueService.resume();
        return SimpleMessageResponse.success("Queue resumed");
    }

    public QueueStatusResponse getQueueStatus() {
        try {
            return QueueStatusResponse.success(queueService.status());
        } catch (final IOException e) {
            logger.error("Error getting queue status", e);
            return QueueStatusResponse.error("Error getting queue status: " + e.getMessage());
        }
    }

    // ==================== Settings ====================

    public SettingsResponse getSettings() {
        final SettingsSnapshot snapshot = settingsManager.current();
        return SettingsResponse.success(snapshot.version(), snapshot.settings().toMap());
    }

    /**
     * Applies the given keys on top of the current settings. Omitted keys keep their value.
     */
    public SettingsResponse updateSettings(final Map<String, Object> changes) {
        try {
            final SettingsSnapshot snapshot = settingsManager.update(changes);
            logger.info("Settings updated to version {}", snapshot.version());
            return SettingsResponse.success(snapshot.version(), snapshot.settings().toMap());
        } catch (final ConfigException e) {
            return SettingsResponse.invalid(e.getViolations());
        } catch (final IOException e) {
            logger.error("Error saving settings", e);
            return SettingsResponse.error("Error saving settings: " + e.getMessage());
        }
    }

    /**
     * Renders the encoder command for candidate settings without saving them.
     */
    public CommandPreviewResponse previewCommand(final Map<String, Object> candidate) {
        try {
            final RuntimeSettings settings = RuntimeSettings.fromMap(candidate, settingsManager.current().settings())
                    .validate();
            final List<String> arguments = commandBuilder.preview(settings);
            return CommandPreviewResponse.success(arguments, EncoderCommandBuilder.render(arguments));
        } catch (final ConfigException e) {
            return CommandPreviewResponse.invalid(e.getViolations());
        }
    }

    // ==================== Trash and archive ====================

    public ArchiveListingResponse listTrash() {
        try {
            return ArchiveListingResponse.success(trashService.listTrash());
        } catch (final IOException e) {
            logger.error("Error listing trash", e);
            return ArchiveListingResponse.error("Error listing trash: " + e.getMessage());
        }
    }

    /**
     * Lists where originals are currently archived to: the archive directory, or the trash.
     */
    public ArchiveListingResponse listArchive() {
        final Path base = archiver.baseDirectory(settingsManager.current().settings());
        try {
            return ArchiveListingResponse.success(trashService.list(base));
        } catch (final IOException e) {
            logger.error("Error listing archive {}", base, e);
            return ArchiveListingResponse.error("Error listing archive: " + e.getMessage());
        }
    }

    public EmptyTrashResponse emptyTrash() {
        logger.info("Empty trash request");
        try {
            return EmptyTrashResponse.success(trashService.emptyTrash());
        } catch (final IOException e) {
            logger.error("Error emptying trash", e);
            return EmptyTrashResponse.error("Error emptying trash: " + e.getMessage());
        }
    }
}
