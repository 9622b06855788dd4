package de.mirkosertic.mediashrink.queue;

import de.mirkosertic.mediashrink.archive.InstallException;
import de.mirkosertic.mediashrink.archive.InstallResult;
import de.mirkosertic.mediashrink.archive.OriginalArchiver;
import de.mirkosertic.mediashrink.config.RuntimeSettings;
import de.mirkosertic.mediashrink.config.SettingsManager;
import de.mirkosertic.mediashrink.config.SettingsSnapshot;
import de.mirkosertic.mediashrink.encoder.EncodeOutcome;
import de.mirkosertic.mediashrink.encoder.EncodeRequest;
import de.mirkosertic.mediashrink.encoder.Encoder;
import de.mirkosertic.mediashrink.encoder.MediaInfo;
import de.mirkosertic.mediashrink.encoder.MediaProbe;
import de.mirkosertic.mediashrink.encoder.ProgressTracker;
import de.mirkosertic.mediashrink.encoder.TranscodeException;
import de.mirkosertic.mediashrink.model.LogLevel;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskNotFoundException;
import de.mirkosertic.mediashrink.model.TaskStateException;
import de.mirkosertic.mediashrink.model.TaskStatus;
import de.mirkosertic.mediashrink.scanner.FileFingerprint;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import de.mirkosertic.mediashrink.verifier.OutputVerifier;
import de.mirkosertic.mediashrink.verifier.VerificationException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Set;
import java.util.concurrent.locks.Lock;

/**
 * Takes one PENDING task through TRANSCODING, VERIFYING and INSTALLING to a terminal status.
 * <p>
 * Every stage failure ends the task as FAILED with a message on the task record and in its log.
 * Cancellation is honoured until the first file of the install is moved.
 */
public class TaskPipeline {

    private static final Logger logger = LoggerFactory.getLogger(TaskPipeline.class);

    private final TaskIndexService store;
    private final SettingsManager settingsManager;
    private final MediaProbe probe;
    private final Encoder encoder;
    private final OutputVerifier verifier;
    private final OriginalArchiver archiver;
    private final FileFingerprint fingerprint;
    private final ProgressTracker progress;
    private final TaskLogService taskLogs;
    private final Lock pathLock;
    private final Path processingDir;
    private final String outputExtension;

    public TaskPipeline(final TaskIndexService store, final SettingsManager settingsManager, final MediaProbe probe,
                        final Encoder encoder, final OutputVerifier verifier, final OriginalArchiver archiver,
                        final FileFingerprint fingerprint, final ProgressTracker progress,
                        final TaskLogService taskLogs, final Lock pathLock, final Path processingDir,
                        final String outputExtension) {
        this.store = store;
        this.settingsManager = settingsManager;
        this.probe = probe;
        this.encoder = encoder;
        this.verifier = verifier;
        this.archiver = archiver;
        this.fingerprint = fingerprint;
        this.progress = progress;
        this.taskLogs = taskLogs;
        this.pathLock = pathLock;
        this.processingDir = processingDir;
        this.outputExtension = outputExtension;
    }

    /**
     * @return the status the task ended in, or its unchanged status if it was no longer PENDING
     */
    public TaskStatus process(final Task pending, final CancellationToken token) throws IOException {
        final long taskId = pending.id();
        final SettingsSnapshot snapshot = settingsManager.current();
        final RuntimeSettings settings = snapshot.settings();

        final Task task;
        try {
            task = store.update(taskId, Set.of(TaskStatus.PENDING),
                    b -> b.status(TaskStatus.TRANSCODING).errorMessage(null));
        } catch (final TaskStateException e) {
            logger.debug("Task {} left PENDING before it was picked up: {}", taskId, e.getMessage());
            return e.getActual();
        } catch (final TaskNotFoundException e) {
            logger.debug("Task {} was removed before it was picked up", taskId);
            return pending.status();
        }

        progress.begin(taskId, TaskStatus.TRANSCODING);
        taskLogs.log(taskId, LogLevel.INFO, "Transcoding started with settings version " + snapshot.version());

        final Path source = Paths.get(task.sourcePath());
        final Path output = processingDir.resolve(withOutputExtension(task.relativePath()));
        try {
            return runStages(task, source, output, settings, token);
        } catch (final TranscodeException e) {
            return fail(taskId, e.getMessage() + tail(e.getStderrTail()), null);
        } catch (final VerificationException e) {
            return fail(taskId, "Verification failed: " + e.getMessage(), null);
        } catch (final InstallException e) {
            return fail(taskId, "Install failed: " + e.getMessage(), e.getArchivedPath());
        } catch (final IOException | TaskNotFoundException | TaskStateException | RuntimeException e) {
            logger.error("Task {} failed unexpectedly", taskId, e);
            return fail(taskId, "Unexpected error: " + e, null);
        } finally {
            progress.clear();
            deleteQuietly(output);
        }
    }

    private TaskStatus runStages(final Task task, final Path source, final Path output,
                                 final RuntimeSettings settings, final CancellationToken token)
            throws IOException, TranscodeException, VerificationException, InstallException,
            TaskNotFoundException, TaskStateException {
        final long taskId = task.id();

        // TRANSCODING
        final MediaInfo sourceInfo;
        try {
            sourceInfo = probe.probe(source);
        } catch (final IOException e) {
            throw new TranscodeException("Could not probe source " + source + ": " + e.getMessage(), "");
        }
        final double duration = sourceInfo.durationSeconds();
        final long originalSize = Files.size(source);

        final Path parent = output.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.deleteIfExists(output);

        final EncodeOutcome outcome = encoder.encode(new EncodeRequest(taskId, source, output, duration, settings),
                token, event -> progress.update(taskId, event, duration));
        switch (outcome.status()) {
            case CANCELLED -> {
                return cancelled(taskId, token, output);
            }
            case FAILED -> throw new TranscodeException(outcome.message(), outcome.stderrTail());
            case SUCCESS -> {
            }
        }
        if (token.isCancelled()) {
            return cancelled(taskId, token, output);
        }

        // VERIFYING
        store.update(taskId, Set.of(TaskStatus.TRANSCODING), b -> b
                .status(TaskStatus.VERIFYING)
                .originalSize(originalSize)
                .originalDuration(duration));
        progress.stage(TaskStatus.VERIFYING);
        final MediaInfo outputInfo = verifier.verify(duration, output);
        final long newSize = Files.size(output);
        if (token.isCancelled()) {
            return cancelled(taskId, token, output);
        }

        // INSTALLING
        store.update(taskId, Set.of(TaskStatus.VERIFYING), b -> b.status(TaskStatus.INSTALLING));
        progress.stage(TaskStatus.INSTALLING);
        final Path installTarget = Paths.get(withOutputExtension(task.sourcePath()));

        pathLock.lock();
        try {
            if (token.isCancelled()) {
                return cancelled(taskId, token, output);
            }
            final InstallResult installed = archiver.install(task, output, installTarget, settings);
            recordInstall(taskId, installed, newSize, outputInfo);
        } finally {
            pathLock.unlock();
        }

        taskLogs.log(taskId, LogLevel.INFO, "Completed: " + originalSize + " -> " + newSize + " bytes, saved "
                + (originalSize - newSize) + " bytes");
        return TaskStatus.COMPLETED;
    }

    /**
     * Marks an installed task COMPLETED. From here on the original only lives in the archive, so a failure to
     * record it still keeps the archived path on the task.
     */
    private void recordInstall(final long taskId, final InstallResult installed, final long newSize,
                               final MediaInfo outputInfo) throws InstallException {
        final Path installedPath = installed.installedPath();
        final String archivedPath = installed.archivedPath().toString();

        long modifiedAt = 0;
        long fileSize = newSize;
        String installedFingerprint = null;
        try {
            final BasicFileAttributes attrs = Files.readAttributes(installedPath, BasicFileAttributes.class);
            modifiedAt = attrs.lastModifiedTime().toMillis();
            fileSize = attrs.size();
            installedFingerprint = fingerprint.compute(installedPath);
        } catch (final IOException e) {
            // The next scan recomputes the signals and finds the marker
            logger.warn("Could not read file signals of installed file {}: {}", installedPath, e.getMessage());
            taskLogs.log(taskId, LogLevel.WARNING, "Could not read installed file signals: " + e.getMessage());
        }

        final long signalTime = modifiedAt;
        final long signalSize = fileSize;
        final String signalFingerprint = installedFingerprint;
        try {
            store.update(taskId, Set.of(TaskStatus.INSTALLING), b -> b
                    .status(TaskStatus.COMPLETED)
                    .newSize(newSize)
                    .newDuration(outputInfo.durationSeconds())
                    .errorMessage(null)
                    .archivedPath(archivedPath)
                    .installedPath(installedPath.toString())
                    .fileSignals(signalTime, signalSize, signalFingerprint));
        } catch (final IOException | TaskNotFoundException | TaskStateException | RuntimeException e) {
            logger.error("Task {} was installed but could not be marked completed", taskId, e);
            throw new InstallException("Output installed at " + installedPath + " and original archived at "
                    + archivedPath + ", but the task could not be marked completed: " + e.getMessage()
                    + ". Resolve manually.", archivedPath);
        }
    }

    private TaskStatus cancelled(final long taskId, final CancellationToken token, final Path output) {
        final String reason = token.reason() == null ? "Cancelled" : token.reason();
        deleteQuietly(output);
        try {
            if (QueueController.SHUTDOWN_REASON.equals(reason)) {
                store.update(taskId, TaskStatus.ACTIVE, b -> b.status(TaskStatus.PENDING).errorMessage(null));
                taskLogs.log(taskId, LogLevel.WARNING, reason + ", task returned to the queue");
                return TaskStatus.PENDING;
            }
            store.update(taskId, TaskStatus.ACTIVE, b -> b.status(TaskStatus.CANCELLED).errorMessage(reason));
            taskLogs.log(taskId, LogLevel.WARNING, "Cancelled: " + reason);
            return TaskStatus.CANCELLED;
        } catch (final IOException | TaskNotFoundException | TaskStateException e) {
            logger.error("Could not record cancellation of task {}", taskId, e);
            return TaskStatus.CANCELLED;
        }
    }

    private TaskStatus fail(final long taskId, final String message, final @Nullable String archivedPath) {
        taskLogs.log(taskId, LogLevel.ERROR, message);
        try {
            store.update(taskId, TaskStatus.ACTIVE, b -> {
                b.status(TaskStatus.FAILED).errorMessage(message);
                if (archivedPath != null) {
                    b.archivedPath(archivedPath);
                }
            });
        } catch (final IOException | TaskNotFoundException | TaskStateException e) {
            logger.error("Could not mark task {} as failed", taskId, e);
        }
        return TaskStatus.FAILED;
    }

    /**
     * Replaces the file extension when an output container is configured.
     */
    String withOutputExtension(final String path) {
        if (outputExtension.isEmpty()) {
            return path;
        }
        final int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        final int dot = path.lastIndexOf('.');
        final String stem = dot > slash + 1 ? path.substring(0, dot) : path;
        return stem + outputExtension;
    }

    private static String tail(final String stderrTail) {
        return stderrTail == null || stderrTail.isBlank() ? "" : "\n" + stderrTail;
    }

    private static void deleteQuietly(final Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (final IOException e) {
            logger.warn("Could not delete {}", path, e);
        }
    }
}
