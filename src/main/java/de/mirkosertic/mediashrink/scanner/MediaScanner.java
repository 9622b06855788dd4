package de.mirkosertic.mediashrink.scanner;

import de.mirkosertic.mediashrink.config.ApplicationConfig;
import de.mirkosertic.mediashrink.config.RuntimeSettings;
import de.mirkosertic.mediashrink.config.SettingsManager;
import de.mirkosertic.mediashrink.encoder.MediaInfo;
import de.mirkosertic.mediashrink.model.LogLevel;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskNotFoundException;
import de.mirkosertic.mediashrink.model.TaskStateException;
import de.mirkosertic.mediashrink.model.TaskStatus;
import de.mirkosertic.mediashrink.queue.TaskLogService;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;

/**
 * Walks the source tree and keeps the task set in line with the files on disk.
 * <p>
 * A scan runs in four phases: tasks of newly ignored files are dropped, the tree is listed, every
 * listed file goes through {@link ChangeDetector}, and finally tasks whose file is gone are removed.
 * Only one scan runs at a time. Tasks in an active status are never touched.
 */
public class MediaScanner {

    private static final Logger logger = LoggerFactory.getLogger(MediaScanner.class);

    /**
     * Statuses whose task may be dropped when its file becomes ignored.
     */
    private static final Set<TaskStatus> IGNORABLE =
            EnumSet.of(TaskStatus.PENDING, TaskStatus.FAILED, TaskStatus.CANCELLED, TaskStatus.ROLLED_BACK);

    private final ApplicationConfig config;
    private final TaskIndexService store;
    private final SettingsManager settingsManager;
    private final ChangeDetector changeDetector;
    private final TaskLogService taskLogs;
    private final Lock pathLock;
    private final ScanProgressTracker progress = new ScanProgressTracker();
    private final AtomicBoolean scanning = new AtomicBoolean(false);
    private final ExecutorService scanExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread t = new Thread(r, "scan-executor");
        t.setDaemon(true);
        return t;
    });

    /**
     * @param pathLock held while a create or complete decision for one path is applied; the worker holds
     *                 the same lock around install and completion
     */
    public MediaScanner(final ApplicationConfig config, final TaskIndexService store,
                        final SettingsManager settingsManager, final ChangeDetector changeDetector,
                        final TaskLogService taskLogs, final Lock pathLock) {
        this.config = config;
        this.store = store;
        this.settingsManager = settingsManager;
        this.changeDetector = changeDetector;
        this.taskLogs = taskLogs;
        this.pathLock = pathLock;
    }

    /**
     * Starts a scan on the scan thread.
     *
     * @return false if a scan is already running
     */
    public boolean startScan() {
        if (!scanning.compareAndSet(false, true)) {
            logger.info("Scan already in progress");
            return false;
        }
        try {
            scanExecutor.execute(() -> {
                try {
                    runScan();
                } catch (final RuntimeException e) {
                    logger.error("Scan failed", e);
                } finally {
                    scanning.set(false);
                }
            });
        } catch (final RuntimeException e) {
            scanning.set(false);
            throw e;
        }
        return true;
    }

    /**
     * Runs a scan on the calling thread.
     *
     * @return empty if a scan is already running
     */
    public Optional<ScanResult> scan() {
        if (!scanning.compareAndSet(false, true)) {
            logger.info("Scan already in progress");
            return Optional.empty();
        }
        try {
            return Optional.of(runScan());
        } finally {
            scanning.set(false);
        }
    }

    public boolean isScanning() {
        return scanning.get();
    }

    public ScanProgress getProgress() {
        return progress.snapshot();
    }

    /**
     * Relative paths of the video files below the source root that the given patterns would exclude.
     * Nothing is changed.
     *
     * @throws IllegalArgumentException if a pattern is not a valid glob
     */
    public List<String> listIgnoredFiles(final List<String> patterns) throws IOException {
        final IgnorePatternMatcher matcher = new IgnorePatternMatcher(patterns);
        final Path root = config.getSourceDir();
        final List<String> ignored = new ArrayList<>();
        if (matcher.isEmpty() || !Files.isDirectory(root)) {
            return ignored;
        }

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                return isInternalDirectory(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                final String relative = relativize(root, file);
                if (attrs.isRegularFile() && isVideoFile(file) && matcher.isIgnored(relative, false)) {
                    ignored.add(relative);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                logger.debug("Cannot read {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        ignored.sort(String::compareTo);
        return ignored;
    }

    public void shutdown() {
        scanExecutor.shutdownNow();
        try {
            if (!scanExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Scan thread did not terminate in time");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ScanResult runScan() {
        final Path root = config.getSourceDir();
        final RuntimeSettings settings = settingsManager.current().settings();
        final IgnorePatternMatcher matcher = new IgnorePatternMatcher(settings.scanIgnorePatterns());

        progress.start();
        logger.info("Starting scan of {}", root);

        // A missing root must not look like every file was deleted
        if (!Files.isDirectory(root)) {
            logger.error("Source directory {} does not exist or is not a directory, scan aborted", root);
            progress.error();
            return progress.finish();
        }

        progress.phase(ScanPhase.REMOVING_IGNORED);
        removeIgnored(matcher);

        progress.phase(ScanPhase.LISTING_FILES);
        final List<Candidate> candidates = listFiles(root, matcher);

        progress.phase(ScanPhase.CHECKING_METADATA);
        for (final Candidate candidate : candidates) {
            if (Thread.currentThread().isInterrupted()) {
                logger.warn("Scan interrupted");
                return progress.finish();
            }
            progress.currentFile(candidate.relativePath());
            try {
                checkFile(candidate);
            } catch (final IOException e) {
                progress.error();
                logger.warn("Skipping {}: {}", candidate.path(), e.getMessage());
            } catch (final TaskStateException | TaskNotFoundException e) {
                // The task changed while we looked at it, the next scan sees the new state
                logger.debug("Task for {} changed concurrently: {}", candidate.path(), e.getMessage());
            }
            progress.fileChecked();
        }

        progress.phase(ScanPhase.RECONCILING);
        reconcile();

        final ScanResult result = progress.finish();
        logger.info("Scan finished in {}ms: {} files, {} unchanged, {} created, {} completed, {} refreshed, "
                        + "{} removed, {} errors",
                result.durationMs(), result.filesFound(), result.skippedUnchanged(), result.tasksCreated(),
                result.tasksCompleted(), result.tasksRefreshed(), result.tasksRemoved(), result.errors());
        return result;
    }

    private void removeIgnored(final IgnorePatternMatcher matcher) {
        if (matcher.isEmpty()) {
            return;
        }
        try {
            for (final Task task : store.findByStatus(IGNORABLE)) {
                if (matcher.isIgnored(task.relativePath(), false)) {
                    removeTask(task, "now matches an ignore pattern");
                }
            }
        } catch (final IOException e) {
            progress.error();
            logger.error("Could not remove tasks of ignored files", e);
        }
    }

    private List<Candidate> listFiles(final Path root, final IgnorePatternMatcher matcher) {
        final List<Candidate> candidates = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) {
                    if (isInternalDirectory(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    if (!dir.equals(root) && matcher.isIgnored(relativize(root, dir), true)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile() || !isVideoFile(file)) {
                        return FileVisitResult.CONTINUE;
                    }
                    final String relative = relativize(root, file);
                    if (matcher.isIgnored(relative, false)) {
                        return FileVisitResult.CONTINUE;
                    }
                    candidates.add(new Candidate(file, relative, attrs.lastModifiedTime().toMillis(), attrs.size()));
                    progress.fileFound();
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                    progress.error();
                    logger.warn("Cannot read {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (final IOException e) {
            progress.error();
            logger.error("Error walking {}", root, e);
        }
        return candidates;
    }

    private void checkFile(final Candidate candidate)
            throws IOException, TaskStateException, TaskNotFoundException {
        pathLock.lock();
        try {
            final Task existing = store.findByCurrentPath(candidate.path().toString()).orElse(null);
            if (existing != null && existing.status().isActive()) {
                return;
            }

            final ChangeDetector.Decision decision =
                    changeDetector.evaluate(candidate.path(), candidate.modifiedAt(), candidate.size(), existing);
            switch (decision.kind()) {
                case UNCHANGED -> progress.skippedUnchanged();
                case METADATA_ONLY -> {
                    refreshSignals(existing, decision);
                    progress.taskRefreshed();
                }
                case PROCESSED -> applyProcessed(candidate, existing, decision);
                case CHANGED -> applyChanged(candidate, existing, decision);
            }
        } finally {
            pathLock.unlock();
        }
    }

    private void applyProcessed(final Candidate candidate, final @Nullable Task existing,
                                final ChangeDetector.Decision decision)
            throws IOException, TaskStateException, TaskNotFoundException {
        final double duration = durationOf(decision.mediaInfo());
        if (existing == null) {
            final Task created = store.createTask(Task.builder(candidate.path().toString(), candidate.relativePath())
                    .status(TaskStatus.COMPLETED)
                    .originalSize(candidate.size())
                    .newSize(candidate.size())
                    .originalDuration(duration)
                    .newDuration(duration)
                    .fileSignals(decision.modifiedAt(), decision.size(), decision.fingerprint()));
            taskLogs.log(created.id(), LogLevel.INFO, "File already carries the processed marker, recorded as completed");
            progress.taskCompleted();
            return;
        }

        switch (existing.status()) {
            case PENDING, FAILED, CANCELLED -> {
                store.update(existing.id(), Set.of(existing.status()), b -> b
                        .status(TaskStatus.COMPLETED)
                        .originalSize(candidate.size())
                        .newSize(candidate.size())
                        .originalDuration(duration)
                        .newDuration(duration)
                        .errorMessage(null)
                        .fileSignals(decision.modifiedAt(), decision.size(), decision.fingerprint()));
                taskLogs.log(existing.id(), LogLevel.INFO, "Processed marker found, marked as completed");
                progress.taskCompleted();
            }
            default -> {
                refreshSignals(existing, decision);
                progress.taskRefreshed();
            }
        }
    }

    private void applyChanged(final Candidate candidate, final @Nullable Task existing,
                              final ChangeDetector.Decision decision)
            throws IOException, TaskStateException, TaskNotFoundException {
        final double duration = durationOf(decision.mediaInfo());
        if (existing == null) {
            createPending(candidate, decision, duration);
            return;
        }

        switch (existing.status()) {
            case PENDING, FAILED, CANCELLED, ROLLED_BACK -> {
                store.update(existing.id(), Set.of(existing.status()), b -> b
                        .originalSize(candidate.size())
                        .originalDuration(duration)
                        .fileSignals(decision.modifiedAt(), decision.size(), decision.fingerprint()));
                progress.taskRefreshed();
            }
            case COMPLETED -> {
                // The converted file was replaced by an unconverted one
                removeTask(existing, "its file was replaced by an unprocessed file");
                createPending(candidate, decision, duration);
            }
            default -> {
                // active, never reached
            }
        }
    }

    private void createPending(final Candidate candidate, final ChangeDetector.Decision decision,
                               final double duration) throws IOException {
        final Task created = store.createTask(Task.builder(candidate.path().toString(), candidate.relativePath())
                .status(TaskStatus.PENDING)
                .originalSize(candidate.size())
                .originalDuration(duration)
                .fileSignals(decision.modifiedAt(), decision.size(), decision.fingerprint()));
        logger.debug("Queued task {} for {}", created.id(), candidate.relativePath());
        progress.taskCreated();
    }

    private void refreshSignals(final Task existing, final ChangeDetector.Decision decision)
            throws IOException, TaskStateException, TaskNotFoundException {
        store.update(existing.id(), Set.of(existing.status()),
                b -> b.fileSignals(decision.modifiedAt(), decision.size(), decision.fingerprint()));
    }

    private void reconcile() {
        final List<Task> tasks;
        try {
            tasks = store.findAll();
        } catch (final IOException e) {
            progress.error();
            logger.error("Could not load tasks for reconciliation", e);
            return;
        }

        for (final Task task : tasks) {
            if (task.status().isActive()) {
                continue;
            }
            // A failed install left the original in the archive, the operator resolves it
            if (task.status() != TaskStatus.COMPLETED && task.archivedPath() != null) {
                continue;
            }
            pathLock.lock();
            try {
                if (Files.notExists(Paths.get(task.currentPath()))) {
                    removeTask(task, "its file no longer exists");
                }
            } catch (final IOException e) {
                progress.error();
                logger.warn("Could not reconcile task {}: {}", task.id(), e.getMessage());
            } finally {
                pathLock.unlock();
            }
        }
    }

    private void removeTask(final Task task, final String reason) throws IOException {
        try {
            if (store.remove(task.id(), Set.of(task.status())).isPresent()) {
                progress.taskRemoved();
                logger.info("Removed task {} ({}) for {}: {}", task.id(), task.status(), task.relativePath(), reason);
            }
        } catch (final TaskStateException e) {
            logger.debug("Task {} changed concurrently, not removed: {}", task.id(), e.getMessage());
        }
    }

    private boolean isInternalDirectory(final Path dir) {
        final Path normalized = dir.toAbsolutePath().normalize();
        if (normalized.equals(config.getTempDir()) || normalized.equals(config.getConfigDir())) {
            return true;
        }
        final Path archive = settingsManager.current().settings().archivePath();
        return archive != null && normalized.equals(archive.toAbsolutePath().normalize());
    }

    private boolean isVideoFile(final Path file) {
        final String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        for (final String extension : config.getVideoExtensions()) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    private static String relativize(final Path root, final Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private static double durationOf(final @Nullable MediaInfo info) {
        return info == null ? 0 : info.durationSeconds();
    }

    private record Candidate(Path path, String relativePath, long modifiedAt, long size) {
    }
}
