package de.mirkosertic.mediashrink;

import de.mirkosertic.mediashrink.api.MediaShrinkOperations;
import de.mirkosertic.mediashrink.archive.FileMover;
import de.mirkosertic.mediashrink.archive.OriginalArchiver;
import de.mirkosertic.mediashrink.archive.TrashService;
import de.mirkosertic.mediashrink.config.ApplicationConfig;
import de.mirkosertic.mediashrink.config.BuildInfo;
import de.mirkosertic.mediashrink.config.LoggingConfigurator;
import de.mirkosertic.mediashrink.config.SettingsManager;
import de.mirkosertic.mediashrink.encoder.Encoder;
import de.mirkosertic.mediashrink.encoder.EncoderCommandBuilder;
import de.mirkosertic.mediashrink.encoder.FfmpegEncoder;
import de.mirkosertic.mediashrink.encoder.FfprobeMediaProbe;
import de.mirkosertic.mediashrink.encoder.MediaProbe;
import de.mirkosertic.mediashrink.encoder.ProgressTracker;
import de.mirkosertic.mediashrink.queue.QueueController;
import de.mirkosertic.mediashrink.queue.TaskLogService;
import de.mirkosertic.mediashrink.queue.TaskPipeline;
import de.mirkosertic.mediashrink.queue.TaskQueueService;
import de.mirkosertic.mediashrink.queue.TranscodeWorker;
import de.mirkosertic.mediashrink.recovery.RecoveryException;
import de.mirkosertic.mediashrink.recovery.RecoveryService;
import de.mirkosertic.mediashrink.scanner.ChangeDetector;
import de.mirkosertic.mediashrink.scanner.FileFingerprint;
import de.mirkosertic.mediashrink.scanner.MediaScanner;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import de.mirkosertic.mediashrink.verifier.OutputVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main entry point. Wires all services, recovers from an unclean shutdown and starts the worker.
 */
public class MediaShrinkApplication {

    private static final Logger logger = LoggerFactory.getLogger(MediaShrinkApplication.class);

    private final ApplicationConfig config;
    private final TaskIndexService store;
    private final SettingsManager settingsManager;
    private final TaskLogService taskLogs;
    private final RecoveryService recoveryService;
    private final QueueController queueController;
    private final TranscodeWorker worker;
    private final MediaScanner scanner;
    private final MediaShrinkOperations operations;

    public MediaShrinkApplication(final ApplicationConfig config) {
        this(config,
                new FfprobeMediaProbe(config.getFfprobeBinary(), config.getProbeTimeoutMs()),
                new FfmpegEncoder(new EncoderCommandBuilder(config.getFfmpegBinary(), config.getMarker()),
                        config.getCancelGracePeriodMs()));
    }

    MediaShrinkApplication(final ApplicationConfig config, final MediaProbe probe, final Encoder encoder) {
        this.config = config;

        // Initialize services in dependency order
        this.store = new TaskIndexService(config.getTaskIndexPath());
        this.settingsManager = new SettingsManager(config.getSettingsPath());
        this.taskLogs = new TaskLogService(store);
        this.recoveryService = new RecoveryService(store, taskLogs, config.getProcessingDir());

        // Held by the scanner while deciding about a path and by the worker around install
        final Lock pathLock = new ReentrantLock(true);

        final FileFingerprint fingerprint = new FileFingerprint(config.getFingerprintSampleBytes());
        final ProgressTracker progress = new ProgressTracker();
        final OriginalArchiver archiver = new OriginalArchiver(new FileMover(fingerprint), config.getTrashDir());
        final OutputVerifier verifier = new OutputVerifier(probe, config.getDurationTolerance(),
                config.getMinOutputBytes());

        this.queueController = new QueueController(false);
        final TaskPipeline pipeline = new TaskPipeline(store, settingsManager, probe, encoder, verifier, archiver,
                fingerprint, progress, taskLogs, pathLock, config.getProcessingDir(), config.getOutputExtension());
        this.worker = new TranscodeWorker(store, queueController, pipeline, config.getWorkerPollIntervalMs());
        final TaskQueueService queueService = new TaskQueueService(store, queueController, worker, archiver,
                fingerprint, progress, taskLogs, pathLock);

        this.scanner = new MediaScanner(config, store, settingsManager,
                new ChangeDetector(fingerprint, probe, config.getMarker()), taskLogs, pathLock);

        this.operations = new MediaShrinkOperations(store, queueService, taskLogs, scanner, settingsManager,
                new EncoderCommandBuilder(config.getFfmpegBinary(), config.getMarker()),
                new TrashService(config.getTrashDir()), archiver, progress);
    }

    /**
     * Opens the task index and settings, repairs crash leftovers and starts the worker.
     *
     * @throws RecoveryException if crash leftovers cannot be cleaned up
     */
    public void init() throws IOException, RecoveryException {
        logger.info("Initializing MediaShrink {}...", BuildInfo.getVersion());

        Files.createDirectories(config.getConfigDir());
        Files.createDirectories(config.getProcessingDir());
        Files.createDirectories(config.getTrashDir());

        store.init();
        settingsManager.init();

        // Must finish before the worker takes its first task
        recoveryService.recover();

        if (settingsManager.current().settings().startPaused()) {
            queueController.pause(false);
        }
        worker.start();

        if (config.isScanOnStartup()) {
            logger.info("Scan on startup is enabled");
            scanner.startScan();
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Blocks the main thread until the process is shut down.
     */
    public void start() {
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));
        logger.info("MediaShrink running, watching {}", config.getSourceDir());

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    /**
     * Shuts down all services in reverse order of initialization.
     */
    public void shutdown() {
        logger.info("Shutting down MediaShrink...");

        try {
            scanner.shutdown();
        } catch (final RuntimeException e) {
            logger.error("Error shutting down scanner", e);
        }

        try {
            worker.stop();
        } catch (final RuntimeException e) {
            logger.error("Error stopping worker", e);
        }

        try {
            store.close();
        } catch (final IOException | RuntimeException e) {
            logger.error("Error closing task index", e);
        }

        logger.info("MediaShrink shutdown complete");
    }

    public MediaShrinkOperations getOperations() {
        return operations;
    }

    public MediaScanner getScanner() {
        return scanner;
    }

    public static void main(final String[] args) {
        try {
            // Configure logging first, before any code that might log
            final boolean deployedMode = "deployed".equalsIgnoreCase(System.getProperty("mediashrink.profile"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();
            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Source directory: {}", config.getSourceDir());
                logger.info("Temp directory: {}", config.getTempDir());
                logger.info("Config directory: {}", config.getConfigDir());
            }

            final MediaShrinkApplication app = new MediaShrinkApplication(config);
            app.init();
            app.start();
        } catch (final Exception e) {
            // In deployed mode there is no console logging, so write to stderr
            System.err.println("Failed to start MediaShrink: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
