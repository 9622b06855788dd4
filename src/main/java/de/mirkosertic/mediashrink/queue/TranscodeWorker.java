package de.mirkosertic.mediashrink.queue;

import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskStatus;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single worker thread. Picks the oldest PENDING task whenever the queue is not paused and hands
 * it to the {@link TaskPipeline}; otherwise waits for a signal or the poll interval.
 */
public class TranscodeWorker {

    private static final Logger logger = LoggerFactory.getLogger(TranscodeWorker.class);

    private final TaskIndexService store;
    private final QueueController controller;
    private final TaskPipeline pipeline;
    private final long pollIntervalMs;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread workerThread;

    public TranscodeWorker(final TaskIndexService store, final QueueController controller,
                           final TaskPipeline pipeline, final long pollIntervalMs) {
        this.store = store;
        this.controller = controller;
        this.pipeline = pipeline;
        this.pollIntervalMs = pollIntervalMs;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            logger.warn("Worker already running");
            return;
        }
        final Thread thread = new Thread(this::runLoop, "transcode-worker");
        thread.setDaemon(true);
        workerThread = thread;
        thread.start();
        logger.info("Worker started (paused={})", controller.isPaused());
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Stops the loop. An encode in progress is interrupted and its task goes back to PENDING.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        controller.shutdown();
        final Thread thread = workerThread;
        if (thread != null) {
            try {
                thread.join(30_000);
                if (thread.isAlive()) {
                    logger.warn("Worker did not stop within 30s");
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        logger.info("Worker stopped");
    }

    private void runLoop() {
        while (running.get()) {
            try {
                if (controller.isPaused() || !processNext()) {
                    final QueueController.Signal signal = controller.awaitSignal(pollIntervalMs);
                    if (signal == QueueController.Signal.SHUTDOWN) {
                        break;
                    }
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.info("Worker interrupted");
                break;
            } catch (final Exception e) {
                // Keep the loop alive, the failed task has already been recorded
                logger.error("Unexpected error in worker loop", e);
                try {
                    Thread.sleep(pollIntervalMs);
                } catch (final InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        running.set(false);
    }

    /**
     * @return false if there was nothing to do or the queue got paused
     */
    boolean processNext() throws IOException {
        final Optional<Task> next = store.nextPending();
        if (next.isEmpty()) {
            return false;
        }

        final Task task = next.get();
        final CancellationToken token = controller.activate(task.id());
        if (controller.isPaused()) {
            // An immediate pause between the caller's check and activate found no task to cancel
            controller.deactivate(task.id());
            logger.debug("Queue paused before task {} started, leaving it queued", task.id());
            return false;
        }
        try {
            final TaskStatus result = pipeline.process(task, token);
            logger.info("Task {} ({}) finished as {}", task.id(), task.relativePath(), result);
        } finally {
            controller.deactivate(task.id());
        }
        return true;
    }
}
