package de.mirkosertic.mediashrink.encoder;

import com.google.common.collect.EvictingQueue;
import de.mirkosertic.mediashrink.queue.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs ffmpeg as a subprocess.
 * <p>
 * Progress is read from stdout as it is produced, stderr is drained on its own thread into a bounded
 * tail used for failure diagnostics. Cancellation sends a termination signal and escalates to a forced
 * kill after the grace period; the partial output is deleted only after the process has exited.
 */
public class FfmpegEncoder implements Encoder {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegEncoder.class);

    private static final int STDERR_TAIL_LINES = 40;
    private static final int STDERR_TAIL_CHARS = 2000;

    /**
     * Diagnostics that mean a stream could not be carried over even if ffmpeg exits with 0.
     */
    private static final List<String> STREAM_COPY_ERRORS = List.of(
            "subtitle encoding currently only possible from text to text or bitmap to bitmap",
            "could not find tag for codec",
            "codec not currently supported in container",
            "error initializing output stream"
    );

    private final EncoderCommandBuilder commandBuilder;
    private final long cancelGracePeriodMs;

    public FfmpegEncoder(final EncoderCommandBuilder commandBuilder, final long cancelGracePeriodMs) {
        this.commandBuilder = commandBuilder;
        this.cancelGracePeriodMs = cancelGracePeriodMs;
    }

    @Override
    public EncodeOutcome encode(final EncodeRequest request, final CancellationToken token,
                                final Consumer<ProgressEvent> progressListener) throws IOException {
        final Path output = request.output();
        final Path parent = output.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.deleteIfExists(output);

        if (token.isCancelled()) {
            return EncodeOutcome.cancelled(token.reason());
        }

        final List<String> command = commandBuilder.build(request.settings(), request.input(), output);
        logger.info("Starting encoder for task {}: {}", request.taskId(), EncoderCommandBuilder.render(command));

        final Process process = new ProcessBuilder(command).start();
        final StderrTail stderrTail = new StderrTail(process.getErrorStream());
        final Thread stderrThread = new Thread(stderrTail, "encoder-stderr-" + request.taskId());
        stderrThread.setDaemon(true);
        stderrThread.start();

        final int exitCode;
        boolean exited = false;
        try (CancellationToken.Registration ignored = token.onCancel(() -> terminate(process))) {
            final ProgressStream progress = new ProgressStream(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
            try {
                while (progress.hasNext()) {
                    progressListener.accept(progress.next());
                }
            } catch (final UncheckedIOException e) {
                // stdout closes abruptly when the process is killed
                logger.debug("Progress stream of task {} ended: {}", request.taskId(), e.getMessage());
            }
            exitCode = process.waitFor();
            exited = true;
            stderrThread.join(cancelGracePeriodMs);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            deletePartialOutput(output);
            return EncodeOutcome.cancelled("Worker interrupted");
        } finally {
            if (!exited && process.isAlive()) {
                logger.warn("Encoder for task {} left abnormally, killing it", request.taskId());
                process.destroyForcibly();
            }
        }

        if (token.isCancelled()) {
            deletePartialOutput(output);
            logger.info("Encoder for task {} cancelled: {}", request.taskId(), token.reason());
            return EncodeOutcome.cancelled(token.reason());
        }

        final String tail = stderrTail.tail();
        if (exitCode != 0) {
            deletePartialOutput(output);
            return EncodeOutcome.failed(exitCode, "Encoder exited with code " + exitCode, tail);
        }
        final String copyError = findStreamCopyError(tail);
        if (copyError != null) {
            deletePartialOutput(output);
            return EncodeOutcome.failed(exitCode, "Encoder could not copy a stream: " + copyError, tail);
        }
        if (!Files.exists(output)) {
            return EncodeOutcome.failed(exitCode, "Encoder exited with code 0 but wrote no output: " + output, tail);
        }
        return EncodeOutcome.success();
    }

    static String findStreamCopyError(final String stderr) {
        final String lower = stderr.toLowerCase(Locale.ROOT);
        for (final String pattern : STREAM_COPY_ERRORS) {
            if (lower.contains(pattern)) {
                return pattern;
            }
        }
        return null;
    }

    private void terminate(final Process process) {
        if (!process.isAlive()) {
            return;
        }
        process.destroy();
        final Thread killer = new Thread(() -> {
            try {
                if (!process.waitFor(cancelGracePeriodMs, TimeUnit.MILLISECONDS)) {
                    logger.warn("Encoder did not stop within {}ms, killing it", cancelGracePeriodMs);
                    process.destroyForcibly();
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }, "encoder-kill");
        killer.setDaemon(true);
        killer.start();
    }

    private static void deletePartialOutput(final Path output) throws IOException {
        if (Files.deleteIfExists(output)) {
            logger.debug("Deleted partial output {}", output);
        }
    }

    /**
     * Drains stderr, keeping the last lines.
     */
    private static final class StderrTail implements Runnable {

        private final InputStream stream;
        private final EvictingQueue<String> lines = EvictingQueue.create(STDERR_TAIL_LINES);

        private StderrTail(final InputStream stream) {
            this.stream = stream;
        }

        @Override
        public void run() {
            try (final BufferedReader reader = new BufferedReader(
                    new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (lines) {
                        lines.add(line);
                    }
                }
            } catch (final IOException e) {
                logger.debug("Stopped reading encoder stderr: {}", e.getMessage());
            }
        }

        String tail() {
            final String joined;
            synchronized (lines) {
                joined = String.join("\n", lines);
            }
            return joined.length() <= STDERR_TAIL_CHARS
                    ? joined
                    : joined.substring(joined.length() - STDERR_TAIL_CHARS);
        }
    }
}
