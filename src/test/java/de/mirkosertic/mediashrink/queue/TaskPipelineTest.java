package de.mirkosertic.mediashrink.queue;

import de.mirkosertic.mediashrink.encoder.FakeEncoder;
import de.mirkosertic.mediashrink.model.ProcessingStats;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskLogEntry;
import de.mirkosertic.mediashrink.model.TaskStatus;
import de.mirkosertic.mediashrink.scanner.FileFingerprint;
import de.mirkosertic.mediashrink.store.TaskIndexService;
import de.mirkosertic.mediashrink.verifier.OutputVerifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

@DisplayName("TaskPipeline Tests")
class TaskPipelineTest {

    @TempDir
    Path tempDir;

    private QueueFixture fixture;

    @BeforeEach
    void setUp() throws IOException {
        fixture = new QueueFixture(tempDir);
    }

    @AfterEach
    void tearDown() throws IOException {
        fixture.close();
    }

    private long processingFileCount() throws IOException {
        try (Stream<Path> files = Files.walk(fixture.processingDir)) {
            return files.filter(Files::isRegularFile).count();
        }
    }

    @Nested
    @DisplayName("Successful run")
    class Success {

        @Test
        @DisplayName("Should install the output, archive the original and add the savings")
        void shouldComplete() throws Exception {
            // Given
            final Task pending = fixture.pendingTask("Movies/movie.mkv");
            final Path source = Path.of(pending.sourcePath());
            final byte[] original = Files.readAllBytes(source);

            // When
            final TaskStatus result = fixture.pipeline.process(pending, new CancellationToken());

            // Then
            assertThat(result).isEqualTo(TaskStatus.COMPLETED);
            final Task task = fixture.store.getTask(pending.id());
            assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(task.newSize()).isEqualTo(20_000L);
            assertThat(task.savedBytes()).isEqualTo(QueueFixture.SOURCE_SIZE - 20_000L);
            assertThat(task.installedPath()).isEqualTo(pending.sourcePath());
            assertThat(Path.of(task.archivedPath())).hasBinaryContent(original);
            assertThat(FakeEncoder.isEncoded(source)).as("Source path now holds the encoded file").isTrue();
            assertThat(task.fileSize()).isEqualTo(20_000L);

            assertThat(fixture.store.getStats()).isEqualTo(new ProcessingStats(QueueFixture.SOURCE_SIZE - 20_000L, 1));
            assertThat(processingFileCount()).as("Processing area is cleaned up").isZero();
            assertThat(fixture.progress.current().isIdle()).isTrue();
            assertThat(fixture.taskLogs.getLogs(pending.id(), 0, 100))
                    .extracting(TaskLogEntry::message)
                    .anyMatch(m -> m.startsWith("Completed: 100000 -> 20000 bytes"));
        }

        @Test
        @DisplayName("Should install under the configured output extension")
        void shouldChangeExtension() throws Exception {
            // Given
            fixture.close();
            fixture = new QueueFixture(tempDir.resolve("ext"), ".mkv");
            final Task pending = fixture.pendingTask("clip.avi");

            // When
            fixture.pipeline.process(pending, new CancellationToken());

            // Then
            final Task task = fixture.store.getTask(pending.id());
            assertThat(task.installedPath()).endsWith("clip.mkv");
            assertThat(Path.of(pending.sourcePath())).doesNotExist();
            assertThat(fixture.store.findByCurrentPath(task.installedPath())).isPresent();
        }

        @Test
        @DisplayName("Output extension replaces only the last extension of the file name")
        void outputExtensionNaming() throws IOException {
            fixture.close();
            fixture = new QueueFixture(tempDir.resolve("naming"), ".mkv");

            assertThat(fixture.pipeline.withOutputExtension("Show.S01E01.avi")).isEqualTo("Show.S01E01.mkv");
            assertThat(fixture.pipeline.withOutputExtension("dir.v2/noext")).isEqualTo("dir.v2/noext.mkv");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Encoder failure records message and diagnostics and leaves the source alone")
        void encoderFailure() throws Exception {
            // Given
            fixture.encoder.mode(FakeEncoder.Mode.FAIL);
            final Task pending = fixture.pendingTask("movie.mkv");

            // When
            final TaskStatus result = fixture.pipeline.process(pending, new CancellationToken());

            // Then
            assertThat(result).isEqualTo(TaskStatus.FAILED);
            final Task task = fixture.store.getTask(pending.id());
            assertThat(task.errorMessage())
                    .contains("Encoder exited with code 1")
                    .contains("Unsupported codec in stream #0:2");
            assertThat(FakeEncoder.isEncoded(Path.of(pending.sourcePath()))).isFalse();
            assertThat(fixture.store.getStats()).isEqualTo(ProcessingStats.EMPTY);
        }

        @Test
        @DisplayName("Verification failure names the duration mismatch and deletes the output")
        void verificationFailure() throws Exception {
            // Given
            fixture.probe.encodedDuration(60);
            final Task pending = fixture.pendingTask("movie.mkv");

            // When
            final TaskStatus result = fixture.pipeline.process(pending, new CancellationToken());

            // Then
            assertThat(result).isEqualTo(TaskStatus.FAILED);
            assertThat(fixture.store.getTask(pending.id()).errorMessage())
                    .startsWith("Verification failed: Duration mismatch");
            assertThat(processingFileCount()).isZero();
            assertThat(FakeEncoder.isEncoded(Path.of(pending.sourcePath()))).isFalse();
        }

        @Test
        @DisplayName("Missing source fails the task")
        void missingSource() throws Exception {
            final Task pending = fixture.pendingTask("movie.mkv");
            Files.delete(Path.of(pending.sourcePath()));

            assertThat(fixture.pipeline.process(pending, new CancellationToken())).isEqualTo(TaskStatus.FAILED);
            assertThat(fixture.store.getTask(pending.id()).errorMessage()).contains("Could not probe source");
        }
    }

    @Nested
    @DisplayName("Errors after the install moves")
    class AfterInstall {

        private TaskPipeline pipelineWith(final TaskIndexService store, final FileFingerprint fingerprint) {
            return new TaskPipeline(store, fixture.settingsManager, fixture.probe, fixture.encoder,
                    new OutputVerifier(fixture.probe, 0.01, 1024), fixture.archiver, fingerprint, fixture.progress,
                    fixture.taskLogs, new ReentrantLock(true), fixture.processingDir, "");
        }

        @Test
        @DisplayName("Unreadable installed file still completes the task with its archived original")
        void unreadableInstalledFileStillCompletes() throws Exception {
            // Given: the fingerprint of the converted file cannot be read
            final FileFingerprint failingOnOutput = new FileFingerprint(1024) {
                @Override
                public String compute(final Path file) throws IOException {
                    if (FakeEncoder.isEncoded(file)) {
                        throw new IOException("read error after install");
                    }
                    return super.compute(file);
                }
            };
            final Task pending = fixture.pendingTask("movie.mkv");
            final byte[] original = Files.readAllBytes(Path.of(pending.sourcePath()));

            // When
            final TaskStatus result = pipelineWith(fixture.store, failingOnOutput)
                    .process(pending, new CancellationToken());

            // Then
            assertThat(result).isEqualTo(TaskStatus.COMPLETED);
            final Task task = fixture.store.getTask(pending.id());
            assertThat(task.archivedPath()).isNotNull();
            assertThat(Path.of(task.archivedPath())).hasBinaryContent(original);
            assertThat(task.fingerprint()).isNull();
            assertThat(fixture.store.getStats()).isEqualTo(new ProcessingStats(QueueFixture.SOURCE_SIZE - 20_000L, 1));

            // And: the original can be restored
            fixture.queueService.rollback(task.id());
            assertThat(Path.of(pending.sourcePath())).hasBinaryContent(original);
        }

        @Test
        @DisplayName("Failing to record completion keeps the archived original on the failed task")
        void failedCompletionKeepsArchivedPath() throws Exception {
            // Given
            final Task pending = fixture.pendingTask("movie.mkv");
            final byte[] original = Files.readAllBytes(Path.of(pending.sourcePath()));
            final TaskIndexService store = spy(fixture.store);
            doThrow(new IOException("disk full"))
                    .when(store).update(eq(pending.id()), eq(Set.of(TaskStatus.INSTALLING)), any());

            // When
            final TaskStatus result = pipelineWith(store, fixture.fingerprint)
                    .process(pending, new CancellationToken());

            // Then
            assertThat(result).isEqualTo(TaskStatus.FAILED);
            final Task task = store.getTask(pending.id());
            assertThat(task.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(task.errorMessage())
                    .startsWith("Install failed: Output installed at")
                    .contains("disk full")
                    .contains("Resolve manually");
            assertThat(task.archivedPath())
                    .as("The archived original must stay reachable from the task")
                    .isNotNull();
            assertThat(Path.of(task.archivedPath())).hasBinaryContent(original);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancelled task keeps the source and records the reason")
        void userCancel() throws Exception {
            // Given
            final Task pending = fixture.pendingTask("movie.mkv");
            final CancellationToken token = new CancellationToken();
            token.cancel("Cancelled by user");

            // When
            final TaskStatus result = fixture.pipeline.process(pending, token);

            // Then
            assertThat(result).isEqualTo(TaskStatus.CANCELLED);
            final Task task = fixture.store.getTask(pending.id());
            assertThat(task.errorMessage()).isEqualTo("Cancelled by user");
            assertThat(task.archivedPath()).isNull();
            assertThat(FakeEncoder.isEncoded(Path.of(pending.sourcePath()))).isFalse();
            assertThat(processingFileCount()).isZero();
        }

        @Test
        @DisplayName("Shutdown returns the task to the queue")
        void shutdownRequeues() throws Exception {
            final Task pending = fixture.pendingTask("movie.mkv");
            final CancellationToken token = new CancellationToken();
            token.cancel(QueueController.SHUTDOWN_REASON);

            assertThat(fixture.pipeline.process(pending, token)).isEqualTo(TaskStatus.PENDING);
            assertThat(fixture.store.getTask(pending.id()).status()).isEqualTo(TaskStatus.PENDING);
        }
    }

    @Test
    @DisplayName("A task that is no longer pending is left alone")
    void skipsTaskThatLeftPending() throws Exception {
        // Given
        final Task pending = fixture.pendingTask("movie.mkv");
        fixture.store.update(pending.id(), Set.of(TaskStatus.PENDING), b -> b.status(TaskStatus.TRANSCODING));
        fixture.store.update(pending.id(), Set.of(TaskStatus.TRANSCODING),
                b -> b.status(TaskStatus.CANCELLED).errorMessage("Cancelled by user"));

        // When
        final TaskStatus result = fixture.pipeline.process(pending, new CancellationToken());

        // Then
        assertThat(result).isEqualTo(TaskStatus.CANCELLED);
        assertThat(fixture.encoder.encodedTasks()).isEmpty();
    }
}
