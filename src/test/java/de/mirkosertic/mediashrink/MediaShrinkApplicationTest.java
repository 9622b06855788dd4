package de.mirkosertic.mediashrink;

import de.mirkosertic.mediashrink.api.MediaShrinkOperations;
import de.mirkosertic.mediashrink.api.ResponseJson;
import de.mirkosertic.mediashrink.api.dto.CommandPreviewResponse;
import de.mirkosertic.mediashrink.api.dto.ListTasksRequest;
import de.mirkosertic.mediashrink.api.dto.SettingsResponse;
import de.mirkosertic.mediashrink.api.dto.StatsResponse;
import de.mirkosertic.mediashrink.api.dto.TaskActionResponse;
import de.mirkosertic.mediashrink.api.dto.TaskListResponse;
import de.mirkosertic.mediashrink.api.dto.TaskLogsResponse;
import de.mirkosertic.mediashrink.api.dto.TaskSummary;
import de.mirkosertic.mediashrink.config.ApplicationConfig;
import de.mirkosertic.mediashrink.encoder.FakeEncoder;
import de.mirkosertic.mediashrink.encoder.FakeMediaProbe;
import de.mirkosertic.mediashrink.model.TaskStatus;
import de.mirkosertic.mediashrink.scanner.ScanResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MediaShrinkApplication Tests")
class MediaShrinkApplicationTest {

    private static final int SOURCE_SIZE = 100_000;

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private FakeEncoder encoder;
    private MediaShrinkApplication app;
    private MediaShrinkOperations operations;

    @BeforeEach
    void setUp() throws Exception {
        sourceDir = Files.createDirectories(tempDir.resolve("source"));

        final ApplicationConfig config = ApplicationConfig.defaults();
        config.setSourceDir(sourceDir);
        config.setTempDir(tempDir.resolve("temp"));
        config.setConfigDir(tempDir.resolve("config"));
        config.setScanOnStartup(false);
        config.setMinOutputBytes(1024);
        config.setWorkerPollIntervalMs(50);

        encoder = new FakeEncoder();
        app = new MediaShrinkApplication(config, new FakeMediaProbe(config.getMarker()), encoder);
        app.init();
        operations = app.getOperations();
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.shutdown();
        }
    }

    private Path writeSource(final String relativePath) throws IOException {
        final Path file = sourceDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        final byte[] content = new byte[SOURCE_SIZE];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i % 251);
        }
        return Files.write(file, content);
    }

    private List<TaskSummary> awaitTasks(final TaskStatus status, final int expected, final long timeoutMs)
            throws InterruptedException {
        final ListTasksRequest request = new ListTasksRequest(List.of(status.name()), null, null, null);
        final long deadline = System.currentTimeMillis() + timeoutMs;
        TaskListResponse response = operations.listTasks(request);
        while (response.tasks().size() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(25);
            response = operations.listTasks(request);
        }
        return response.tasks();
    }

    @Nested
    @DisplayName("Processing lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Scan, transcode, and roll back a file through the operations")
        void shouldProcessAndRollBack() throws Exception {
            // Given
            final Path movie = writeSource("Movies/movie.mkv");
            final byte[] original = Files.readAllBytes(movie);

            // When: a scan discovers the file and the worker picks it up
            final ScanResult scan = app.getScanner().scan().orElseThrow();
            final List<TaskSummary> completed = awaitTasks(TaskStatus.COMPLETED, 1, 10_000);

            // Then
            assertThat(scan.tasksCreated()).isEqualTo(1);
            assertThat(completed).hasSize(1);
            final TaskSummary task = completed.get(0);
            assertThat(task.relativePath()).isEqualTo("Movies/movie.mkv");
            assertThat(task.savedBytes()).isEqualTo(SOURCE_SIZE - 20_000);
            assertThat(FakeEncoder.isEncoded(movie))
                    .as("Converted file must replace the original in place")
                    .isTrue();

            final StatsResponse stats = operations.getStats();
            assertThat(stats.success()).isTrue();
            assertThat(stats.totalSavedBytes()).isEqualTo(SOURCE_SIZE - 20_000L);
            assertThat(stats.totalProcessedFiles()).isEqualTo(1L);
            assertThat(stats.tasksByStatus()).containsEntry("COMPLETED", 1L);

            final TaskLogsResponse logs = operations.getTaskLogs(task.id(), 0, 0);
            assertThat(logs.entries()).isNotEmpty();

            // When: the user restores the original
            final TaskActionResponse rollback = operations.rollbackTask(task.id());

            // Then
            assertThat(rollback.success()).as("Rollback error: %s", rollback.error()).isTrue();
            assertThat(rollback.status()).isEqualTo("ROLLED_BACK");
            assertThat(Files.readAllBytes(movie)).isEqualTo(original);
            assertThat(operations.getStats().totalSavedBytes()).isZero();
            assertThat(operations.getStats().totalProcessedFiles()).isZero();
        }

        @Test
        @DisplayName("Rescan after completion should not queue the converted file again")
        void rescanSkipsConvertedFile() throws Exception {
            // Given
            writeSource("Series/episode.mkv");
            app.getScanner().scan();
            awaitTasks(TaskStatus.COMPLETED, 1, 10_000);

            // When
            final ScanResult rescan = app.getScanner().scan().orElseThrow();

            // Then
            assertThat(rescan.tasksCreated()).isZero();
            assertThat(awaitTasks(TaskStatus.PENDING, 0, 0)).isEmpty();
            assertThat(encoder.encodedTasks()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Operation errors")
    class Errors {

        @Test
        @DisplayName("Unknown task ids are reported, not thrown")
        void unknownTaskIsReported() {
            // When
            final TaskActionResponse response = operations.retryTask(4711);

            // Then
            assertThat(response.success()).isFalse();
            assertThat(response.error()).contains("4711");
            assertThat(ResponseJson.isError(response)).isTrue();
            assertThat(operations.getTask(4711).success()).isFalse();
        }

        @Test
        @DisplayName("Invalid listing requests are reported")
        void invalidListingIsReported() {
            // When
            final TaskListResponse response = operations.listTasks(
                    new ListTasksRequest(List.of("SLEEPING"), null, null, null));

            // Then
            assertThat(response.success()).isFalse();
            assertThat(response.error()).contains("Unknown status: SLEEPING");
        }

        @Test
        @DisplayName("Invalid settings are rejected with every violation and the version stays")
        void invalidSettingsAreRejected() {
            // Given
            final long versionBefore = operations.getSettings().version();

            // When
            final SettingsResponse response = operations.updateSettings(Map.of("video-crf", 99, "video-preset", -1));

            // Then
            assertThat(response.success()).isFalse();
            assertThat(response.violations()).hasSize(2);
            assertThat(operations.getSettings().version()).isEqualTo(versionBefore);
        }
    }

    @Nested
    @DisplayName("Settings")
    class Settings {

        @Test
        @DisplayName("Accepted update bumps the version")
        void updateBumpsVersion() {
            // Given
            final long versionBefore = operations.getSettings().version();

            // When
            final SettingsResponse response = operations.updateSettings(Map.of("video-crf", 28));

            // Then
            assertThat(response.success()).isTrue();
            assertThat(response.version()).isEqualTo(versionBefore + 1);
            assertThat(response.settings()).containsEntry("video-crf", 28);
        }

        @Test
        @DisplayName("Command preview renders candidate settings without saving them")
        void previewDoesNotSave() {
            // When
            final CommandPreviewResponse preview = operations.previewCommand(Map.of("video-crf", 40));

            // Then
            assertThat(preview.success()).isTrue();
            assertThat(preview.arguments()).containsSequence("-crf", "40");
            assertThat(preview.commandLine()).contains("-crf 40");
            assertThat(operations.getSettings().settings()).containsEntry("video-crf", 30);
        }
    }

    @Nested
    @DisplayName("Queue control")
    class QueueControl {

        @Test
        @DisplayName("Pause and resume are reflected in the queue status")
        void pauseAndResume() {
            // When
            operations.pauseQueue(false);

            // Then
            assertThat(operations.getQueueStatus().paused()).isTrue();
            assertThat(operations.getQueueStatus().workerRunning()).isTrue();

            // When
            operations.resumeQueue();

            // Then
            assertThat(operations.getQueueStatus().paused()).isFalse();
        }

        @Test
        @DisplayName("Scan status is idle before any scan")
        void scanStatusIsIdleInitially() {
            assertThat(operations.getScanStatus().scanning()).isFalse();
            assertThat(operations.getScanStatus().phase()).isEqualTo("IDLE");
        }
    }
}
