package de.mirkosertic.mediashrink.queue;

import de.mirkosertic.mediashrink.archive.RollbackException;
import de.mirkosertic.mediashrink.encoder.FakeEncoder;
import de.mirkosertic.mediashrink.model.ProcessingStats;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskStateException;
import de.mirkosertic.mediashrink.model.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskQueueService Tests")
class TaskQueueServiceTest {

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

    private Task completed(final String relativePath) throws Exception {
        final Task pending = fixture.pendingTask(relativePath);
        fixture.pipeline.process(pending, new CancellationToken());
        return fixture.store.getTask(pending.id());
    }

    @Nested
    @DisplayName("Retry")
    class Retry {

        @Test
        @DisplayName("Failed task goes to the end of the queue with its error cleared")
        void retryFailedTask() throws Exception {
            // Given
            fixture.encoder.mode(FakeEncoder.Mode.FAIL);
            final Task failed = fixture.pendingTask("a.mkv");
            fixture.pipeline.process(failed, new CancellationToken());
            final Task other = fixture.pendingTask("b.mkv");

            // When
            final Task retried = fixture.queueService.retry(failed.id());

            // Then
            assertThat(retried.status()).isEqualTo(TaskStatus.PENDING);
            assertThat(retried.errorMessage()).isNull();
            assertThat(fixture.store.nextPending()).map(Task::id).contains(other.id());
        }

        @Test
        @DisplayName("Only failed or cancelled tasks can be retried")
        void retryRejectsOtherStatuses() throws Exception {
            final Task pending = fixture.pendingTask("a.mkv");

            assertThatThrownBy(() -> fixture.queueService.retry(pending.id()))
                    .isInstanceOf(TaskStateException.class);
        }
    }

    @Nested
    @DisplayName("Cancel")
    class Cancel {

        @Test
        @DisplayName("Cancelling a task that is not running is rejected")
        void cancelRejectsInactiveTask() throws Exception {
            final Task pending = fixture.pendingTask("a.mkv");

            assertThatThrownBy(() -> fixture.queueService.cancel(pending.id()))
                    .isInstanceOf(TaskStateException.class)
                    .hasMessageContaining("PENDING");
        }

        @Test
        @DisplayName("Cancelling the running task ends it as CANCELLED")
        void cancelRunningTask() throws Exception {
            // Given
            fixture.encoder.mode(FakeEncoder.Mode.BLOCK_UNTIL_CANCELLED);
            final Task task = fixture.pendingTask("a.mkv");
            fixture.worker.start();
            assertThat(fixture.encoder.awaitStarted(10_000)).isTrue();

            // When
            fixture.queueService.cancel(task.id());

            // Then
            final Task cancelled = fixture.awaitStatus(task.id(), TaskStatus.CANCELLED, 10_000);
            assertThat(cancelled.status()).isEqualTo(TaskStatus.CANCELLED);
            assertThat(cancelled.errorMessage()).isEqualTo("Cancelled by user");
            assertThat(FakeEncoder.isEncoded(Path.of(task.sourcePath()))).isFalse();
        }
    }

    @Nested
    @DisplayName("Rollback")
    class Rollback {

        @Test
        @DisplayName("Should restore the original and subtract the savings")
        void rollbackRestoresOriginal() throws Exception {
            // Given
            final Task pending = fixture.pendingTask("Movies/movie.mkv");
            final byte[] original = Files.readAllBytes(Path.of(pending.sourcePath()));
            fixture.pipeline.process(pending, new CancellationToken());
            final Task done = fixture.store.getTask(pending.id());
            assertThat(fixture.store.getStats().totalProcessedFiles()).isEqualTo(1);

            // When
            final Task rolledBack = fixture.queueService.rollback(done.id());

            // Then
            assertThat(rolledBack.status()).isEqualTo(TaskStatus.ROLLED_BACK);
            assertThat(Path.of(done.sourcePath())).hasBinaryContent(original);
            assertThat(Path.of(done.archivedPath())).doesNotExist();
            assertThat(fixture.store.getStats()).isEqualTo(ProcessingStats.EMPTY);
            assertThat(fixture.store.checkStatsInvariant().consistent()).isTrue();
        }

        @Test
        @DisplayName("Missing archived original refuses the rollback and keeps the task")
        void rollbackWithoutArchive() throws Exception {
            // Given
            final Task done = completed("movie.mkv");
            Files.delete(Path.of(done.archivedPath()));

            // When / Then
            assertThatThrownBy(() -> fixture.queueService.rollback(done.id()))
                    .isInstanceOf(RollbackException.class);
            assertThat(fixture.store.getTask(done.id()).status()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(FakeEncoder.isEncoded(Path.of(done.sourcePath()))).isTrue();
        }

        @Test
        @DisplayName("Only completed tasks can be rolled back")
        void rollbackRejectsPending() throws Exception {
            final Task pending = fixture.pendingTask("movie.mkv");

            assertThatThrownBy(() -> fixture.queueService.rollback(pending.id()))
                    .isInstanceOf(TaskStateException.class);
        }
    }

    @Test
    @DisplayName("Status reports pause flag, worker state and pending count")
    void status() throws Exception {
        fixture.pendingTask("a.mkv");
        fixture.pendingTask("b.mkv");
        fixture.queueService.pause(false);

        final QueueStatus status = fixture.queueService.status();

        assertThat(status.paused()).isTrue();
        assertThat(status.workerRunning()).isFalse();
        assertThat(status.activeTaskId()).isNull();
        assertThat(status.pendingTasks()).isEqualTo(2);
    }
}
