package de.mirkosertic.mediashrink.store;

import de.mirkosertic.mediashrink.model.LogLevel;
import de.mirkosertic.mediashrink.model.ProcessingStats;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskLogEntry;
import de.mirkosertic.mediashrink.model.TaskNotFoundException;
import de.mirkosertic.mediashrink.model.TaskPage;
import de.mirkosertic.mediashrink.model.TaskQuery;
import de.mirkosertic.mediashrink.model.TaskStateException;
import de.mirkosertic.mediashrink.model.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskIndexService Tests")
class TaskIndexServiceTest {

    @TempDir
    Path tempDir;

    private TaskIndexService store;

    @BeforeEach
    void setUp() throws IOException {
        store = new TaskIndexService(tempDir.resolve("taskindex"));
        store.init();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (store != null) {
            store.close();
        }
    }

    private Task createPending(final String relativePath, final long size) throws IOException {
        return store.createTask(Task.builder("/media/" + relativePath, relativePath)
                .originalSize(size)
                .originalDuration(120)
                .fileSignals(1000, size, "fp-" + relativePath));
    }

    private Task complete(final Task task, final long newSize) throws Exception {
        store.update(task.id(), Set.of(TaskStatus.PENDING), b -> b.status(TaskStatus.TRANSCODING));
        store.update(task.id(), Set.of(TaskStatus.TRANSCODING), b -> b.status(TaskStatus.VERIFYING));
        store.update(task.id(), Set.of(TaskStatus.VERIFYING), b -> b.status(TaskStatus.INSTALLING));
        return store.update(task.id(), Set.of(TaskStatus.INSTALLING), b -> b
                .status(TaskStatus.COMPLETED)
                .newSize(newSize)
                .archivedPath("/trash/" + task.relativePath())
                .installedPath(task.sourcePath()));
    }

    @Nested
    @DisplayName("Creating and finding tasks")
    class CreateAndFind {

        @Test
        @DisplayName("Should assign increasing ids and queue positions")
        void shouldAssignIdsAndPositions() throws IOException {
            // When
            final Task first = createPending("a.mkv", 1000);
            final Task second = createPending("b.mkv", 2000);

            // Then
            assertThat(second.id()).isGreaterThan(first.id());
            assertThat(second.queuePosition()).isGreaterThan(first.queuePosition());
            assertThat(first.createdAt()).isPositive();
        }

        @Test
        @DisplayName("Should round-trip every field")
        void shouldRoundTripFields() throws Exception {
            // Given
            final Task created = store.createTask(Task.builder("/media/show/ep1.mkv", "show/ep1.mkv")
                    .status(TaskStatus.COMPLETED)
                    .originalSize(5000)
                    .newSize(2000L)
                    .originalDuration(1432.5)
                    .newDuration(1432.25)
                    .errorMessage("old error")
                    .fileSignals(123456L, 2000, "abcdef")
                    .archivedPath("/trash/show/ep1.mkv")
                    .installedPath("/media/show/ep1.mkv"));

            // When
            final Task loaded = store.getTask(created.id());

            // Then
            assertThat(loaded).isEqualTo(created);
        }

        @Test
        @DisplayName("Should find task by current path")
        void shouldFindByCurrentPath() throws Exception {
            // Given: a completed task whose output got a different extension
            final Task task = store.createTask(Task.builder("/media/movie.avi", "movie.avi")
                    .status(TaskStatus.COMPLETED)
                    .newSize(10L)
                    .installedPath("/media/movie.mkv"));

            // Then: lookup works by the installed path, not the old source path
            assertThat(store.findByCurrentPath("/media/movie.mkv")).map(Task::id).contains(task.id());
            assertThat(store.findByCurrentPath("/media/movie.avi")).isEmpty();
        }

        @Test
        @DisplayName("Should throw TaskNotFoundException for unknown ids")
        void shouldThrowForUnknownId() {
            assertThatThrownBy(() -> store.getTask(4711))
                    .isInstanceOf(TaskNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Compare-and-set updates")
    class Updates {

        @Test
        @DisplayName("Should reject update when status does not match")
        void shouldRejectUnexpectedStatus() throws IOException {
            // Given
            final Task task = createPending("a.mkv", 1000);

            // When / Then
            assertThatThrownBy(() -> store.update(task.id(), Set.of(TaskStatus.FAILED),
                    b -> b.status(TaskStatus.PENDING)))
                    .isInstanceOf(TaskStateException.class)
                    .hasMessageContaining("PENDING");
        }

        @Test
        @DisplayName("Should reject illegal transitions")
        void shouldRejectIllegalTransition() throws Exception {
            // Given
            final Task task = createPending("a.mkv", 1000);

            // When / Then
            assertThatThrownBy(() -> store.update(task.id(), Set.of(), b -> b.status(TaskStatus.ROLLED_BACK)))
                    .isInstanceOf(TaskStateException.class)
                    .hasMessageContaining("Illegal transition");
            assertThat(store.getTask(task.id()).status())
                    .as("Task must be unchanged after a rejected update")
                    .isEqualTo(TaskStatus.PENDING);
        }

        @Test
        @DisplayName("Requeue should move the task behind all other pending tasks")
        void requeueMovesToBack() throws Exception {
            // Given: a failed task that was queued first
            final Task first = createPending("a.mkv", 1000);
            createPending("b.mkv", 1000);
            store.update(first.id(), Set.of(TaskStatus.PENDING), b -> b.status(TaskStatus.TRANSCODING));
            store.update(first.id(), Set.of(TaskStatus.TRANSCODING),
                    b -> b.status(TaskStatus.FAILED).errorMessage("boom"));

            // When
            store.requeue(first.id(), TaskStatus.RETRYABLE, b -> b.status(TaskStatus.PENDING).errorMessage(null));

            // Then
            final List<Task> pending = store.findByStatus(Set.of(TaskStatus.PENDING));
            assertThat(pending).extracting(Task::relativePath).containsExactly("b.mkv", "a.mkv");
            assertThat(store.nextPending()).map(Task::relativePath).contains("b.mkv");
            assertThat(store.getTask(first.id()).errorMessage()).isNull();
        }
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("Should filter by status, search path words and paginate newest first")
        void shouldQuery() throws Exception {
            // Given
            createPending("Movies/Alien (1979).mkv", 100);
            createPending("Movies/Aliens (1986).mkv", 100);
            final Task series = createPending("Series/Breaking Bad/S01E01.mkv", 100);
            store.update(series.id(), Set.of(TaskStatus.PENDING), b -> b.status(TaskStatus.TRANSCODING));

            // When: text search uses prefix matching on path words
            final TaskPage aliens = store.query(new TaskQuery(Set.of(), "alien", 0, 10));

            // Then
            assertThat(aliens.total()).isEqualTo(2);
            assertThat(aliens.tasks()).extracting(Task::relativePath)
                    .containsExactly("Movies/Aliens (1986).mkv", "Movies/Alien (1979).mkv");

            // When: status filter
            final TaskPage active = store.query(new TaskQuery(EnumSet.of(TaskStatus.TRANSCODING), null, 0, 10));
            assertThat(active.tasks()).extracting(Task::id).containsExactly(series.id());

            // When: paging
            final TaskPage page = store.query(TaskQuery.all(1, 1));
            assertThat(page.total()).isEqualTo(3);
            assertThat(page.tasks()).hasSize(1);
            assertThat(page.hasMore()).isTrue();
        }

        @Test
        @DisplayName("An offset past the last task returns an empty page")
        void offsetPastEnd() throws IOException {
            // Given
            createPending("a.mkv", 1);

            // When
            final TaskPage page = store.query(TaskQuery.all(TaskQuery.MAX_OFFSET, TaskQuery.MAX_LIMIT));

            // Then
            assertThat(page.tasks()).isEmpty();
            assertThat(page.total()).isEqualTo(1);
            assertThat(page.hasMore()).isFalse();
        }

        @Test
        @DisplayName("Should count tasks per status")
        void shouldCountByStatus() throws IOException {
            createPending("a.mkv", 1);
            createPending("b.mkv", 1);

            final Map<TaskStatus, Long> counts = store.countByStatus();

            assertThat(counts).containsEntry(TaskStatus.PENDING, 2L);
        }
    }

    @Nested
    @DisplayName("Processing stats")
    class Stats {

        @Test
        @DisplayName("Completing a task adds its savings")
        void completingAddsSavings() throws Exception {
            // Given
            final Task a = createPending("a.mkv", 1000);
            final Task b = createPending("b.mkv", 3000);

            // When
            complete(a, 400);
            complete(b, 1000);

            // Then
            assertThat(store.getStats()).isEqualTo(new ProcessingStats(2600, 2));
            assertThat(store.checkStatsInvariant().consistent()).isTrue();
        }

        @Test
        @DisplayName("Rollback and removal subtract the contribution in the same commit")
        void rollbackAndRemovalSubtract() throws Exception {
            // Given
            final Task a = complete(createPending("a.mkv", 1000), 400);
            final Task b = complete(createPending("b.mkv", 3000), 1000);

            // When
            store.update(a.id(), Set.of(TaskStatus.COMPLETED), builder -> builder.status(TaskStatus.ROLLED_BACK));
            store.remove(b.id(), Set.of(TaskStatus.COMPLETED));

            // Then
            assertThat(store.getStats()).isEqualTo(ProcessingStats.EMPTY);
            assertThat(store.checkStatsInvariant().consistent()).isTrue();
        }

        @Test
        @DisplayName("Stats survive a restart")
        void statsArePersisted() throws Exception {
            // Given
            complete(createPending("a.mkv", 1000), 250);
            store.close();

            // When
            store = new TaskIndexService(tempDir.resolve("taskindex"));
            store.init();

            // Then
            assertThat(store.getStats()).isEqualTo(new ProcessingStats(750, 1));
            assertThat(store.getIndexSchemaVersion()).isEqualTo(TaskDocumentMapper.SCHEMA_VERSION);
            assertThat(createPending("b.mkv", 1).id())
                    .as("Id counter must continue after restart")
                    .isGreaterThan(1);
        }
    }

    @Nested
    @DisplayName("Task logs")
    class Logs {

        @Test
        @DisplayName("Should return entries after a sequence number in order")
        void shouldReturnEntriesAfterSequence() throws IOException {
            // Given
            final Task task = createPending("a.mkv", 1);
            final TaskLogEntry first = store.appendLog(task.id(), LogLevel.INFO, "started");
            store.appendLog(task.id(), LogLevel.WARNING, "slow");
            store.appendLog(task.id(), LogLevel.ERROR, "failed");

            // When
            final List<TaskLogEntry> all = store.getLogs(task.id(), 0, 100);
            final List<TaskLogEntry> newer = store.getLogs(task.id(), first.sequence(), 100);

            // Then
            assertThat(all).extracting(TaskLogEntry::message).containsExactly("started", "slow", "failed");
            assertThat(newer).extracting(TaskLogEntry::level).containsExactly(LogLevel.WARNING, LogLevel.ERROR);
        }

        @Test
        @DisplayName("Removing a task removes its log")
        void removingTaskRemovesLogs() throws Exception {
            // Given
            final Task task = createPending("a.mkv", 1);
            store.appendLog(task.id(), LogLevel.INFO, "started");

            // When
            store.remove(task.id(), Set.of());

            // Then
            assertThat(store.getLogs(task.id(), 0, 100)).isEmpty();
            assertThat(store.findById(task.id())).isEmpty();
        }
    }
}
