package de.mirkosertic.mediashrink.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskQuery Tests")
class TaskQueryTest {

    @Test
    @DisplayName("Largest offset still leaves room for the largest page")
    void largestWindowFitsIntoInt() {
        final TaskQuery query = TaskQuery.all(TaskQuery.MAX_OFFSET, TaskQuery.MAX_LIMIT);

        assertThat(query.offset() + query.limit())
                .as("offset + limit must not overflow")
                .isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    @DisplayName("Should reject offsets whose window would overflow")
    void rejectsOverflowingOffset() {
        assertThatThrownBy(() -> TaskQuery.all(Integer.MAX_VALUE, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("offset");
        assertThatThrownBy(() -> TaskQuery.all(-1, 10))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Status set is copied")
    void copiesStatuses() {
        final EnumSet<TaskStatus> statuses = EnumSet.of(TaskStatus.FAILED);
        final TaskQuery query = new TaskQuery(statuses, null, 0, 10);

        statuses.add(TaskStatus.PENDING);

        assertThat(query.statuses()).containsExactly(TaskStatus.FAILED);
    }
}
