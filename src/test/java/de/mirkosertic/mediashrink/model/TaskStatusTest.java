package de.mirkosertic.mediashrink.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TaskStatus Tests")
class TaskStatusTest {

    @Test
    @DisplayName("Pipeline moves forward one stage at a time")
    void pipelineMovesForward() {
        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.TRANSCODING)).isTrue();
        assertThat(TaskStatus.TRANSCODING.canTransitionTo(TaskStatus.VERIFYING)).isTrue();
        assertThat(TaskStatus.VERIFYING.canTransitionTo(TaskStatus.INSTALLING)).isTrue();
        assertThat(TaskStatus.INSTALLING.canTransitionTo(TaskStatus.COMPLETED)).isTrue();

        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.INSTALLING))
                .as("Stages cannot be skipped")
                .isFalse();
        assertThat(TaskStatus.TRANSCODING.canTransitionTo(TaskStatus.COMPLETED))
                .as("Verification cannot be skipped")
                .isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"TRANSCODING", "VERIFYING", "INSTALLING"})
    @DisplayName("Active stages can fail, be cancelled or be reset by recovery")
    void activeStagesCanEnd(final TaskStatus status) {
        assertThat(status.isActive()).isTrue();
        assertThat(status.canTransitionTo(TaskStatus.FAILED)).isTrue();
        assertThat(status.canTransitionTo(TaskStatus.CANCELLED)).isTrue();
        assertThat(status.canTransitionTo(TaskStatus.PENDING)).isTrue();
    }

    @Test
    @DisplayName("Only FAILED and CANCELLED are retryable")
    void retryableStatuses() {
        for (final TaskStatus status : TaskStatus.values()) {
            assertThat(status.isRetryable())
                    .as("%s retryable", status)
                    .isEqualTo(status == TaskStatus.FAILED || status == TaskStatus.CANCELLED);
        }
    }

    @Test
    @DisplayName("COMPLETED can only be rolled back and ROLLED_BACK is final")
    void completedAndRolledBack() {
        assertThat(TaskStatus.COMPLETED.canTransitionTo(TaskStatus.ROLLED_BACK)).isTrue();
        assertThat(TaskStatus.COMPLETED.canTransitionTo(TaskStatus.PENDING)).isFalse();
        for (final TaskStatus target : TaskStatus.values()) {
            assertThat(TaskStatus.ROLLED_BACK.canTransitionTo(target))
                    .as("ROLLED_BACK -> %s", target)
                    .isFalse();
        }
    }

    @Test
    @DisplayName("Marker detection may complete waiting tasks directly")
    void markerCompletion() {
        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.COMPLETED)).isTrue();
        assertThat(TaskStatus.FAILED.canTransitionTo(TaskStatus.COMPLETED)).isTrue();
        assertThat(TaskStatus.CANCELLED.canTransitionTo(TaskStatus.COMPLETED)).isTrue();
    }
}
