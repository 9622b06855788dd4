package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.model.CurrentProgress;
import de.mirkosertic.mediashrink.model.Task;

/**
 * Full task record. {@code progress} is only set while the task is the active one.
 */
public record TaskDetailResponse(
        boolean success,
        Task task,
        long savedBytes,
        CurrentProgress progress,
        String error
) {
    public static TaskDetailResponse success(final Task task, final CurrentProgress progress) {
        return new TaskDetailResponse(true, task, task.savedBytes(), progress, null);
    }

    public static TaskDetailResponse error(final String errorMessage) {
        return new TaskDetailResponse(false, null, 0, null, errorMessage);
    }
}
