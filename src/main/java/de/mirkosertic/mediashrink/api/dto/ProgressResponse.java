package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.model.CurrentProgress;

public record ProgressResponse(
        boolean success,
        boolean active,
        Long taskId,
        String status,
        double fps,
        double speed,
        double fraction,
        Double etaSeconds,
        String error
) {
    public static ProgressResponse from(final CurrentProgress progress) {
        if (progress.isIdle()) {
            return new ProgressResponse(true, false, null, null, 0, 0, 0, null, null);
        }
        return new ProgressResponse(true, true, progress.taskId(), progress.status().name(), progress.fps(),
                progress.speed(), progress.fraction(), progress.etaSeconds(), null);
    }
}
