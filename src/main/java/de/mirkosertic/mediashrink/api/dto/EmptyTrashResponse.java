package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.archive.EmptyTrashResult;

public record EmptyTrashResponse(
        boolean success,
        Long deletedFiles,
        Long freedBytes,
        Long failedFiles,
        String error
) {
    public static EmptyTrashResponse success(final EmptyTrashResult result) {
        return new EmptyTrashResponse(true, result.deletedFiles(), result.freedBytes(), result.failedFiles(), null);
    }

    public static EmptyTrashResponse error(final String errorMessage) {
        return new EmptyTrashResponse(false, null, null, null, errorMessage);
    }
}
