package de.mirkosertic.mediashrink.api.dto;

import java.util.List;

/**
 * Video files a candidate set of ignore patterns would exclude from scanning.
 */
public record IgnoredFilesResponse(
        boolean success,
        List<String> files,
        Integer count,
        String error
) {
    public static IgnoredFilesResponse success(final List<String> files) {
        return new IgnoredFilesResponse(true, files, files.size(), null);
    }

    public static IgnoredFilesResponse error(final String errorMessage) {
        return new IgnoredFilesResponse(false, null, null, errorMessage);
    }
}
