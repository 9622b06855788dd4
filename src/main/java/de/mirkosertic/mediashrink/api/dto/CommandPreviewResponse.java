package de.mirkosertic.mediashrink.api.dto;

import java.util.List;

/**
 * The encoder command the given settings would produce, with placeholder input and output paths.
 */
public record CommandPreviewResponse(
        boolean success,
        List<String> arguments,
        String commandLine,
        List<String> violations,
        String error
) {
    public static CommandPreviewResponse success(final List<String> arguments, final String commandLine) {
        return new CommandPreviewResponse(true, arguments, commandLine, null, null);
    }

    public static CommandPreviewResponse invalid(final List<String> violations) {
        return new CommandPreviewResponse(false, null, null, violations,
                "Invalid settings: " + String.join("; ", violations));
    }

    public static CommandPreviewResponse error(final String errorMessage) {
        return new CommandPreviewResponse(false, null, null, null, errorMessage);
    }
}
