package de.mirkosertic.mediashrink.encoder;

import de.mirkosertic.mediashrink.config.RuntimeSettings;

import java.nio.file.Path;

/**
 * @param originalDurationSeconds source duration, used to compute fractional progress
 */
public record EncodeRequest(
        long taskId,
        Path input,
        Path output,
        double originalDurationSeconds,
        RuntimeSettings settings
) {
}
