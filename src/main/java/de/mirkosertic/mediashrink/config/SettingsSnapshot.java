package de.mirkosertic.mediashrink.config;

/**
 * A published version of the runtime settings. The worker takes one snapshot per task and never
 * re-reads settings mid-encode.
 */
public record SettingsSnapshot(long version, RuntimeSettings settings) {
}
