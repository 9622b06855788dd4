package de.mirkosertic.mediashrink.config;

import java.util.List;

/**
 * Settings rejected by validation. The previously active settings stay in effect.
 */
public class ConfigException extends Exception {

    private final List<String> violations;

    public ConfigException(final List<String> violations) {
        super("Invalid settings: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigException(final String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
