package de.mirkosertic.mediashrink.api.dto;

import java.util.List;
import java.util.Map;

/**
 * Current runtime settings, or the reasons an update was rejected.
 */
public record SettingsResponse(
        boolean success,
        Long version,
        Map<String, Object> settings,
        List<String> violations,
        String error
) {
    public static SettingsResponse success(final long version, final Map<String, Object> settings) {
        return new SettingsResponse(true, version, settings, null, null);
    }

    public static SettingsResponse invalid(final List<String> violations) {
        return new SettingsResponse(false, null, null, violations, "Invalid settings: " + String.join("; ", violations));
    }

    public static SettingsResponse error(final String errorMessage) {
        return new SettingsResponse(false, null, null, null, errorMessage);
    }
}
