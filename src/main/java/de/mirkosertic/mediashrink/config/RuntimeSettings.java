package de.mirkosertic.mediashrink.config;

import de.mirkosertic.mediashrink.encoder.ArgumentTokenizer;
import de.mirkosertic.mediashrink.scanner.IgnorePatternMatcher;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Operator-editable settings. Immutable; a change produces a new {@link SettingsSnapshot}.
 *
 * @param maxThreads         encoder thread limit, 0 for no limit
 * @param maxLongSide        cap for the longer frame side in pixels, 0 for no cap
 * @param maxShortSide       cap for the shorter frame side in pixels, 0 for no cap
 * @param maxFps             frame rate cap, 0 for no cap
 * @param extraArgs          free-form encoder arguments appended last
 * @param archiveDir         target directory for {@link OriginalFileStrategy#ARCHIVE}
 * @param scanIgnorePatterns gitignore-style patterns relative to the source root
 */
public record RuntimeSettings(
        int videoPreset,
        int videoCrf,
        int videoFilmGrain,
        int videoBitDepth,
        String audioBitrate,
        int maxThreads,
        int maxLongSide,
        int maxShortSide,
        int maxFps,
        String extraArgs,
        OriginalFileStrategy originalFileStrategy,
        @Nullable String archiveDir,
        boolean startPaused,
        List<String> scanIgnorePatterns
) {

    private static final Pattern BITRATE = Pattern.compile("[1-9][0-9]*k");

    public RuntimeSettings {
        audioBitrate = audioBitrate == null ? "" : audioBitrate.trim();
        extraArgs = extraArgs == null ? "" : extraArgs.trim();
        archiveDir = archiveDir == null || archiveDir.isBlank() ? null : archiveDir.trim();
        scanIgnorePatterns = scanIgnorePatterns == null ? List.of() : List.copyOf(scanIgnorePatterns);
    }

    public static RuntimeSettings defaults() {
        return new RuntimeSettings(6, 30, 0, 10, "64k", 0, 0, 0, 30, "",
                OriginalFileStrategy.TRASH, null, false, List.of());
    }

    /**
     * @throws ConfigException listing every value outside its declared range
     */
    public RuntimeSettings validate() throws ConfigException {
        final List<String> violations = new ArrayList<>();
        checkRange(violations, "video-preset", videoPreset, 0, 13);
        checkRange(violations, "video-crf", videoCrf, 0, 63);
        checkRange(violations, "video-film-grain", videoFilmGrain, 0, 50);
        if (videoBitDepth != 8 && videoBitDepth != 10) {
            violations.add("video-bit-depth must be 8 or 10, was " + videoBitDepth);
        }
        if (!BITRATE.matcher(audioBitrate).matches()) {
            violations.add("audio-bitrate must look like '64k', was '" + audioBitrate + "'");
        }
        checkRange(violations, "max-threads", maxThreads, 0, 256);
        checkRange(violations, "max-long-side", maxLongSide, 0, 16384);
        checkRange(violations, "max-short-side", maxShortSide, 0, 16384);
        if (maxLongSide > 0 && maxShortSide > maxLongSide) {
            violations.add("max-short-side (" + maxShortSide + ") must not exceed max-long-side (" + maxLongSide + ")");
        }
        checkRange(violations, "max-fps", maxFps, 0, 240);
        try {
            ArgumentTokenizer.tokenize(extraArgs);
        } catch (final IllegalArgumentException e) {
            violations.add("extra-args: " + e.getMessage());
        }
        try {
            new IgnorePatternMatcher(scanIgnorePatterns);
        } catch (final IllegalArgumentException e) {
            violations.add("scan-ignore-patterns: " + e.getMessage());
        }
        if (originalFileStrategy == null) {
            violations.add("original-file-strategy must be one of TRASH, ARCHIVE");
        } else if (originalFileStrategy == OriginalFileStrategy.ARCHIVE) {
            if (archiveDir == null) {
                violations.add("archive-dir is required when original-file-strategy is ARCHIVE");
            } else if (!Paths.get(archiveDir).isAbsolute()) {
                violations.add("archive-dir must be an absolute path, was '" + archiveDir + "'");
            }
        }
        if (!violations.isEmpty()) {
            throw new ConfigException(violations);
        }
        return this;
    }

    private static void checkRange(final List<String> violations, final String name, final int value,
                                   final int min, final int max) {
        if (value < min || value > max) {
            violations.add(name + " must be between " + min + " and " + max + ", was " + value);
        }
    }

    public @Nullable Path archivePath() {
        return archiveDir == null ? null : Paths.get(archiveDir);
    }

    public Map<String, Object> toMap() {
        final Map<String, Object> map = new LinkedHashMap<>();
        map.put("video-preset", videoPreset);
        map.put("video-crf", videoCrf);
        map.put("video-film-grain", videoFilmGrain);
        map.put("video-bit-depth", videoBitDepth);
        map.put("audio-bitrate", audioBitrate);
        map.put("max-threads", maxThreads);
        map.put("max-long-side", maxLongSide);
        map.put("max-short-side", maxShortSide);
        map.put("max-fps", maxFps);
        map.put("extra-args", extraArgs);
        map.put("original-file-strategy", originalFileStrategy.name());
        map.put("archive-dir", archiveDir == null ? "" : archiveDir);
        map.put("start-paused", startPaused);
        map.put("scan-ignore-patterns", new ArrayList<>(scanIgnorePatterns));
        return map;
    }

    /**
     * Reads settings from a map, falling back to {@code base} for absent keys. Does not validate ranges.
     *
     * @throws ConfigException if a value has the wrong type
     */
    public static RuntimeSettings fromMap(final Map<String, Object> map, final RuntimeSettings base)
            throws ConfigException {
        final List<String> violations = new ArrayList<>();
        final RuntimeSettings settings = new RuntimeSettings(
                intValue(map, "video-preset", base.videoPreset, violations),
                intValue(map, "video-crf", base.videoCrf, violations),
                intValue(map, "video-film-grain", base.videoFilmGrain, violations),
                intValue(map, "video-bit-depth", base.videoBitDepth, violations),
                stringValue(map, "audio-bitrate", base.audioBitrate),
                intValue(map, "max-threads", base.maxThreads, violations),
                intValue(map, "max-long-side", base.maxLongSide, violations),
                intValue(map, "max-short-side", base.maxShortSide, violations),
                intValue(map, "max-fps", base.maxFps, violations),
                stringValue(map, "extra-args", base.extraArgs),
                strategyValue(map, base.originalFileStrategy, violations),
                stringValue(map, "archive-dir", base.archiveDir),
                booleanValue(map, "start-paused", base.startPaused, violations),
                patternsValue(map, base.scanIgnorePatterns, violations)
        );
        if (!violations.isEmpty()) {
            throw new ConfigException(violations);
        }
        return settings;
    }

    private static int intValue(final Map<String, Object> map, final String key, final int fallback,
                                final List<String> violations) {
        final Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (final NumberFormatException e) {
            violations.add(key + " must be an integer, was '" + value + "'");
            return fallback;
        }
    }

    private static String stringValue(final Map<String, Object> map, final String key, final String fallback) {
        final Object value = map.get(key);
        return value == null ? fallback : value.toString();
    }

    private static boolean booleanValue(final Map<String, Object> map, final String key, final boolean fallback,
                                        final List<String> violations) {
        final Object value = map.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        final String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if ("true".equals(text) || "false".equals(text)) {
            return Boolean.parseBoolean(text);
        }
        violations.add(key + " must be true or false, was '" + value + "'");
        return fallback;
    }

    private static OriginalFileStrategy strategyValue(final Map<String, Object> map,
                                                      final OriginalFileStrategy fallback,
                                                      final List<String> violations) {
        final Object value = map.get("original-file-strategy");
        if (value == null) {
            return fallback;
        }
        try {
            return OriginalFileStrategy.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            violations.add("original-file-strategy must be one of TRASH, ARCHIVE, was '" + value + "'");
            return fallback;
        }
    }

    private static List<String> patternsValue(final Map<String, Object> map, final List<String> fallback,
                                              final List<String> violations) {
        final Object value = map.get("scan-ignore-patterns");
        if (value == null) {
            return fallback;
        }
        if (value instanceof List<?> list) {
            final List<String> patterns = new ArrayList<>();
            for (final Object item : list) {
                if (item != null) {
                    patterns.add(item.toString());
                }
            }
            return patterns;
        }
        // A single multi-line string, one pattern per line
        if (value instanceof String text) {
            return List.of(text.split("\\R"));
        }
        violations.add("scan-ignore-patterns must be a list of strings");
        return fallback;
    }
}
