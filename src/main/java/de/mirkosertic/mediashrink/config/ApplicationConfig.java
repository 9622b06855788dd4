package de.mirkosertic.mediashrink.config;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Bootstrap configuration of MediaShrink. Operator-editable encoder settings live in
 * {@link SettingsManager} instead.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables (MEDIASHRINK_*)
 * 2. System properties (mediashrink.*)
 * 3. User config file (~/.mediashrink/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_SOURCE_DIR = "MEDIASHRINK_SOURCE_DIR";
    private static final String ENV_TEMP_DIR = "MEDIASHRINK_TEMP_DIR";
    private static final String ENV_CONFIG_DIR = "MEDIASHRINK_CONFIG_DIR";
    private static final String ENV_FFMPEG = "MEDIASHRINK_FFMPEG";
    private static final String ENV_FFPROBE = "MEDIASHRINK_FFPROBE";
    private static final String PROP_PROFILE = "mediashrink.profile";
    private static final String USER_CONFIG_DIR = ".mediashrink";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private static final String PROCESSING_DIR = "processing";
    private static final String TRASH_DIR = "trash";
    private static final String TASK_INDEX_DIR = "taskindex";
    private static final String SETTINGS_FILE = "settings.yaml";

    // Paths
    private String sourceDir = "/source";
    private String tempDir = "/temp";
    private String configDir = Paths.get(System.getProperty("user.home"), USER_CONFIG_DIR).toString();

    // Scanner
    private List<String> videoExtensions = List.of(
            ".mkv", ".mp4", ".avi", ".mov", ".wmv", ".flv",
            ".webm", ".m4v", ".ts", ".mts", ".m2ts"
    );
    private int fingerprintSampleBytes = 64 * 1024;
    private boolean scanOnStartup = true;

    // Encoder
    private String ffmpegBinary = "ffmpeg";
    private String ffprobeBinary = "ffprobe";
    private String marker = "MediaShrink-Processed";
    private String outputExtension = "";
    private long cancelGracePeriodMs = 10_000;
    private long probeTimeoutMs = 60_000;

    // Verifier
    private double durationTolerance = 0.01;
    private long minOutputBytes = 10_240;

    // Worker
    private long workerPollIntervalMs = 5_000;

    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        config.loadFromClasspath();
        config.loadFromUserConfig();
        config.applyEnvironmentOverrides();
        config.determineProfile();

        logger.info("Configuration loaded: sourceDir={}, tempDir={}, configDir={}, deployedMode={}",
                config.sourceDir, config.tempDir, config.configDir, config.deployedMode);

        return config;
    }

    /**
     * Classpath defaults only, ignoring user file and environment.
     */
    public static ApplicationConfig defaults() {
        final ApplicationConfig config = new ApplicationConfig();
        config.loadFromClasspath();
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    void applyYamlConfig(final Map<String, Object> config) {
        final Map<?, ?> root = section(config, "mediashrink");
        if (root == null) {
            return;
        }

        final Map<?, ?> paths = section(root, "paths");
        if (paths != null) {
            if (paths.get("source-dir") != null) {
                this.sourceDir = resolveVariables(paths.get("source-dir").toString());
            }
            if (paths.get("temp-dir") != null) {
                this.tempDir = resolveVariables(paths.get("temp-dir").toString());
            }
            if (paths.get("config-dir") != null) {
                this.configDir = resolveVariables(paths.get("config-dir").toString());
            }
        }

        final Map<?, ?> scanner = section(root, "scanner");
        if (scanner != null) {
            if (scanner.get("video-extensions") instanceof List<?> configured) {
                final List<String> extensions = new ArrayList<>();
                for (final Object extension : configured) {
                    extensions.add(normalizeExtension(extension.toString()));
                }
                this.videoExtensions = extensions;
            }
            if (scanner.containsKey("fingerprint-sample-bytes")) {
                this.fingerprintSampleBytes = ((Number) scanner.get("fingerprint-sample-bytes")).intValue();
            }
            if (scanner.containsKey("scan-on-startup")) {
                this.scanOnStartup = (Boolean) scanner.get("scan-on-startup");
            }
        }

        final Map<?, ?> encoder = section(root, "encoder");
        if (encoder != null) {
            if (encoder.get("ffmpeg-binary") != null) {
                this.ffmpegBinary = encoder.get("ffmpeg-binary").toString();
            }
            if (encoder.get("ffprobe-binary") != null) {
                this.ffprobeBinary = encoder.get("ffprobe-binary").toString();
            }
            if (encoder.get("marker") != null) {
                this.marker = encoder.get("marker").toString();
            }
            if (encoder.containsKey("output-extension")) {
                final Object extension = encoder.get("output-extension");
                this.outputExtension = extension == null ? "" : normalizeExtension(extension.toString());
            }
            if (encoder.containsKey("cancel-grace-period-ms")) {
                this.cancelGracePeriodMs = ((Number) encoder.get("cancel-grace-period-ms")).longValue();
            }
            if (encoder.containsKey("probe-timeout-ms")) {
                this.probeTimeoutMs = ((Number) encoder.get("probe-timeout-ms")).longValue();
            }
        }

        final Map<?, ?> verifier = section(root, "verifier");
        if (verifier != null) {
            if (verifier.containsKey("duration-tolerance")) {
                this.durationTolerance = ((Number) verifier.get("duration-tolerance")).doubleValue();
            }
            if (verifier.containsKey("min-output-bytes")) {
                this.minOutputBytes = ((Number) verifier.get("min-output-bytes")).longValue();
            }
        }

        final Map<?, ?> worker = section(root, "worker");
        if (worker != null && worker.containsKey("poll-interval-ms")) {
            this.workerPollIntervalMs = ((Number) worker.get("poll-interval-ms")).longValue();
        }
    }

    private static @Nullable Map<?, ?> section(final Map<?, ?> parent, final String key) {
        return parent.get(key) instanceof Map<?, ?> child ? child : null;
    }

    private void applyEnvironmentOverrides() {
        this.sourceDir = override(ENV_SOURCE_DIR, "mediashrink.source.dir", sourceDir);
        this.tempDir = override(ENV_TEMP_DIR, "mediashrink.temp.dir", tempDir);
        this.configDir = override(ENV_CONFIG_DIR, "mediashrink.config.dir", configDir);
        this.ffmpegBinary = override(ENV_FFMPEG, "mediashrink.ffmpeg", ffmpegBinary);
        this.ffprobeBinary = override(ENV_FFPROBE, "mediashrink.ffprobe", ffprobeBinary);
    }

    private static String override(final String envName, final String propertyName, final String current) {
        final String envValue = System.getenv(envName);
        if (envValue != null && !envValue.trim().isEmpty()) {
            logger.info("{} from environment: {}", envName, envValue.trim());
            return envValue.trim();
        }
        final String propValue = System.getProperty(propertyName);
        if (propValue != null && !propValue.isEmpty()) {
            return propValue;
        }
        return current;
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables like ${VAR:default}, where the default may itself contain variables.
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        final StringBuilder result = new StringBuilder();
        int position = 0;
        while (position < value.length()) {
            final int start = value.indexOf("${", position);
            if (start < 0) {
                result.append(value, position, value.length());
                break;
            }
            final int end = findClosingBrace(value, start + 2);
            if (end < 0) {
                result.append(value, position, value.length());
                break;
            }
            result.append(value, position, start);

            final String expression = value.substring(start + 2, end);
            final int colon = expression.indexOf(':');
            final String name = colon < 0 ? expression : expression.substring(0, colon);
            final String defaultValue = colon < 0 ? "" : expression.substring(colon + 1);

            // Environment first, then system properties
            String replacement = System.getenv(name);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(name);
            }
            if (replacement == null || replacement.isEmpty()) {
                replacement = resolveVariables(defaultValue);
            }
            result.append(replacement);
            position = end + 1;
        }
        return result.toString();
    }

    private static int findClosingBrace(final String value, final int from) {
        int depth = 1;
        for (int i = from; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String normalizeExtension(final String extension) {
        final String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty() || trimmed.startsWith(".")) {
            return trimmed;
        }
        return "." + trimmed;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), USER_CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters
    public Path getSourceDir() {
        return Paths.get(sourceDir).toAbsolutePath().normalize();
    }

    public void setSourceDir(final Path sourceDir) {
        this.sourceDir = sourceDir.toString();
    }

    public Path getTempDir() {
        return Paths.get(tempDir).toAbsolutePath().normalize();
    }

    public void setTempDir(final Path tempDir) {
        this.tempDir = tempDir.toString();
    }

    public Path getConfigDir() {
        return Paths.get(configDir).toAbsolutePath().normalize();
    }

    public void setConfigDir(final Path configDir) {
        this.configDir = configDir.toString();
    }

    /**
     * Encoder output, mirrored by relative path. Wiped on every startup.
     */
    public Path getProcessingDir() {
        return getTempDir().resolve(PROCESSING_DIR);
    }

    public Path getTrashDir() {
        return getTempDir().resolve(TRASH_DIR);
    }

    public Path getTaskIndexPath() {
        return getConfigDir().resolve(TASK_INDEX_DIR);
    }

    public Path getSettingsPath() {
        return getConfigDir().resolve(SETTINGS_FILE);
    }

    public List<String> getVideoExtensions() {
        return videoExtensions;
    }

    public int getFingerprintSampleBytes() {
        return fingerprintSampleBytes;
    }

    public boolean isScanOnStartup() {
        return scanOnStartup;
    }

    public void setScanOnStartup(final boolean scanOnStartup) {
        this.scanOnStartup = scanOnStartup;
    }

    public String getFfmpegBinary() {
        return ffmpegBinary;
    }

    public String getFfprobeBinary() {
        return ffprobeBinary;
    }

    public String getMarker() {
        return marker;
    }

    /**
     * Extension of encoded outputs including the dot, empty to keep the source extension.
     */
    public String getOutputExtension() {
        return outputExtension;
    }

    public void setOutputExtension(final String outputExtension) {
        this.outputExtension = outputExtension == null ? "" : normalizeExtension(outputExtension);
    }

    public long getCancelGracePeriodMs() {
        return cancelGracePeriodMs;
    }

    public long getProbeTimeoutMs() {
        return probeTimeoutMs;
    }

    public double getDurationTolerance() {
        return durationTolerance;
    }

    public void setDurationTolerance(final double durationTolerance) {
        this.durationTolerance = durationTolerance;
    }

    public long getMinOutputBytes() {
        return minOutputBytes;
    }

    public void setMinOutputBytes(final long minOutputBytes) {
        this.minOutputBytes = minOutputBytes;
    }

    public long getWorkerPollIntervalMs() {
        return workerPollIntervalMs;
    }

    public void setWorkerPollIntervalMs(final long workerPollIntervalMs) {
        this.workerPollIntervalMs = workerPollIntervalMs;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
