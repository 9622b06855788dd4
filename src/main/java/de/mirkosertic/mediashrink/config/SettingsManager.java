package de.mirkosertic.mediashrink.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Persists the runtime settings as one key-value blob in settings.yaml and publishes them as
 * versioned {@link SettingsSnapshot}s.
 * <p>
 * Updates are validated before they are written; a rejected update leaves both the file and the
 * published snapshot untouched.
 */
public class SettingsManager {

    private static final Logger logger = LoggerFactory.getLogger(SettingsManager.class);

    private final Path settingsPath;
    private final Yaml yaml;
    private final AtomicReference<SettingsSnapshot> current =
            new AtomicReference<>(new SettingsSnapshot(0, RuntimeSettings.defaults()));

    public SettingsManager(final Path settingsPath) {
        this.settingsPath = settingsPath;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    /**
     * Loads persisted settings, or writes the defaults if there are none yet. A file that cannot be
     * parsed or fails validation is logged and replaced by the defaults in memory only.
     */
    public synchronized void init() throws IOException {
        if (!Files.exists(settingsPath)) {
            save(RuntimeSettings.defaults());
            logger.info("Created default settings file: {}", settingsPath);
            current.set(new SettingsSnapshot(1, RuntimeSettings.defaults()));
            return;
        }

        try (final Reader reader = Files.newBufferedReader(settingsPath)) {
            final Map<String, Object> map = yaml.load(reader);
            final RuntimeSettings settings = RuntimeSettings.fromMap(
                    map == null ? Map.of() : map, RuntimeSettings.defaults()).validate();
            current.set(new SettingsSnapshot(1, settings));
            logger.info("Loaded settings from {}", settingsPath);
        } catch (final ConfigException e) {
            logger.error("Persisted settings in {} are invalid, using defaults: {}", settingsPath, e.getViolations());
            current.set(new SettingsSnapshot(1, RuntimeSettings.defaults()));
        } catch (final YAMLException | ClassCastException e) {
            logger.error("Failed to parse settings file {}, using defaults", settingsPath, e);
            current.set(new SettingsSnapshot(1, RuntimeSettings.defaults()));
        }
    }

    public SettingsSnapshot current() {
        return current.get();
    }

    /**
     * Validates, persists and publishes new settings.
     *
     * @throws ConfigException if any value is out of range; the previous snapshot stays active
     */
    public synchronized SettingsSnapshot update(final RuntimeSettings candidate) throws ConfigException, IOException {
        candidate.validate();
        save(candidate);
        final SettingsSnapshot previous = current.get();
        final SettingsSnapshot next = new SettingsSnapshot(previous.version() + 1, candidate);
        current.set(next);
        logger.info("Settings updated to version {}", next.version());
        return next;
    }

    /**
     * Applies the given keys on top of the current settings.
     */
    public synchronized SettingsSnapshot update(final Map<String, Object> changes) throws ConfigException, IOException {
        return update(RuntimeSettings.fromMap(changes, current.get().settings()));
    }

    public Path getSettingsPath() {
        return settingsPath;
    }

    private void save(final RuntimeSettings settings) throws IOException {
        final Path parent = settingsPath.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
        }

        final Map<String, Object> root = new HashMap<>(settings.toMap());
        final Path temp = settingsPath.resolveSibling(settingsPath.getFileName() + ".tmp");
        try (final Writer writer = Files.newBufferedWriter(temp)) {
            yaml.dump(root, writer);
        }
        try {
            Files.move(temp, settingsPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(temp, settingsPath, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
