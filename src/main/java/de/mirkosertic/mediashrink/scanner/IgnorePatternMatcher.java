package de.mirkosertic.mediashrink.scanner;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * gitignore-style matching of paths relative to the source root.
 * <p>
 * Supported: blank lines and {@code #} comments, {@code !} negation (last matching line wins),
 * trailing {@code /} for directories only, and anchoring by a leading or inner {@code /}.
 * Unanchored patterns match at any depth. A path below an ignored directory is always ignored.
 */
public class IgnorePatternMatcher {

    private final List<Rule> rules;

    /**
     * @throws IllegalArgumentException if a pattern is not a valid glob
     */
    public IgnorePatternMatcher(final List<String> patterns) {
        final List<Rule> compiled = new ArrayList<>();
        for (final String line : patterns) {
            final Rule rule = Rule.parse(line);
            if (rule != null) {
                compiled.add(rule);
            }
        }
        this.rules = List.copyOf(compiled);
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public boolean isIgnored(final String relativePath, final boolean directory) {
        if (rules.isEmpty() || relativePath.isEmpty()) {
            return false;
        }
        final Path path = Paths.get(relativePath);
        for (int i = 1; i < path.getNameCount(); i++) {
            if (matches(path.subpath(0, i), true)) {
                return true;
            }
        }
        return matches(path, directory);
    }

    private boolean matches(final Path path, final boolean directory) {
        boolean ignored = false;
        for (final Rule rule : rules) {
            if (rule.directoryOnly() && !directory) {
                continue;
            }
            if (rule.matches(path)) {
                ignored = !rule.negated();
            }
        }
        return ignored;
    }

    private record Rule(List<PathMatcher> matchers, boolean negated, boolean directoryOnly) {

        static Rule parse(final String line) {
            if (line == null) {
                return null;
            }
            String pattern = line.strip();
            if (pattern.isEmpty() || pattern.startsWith("#")) {
                return null;
            }

            boolean negated = false;
            if (pattern.startsWith("!")) {
                negated = true;
                pattern = pattern.substring(1);
            }
            boolean directoryOnly = false;
            if (pattern.endsWith("/")) {
                directoryOnly = true;
                pattern = pattern.substring(0, pattern.length() - 1);
            }
            final boolean anchored = pattern.contains("/");
            while (pattern.startsWith("/")) {
                pattern = pattern.substring(1);
            }
            if (pattern.isEmpty()) {
                return null;
            }

            final List<PathMatcher> matchers = new ArrayList<>();
            matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
            if (!anchored) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:**/" + pattern));
            }
            return new Rule(matchers, negated, directoryOnly);
        }

        boolean matches(final Path path) {
            for (final PathMatcher matcher : matchers) {
                if (matcher.matches(path)) {
                    return true;
                }
            }
            return false;
        }
    }
}
