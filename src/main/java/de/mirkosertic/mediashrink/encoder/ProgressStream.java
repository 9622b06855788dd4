package de.mirkosertic.mediashrink.encoder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Lazily parses the {@code -progress} output of ffmpeg into {@link ProgressEvent}s.
 * <p>
 * The output consists of {@code key=value} lines grouped into blocks, each block terminated by a
 * {@code progress=continue} or {@code progress=end} line. The stream can only be consumed once;
 * restarting means re-launching the encoder.
 */
public class ProgressStream implements Iterator<ProgressEvent> {

    private static final Logger logger = LoggerFactory.getLogger(ProgressStream.class);

    private final BufferedReader reader;
    private ProgressEvent next;
    private boolean exhausted;

    public ProgressStream(final Reader reader) {
        this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
    }

    /**
     * @throws UncheckedIOException if reading the underlying stream fails
     */
    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        try {
            next = readBlock();
        } catch (final IOException e) {
            exhausted = true;
            throw new UncheckedIOException(e);
        }
        if (next == null) {
            exhausted = true;
        }
        return next != null;
    }

    @Override
    public ProgressEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        final ProgressEvent event = next;
        next = null;
        return event;
    }

    private ProgressEvent readBlock() throws IOException {
        final Map<String, String> values = new HashMap<>();
        String line;
        while ((line = reader.readLine()) != null) {
            final int separator = line.indexOf('=');
            if (separator <= 0) {
                continue;
            }
            final String key = line.substring(0, separator).trim();
            final String value = line.substring(separator + 1).trim();
            if ("progress".equals(key)) {
                return toEvent(values, "end".equals(value));
            }
            values.put(key, value);
        }
        // Output ended without a terminating progress line
        return null;
    }

    static ProgressEvent toEvent(final Map<String, String> values, final boolean finished) {
        return new ProgressEvent(
                parseLong(values.get("frame")),
                parseDouble(values.get("fps")),
                parseSpeed(values.get("speed")),
                parseOutTime(values),
                finished
        );
    }

    private static long parseOutTime(final Map<String, String> values) {
        // out_time_ms carries microseconds as well, a long-standing ffmpeg quirk
        final long micros = parseLong(values.get("out_time_us"));
        if (micros > 0) {
            return micros;
        }
        final long millisKey = parseLong(values.get("out_time_ms"));
        if (millisKey > 0) {
            return millisKey;
        }
        return parseClock(values.get("out_time"));
    }

    /**
     * Parses "HH:MM:SS.ffffff" into microseconds.
     */
    static long parseClock(final String value) {
        if (value == null || value.isEmpty() || value.startsWith("-")) {
            return 0;
        }
        final String[] parts = value.split(":");
        if (parts.length != 3) {
            return 0;
        }
        try {
            final double seconds = Long.parseLong(parts[0]) * 3600.0
                    + Long.parseLong(parts[1]) * 60.0
                    + Double.parseDouble(parts[2]);
            return Math.round(seconds * 1_000_000);
        } catch (final NumberFormatException e) {
            logger.debug("Unparseable out_time: {}", value);
            return 0;
        }
    }

    private static double parseSpeed(final String value) {
        if (value == null) {
            return 0;
        }
        final String trimmed = value.endsWith("x") ? value.substring(0, value.length() - 1) : value;
        return parseDouble(trimmed.trim());
    }

    private static long parseLong(final String value) {
        if (value == null || value.isEmpty() || "N/A".equals(value)) {
            return 0;
        }
        try {
            return Long.parseLong(value);
        } catch (final NumberFormatException e) {
            return 0;
        }
    }

    private static double parseDouble(final String value) {
        if (value == null || value.isEmpty() || "N/A".equals(value)) {
            return 0;
        }
        try {
            final double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? parsed : 0;
        } catch (final NumberFormatException e) {
            return 0;
        }
    }
}
