package de.mirkosertic.mediashrink.verifier;

import de.mirkosertic.mediashrink.encoder.MediaInfo;
import de.mirkosertic.mediashrink.encoder.MediaProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Gate between encode and install: an output only replaces its source if it exists, has a plausible
 * size, contains video and lasts as long as the source within the configured tolerance.
 */
public class OutputVerifier {

    private static final Logger logger = LoggerFactory.getLogger(OutputVerifier.class);

    private final MediaProbe probe;
    private final double durationTolerance;
    private final long minOutputBytes;

    public OutputVerifier(final MediaProbe probe, final double durationTolerance, final long minOutputBytes) {
        this.probe = probe;
        this.durationTolerance = durationTolerance;
        this.minOutputBytes = minOutputBytes;
    }

    /**
     * Probes the output and checks it.
     *
     * @return the probed output, for the new duration
     * @throws VerificationException naming every failed check
     */
    public MediaInfo verify(final double originalDuration, final Path output) throws VerificationException {
        if (!Files.isRegularFile(output)) {
            throw new VerificationException("Output file is missing: " + output);
        }
        final MediaInfo info;
        try {
            info = probe.probe(output);
        } catch (final IOException e) {
            throw new VerificationException("Output file cannot be probed: " + e.getMessage());
        }
        final VerificationResult result = check(originalDuration, output, info);
        if (!result.passed()) {
            throw new VerificationException(result.failureMessage());
        }
        return info;
    }

    /**
     * Applies all rules to an already probed output.
     */
    public VerificationResult check(final double originalDuration, final Path output, final MediaInfo info) {
        final List<String> failures = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        long size = -1;
        try {
            size = Files.size(output);
        } catch (final IOException e) {
            failures.add("Output file size cannot be read: " + e.getMessage());
        }
        if (size >= 0 && size < minOutputBytes) {
            failures.add("Output file too small: " + size + " bytes (minimum " + minOutputBytes + " bytes)");
        }

        if (!info.hasVideoStream()) {
            failures.add("Output file contains no video stream");
        }

        final String durationFailure = checkDuration(originalDuration, info.durationSeconds());
        if (durationFailure != null) {
            failures.add(durationFailure);
        }
        if (originalDuration <= 0) {
            warnings.add("Original duration unknown, duration check skipped");
            logger.warn("Original duration of {} unknown, skipping duration check", output);
        }

        return new VerificationResult(failures, warnings);
    }

    /**
     * @return a failure message, or null if within tolerance or the original duration is unknown
     */
    String checkDuration(final double originalDuration, final double newDuration) {
        if (originalDuration <= 0) {
            return null;
        }
        final double difference = Math.abs(newDuration - originalDuration) / originalDuration;
        if (difference <= durationTolerance) {
            return null;
        }
        return String.format(Locale.ROOT,
                "Duration mismatch: output is %s%% %s than the original (%ss -> %ss), tolerance is %s%%",
                percent(difference),
                newDuration < originalDuration ? "shorter" : "longer",
                seconds(originalDuration),
                seconds(newDuration),
                percent(durationTolerance));
    }

    private static String percent(final double fraction) {
        return new DecimalFormat("0.#", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(fraction * 100);
    }

    private static String seconds(final double value) {
        return new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT)).format(value);
    }
}
