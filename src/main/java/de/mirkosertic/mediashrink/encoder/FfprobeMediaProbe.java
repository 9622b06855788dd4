package de.mirkosertic.mediashrink.encoder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * {@link MediaProbe} backed by ffprobe's JSON output.
 */
public class FfprobeMediaProbe implements MediaProbe {

    private static final Logger logger = LoggerFactory.getLogger(FfprobeMediaProbe.class);

    private final String ffprobeBinary;
    private final long timeoutMs;
    private final ObjectMapper objectMapper;

    public FfprobeMediaProbe(final String ffprobeBinary, final long timeoutMs) {
        this.ffprobeBinary = ffprobeBinary;
        this.timeoutMs = timeoutMs;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public MediaInfo probe(final Path file) throws IOException {
        final List<String> command = List.of(ffprobeBinary, "-v", "quiet", "-print_format", "json",
                "-show_format", "-show_streams", file.toString());

        final Process process = new ProcessBuilder(command)
                .redirectError(ProcessBuilder.Redirect.DISCARD)
                .start();
        final JsonNode root;
        try (final InputStream stdout = process.getInputStream()) {
            root = objectMapper.readTree(stdout);
        } catch (final IOException e) {
            process.destroyForcibly();
            throw new IOException("Unreadable ffprobe output for " + file, e);
        }

        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new IOException("ffprobe timed out after " + timeoutMs + "ms for " + file);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("Interrupted while probing " + file, e);
        }

        if (process.exitValue() != 0) {
            throw new IOException("ffprobe exited with code " + process.exitValue() + " for " + file);
        }
        if (root == null || root.isMissingNode()) {
            throw new IOException("ffprobe returned no data for " + file);
        }
        final MediaInfo info = parse(root);
        logger.debug("Probed {}: {}", file, info);
        return info;
    }

    /**
     * Extracts the fields of interest from {@code -show_format -show_streams} JSON.
     */
    static MediaInfo parse(final JsonNode root) {
        final JsonNode format = root.path("format");
        double duration = 0;
        final String durationText = format.path("duration").asText("");
        if (!durationText.isEmpty()) {
            try {
                duration = Double.parseDouble(durationText);
            } catch (final NumberFormatException e) {
                logger.debug("Unparseable duration: {}", durationText);
            }
        }

        int video = 0;
        int audio = 0;
        int subtitle = 0;
        for (final JsonNode stream : root.path("streams")) {
            final String type = stream.path("codec_type").asText("");
            switch (type) {
                case "video" -> {
                    // Cover art is exposed as a video stream but is not a video track
                    if (stream.path("disposition").path("attached_pic").asInt(0) == 0) {
                        video++;
                    }
                }
                case "audio" -> audio++;
                case "subtitle" -> subtitle++;
                default -> {
                }
            }
        }

        return new MediaInfo(duration, video, audio, subtitle, findTag(format.path("tags"), "comment"));
    }

    private static String findTag(final JsonNode tags, final String name) {
        // Containers differ in tag casing (comment vs COMMENT)
        final Iterator<Map.Entry<String, JsonNode>> fields = tags.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (field.getKey().toLowerCase(Locale.ROOT).equals(name)) {
                return field.getValue().asText();
            }
        }
        return null;
    }
}
