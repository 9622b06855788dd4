package de.mirkosertic.mediashrink.encoder;

import de.mirkosertic.mediashrink.config.RuntimeSettings;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the ffmpeg invocation for one encode. Pure: the same settings and paths always yield the
 * same argument list, which is also what the command preview shows.
 * <p>
 * Structure: the first video stream is re-encoded to AV1 (SVT-AV1), every audio stream to Opus,
 * subtitle, attachment and data streams are copied, global metadata and chapters are kept, and the
 * processed marker is written into the container comment.
 */
public class EncoderCommandBuilder {

    static final Path PREVIEW_INPUT = Paths.get("/input.mkv");
    static final Path PREVIEW_OUTPUT = Paths.get("/output.mkv");

    private final String ffmpegBinary;
    private final String marker;

    public EncoderCommandBuilder(final String ffmpegBinary, final String marker) {
        this.ffmpegBinary = ffmpegBinary;
        this.marker = marker;
    }

    public List<String> build(final RuntimeSettings settings, final Path input, final Path output) {
        final List<String> command = new ArrayList<>();
        command.add(ffmpegBinary);
        command.add("-hide_banner");
        command.add("-nostdin");
        command.add("-y");
        command.add("-progress");
        command.add("pipe:1");
        command.add("-nostats");
        command.add("-i");
        command.add(input.toString());

        // Streams: first video, all optional audio/subtitle/attachment/data
        add(command, "-map", "0:v:0");
        add(command, "-map", "0:a?");
        add(command, "-map", "0:s?");
        add(command, "-map", "0:t?");
        add(command, "-map", "0:d?");
        add(command, "-map_metadata", "0");
        add(command, "-map_chapters", "0");

        // Video
        add(command, "-c:v", "libsvtav1");
        add(command, "-preset", Integer.toString(settings.videoPreset()));
        add(command, "-crf", Integer.toString(settings.videoCrf()));
        add(command, "-svtav1-params", "film-grain=" + settings.videoFilmGrain());
        add(command, "-pix_fmt", settings.videoBitDepth() == 10 ? "yuv420p10le" : "yuv420p");

        final String scaleFilter = scaleFilter(settings.maxLongSide(), settings.maxShortSide());
        if (scaleFilter != null) {
            add(command, "-vf", scaleFilter);
        }
        if (settings.maxFps() > 0) {
            add(command, "-fpsmax", Integer.toString(settings.maxFps()));
        }

        // Audio, always re-encoded
        add(command, "-c:a", "libopus");
        add(command, "-b:a", settings.audioBitrate());
        add(command, "-vbr", "on");

        // Everything else untouched
        add(command, "-c:s", "copy");
        add(command, "-c:t", "copy");
        add(command, "-c:d", "copy");

        add(command, "-metadata", "comment=" + marker);

        if (settings.maxThreads() > 0) {
            add(command, "-threads", Integer.toString(settings.maxThreads()));
        }

        command.addAll(ArgumentTokenizer.tokenize(settings.extraArgs()));
        command.add(output.toString());
        return command;
    }

    /**
     * The argument list for placeholder paths, for operators to audit before saving settings.
     */
    public List<String> preview(final RuntimeSettings settings) {
        return build(settings, PREVIEW_INPUT, PREVIEW_OUTPUT);
    }

    /**
     * Renders an argument list as a copy-pasteable shell command line.
     */
    public static String render(final List<String> command) {
        final StringBuilder line = new StringBuilder();
        for (final String argument : command) {
            if (line.length() > 0) {
                line.append(' ');
            }
            if (argument.isEmpty() || argument.matches(".*[\\s'\"\\\\$`()*?;&|<>].*")) {
                line.append('\'').append(argument.replace("'", "'\\''")).append('\'');
            } else {
                line.append(argument);
            }
        }
        return line.toString();
    }

    /**
     * Scale filter that keeps the frame within the long/short side caps in either orientation,
     * never upscales and keeps even dimensions. Null when no cap is set.
     */
    static String scaleFilter(final int maxLongSide, final int maxShortSide) {
        if (maxLongSide <= 0 && maxShortSide <= 0) {
            return null;
        }
        final String width = "if(gte(iw,ih)," + cap("iw", maxLongSide) + "," + cap("iw", maxShortSide) + ")";
        final String height = "if(gte(iw,ih)," + cap("ih", maxShortSide) + "," + cap("ih", maxLongSide) + ")";
        return "scale=w='" + width + "':h='" + height + "'"
                + ":force_original_aspect_ratio=decrease:force_divisible_by=2";
    }

    private static String cap(final String dimension, final int limit) {
        return limit > 0 ? "min(" + dimension + "," + limit + ")" : dimension;
    }

    private static void add(final List<String> command, final String option, final String value) {
        command.add(option);
        command.add(value);
    }
}
