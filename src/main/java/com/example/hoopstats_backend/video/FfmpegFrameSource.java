package com.example.hoopstats_backend.video;

import com.example.hoopstats_backend.exception.VideoSourceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Decodes a video through an {@code ffmpeg} child process writing raw {@code rgb24} frames to stdout.
 * Stream geometry and frame rate come from {@code ffprobe}. ffmpeg applies rotation metadata while decoding,
 * so a stream rotated by 90 or 270 degrees is read with width and height swapped.
 */
public class FfmpegFrameSource implements FrameSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegFrameSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long PROBE_TIMEOUT_SEC = 30;
    private static final long DECODER_EXIT_TIMEOUT_SEC = 10;

    private final Path video;
    private final VideoProbe probe;
    private final Process decoder;
    private final StderrTail stderr;
    private final InputStream frames;
    private final byte[] frameBuffer;
    private int nextIndex;
    private boolean exhausted;
    private boolean closed;

    FfmpegFrameSource(Path video, VideoProbe probe, Process decoder, StderrTail stderr) {
        this.video = video;
        this.probe = probe;
        this.decoder = decoder;
        this.stderr = stderr;
        this.frames = new BufferedInputStream(decoder.getInputStream(), 1 << 20);
        this.frameBuffer = new byte[probe.width() * probe.height() * 3];
    }

    public static FfmpegFrameSource open(Path video, String ffmpegBin, String ffprobeBin) {
        if (video == null || !Files.isRegularFile(video)) {
            throw new VideoSourceException("Could not open video: " + video);
        }
        VideoProbe probe = probe(video, ffprobeBin);
        List<String> cmd = List.of(
                ffmpegBin, "-hide_banner", "-nostats", "-v", "error",
                "-i", video.toAbsolutePath().toString(),
                "-f", "rawvideo",
                "-pix_fmt", "rgb24",
                "-"
        );
        try {
            Process p = new ProcessBuilder(cmd).redirectErrorStream(false).start();
            StderrTail stderr = StderrTail.drain(p.getErrorStream());
            LOGGER.info("Video: {} frames at {} fps ({}x{}, rotation {}) file={}", probe.totalFrames(),
                    String.format(Locale.ROOT, "%.2f", probe.fps()), probe.width(), probe.height(), probe.rotation(), video);
            return new FfmpegFrameSource(video, probe, p, stderr);
        } catch (IOException e) {
            throw new VideoSourceException("Could not start ffmpeg for " + video, e);
        }
    }

    static VideoProbe probe(Path video, String ffprobeBin) {
        List<String> cmd = List.of(
                ffprobeBin, "-v", "error",
                "-select_streams", "v:0",
                "-show_streams",
                "-of", "json",
                video.toAbsolutePath().toString()
        );
        try {
            Process p = new ProcessBuilder(cmd)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            String json = new String(p.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            if (!p.waitFor(PROBE_TIMEOUT_SEC, TimeUnit.SECONDS)) {
                p.destroyForcibly();
                throw new VideoSourceException("ffprobe timed out for " + video);
            }
            if (p.exitValue() != 0) {
                throw new VideoSourceException("Could not open video: " + video + " (ffprobe exit " + p.exitValue() + ")");
            }
            return parseProbe(json);
        } catch (IOException e) {
            throw new VideoSourceException("ffprobe failed for " + video, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VideoSourceException("Interrupted while probing " + video, e);
        }
    }

    static VideoProbe parseProbe(String json) throws IOException {
        JsonNode streams = MAPPER.readTree(json).path("streams");
        if (!streams.isArray() || streams.isEmpty()) {
            throw new VideoSourceException("No video stream found");
        }
        JsonNode s = streams.get(0);
        int width = s.path("width").asInt(0);
        int height = s.path("height").asInt(0);
        if (width <= 0 || height <= 0) {
            throw new VideoSourceException("Video stream has no dimensions");
        }
        double fps = parseRate(s.path("avg_frame_rate").asText(""));
        if (fps <= 0) {
            fps = parseRate(s.path("r_frame_rate").asText(""));
        }
        int totalFrames = s.path("nb_frames").asInt(0);
        int rotation = rotation(s);
        if (rotation % 180 != 0) {
            return new VideoProbe(height, width, fps, totalFrames, rotation);
        }
        return new VideoProbe(width, height, fps, totalFrames, rotation);
    }

    /** Rotation in degrees, normalised to 0, 90, 180 or 270. Newer ffprobe reports it as display-matrix side data. */
    static int rotation(JsonNode stream) {
        int degrees = 0;
        for (JsonNode side : stream.path("side_data_list")) {
            if (side.has("rotation")) {
                degrees = side.path("rotation").asInt(0);
                break;
            }
        }
        if (degrees == 0) {
            degrees = stream.path("tags").path("rotate").asInt(0);
        }
        return Math.floorMod(Math.round(degrees / 90.0f) * 90, 360);
    }

    /** Parses ffprobe rationals such as {@code 30000/1001}; {@code 0} when undefined. */
    static double parseRate(String rate) {
        if (rate == null || rate.isBlank()) {
            return 0.0;
        }
        int slash = rate.indexOf('/');
        try {
            if (slash < 0) {
                return Double.parseDouble(rate);
            }
            double num = Double.parseDouble(rate.substring(0, slash));
            double den = Double.parseDouble(rate.substring(slash + 1));
            return den == 0 ? 0.0 : num / den;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    @Override
    public double fps() {
        return probe.fps();
    }

    @Override
    public int totalFrames() {
        return probe.totalFrames();
    }

    @Override
    public VideoFrame grab() {
        if (closed || exhausted) {
            return null;
        }
        try {
            int read = frames.readNBytes(frameBuffer, 0, frameBuffer.length);
            if (read < frameBuffer.length) {
                exhausted = true;
                finishDecoding(read);
                return null;
            }
        } catch (IOException e) {
            throw new VideoSourceException("Frame read failed at index " + nextIndex + " of " + video, e);
        }
        return new VideoFrame(nextIndex++, toImage(frameBuffer, probe.width(), probe.height()));
    }

    /** End of stdout: the decoder must have exited cleanly after at least one frame. */
    private void finishDecoding(int trailingBytes) {
        int exit;
        try {
            if (!decoder.waitFor(DECODER_EXIT_TIMEOUT_SEC, TimeUnit.SECONDS)) {
                decoder.destroyForcibly();
                throw new VideoSourceException("ffmpeg did not exit after end of stream for " + video);
            }
            exit = decoder.exitValue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VideoSourceException("Interrupted while waiting for ffmpeg on " + video, e);
        }
        if (exit != 0 || nextIndex == 0) {
            stderr.awaitEnd();
        }
        if (exit != 0) {
            throw new VideoSourceException("Could not decode video: " + video + " (ffmpeg exit " + exit
                    + " after " + nextIndex + " frames)" + stderr.describe());
        }
        if (nextIndex == 0) {
            throw new VideoSourceException("Could not decode video: " + video + " (no frames)" + stderr.describe());
        }
        if (trailingBytes > 0) {
            LOGGER.warn("Dropped truncated final frame file={} bytes={}", video, trailingBytes);
        }
        LOGGER.debug("ffmpeg finished file={} frames={}", video, nextIndex);
    }

    private static BufferedImage toImage(byte[] rgb, int width, int height) {
        int[] pixels = new int[width * height];
        for (int i = 0, p = 0; i < pixels.length; i++, p += 3) {
            pixels[i] = ((rgb[p] & 0xFF) << 16) | ((rgb[p + 1] & 0xFF) << 8) | (rgb[p + 2] & 0xFF);
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            frames.close();
        } catch (IOException e) {
            LOGGER.debug("Closing ffmpeg stdout failed file={} err={}", video, e.toString());
        }
        decoder.destroy();
    }

    /** Width and height are the decoded frame geometry, after rotation. */
    record VideoProbe(int width, int height, double fps, int totalFrames, int rotation) {
    }

    /** Last lines ffmpeg wrote to stderr, kept for error messages. */
    static final class StderrTail {
        private static final int MAX_LINES = 20;

        private final Deque<String> lines = new ArrayDeque<>();
        private Thread reader;

        static StderrTail drain(InputStream err) {
            StderrTail tail = new StderrTail();
            Thread t = new Thread(() -> {
                try (var br = new BufferedReader(new InputStreamReader(err, StandardCharsets.UTF_8))) {
                    br.lines().forEach(line -> {
                        LOGGER.debug("[ffmpeg-err] {}", line);
                        tail.add(line);
                    });
                } catch (IOException | RuntimeException e) {
                    LOGGER.debug("ffmpeg stderr reader stopped: {}", e.toString());
                }
            }, "ffmpeg-stderr");
            t.setDaemon(true);
            tail.reader = t;
            t.start();
            return tail;
        }

        /** Gives the reader a moment to pick up the last lines of an exited process. */
        void awaitEnd() {
            if (reader == null) {
                return;
            }
            try {
                reader.join(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        synchronized void add(String line) {
            if (lines.size() == MAX_LINES) {
                lines.removeFirst();
            }
            lines.addLast(line);
        }

        synchronized String describe() {
            return lines.isEmpty() ? "" : ": " + String.join(" | ", lines);
        }
    }
}
