package com.example.hoopstats_backend.video;

import com.example.hoopstats_backend.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Cuts a frame stream into overlapping fixed-length clips.
 * <p>
 * Frames are buffered until the buffer holds {@code framesPerClip} frames; the buffer is then emitted as a clip
 * and its first {@code stride} frames are dropped, the remainder seeding the next clip.
 */
@Component
public class ClipExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClipExtractor.class);

    /**
     * Starts a lazy extraction over {@code source}. Settings are validated eagerly.
     *
     * @throws InvalidConfigurationException when the frame rate or windowing settings cannot produce a clip.
     */
    public ClipCursor extract(FrameSource source, ClipSettings settings) {
        double fps = source.fps();
        validate(fps, settings);
        int framesPerClip = settings.framesPerClip(fps);
        int stride = settings.stride(fps);
        LOGGER.info("Clip extraction fps={} framesPerClip={} stride={} maxClips={}",
                String.format(Locale.ROOT, "%.2f", fps), framesPerClip, stride, settings.maxClips());
        return new ClipCursor(source, fps, framesPerClip, stride, settings.maxClips());
    }

    static void validate(double fps, ClipSettings settings) {
        if (settings == null) {
            throw new InvalidConfigurationException("Clip settings are required");
        }
        if (Double.isNaN(fps) || fps <= 0) {
            throw new InvalidConfigurationException("Invalid frame rate: " + fps);
        }
        if (Double.isNaN(settings.clipDurationSec()) || settings.clipDurationSec() <= 0) {
            throw new InvalidConfigurationException("Invalid clip duration: " + settings.clipDurationSec());
        }
        if (Double.isNaN(settings.overlap()) || settings.overlap() < 0 || settings.overlap() >= 1) {
            throw new InvalidConfigurationException("Clip overlap must be in [0,1): " + settings.overlap());
        }
        if (settings.maxClips() < 0) {
            throw new InvalidConfigurationException("maxClips must not be negative: " + settings.maxClips());
        }
        int framesPerClip = settings.framesPerClip(fps);
        if (framesPerClip <= 0) {
            throw new InvalidConfigurationException("Clip of " + settings.clipDurationSec() + "s at " + fps + " fps has no frames");
        }
        if (settings.stride(fps) < 1) {
            throw new InvalidConfigurationException("Overlap " + settings.overlap() + " leaves a zero stride for " + framesPerClip + " frames per clip");
        }
    }

    /**
     * Finite, non-restartable iterator over clips. Blocks on the underlying frame source.
     */
    public static final class ClipCursor implements Iterator<Clip> {
        private final FrameSource source;
        private final double fps;
        private final int framesPerClip;
        private final int stride;
        private final int maxClips;
        private final Deque<VideoFrame> buffer = new ArrayDeque<>();
        private Clip pending;
        private boolean exhausted;
        private int framesRead;
        private int clipsEmitted;

        private ClipCursor(FrameSource source, double fps, int framesPerClip, int stride, int maxClips) {
            this.source = source;
            this.fps = fps;
            this.framesPerClip = framesPerClip;
            this.stride = stride;
            this.maxClips = maxClips;
        }

        @Override
        public boolean hasNext() {
            if (pending != null) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            pending = advance();
            return pending != null;
        }

        @Override
        public Clip next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more clips");
            }
            Clip clip = pending;
            pending = null;
            return clip;
        }

        private Clip advance() {
            while (clipsEmitted < maxClips) {
                VideoFrame frame = source.grab();
                if (frame == null) {
                    break;
                }
                framesRead++;
                buffer.addLast(frame);
                if (buffer.size() == framesPerClip) {
                    Clip clip = new Clip(buffer.peekFirst().index(), new ArrayList<>(buffer), fps);
                    for (int i = 0; i < stride; i++) {
                        buffer.pollFirst();
                    }
                    clipsEmitted++;
                    if (clipsEmitted % 10 == 0) {
                        LOGGER.info("Extracted {} clips so far...", clipsEmitted);
                    }
                    return clip;
                }
            }
            exhausted = true;
            buffer.clear();
            LOGGER.info("Total clips extracted: {} (frames read {})", clipsEmitted, framesRead);
            return null;
        }

        public double fps() {
            return fps;
        }

        public int framesRead() {
            return framesRead;
        }

        public int clipsEmitted() {
            return clipsEmitted;
        }
    }
}
