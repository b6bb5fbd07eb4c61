package com.example.hoopstats_backend.video;

import java.util.List;

/**
 * Fixed-length window of consecutive frames.
 *
 * @param startFrame index of the first frame of the window in the source video.
 * @param frames     consecutive frames, oldest first.
 * @param fps        frame rate of the source video.
 */
public record Clip(int startFrame, List<VideoFrame> frames, double fps) {

    public Clip {
        frames = List.copyOf(frames);
    }

    public int size() {
        return frames.size();
    }

    /** Seconds from the start of the video to the first frame of this clip. */
    public double timestampSec() {
        return fps > 0 ? startFrame / fps : 0.0;
    }

    public VideoFrame middleFrame() {
        return frames.get(frames.size() / 2);
    }
}
