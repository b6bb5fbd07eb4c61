package com.example.hoopstats_backend.video;

/**
 * Windowing parameters for {@link ClipExtractor}.
 *
 * @param clipDurationSec length of each clip in seconds.
 * @param overlap         fraction of a clip shared with the next one, in {@code [0, 1)}.
 * @param maxClips        upper bound on the number of clips produced.
 */
public record ClipSettings(double clipDurationSec, double overlap, int maxClips) {

    public int framesPerClip(double fps) {
        return (int) Math.floor(fps * clipDurationSec);
    }

    public int stride(double fps) {
        return (int) Math.floor(framesPerClip(fps) * (1.0 - overlap));
    }
}
