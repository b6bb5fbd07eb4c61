package com.example.hoopstats_backend.video;

/**
 * Sequential, one-pass stream of decoded frames.
 */
public interface FrameSource extends AutoCloseable {

    double fps();

    /** Frame count reported by the container, or {@code 0} when unknown. */
    int totalFrames();

    /**
     * Reads the next frame.
     *
     * @return the next frame, or {@code null} once the stream is exhausted.
     */
    VideoFrame grab();

    @Override
    void close();
}
