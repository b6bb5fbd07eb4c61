package com.example.hoopstats_backend.video;

import java.nio.file.Path;

public interface FrameSourceFactory {
    /**
     * Opens a video for sequential decoding.
     *
     * @throws com.example.hoopstats_backend.exception.VideoSourceException when the file cannot be opened.
     */
    FrameSource open(Path video);
}
