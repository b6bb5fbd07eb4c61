package com.example.hoopstats_backend.service.Interfaces;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

public interface FrameStorage {
    /** Stores the image and returns the file name to reference it by. */
    String save(String sessionId, int frameIndex, BufferedImage image);

    Path resolve(String fileName);

    boolean exists(String fileName);
}
