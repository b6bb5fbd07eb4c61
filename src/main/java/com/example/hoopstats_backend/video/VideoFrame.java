package com.example.hoopstats_backend.video;

import java.awt.image.BufferedImage;

/**
 * A single decoded frame in RGB channel order.
 *
 * @param index ordinal position of the frame in the source video.
 * @param image decoded pixels.
 */
public record VideoFrame(int index, BufferedImage image) {

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
