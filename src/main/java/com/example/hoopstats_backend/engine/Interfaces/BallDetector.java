package com.example.hoopstats_backend.engine.Interfaces;

import com.example.hoopstats_backend.dto.BoundingBox;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Finds a ball-like object in a single frame.
 */
public interface BallDetector {

    boolean initialize();

    /**
     * @return the ball's box in pixel coordinates, or empty when no ball is visible.
     */
    Optional<BoundingBox> detect(BufferedImage frame);
}
