package com.example.hoopstats_backend.dto;

/**
 * Axis-aligned detection box in pixel coordinates.
 */
public record BoundingBox(double x1, double y1, double x2, double y2, String label, double confidence) {

    public double centerX() {
        return (x1 + x2) / 2.0;
    }

    public double centerY() {
        return (y1 + y2) / 2.0;
    }
}
