package com.example.hoopstats_backend.dto;

/**
 * Ball centre for one frame, normalised to {@code [0,1]} by frame width and height.
 * Smaller {@code y} is higher on screen.
 */
public record BallPosition(double x, double y, boolean present) {
    private static final BallPosition ABSENT = new BallPosition(Double.NaN, Double.NaN, false);

    public static BallPosition of(double x, double y) {
        return new BallPosition(x, y, true);
    }

    public static BallPosition absent() {
        return ABSENT;
    }
}
