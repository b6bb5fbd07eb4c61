package com.example.hoopstats_backend.exception;

public class GroundTruthNotFoundException extends RuntimeException {
    public GroundTruthNotFoundException(String videoName) {
        super("Ground truth not found for video: " + videoName);
    }
}
