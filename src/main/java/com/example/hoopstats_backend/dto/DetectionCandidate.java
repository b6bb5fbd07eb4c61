package com.example.hoopstats_backend.dto;

/**
 * Classified clip that passed the detection threshold, before scoring.
 */
public record DetectionCandidate(int frame, double timestamp, String action, double confidence, String frameImage) {
}
