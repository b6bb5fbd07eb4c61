package com.example.hoopstats_backend.dto;

/**
 * A detection candidate and the disposition the scoring rules gave it.
 */
public record ScoredAction(DetectionCandidate candidate, String classifiedAs) {
}
