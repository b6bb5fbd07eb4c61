package com.example.hoopstats_backend.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of matching a session's detections against ground truth.
 */
public record EvaluationResult(
        @JsonProperty("true_positives") List<TruePositive> truePositives,
        @JsonProperty("false_positives") List<FalsePositive> falsePositives,
        @JsonProperty("false_negatives") List<FalseNegative> falseNegatives,
        @JsonProperty("stats_correct") Map<String, Integer> statsCorrect,
        @JsonProperty("stats_errors") Map<String, StatMismatch> statsErrors
) {
    public EvaluationResult {
        truePositives = List.copyOf(truePositives);
        falsePositives = List.copyOf(falsePositives);
        falseNegatives = List.copyOf(falseNegatives);
        statsCorrect = Collections.unmodifiableMap(new LinkedHashMap<>(statsCorrect));
        statsErrors = Collections.unmodifiableMap(new LinkedHashMap<>(statsErrors));
    }

    public record TruePositive(
            @JsonProperty("type") String type,
            @JsonProperty("expected_time") double expectedTime,
            @JsonProperty("actual_time") double actualTime,
            @JsonProperty("time_error") double timeError
    ) {
    }

    public record FalsePositive(
            @JsonProperty("type") String type,
            @JsonProperty("timestamp") double timestamp
    ) {
    }

    public record FalseNegative(
            @JsonProperty("type") String type,
            @JsonProperty("expected_time") double expectedTime
    ) {
    }

    public record StatMismatch(
            @JsonProperty("expected") int expected,
            @JsonProperty("actual") int actual
    ) {
    }
}
