package com.example.hoopstats_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Accuracy of one session against ground truth. Precision, recall, F1, stats and timing accuracy are
 * percentages rounded to two decimals.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Score(
        @JsonProperty("overall_score") double overallScore,
        @JsonProperty("precision") double precision,
        @JsonProperty("recall") double recall,
        @JsonProperty("f1_score") double f1Score,
        @JsonProperty("stats_accuracy") double statsAccuracy,
        @JsonProperty("timing_accuracy") double timingAccuracy,
        @JsonProperty("avg_time_error_seconds") double avgTimeErrorSeconds,
        @JsonProperty("true_positives") int truePositives,
        @JsonProperty("false_positives") int falsePositives,
        @JsonProperty("false_negatives") int falseNegatives
) {
}
