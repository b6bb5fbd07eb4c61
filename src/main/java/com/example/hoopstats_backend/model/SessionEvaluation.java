package com.example.hoopstats_backend.model;

import com.example.hoopstats_backend.dto.Score;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Evaluation score attached to a session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionEvaluation(
        @JsonProperty("evaluated_at") String evaluatedAt,
        @JsonProperty("video_name") String videoName,
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
    public static SessionEvaluation of(String evaluatedAt, String videoName, Score score) {
        return new SessionEvaluation(evaluatedAt, videoName,
                score.overallScore(), score.precision(), score.recall(), score.f1Score(),
                score.statsAccuracy(), score.timingAccuracy(), score.avgTimeErrorSeconds(),
                score.truePositives(), score.falsePositives(), score.falseNegatives());
    }
}
