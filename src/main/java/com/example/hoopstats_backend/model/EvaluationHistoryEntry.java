package com.example.hoopstats_backend.model;

import com.example.hoopstats_backend.dto.Score;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One line of the evaluation history log, joined to sessions by {@code session_id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EvaluationHistoryEntry(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("video_name") String videoName,
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("score") Score score,
        @JsonProperty("true_positives") List<EvaluationResult.TruePositive> truePositives,
        @JsonProperty("false_positives") List<EvaluationResult.FalsePositive> falsePositives,
        @JsonProperty("false_negatives") List<EvaluationResult.FalseNegative> falseNegatives,
        @JsonProperty("stats_correct") Map<String, Integer> statsCorrect,
        @JsonProperty("stats_errors") Map<String, EvaluationResult.StatMismatch> statsErrors
) {
    public static EvaluationHistoryEntry of(String timestamp, String videoName, String sessionId,
                                            Score score, EvaluationResult result) {
        return new EvaluationHistoryEntry(timestamp, videoName, sessionId, score,
                result.truePositives(), result.falsePositives(), result.falseNegatives(),
                result.statsCorrect(), result.statsErrors());
    }
}
