package com.example.hoopstats_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One complete analysis run, persisted as a single line of the session log.
 *
 * @param timestamp     ISO-8601 creation time.
 * @param videoDuration estimated video length in seconds.
 * @param stats         aggregate counters; always holds points, assists, steals, blocks and rebounds.
 * @param evaluation    score attached after evaluation, {@code null} until then.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionRecord(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("video_name") String videoName,
        @JsonProperty("video_duration") double videoDuration,
        @JsonProperty("total_detections") int totalDetections,
        @JsonProperty("classifier_used") String classifierUsed,
        @JsonProperty("stats") Map<String, Integer> stats,
        @JsonProperty("detections") List<Detection> detections,
        @JsonProperty("evaluation") SessionEvaluation evaluation
) {
    public SessionRecord {
        stats = stats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(stats));
        detections = detections == null ? List.of() : List.copyOf(detections);
    }

    public SessionRecord withEvaluation(SessionEvaluation value) {
        return new SessionRecord(sessionId, timestamp, videoName, videoDuration, totalDetections,
                classifierUsed, stats, detections, value);
    }
}
