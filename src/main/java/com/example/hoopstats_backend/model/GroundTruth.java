package com.example.hoopstats_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GroundTruth(
        @JsonProperty("video_name") String videoName,
        @JsonProperty("expected_detections") List<ExpectedEvent> expectedDetections,
        @JsonProperty("expected_stats") Map<String, Integer> expectedStats
) {
    public GroundTruth {
        expectedDetections = expectedDetections == null ? List.of() : List.copyOf(expectedDetections);
        expectedStats = expectedStats == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(expectedStats));
    }
}
