package com.example.hoopstats_backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InferenceResponse(String label, Double confidence, Map<String, Double> scores, List<Box> boxes) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Box(String label, double x1, double y1, double x2, double y2, double confidence) {
        public BoundingBox toBoundingBox() {
            return new BoundingBox(x1, y1, x2, y2, label, confidence);
        }
    }
}
