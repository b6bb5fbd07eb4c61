package com.example.hoopstats_backend.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Label assigned to one clip by one classifier invocation.
 *
 * @param action     free-text label, classifier specific.
 * @param confidence value in {@code [0, 1]}.
 * @param metadata   classifier specific details, never {@code null}.
 */
public record ClassificationResult(String action, double confidence, Map<String, Object> metadata) {
    public static final String ERROR = "error";
    public static final String UNKNOWN = "unknown";

    public ClassificationResult {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ClassificationResult of(String action, double confidence) {
        return new ClassificationResult(action, confidence, Map.of());
    }

    /** Sentinel for a failed classification; never mistaken for a genuine hit. */
    public static ClassificationResult error(String reason) {
        Map<String, Object> meta = new LinkedHashMap<>();
        if (reason != null) {
            meta.put("error", reason);
        }
        return new ClassificationResult(ERROR, 0.0, meta);
    }

    public static ClassificationResult unknown() {
        return new ClassificationResult(UNKNOWN, 0.0, Map.of());
    }

    public boolean isError() {
        return ERROR.equals(action);
    }
}
