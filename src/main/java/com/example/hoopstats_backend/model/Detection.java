package com.example.hoopstats_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One scored detection inside a session.
 *
 * @param timestamp      seconds from the start of the video, derived from {@code frame / fps}.
 * @param frame          index of the first frame of the detected clip.
 * @param detectedAction raw classifier label.
 * @param classifiedAs   disposition: matched rule labels, or {@link com.example.hoopstats_backend.service.StatsCalculationService#IGNORED}.
 * @param frameImage     file name of the representative frame.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Detection(
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("frame") int frame,
        @JsonProperty("detected_action") String detectedAction,
        @JsonProperty("confidence") double confidence,
        @JsonProperty("classified_as") String classifiedAs,
        @JsonProperty("frame_image") String frameImage,
        @JsonProperty("session_id") String sessionId
) {
}
