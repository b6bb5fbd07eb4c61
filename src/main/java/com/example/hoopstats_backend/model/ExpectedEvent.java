package com.example.hoopstats_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hand-labelled event: {@code type} must appear in a detection's disposition within {@code tolerance} seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExpectedEvent(
        @JsonProperty("type") String type,
        @JsonProperty("timestamp") double timestamp,
        @JsonProperty("tolerance") double tolerance
) {
}
