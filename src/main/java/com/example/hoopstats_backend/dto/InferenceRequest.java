package com.example.hoopstats_backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body sent to the model server. Frames are base64 encoded JPEGs.
 *
 * @param labels candidate labels for zero-shot models, omitted otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record InferenceRequest(String model, List<String> frames, List<String> labels) {
}
