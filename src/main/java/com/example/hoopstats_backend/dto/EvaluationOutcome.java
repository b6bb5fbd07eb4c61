package com.example.hoopstats_backend.dto;

import com.example.hoopstats_backend.model.EvaluationResult;

/**
 * Either a score or the reason no score could be computed. A missing ground truth is never reported as a low score.
 */
public record EvaluationOutcome(boolean success, Failure failure, String message, Score score, EvaluationResult result) {

    public enum Failure {
        NO_GROUND_TRUTH,
        SESSION_NOT_FOUND,
        EVALUATION_FAILED
    }

    public static EvaluationOutcome success(Score score, EvaluationResult result) {
        return new EvaluationOutcome(true, null, null, score, result);
    }

    public static EvaluationOutcome failed(Failure failure, String message) {
        return new EvaluationOutcome(false, failure, message, null, null);
    }
}
