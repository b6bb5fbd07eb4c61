package com.example.hoopstats_backend.exception;

/**
 * Raised when analysis settings cannot produce a valid pipeline (bad frame rate, clip length, overlap...).
 * Never defaulted silently.
 */
public class InvalidConfigurationException extends RuntimeException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
