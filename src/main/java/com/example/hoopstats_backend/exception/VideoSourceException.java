package com.example.hoopstats_backend.exception;

public class VideoSourceException extends RuntimeException {
    public VideoSourceException(String message) {
        super(message);
    }

    public VideoSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
