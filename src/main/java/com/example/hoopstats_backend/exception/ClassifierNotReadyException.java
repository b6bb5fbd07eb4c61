package com.example.hoopstats_backend.exception;

public class ClassifierNotReadyException extends RuntimeException {
    public ClassifierNotReadyException(String classifierId) {
        super("Classifier " + classifierId + " failed to initialize");
    }
}
