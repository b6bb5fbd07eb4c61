package com.example.hoopstats_backend.exception;

import java.util.Collection;

public class UnknownClassifierException extends InvalidConfigurationException {
    private final String classifierId;

    public UnknownClassifierException(String classifierId, Collection<String> available) {
        super("Invalid classifier: " + classifierId + ". Available: " + String.join(", ", available));
        this.classifierId = classifierId;
    }

    public String getClassifierId() {
        return classifierId;
    }
}
