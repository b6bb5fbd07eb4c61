package com.example.hoopstats_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./data";
    private String sessionsFile = "sessions.jsonl";
    private String evaluationsFile = "evaluation_history.jsonl";
    private String framesPrefix = "frames";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getSessionsFile() { return sessionsFile; }
    public void setSessionsFile(String sessionsFile) { this.sessionsFile = sessionsFile; }

    public String getEvaluationsFile() { return evaluationsFile; }
    public void setEvaluationsFile(String evaluationsFile) { this.evaluationsFile = evaluationsFile; }

    public String getFramesPrefix() { return framesPrefix; }
    public void setFramesPrefix(String framesPrefix) { this.framesPrefix = framesPrefix; }
}
