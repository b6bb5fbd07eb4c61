package com.example.hoopstats_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where hand-authored ground truth lives and whether analyses are evaluated automatically.
 */
@ConfigurationProperties(prefix = "evaluation")
public class EvaluationProperties {
    private boolean enabled = true;
    private String groundTruthDir = "./ground_truth";
    /** Used when no {@code <video>.json} exists in {@link #groundTruthDir}. Empty disables the fallback. */
    private String defaultGroundTruth = "";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getGroundTruthDir() {
        return groundTruthDir;
    }

    public void setGroundTruthDir(String groundTruthDir) {
        this.groundTruthDir = groundTruthDir;
    }

    public String getDefaultGroundTruth() {
        return defaultGroundTruth;
    }

    public void setDefaultGroundTruth(String defaultGroundTruth) {
        this.defaultGroundTruth = defaultGroundTruth;
    }
}
