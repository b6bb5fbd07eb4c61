package com.example.hoopstats_backend.config;

import com.example.hoopstats_backend.video.ClipSettings;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Clip windowing and detection settings for the analysis pipeline.
 */
@Validated
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    @DecimalMin(value = "0.0", inclusive = false)
    private double clipDurationSec = 2.0;

    @DecimalMin("0.0")
    @DecimalMax(value = "1.0", inclusive = false)
    private double clipOverlap = 0.5;

    @Min(0)
    private int maxClips = 30;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double detectionThreshold = 0.3;

    @NotBlank
    private String defaultClassifier = "videomae";

    public double getClipDurationSec() {
        return clipDurationSec;
    }

    public void setClipDurationSec(double clipDurationSec) {
        this.clipDurationSec = clipDurationSec;
    }

    public double getClipOverlap() {
        return clipOverlap;
    }

    public void setClipOverlap(double clipOverlap) {
        this.clipOverlap = clipOverlap;
    }

    public int getMaxClips() {
        return maxClips;
    }

    public void setMaxClips(int maxClips) {
        this.maxClips = maxClips;
    }

    public double getDetectionThreshold() {
        return detectionThreshold;
    }

    public void setDetectionThreshold(double detectionThreshold) {
        this.detectionThreshold = detectionThreshold;
    }

    public String getDefaultClassifier() {
        return defaultClassifier;
    }

    public void setDefaultClassifier(String defaultClassifier) {
        this.defaultClassifier = defaultClassifier;
    }

    public ClipSettings toClipSettings() {
        return new ClipSettings(clipDurationSec, clipOverlap, maxClips);
    }
}
