package com.example.hoopstats_backend.config;

import com.example.hoopstats_backend.dto.ActionCategory;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Thresholds of the default scoring rules. {@code keywords} replaces the classifier's keyword list for the
 * categories it names; categories left out keep the classifier's own wording.
 */
@Validated
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double shotThreshold = 0.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double assistThreshold = 0.4;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double blockThreshold = 0.45;

    private Map<ActionCategory, List<String>> keywords = new EnumMap<>(ActionCategory.class);

    public double getShotThreshold() {
        return shotThreshold;
    }

    public void setShotThreshold(double shotThreshold) {
        this.shotThreshold = shotThreshold;
    }

    public double getAssistThreshold() {
        return assistThreshold;
    }

    public void setAssistThreshold(double assistThreshold) {
        this.assistThreshold = assistThreshold;
    }

    public double getBlockThreshold() {
        return blockThreshold;
    }

    public void setBlockThreshold(double blockThreshold) {
        this.blockThreshold = blockThreshold;
    }

    public Map<ActionCategory, List<String>> getKeywords() {
        return keywords;
    }

    public void setKeywords(Map<ActionCategory, List<String>> keywords) {
        this.keywords = keywords;
    }

    /** Classifier mapping with the configured overrides applied. */
    public Map<ActionCategory, List<String>> applyOverrides(Map<ActionCategory, List<String>> classifierMapping) {
        Map<ActionCategory, List<String>> merged = new EnumMap<>(ActionCategory.class);
        if (classifierMapping != null) {
            merged.putAll(classifierMapping);
        }
        if (keywords != null) {
            keywords.forEach((category, words) -> {
                if (words != null && !words.isEmpty()) {
                    merged.put(category, List.copyOf(words));
                }
            });
        }
        return merged;
    }
}
