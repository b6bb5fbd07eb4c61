package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.dto.ActionCategory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Awards {@code points} to {@code stat} when a detection label contains a keyword of one of {@code categories}
 * and its confidence is strictly above {@code threshold}.
 */
public record ScoringRule(String stat, int points, String label, double threshold, Set<ActionCategory> categories) {

    public ScoringRule {
        Objects.requireNonNull(stat, "stat");
        Objects.requireNonNull(label, "label");
        categories = categories == null || categories.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(categories));
    }

    boolean fires(String lowerLabel, double confidence, Map<ActionCategory, List<String>> mapping) {
        if (!(confidence > threshold)) {
            return false;
        }
        for (ActionCategory category : categories) {
            List<String> keywords = mapping.get(category);
            if (keywords == null) {
                continue;
            }
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isEmpty()
                        && lowerLabel.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }
}
