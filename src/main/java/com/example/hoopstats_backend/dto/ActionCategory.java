package com.example.hoopstats_backend.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Canonical basketball event categories that classifier labels are mapped onto.
 */
public enum ActionCategory {
    SHOOTING,
    PASSING,
    DRIBBLING,
    DUNKING,
    BLOCKING,
    CATCHING;

    private static final Map<ActionCategory, List<String>> DEFAULT_KEYWORDS;

    static {
        Map<ActionCategory, List<String>> m = new EnumMap<>(ActionCategory.class);
        m.put(SHOOTING, List.of("shooting", "throw", "toss"));
        m.put(PASSING, List.of("passing", "hand", "throw"));
        m.put(DRIBBLING, List.of("dribbling", "bounce"));
        m.put(DUNKING, List.of("dunk", "slam"));
        m.put(BLOCKING, List.of("block", "defend"));
        m.put(CATCHING, List.of("catch", "grab"));
        DEFAULT_KEYWORDS = Collections.unmodifiableMap(m);
    }

    /** Keyword lists suited to Kinetics-style labels ("shooting basketball", "passing American football"...). */
    public static Map<ActionCategory, List<String>> defaultKeywords() {
        return DEFAULT_KEYWORDS;
    }
}
