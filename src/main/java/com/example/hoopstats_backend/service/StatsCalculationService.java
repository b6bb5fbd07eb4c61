package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.config.ScoringProperties;
import com.example.hoopstats_backend.dto.ActionCategory;
import com.example.hoopstats_backend.dto.DetectionCandidate;
import com.example.hoopstats_backend.dto.ScoredAction;
import com.example.hoopstats_backend.dto.StatsResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns classified clips into box-score counters.
 * <p>
 * Every rule is checked against every detection, so one detection can score for several stats. A detection no
 * rule fires for is marked {@link #IGNORED}. The service holds no state between calls.
 */
@Service
public class StatsCalculationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(StatsCalculationService.class);

    public static final String IGNORED = "IGNORED (below threshold or no match)";

    /** Always present in the stats map, in this order, even when no rule targets them. */
    public static final List<String> RESERVED_STATS = List.of("points", "assists", "steals", "blocks", "rebounds");

    private final List<ScoringRule> rules;

    @Autowired
    public StatsCalculationService(ScoringProperties props) {
        this(defaultRules(props.getShotThreshold(), props.getAssistThreshold(), props.getBlockThreshold()));
    }

    public StatsCalculationService(List<ScoringRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<ScoringRule> defaultRules(double shotThreshold, double assistThreshold, double blockThreshold) {
        return List.of(
                new ScoringRule("points", 2, "SHOT (+2 points)", shotThreshold,
                        EnumSet.of(ActionCategory.SHOOTING, ActionCategory.DUNKING)),
                new ScoringRule("assists", 1, "ASSIST (+1)", assistThreshold, EnumSet.of(ActionCategory.PASSING)),
                new ScoringRule("blocks", 1, "BLOCK (+1)", blockThreshold, EnumSet.of(ActionCategory.BLOCKING))
        );
    }

    public StatsResult calculate(List<DetectionCandidate> detections, Map<ActionCategory, List<String>> mapping) {
        Map<String, Integer> stats = new LinkedHashMap<>();
        for (String name : RESERVED_STATS) {
            stats.put(name, 0);
        }
        for (ScoringRule rule : rules) {
            stats.putIfAbsent(rule.stat(), 0);
        }
        Map<ActionCategory, List<String>> keywords = mapping == null ? Map.of() : mapping;

        List<ScoredAction> scored = new ArrayList<>(detections.size());
        for (DetectionCandidate d : detections) {
            String lower = d.action() == null ? "" : d.action().toLowerCase(Locale.ROOT);
            List<String> labels = new ArrayList<>();
            for (ScoringRule rule : rules) {
                if (rule.fires(lower, d.confidence(), keywords)) {
                    stats.merge(rule.stat(), rule.points(), Integer::sum);
                    labels.add(rule.label());
                }
            }
            String disposition = labels.isEmpty() ? IGNORED : String.join(", ", labels);
            if (!labels.isEmpty()) {
                LOGGER.debug("Scored frame={} action='{}' conf={} -> {}", d.frame(), d.action(), d.confidence(), disposition);
            }
            scored.add(new ScoredAction(d, disposition));
        }
        return new StatsResult(Collections.unmodifiableMap(stats), List.copyOf(scored));
    }

    public static boolean isIgnored(String disposition) {
        return disposition == null || IGNORED.equals(disposition);
    }
}
