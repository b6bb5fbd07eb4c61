package com.example.hoopstats_backend.dto;

import java.util.List;
import java.util.Map;

/**
 * @param stats   counter per stat name, in a stable order.
 * @param actions the input detections, in input order, each with its disposition.
 */
public record StatsResult(Map<String, Integer> stats, List<ScoredAction> actions) {
}
