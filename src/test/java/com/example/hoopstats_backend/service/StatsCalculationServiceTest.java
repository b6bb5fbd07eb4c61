package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.config.ScoringProperties;
import com.example.hoopstats_backend.dto.ActionCategory;
import com.example.hoopstats_backend.dto.DetectionCandidate;
import com.example.hoopstats_backend.dto.ScoredAction;
import com.example.hoopstats_backend.dto.StatsResult;
import com.example.hoopstats_backend.engine.TrajectoryHeuristicClassifier;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StatsCalculationServiceTest {

    private final StatsCalculationService service = new StatsCalculationService(new ScoringProperties());
    private final Map<ActionCategory, List<String>> mapping = ActionCategory.defaultKeywords();

    private static DetectionCandidate det(String action, double confidence) {
        return new DetectionCandidate(0, 0.0, action, confidence, "f.jpg");
    }

    private static List<String> dispositions(StatsResult r) {
        return r.actions().stream().map(ScoredAction::classifiedAs).toList();
    }

    @Test
    void reservedStatsArePresentEvenWithoutDetections() {
        StatsResult r = service.calculate(List.of(), mapping);

        assertThat(r.stats()).containsExactly(
                Map.entry("points", 0), Map.entry("assists", 0), Map.entry("steals", 0),
                Map.entry("blocks", 0), Map.entry("rebounds", 0));
        assertThat(r.actions()).isEmpty();
    }

    @Test
    void shotsAndDunksScoreTwoPoints() {
        StatsResult r = service.calculate(List.of(
                det("shooting basketball", 0.7),
                det("Slam Dunking", 0.9)), mapping);

        assertThat(r.stats()).containsEntry("points", 4);
        assertThat(dispositions(r)).containsExactly("SHOT (+2 points)", "SHOT (+2 points)");
    }

    @Test
    void confidenceEqualToThresholdDoesNotScore() {
        StatsResult r = service.calculate(List.of(
                det("shooting basketball", 0.5),
                det("passing basketball", 0.4),
                det("blocking", 0.45)), mapping);

        assertThat(r.stats()).containsEntry("points", 0).containsEntry("assists", 0).containsEntry("blocks", 0);
        assertThat(dispositions(r)).containsOnly(StatsCalculationService.IGNORED);
    }

    @Test
    void oneDetectionCanScoreSeveralRules() {
        // "throw" is both a shooting and a passing keyword
        StatsResult r = service.calculate(List.of(det("throwing ball", 0.6)), mapping);

        assertThat(r.stats()).containsEntry("points", 2).containsEntry("assists", 1);
        assertThat(dispositions(r)).containsExactly("SHOT (+2 points), ASSIST (+1)");
    }

    @Test
    void unmatchedLabelIsIgnored() {
        StatsResult r = service.calculate(List.of(det("dribbling basketball", 0.99)), mapping);

        assertThat(dispositions(r)).containsExactly(StatsCalculationService.IGNORED);
        assertThat(StatsCalculationService.isIgnored(r.actions().get(0).classifiedAs())).isTrue();
        assertThat(r.stats().values()).containsOnly(0);
    }

    @Test
    void sameInputScoresIdentically() {
        List<DetectionCandidate> detections = List.of(
                det("shooting basketball", 0.7), det("passing basketball", 0.45), det("blocking", 0.2));

        StatsResult first = service.calculate(detections, mapping);
        StatsResult second = service.calculate(detections, mapping);

        assertThat(second.stats()).isEqualTo(first.stats());
        assertThat(dispositions(second)).isEqualTo(dispositions(first));
    }

    @Test
    void keywordsComeFromTheClassifierMapping() {
        Map<ActionCategory, List<String>> heuristic = new TrajectoryHeuristicClassifier(null).actionKeywordMapping();

        StatsResult r = service.calculate(List.of(det("passing basketball", 0.8), det("hand off", 0.8)), heuristic);

        assertThat(r.stats()).containsEntry("assists", 1);
        assertThat(dispositions(r)).containsExactly("ASSIST (+1)", StatsCalculationService.IGNORED);
    }

    @Test
    void thresholdsComeFromProperties() {
        ScoringProperties props = new ScoringProperties();
        props.setShotThreshold(0.8);
        StatsCalculationService strict = new StatsCalculationService(props);

        StatsResult r = strict.calculate(List.of(det("shooting basketball", 0.7)), mapping);

        assertThat(r.stats()).containsEntry("points", 0);
    }

    @Test
    void customRulesAddTheirStat() {
        StatsCalculationService custom = new StatsCalculationService(List.of(
                new ScoringRule("rebounds", 1, "REBOUND (+1)", 0.3, EnumSet.of(ActionCategory.CATCHING))));

        StatsResult r = custom.calculate(List.of(det("catching basketball", 0.6)), mapping);

        assertThat(r.stats()).containsEntry("rebounds", 1).containsKeys("points", "steals");
        assertThat(dispositions(r)).containsExactly("REBOUND (+1)");
    }

    @Test
    void keywordOverridesReplaceClassifierWording() {
        ScoringProperties props = new ScoringProperties();
        props.setKeywords(Map.of(ActionCategory.BLOCKING, List.of("swat")));

        Map<ActionCategory, List<String>> merged = props.applyOverrides(mapping);

        assertThat(merged.get(ActionCategory.BLOCKING)).containsExactly("swat");
        assertThat(merged.get(ActionCategory.SHOOTING)).isEqualTo(mapping.get(ActionCategory.SHOOTING));
    }
}
