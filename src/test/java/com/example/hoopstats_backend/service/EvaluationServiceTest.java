package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.config.EvaluationProperties;
import com.example.hoopstats_backend.dto.EvaluationOutcome;
import com.example.hoopstats_backend.dto.Score;
import com.example.hoopstats_backend.model.Detection;
import com.example.hoopstats_backend.model.EvaluationHistoryEntry;
import com.example.hoopstats_backend.model.EvaluationResult;
import com.example.hoopstats_backend.model.ExpectedEvent;
import com.example.hoopstats_backend.model.GroundTruth;
import com.example.hoopstats_backend.model.SessionRecord;
import com.example.hoopstats_backend.service.Interfaces.SessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EvaluationServiceTest {

    private static final String SHOT = "SHOT (+2 points)";

    @Mock
    private GroundTruthRepository groundTruths;
    @Mock
    private SessionStore sessions;
    @Mock
    private EvaluationHistoryLog history;

    private EvaluationService service() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-13T05:40:00Z"), ZoneOffset.UTC);
        return new EvaluationService(groundTruths, sessions, history, new EvaluationReportFormatter(), clock);
    }

    private static Detection det(double timestamp, String classifiedAs) {
        return new Detection(timestamp, (int) (timestamp * 30), "shooting basketball", 0.8, classifiedAs, "f.jpg", "s1");
    }

    private static SessionRecord session(Map<String, Integer> stats, Detection... detections) {
        return new SessionRecord("s1", "2026-01-13T05:38:47", "trim.mp4", 30.0, detections.length, "VideoMAE",
                stats, List.of(detections), null);
    }

    private static GroundTruth oneShot() {
        return new GroundTruth("trim.mp4", List.of(new ExpectedEvent("shot", 10.0, 1.0)), Map.of("points", 2));
    }

    @Test
    void perfectMatchScoresAsDocumented() {
        EvaluationService svc = service();
        GroundTruth gt = oneShot();

        EvaluationResult result = svc.evaluate(gt, session(Map.of("points", 2), det(10.4, SHOT)));
        Score score = svc.score(result, gt);

        assertThat(result.truePositives()).hasSize(1);
        assertThat(result.falsePositives()).isEmpty();
        assertThat(result.falseNegatives()).isEmpty();
        assertThat(score.statsAccuracy()).isEqualTo(100.0);
        assertThat(score.precision()).isEqualTo(100.0);
        assertThat(score.recall()).isEqualTo(100.0);
        assertThat(score.f1Score()).isEqualTo(100.0);
        assertThat(score.avgTimeErrorSeconds()).isEqualTo(0.4);
        assertThat(score.timingAccuracy()).isEqualTo(92.0);
        assertThat(score.overallScore()).isEqualTo(98.4);
        assertThat(score.truePositives()).isEqualTo(1);
    }

    @Test
    void ignoredDetectionsNeverMatchOrCountAsFalsePositives() {
        EvaluationService svc = service();
        GroundTruth gt = oneShot();

        EvaluationResult result = svc.evaluate(gt, session(Map.of("points", 0),
                det(10.0, StatsCalculationService.IGNORED), det(20.0, StatsCalculationService.IGNORED)));

        assertThat(result.truePositives()).isEmpty();
        assertThat(result.falsePositives()).isEmpty();
        assertThat(result.falseNegatives()).extracting(EvaluationResult.FalseNegative::type).containsExactly("shot");
        assertThat(result.statsErrors()).containsEntry("points", new EvaluationResult.StatMismatch(2, 0));
    }

    @Test
    void matchingIsFirstFitNotClosest() {
        EvaluationService svc = service();
        GroundTruth gt = oneShot();

        EvaluationResult result = svc.evaluate(gt, session(Map.of("points", 4), det(9.2, SHOT), det(10.0, SHOT)));

        assertThat(result.truePositives()).singleElement()
                .satisfies(tp -> assertThat(tp.actualTime()).isEqualTo(9.2));
        assertThat(result.falsePositives()).singleElement()
                .satisfies(fp -> assertThat(fp.timestamp()).isEqualTo(10.0));
    }

    @Test
    void aDetectionIsConsumedByOneExpectedEvent() {
        EvaluationService svc = service();
        GroundTruth gt = new GroundTruth("trim.mp4", List.of(
                new ExpectedEvent("shot", 10.0, 1.0),
                new ExpectedEvent("shot", 10.5, 1.0)), Map.of());

        EvaluationResult result = svc.evaluate(gt, session(Map.of(), det(10.2, SHOT)));

        assertThat(result.truePositives()).hasSize(1);
        assertThat(result.falseNegatives()).extracting(EvaluationResult.FalseNegative::expectedTime).containsExactly(10.5);
    }

    @Test
    void typeMatchIsCaseInsensitiveAndToleranceInclusive() {
        EvaluationService svc = service();
        GroundTruth gt = new GroundTruth("v", List.of(new ExpectedEvent("Assist", 5.0, 0.5)), Map.of());

        EvaluationResult result = svc.evaluate(gt, session(Map.of(), det(5.5, "ASSIST (+1)")));

        assertThat(result.truePositives()).hasSize(1);
    }

    @Test
    void outOfToleranceIsMissAndFalsePositive() {
        EvaluationService svc = service();
        GroundTruth gt = oneShot();

        EvaluationResult result = svc.evaluate(gt, session(Map.of("points", 2), det(12.0, SHOT)));
        Score score = svc.score(result, gt);

        assertThat(score.truePositives()).isZero();
        assertThat(score.falsePositives()).isEqualTo(1);
        assertThat(score.falseNegatives()).isEqualTo(1);
        assertThat(score.precision()).isZero();
        assertThat(score.f1Score()).isZero();
        assertThat(score.timingAccuracy()).isEqualTo(100.0);
        assertThat(score.overallScore()).isEqualTo(50.0);
    }

    @Test
    void missingActualStatCountsAsZero() {
        EvaluationService svc = service();
        GroundTruth gt = new GroundTruth("v", List.of(), Map.of("rebounds", 0, "steals", 1));

        EvaluationResult result = svc.evaluate(gt, session(Map.of()));
        Score score = svc.score(result, gt);

        assertThat(result.statsCorrect()).containsEntry("rebounds", 0);
        assertThat(result.statsErrors()).containsEntry("steals", new EvaluationResult.StatMismatch(1, 0));
        assertThat(score.statsAccuracy()).isEqualTo(50.0);
    }

    @Test
    void noExpectedStatsGivesZeroStatsAccuracy() {
        EvaluationService svc = service();
        GroundTruth gt = new GroundTruth("v", List.of(), Map.of());

        Score score = svc.score(svc.evaluate(gt, session(Map.of())), gt);

        assertThat(score.statsAccuracy()).isZero();
    }

    @Test
    void runEvaluationAttachesScoreAndAppendsHistory() {
        SessionRecord stored = session(Map.of("points", 2), det(10.4, SHOT));
        when(groundTruths.find("trim.mp4")).thenReturn(Optional.of(oneShot()));
        when(sessions.get("s1")).thenReturn(Optional.of(stored));

        EvaluationOutcome outcome = service().runEvaluation("trim.mp4", "s1");

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.score().overallScore()).isEqualTo(98.4);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<UnaryOperator<SessionRecord>> change = ArgumentCaptor.forClass(UnaryOperator.class);
        verify(sessions).update(eq("s1"), change.capture());
        SessionRecord updated = change.getValue().apply(stored);
        assertThat(updated.evaluation().overallScore()).isEqualTo(98.4);
        assertThat(updated.evaluation().evaluatedAt()).isEqualTo("2026-01-13T05:40");

        ArgumentCaptor<EvaluationHistoryEntry> entry = ArgumentCaptor.forClass(EvaluationHistoryEntry.class);
        verify(history).append(entry.capture());
        assertThat(entry.getValue().sessionId()).isEqualTo("s1");
        assertThat(entry.getValue().truePositives()).hasSize(1);
    }

    @Test
    void missingGroundTruthIsNotAScore() {
        when(groundTruths.find("other.mp4")).thenReturn(Optional.empty());

        EvaluationOutcome outcome = service().runEvaluation("other.mp4", "s1");

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failure()).isEqualTo(EvaluationOutcome.Failure.NO_GROUND_TRUTH);
        assertThat(outcome.score()).isNull();
        verify(sessions, never()).update(any(), any());
        verify(history, never()).append(any());
    }

    @Test
    void videoWithoutOwnGroundTruthIsNotScoredAgainstDefaultFile(@TempDir Path dir) throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/ground_truth/trim.json")) {
            Files.copy(in, dir.resolve("expected_results.json"));
        }
        EvaluationProperties props = new EvaluationProperties();
        props.setGroundTruthDir(dir.toString());
        props.setDefaultGroundTruth("expected_results.json");
        Clock clock = Clock.fixed(Instant.parse("2026-01-13T05:40:00Z"), ZoneOffset.UTC);
        EvaluationService real = new EvaluationService(new GroundTruthRepository(props, new ObjectMapper()),
                sessions, history, new EvaluationReportFormatter(), clock);

        EvaluationOutcome outcome = real.runEvaluation("game7.mp4", "s1");

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failure()).isEqualTo(EvaluationOutcome.Failure.NO_GROUND_TRUTH);
        verify(sessions, never()).update(any(), any());
        verify(history, never()).append(any());
    }

    @Test
    void missingSessionIsReported() {
        when(groundTruths.find("trim.mp4")).thenReturn(Optional.of(oneShot()));
        when(sessions.get("gone")).thenReturn(Optional.empty());

        EvaluationOutcome outcome = service().runEvaluation("trim.mp4", "gone");

        assertThat(outcome.failure()).isEqualTo(EvaluationOutcome.Failure.SESSION_NOT_FOUND);
    }

    @Test
    void unexpectedErrorsBecomeFailedOutcome() {
        when(groundTruths.find("trim.mp4")).thenThrow(new IllegalStateException("disk gone"));

        EvaluationOutcome outcome = service().runEvaluation("trim.mp4", "s1");

        assertThat(outcome.failure()).isEqualTo(EvaluationOutcome.Failure.EVALUATION_FAILED);
        assertThat(outcome.message()).isEqualTo("disk gone");
    }
}
