package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.dto.EvaluationOutcome;
import com.example.hoopstats_backend.dto.Score;
import com.example.hoopstats_backend.model.Detection;
import com.example.hoopstats_backend.model.EvaluationHistoryEntry;
import com.example.hoopstats_backend.model.EvaluationResult;
import com.example.hoopstats_backend.model.EvaluationResult.FalseNegative;
import com.example.hoopstats_backend.model.EvaluationResult.FalsePositive;
import com.example.hoopstats_backend.model.EvaluationResult.StatMismatch;
import com.example.hoopstats_backend.model.EvaluationResult.TruePositive;
import com.example.hoopstats_backend.model.ExpectedEvent;
import com.example.hoopstats_backend.model.GroundTruth;
import com.example.hoopstats_backend.model.SessionEvaluation;
import com.example.hoopstats_backend.model.SessionRecord;
import com.example.hoopstats_backend.service.Interfaces.SessionStore;
import com.example.hoopstats_backend.util.Rounding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Scores a session against ground truth.
 * <p>
 * Each expected event takes the first unconsumed scoring detection, in list order, whose disposition contains the
 * event type (case-insensitive) and whose timestamp lies within the tolerance. Detections marked
 * {@link StatsCalculationService#IGNORED} never match and never count as false positives.
 */
@Service
public class EvaluationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationService.class);

    private final GroundTruthRepository groundTruths;
    private final SessionStore sessions;
    private final EvaluationHistoryLog history;
    private final EvaluationReportFormatter reportFormatter;
    private final Clock clock;

    public EvaluationService(GroundTruthRepository groundTruths, SessionStore sessions, EvaluationHistoryLog history,
                             EvaluationReportFormatter reportFormatter, Clock clock) {
        this.groundTruths = groundTruths;
        this.sessions = sessions;
        this.history = history;
        this.reportFormatter = reportFormatter;
        this.clock = clock;
    }

    public EvaluationResult evaluate(GroundTruth groundTruth, SessionRecord session) {
        List<Detection> detections = session.detections();
        boolean[] consumed = new boolean[detections.size()];

        List<TruePositive> tps = new ArrayList<>();
        List<FalseNegative> fns = new ArrayList<>();
        for (ExpectedEvent expected : groundTruth.expectedDetections()) {
            int match = findMatch(expected, detections, consumed);
            if (match >= 0) {
                consumed[match] = true;
                double actual = detections.get(match).timestamp();
                tps.add(new TruePositive(expected.type(), expected.timestamp(), actual,
                        Math.abs(expected.timestamp() - actual)));
            } else {
                fns.add(new FalseNegative(expected.type(), expected.timestamp()));
            }
        }

        List<FalsePositive> fps = new ArrayList<>();
        for (int i = 0; i < detections.size(); i++) {
            Detection d = detections.get(i);
            if (!consumed[i] && !StatsCalculationService.isIgnored(d.classifiedAs())) {
                fps.add(new FalsePositive(d.classifiedAs(), d.timestamp()));
            }
        }

        Map<String, Integer> correct = new LinkedHashMap<>();
        Map<String, StatMismatch> errors = new LinkedHashMap<>();
        Map<String, Integer> actualStats = session.stats();
        groundTruth.expectedStats().forEach((stat, expectedValue) -> {
            int expected = expectedValue == null ? 0 : expectedValue;
            Integer actualValue = actualStats.get(stat);
            int actual = actualValue == null ? 0 : actualValue;
            if (expected == actual) {
                correct.put(stat, expected);
            } else {
                errors.put(stat, new StatMismatch(expected, actual));
            }
        });

        return new EvaluationResult(tps, fps, fns, correct, errors);
    }

    private static int findMatch(ExpectedEvent expected, List<Detection> detections, boolean[] consumed) {
        String type = expected.type() == null ? "" : expected.type().toUpperCase(Locale.ROOT);
        for (int i = 0; i < detections.size(); i++) {
            if (consumed[i]) {
                continue;
            }
            Detection d = detections.get(i);
            if (StatsCalculationService.isIgnored(d.classifiedAs())) {
                continue;
            }
            if (!d.classifiedAs().toUpperCase(Locale.ROOT).contains(type)) {
                continue;
            }
            if (Math.abs(d.timestamp() - expected.timestamp()) <= expected.tolerance()) {
                return i;
            }
        }
        return -1;
    }

    public Score score(EvaluationResult result, GroundTruth groundTruth) {
        int tp = result.truePositives().size();
        int fp = result.falsePositives().size();
        int fn = result.falseNegatives().size();

        double precision = tp + fp > 0 ? (double) tp / (tp + fp) : 0.0;
        double recall = tp + fn > 0 ? (double) tp / (tp + fn) : 0.0;
        double f1 = precision + recall > 0 ? 2 * precision * recall / (precision + recall) : 0.0;

        int totalStats = groundTruth.expectedStats().size();
        double statsAccuracy = totalStats > 0 ? 100.0 * result.statsCorrect().size() / totalStats : 0.0;

        double avgTimeError = 0.0;
        if (tp > 0) {
            double sum = 0.0;
            for (TruePositive t : result.truePositives()) {
                sum += t.timeError();
            }
            avgTimeError = sum / tp;
        }

        // f1 stays a fraction here while the other two terms are percentages
        double timingScore = Math.max(0.0, 100.0 - avgTimeError * 20.0);
        double overall = f1 * 50.0 + statsAccuracy * 0.3 + timingScore * 0.2;

        return new Score(
                Rounding.round(overall, 2),
                Rounding.round(precision * 100.0, 2),
                Rounding.round(recall * 100.0, 2),
                Rounding.round(f1 * 100.0, 2),
                Rounding.round(statsAccuracy, 2),
                Rounding.round(timingScore, 2),
                Rounding.round(avgTimeError, 2),
                tp, fp, fn);
    }

    /**
     * Evaluates a stored session, attaches the score to it and appends the outcome to the evaluation history.
     * Missing ground truth or session is reported as a failed outcome, never as a low score.
     */
    public EvaluationOutcome runEvaluation(String videoName, String sessionId) {
        LOGGER.info("Evaluating session={} video={}", sessionId, videoName);
        try {
            Optional<GroundTruth> groundTruth = groundTruths.find(videoName);
            if (groundTruth.isEmpty()) {
                LOGGER.warn("Skipping evaluation: no ground truth for video={}", videoName);
                return EvaluationOutcome.failed(EvaluationOutcome.Failure.NO_GROUND_TRUTH,
                        "Ground truth not found for video: " + videoName);
            }
            Optional<SessionRecord> session = sessions.get(sessionId);
            if (session.isEmpty()) {
                LOGGER.warn("Skipping evaluation: session={} not found", sessionId);
                return EvaluationOutcome.failed(EvaluationOutcome.Failure.SESSION_NOT_FOUND,
                        "Session not found: " + sessionId);
            }

            GroundTruth gt = groundTruth.get();
            EvaluationResult result = evaluate(gt, session.get());
            Score score = score(result, gt);

            if (LOGGER.isInfoEnabled()) {
                LOGGER.info("\n{}", reportFormatter.format(gt, session.get(), result, score));
            }

            String now = LocalDateTime.now(clock).toString();
            String gtVideo = gt.videoName() != null ? gt.videoName() : videoName;
            sessions.update(sessionId, s -> s.withEvaluation(SessionEvaluation.of(now, gtVideo, score)));
            history.append(EvaluationHistoryEntry.of(now, gtVideo, sessionId, score, result));

            LOGGER.info("Evaluation complete session={} overall={}%", sessionId, score.overallScore());
            return EvaluationOutcome.success(score, result);
        } catch (RuntimeException e) {
            LOGGER.error("Evaluation failed session={} video={}: {}", sessionId, videoName, e.getMessage(), e);
            return EvaluationOutcome.failed(EvaluationOutcome.Failure.EVALUATION_FAILED, String.valueOf(e.getMessage()));
        }
    }
}
