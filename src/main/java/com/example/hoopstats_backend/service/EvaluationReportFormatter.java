package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.dto.Score;
import com.example.hoopstats_backend.model.EvaluationResult;
import com.example.hoopstats_backend.model.GroundTruth;
import com.example.hoopstats_backend.model.SessionRecord;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Plain-text evaluation report for logs and the command line.
 */
@Component
public class EvaluationReportFormatter {
    private static final String RULE = "=".repeat(80);

    public String format(GroundTruth groundTruth, SessionRecord session, EvaluationResult result, Score score) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("EVALUATION REPORT\n");
        sb.append(RULE).append('\n');
        sb.append("Video: ").append(groundTruth.videoName()).append('\n');
        sb.append("Session: ").append(session.sessionId()).append('\n');
        sb.append("Timestamp: ").append(session.timestamp()).append('\n');
        sb.append(RULE).append('\n');
        sb.append("OVERALL SCORE: ").append(score.overallScore()).append("%\n\n");

        sb.append("DETECTION METRICS:\n");
        sb.append("  Precision:  ").append(score.precision()).append("%\n");
        sb.append("  Recall:     ").append(score.recall()).append("%\n");
        sb.append("  F1 Score:   ").append(score.f1Score()).append("%\n\n");

        sb.append("TRUE POSITIVES: ").append(score.truePositives()).append('\n');
        for (EvaluationResult.TruePositive tp : result.truePositives()) {
            sb.append(String.format(Locale.ROOT, "  - %s: expected %ss, detected %ss (error: %.2fs)%n",
                    upper(tp.type()), tp.expectedTime(), tp.actualTime(), tp.timeError()));
        }
        sb.append("FALSE POSITIVES: ").append(score.falsePositives()).append('\n');
        for (EvaluationResult.FalsePositive fp : result.falsePositives()) {
            sb.append("  - ").append(fp.type()).append(" at ").append(fp.timestamp()).append("s\n");
        }
        sb.append("FALSE NEGATIVES: ").append(score.falseNegatives()).append('\n');
        for (EvaluationResult.FalseNegative fn : result.falseNegatives()) {
            sb.append("  - ").append(upper(fn.type())).append(" at ").append(fn.expectedTime()).append("s (missed)\n");
        }

        sb.append("\nSTATS ACCURACY: ").append(score.statsAccuracy()).append("%\n");
        result.statsCorrect().forEach((stat, value) ->
                sb.append("  ok    ").append(stat).append(": ").append(value).append('\n'));
        result.statsErrors().forEach((stat, m) ->
                sb.append("  wrong ").append(stat).append(": expected ").append(m.expected())
                        .append(", got ").append(m.actual()).append('\n'));

        sb.append("\nTIMING ACCURACY: ").append(score.timingAccuracy()).append("%\n");
        sb.append("  Average time error: ").append(score.avgTimeErrorSeconds()).append("s\n");
        sb.append(RULE);
        return sb.toString();
    }

    private static String upper(String s) {
        return s == null ? "" : s.toUpperCase(Locale.ROOT);
    }
}
