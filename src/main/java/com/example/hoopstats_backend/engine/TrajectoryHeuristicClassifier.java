package com.example.hoopstats_backend.engine;

import com.example.hoopstats_backend.dto.ActionCategory;
import com.example.hoopstats_backend.dto.BallPosition;
import com.example.hoopstats_backend.dto.BoundingBox;
import com.example.hoopstats_backend.dto.ClassificationResult;
import com.example.hoopstats_backend.engine.Interfaces.BallDetector;
import com.example.hoopstats_backend.video.Clip;
import com.example.hoopstats_backend.video.VideoFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Infers an action from the ball's path across a clip.
 * <ul>
 *     <li>shooting: ball rises then settles (arc)</li>
 *     <li>dribbling: repeated up-down motion</li>
 *     <li>passing: fast, mostly horizontal travel</li>
 *     <li>catching: ball present but nearly still</li>
 * </ul>
 */
public class TrajectoryHeuristicClassifier extends AbstractActionClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(TrajectoryHeuristicClassifier.class);

    public static final String NAME = "YOLO Ball Tracking";
    public static final String SHOOTING = "shooting basketball";
    public static final String DRIBBLING = "dribbling basketball";
    public static final String PASSING = "passing basketball";
    public static final String CATCHING = "catching basketball";
    public static final String PLAYING = "playing basketball";
    public static final String NO_BALL = "no_ball_detected";

    private static final int MIN_POSITIONS = 3;
    private static final int MIN_ARC_POSITIONS = 6;
    private static final double SHOT_RISE = -0.1;
    private static final double DRIBBLE_MIN_VY = 0.02;
    private static final double PASS_MIN_MOVEMENT = 0.15;
    private static final double CATCH_MAX_MOVEMENT = 0.05;

    private static final Map<ActionCategory, List<String>> KEYWORDS;

    static {
        Map<ActionCategory, List<String>> m = new EnumMap<>(ActionCategory.class);
        m.put(ActionCategory.SHOOTING, List.of(SHOOTING, "throw", "shot"));
        m.put(ActionCategory.PASSING, List.of(PASSING, "pass"));
        m.put(ActionCategory.DRIBBLING, List.of(DRIBBLING, "dribble"));
        m.put(ActionCategory.DUNKING, List.of("dunk", "slam"));
        m.put(ActionCategory.BLOCKING, List.of("block", "defend"));
        m.put(ActionCategory.CATCHING, List.of(CATCHING, "catch"));
        KEYWORDS = Collections.unmodifiableMap(m);
    }

    private final BallDetector detector;

    public TrajectoryHeuristicClassifier(BallDetector detector) {
        this.detector = detector;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected boolean loadResources() {
        return detector.initialize();
    }

    @Override
    protected ClassificationResult doClassify(Clip clip) {
        return analyzeTrajectory(detectBallPositions(clip));
    }

    @Override
    public Map<ActionCategory, List<String>> actionKeywordMapping() {
        return KEYWORDS;
    }

    List<BallPosition> detectBallPositions(Clip clip) {
        List<BallPosition> positions = new ArrayList<>(clip.size());
        for (VideoFrame frame : clip.frames()) {
            Optional<BoundingBox> box = detector.detect(frame.image());
            if (box.isPresent() && frame.width() > 0 && frame.height() > 0) {
                positions.add(BallPosition.of(
                        box.get().centerX() / frame.width(),
                        box.get().centerY() / frame.height()));
            } else {
                positions.add(BallPosition.absent());
            }
        }
        return positions;
    }

    /**
     * Classifies a sequence of per-frame ball positions. Absent positions are skipped.
     */
    public ClassificationResult analyzeTrajectory(List<BallPosition> positions) {
        List<BallPosition> valid = positions.stream().filter(BallPosition::present).toList();
        int n = valid.size();
        if (n < MIN_POSITIONS) {
            return new ClassificationResult(NO_BALL, 0.0, Map.of("valid_detections", n));
        }

        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = valid.get(i).x();
            ys[i] = valid.get(i).y();
        }

        double dx = xs[n - 1] - xs[0];
        double dy = ys[n - 1] - ys[0];

        double sumVx = 0;
        double sumVy = 0;
        double[] yVelocity = new double[n - 1];
        for (int i = 0; i < n - 1; i++) {
            yVelocity[i] = ys[i + 1] - ys[i];
            sumVx += Math.abs(xs[i + 1] - xs[i]);
            sumVy += Math.abs(yVelocity[i]);
        }
        double avgVx = sumVx / (n - 1);
        double avgVy = sumVy / (n - 1);

        int yDirectionChanges = 0;
        for (int i = 0; i < yVelocity.length - 1; i++) {
            if (Math.signum(yVelocity[i + 1]) != Math.signum(yVelocity[i])) {
                yDirectionChanges++;
            }
        }

        double totalMovement = Math.sqrt(dx * dx + dy * dy);
        double midY = ys[n / 2];

        String action;
        double confidence;
        if (dy < SHOT_RISE && n >= MIN_ARC_POSITIONS && midY < ys[0] && midY < ys[n - 1]) {
            action = SHOOTING;
            confidence = Math.min(0.9, 0.5 + Math.abs(dy) * 2);
        } else if (yDirectionChanges >= 2 && avgVy > DRIBBLE_MIN_VY) {
            action = DRIBBLING;
            confidence = Math.min(0.85, 0.4 + yDirectionChanges * 0.15);
        } else if (avgVx > avgVy * 1.5 && totalMovement > PASS_MIN_MOVEMENT) {
            action = PASSING;
            confidence = Math.min(0.8, 0.4 + totalMovement * 2);
        } else if (totalMovement < CATCH_MAX_MOVEMENT && n >= MIN_ARC_POSITIONS) {
            action = CATCHING;
            confidence = 0.6;
        } else {
            action = PLAYING;
            confidence = 0.5;
        }

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("valid_detections", n);
        meta.put("total_frames", positions.size());
        meta.put("detection_rate", n / (double) positions.size());
        meta.put("total_movement", totalMovement);
        meta.put("dx", dx);
        meta.put("dy", dy);
        meta.put("y_direction_changes", yDirectionChanges);
        meta.put("classifier", NAME);
        LOGGER.debug("trajectory n={} dx={} dy={} changes={} -> {} ({})", n, dx, dy, yDirectionChanges, action, confidence);
        return new ClassificationResult(action, confidence, meta);
    }
}
