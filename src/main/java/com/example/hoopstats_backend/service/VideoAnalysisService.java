package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.config.AnalysisProperties;
import com.example.hoopstats_backend.config.ScoringProperties;
import com.example.hoopstats_backend.dto.ActionCategory;
import com.example.hoopstats_backend.dto.ClassificationResult;
import com.example.hoopstats_backend.dto.DetectionCandidate;
import com.example.hoopstats_backend.dto.ScoredAction;
import com.example.hoopstats_backend.dto.StatsResult;
import com.example.hoopstats_backend.engine.ClassifierRegistry;
import com.example.hoopstats_backend.engine.Interfaces.ActionClassifier;
import com.example.hoopstats_backend.exception.ClassifierNotReadyException;
import com.example.hoopstats_backend.model.Detection;
import com.example.hoopstats_backend.model.SessionRecord;
import com.example.hoopstats_backend.service.Interfaces.FrameStorage;
import com.example.hoopstats_backend.service.Interfaces.SessionStore;
import com.example.hoopstats_backend.util.Rounding;
import com.example.hoopstats_backend.util.SessionIdGenerator;
import com.example.hoopstats_backend.video.Clip;
import com.example.hoopstats_backend.video.ClipExtractor;
import com.example.hoopstats_backend.video.ClipExtractor.ClipCursor;
import com.example.hoopstats_backend.video.FrameSource;
import com.example.hoopstats_backend.video.FrameSourceFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs one video through clip extraction, classification and scoring, and stores the resulting session.
 * <p>
 * Setup failures (unknown or unready classifier, unreadable video, bad windowing settings) abort the run.
 * A clip whose classification fails is recorded as an error result and skipped.
 */
@Service
public class VideoAnalysisService {
    private static final Logger LOGGER = LoggerFactory.getLogger(VideoAnalysisService.class);

    private final ClassifierRegistry registry;
    private final FrameSourceFactory frameSources;
    private final ClipExtractor clipExtractor;
    private final StatsCalculationService statsService;
    private final SessionStore sessionStore;
    private final FrameStorage frameStorage;
    private final SessionIdGenerator idGenerator;
    private final AnalysisProperties analysisProps;
    private final ScoringProperties scoringProps;
    private final Clock clock;

    public VideoAnalysisService(ClassifierRegistry registry, FrameSourceFactory frameSources, ClipExtractor clipExtractor,
                                StatsCalculationService statsService, SessionStore sessionStore, FrameStorage frameStorage,
                                SessionIdGenerator idGenerator, AnalysisProperties analysisProps,
                                ScoringProperties scoringProps, Clock clock) {
        this.registry = registry;
        this.frameSources = frameSources;
        this.clipExtractor = clipExtractor;
        this.statsService = statsService;
        this.sessionStore = sessionStore;
        this.frameStorage = frameStorage;
        this.idGenerator = idGenerator;
        this.analysisProps = analysisProps;
        this.scoringProps = scoringProps;
        this.clock = clock;
    }

    /**
     * @param video        file to decode.
     * @param classifierId registry id, e.g. {@code videomae} or {@code yolo}.
     * @param videoName    name recorded on the session and used to find ground truth; defaults to the file name.
     */
    public SessionRecord analyze(Path video, String classifierId, String videoName) {
        LOGGER.info("Opening video file: {}", video);
        LOGGER.info("Using classifier: {}", classifierId);

        ActionClassifier classifier = registry.get(classifierId);
        if (!classifier.isReady()) {
            throw new ClassifierNotReadyException(classifierId);
        }

        String name = videoName != null && !videoName.isBlank()
                ? videoName
                : video.getFileName().toString();
        double threshold = analysisProps.getDetectionThreshold();
        Map<ActionCategory, List<String>> mapping = scoringProps.applyOverrides(classifier.actionKeywordMapping());
        String sessionId = idGenerator.next(id -> sessionStore.get(id).isPresent());

        List<DetectionCandidate> candidates = new ArrayList<>();
        double fps;
        double duration;
        int clipCount;
        try (FrameSource source = frameSources.open(video)) {
            ClipCursor clips = clipExtractor.extract(source, analysisProps.toClipSettings());
            fps = clips.fps();
            int i = 0;
            while (clips.hasNext()) {
                Clip clip = clips.next();
                if (i % 5 == 0) {
                    LOGGER.info("Processing clip {} (frame {})", i + 1, clip.startFrame());
                }
                i++;

                ClassificationResult result = classifySafely(classifier, clip);
                if (result.action() == null || result.action().isBlank() || !(result.confidence() > threshold)) {
                    continue;
                }
                double timestamp = clip.startFrame() / fps;
                String frameImage = frameStorage.save(sessionId, clip.startFrame(), clip.middleFrame().image());
                candidates.add(new DetectionCandidate(clip.startFrame(), timestamp, result.action(),
                        result.confidence(), frameImage));
                LOGGER.info("Detected '{}' (confidence: {}) at {}s", result.action(),
                        String.format(Locale.ROOT, "%.2f", result.confidence()),
                        String.format(Locale.ROOT, "%.2f", timestamp));
            }
            clipCount = clips.clipsEmitted();
            int frames = source.totalFrames() > 0 ? source.totalFrames() : clips.framesRead();
            duration = Rounding.round(frames / fps, 2);
        }
        LOGGER.info("Extracted {} clips (FPS: {})", clipCount, String.format(Locale.ROOT, "%.2f", fps));

        StatsResult stats = statsService.calculate(candidates, mapping);

        List<Detection> details = new ArrayList<>(stats.actions().size());
        for (ScoredAction a : stats.actions()) {
            DetectionCandidate c = a.candidate();
            details.add(new Detection(
                    Rounding.round(c.timestamp(), 2),
                    c.frame(),
                    c.action(),
                    Rounding.round(c.confidence(), 3),
                    a.classifiedAs(),
                    c.frameImage(),
                    sessionId));
        }

        SessionRecord record = new SessionRecord(
                sessionId,
                LocalDateTime.now(clock).toString(),
                name,
                duration,
                details.size(),
                classifier.name(),
                stats.stats(),
                details,
                null);
        sessionStore.create(record);
        LOGGER.info("Saved session {}", sessionId);

        Map<String, Integer> s = stats.stats();
        LOGGER.info("Analysis complete. Detected {} events", details.size());
        LOGGER.info("Stats: Points={}, Assists={}, Blocks={}", s.get("points"), s.get("assists"), s.get("blocks"));
        return record;
    }

    /** Classifiers outside this code base may still throw; that clip becomes an error result. */
    private static ClassificationResult classifySafely(ActionClassifier classifier, Clip clip) {
        try {
            ClassificationResult r = classifier.classify(clip);
            return r != null ? r : ClassificationResult.error("classifier returned no result");
        } catch (RuntimeException e) {
            LOGGER.warn("Classification failed for clip at frame {}: {}", clip.startFrame(), e.toString());
            return ClassificationResult.error(e.getMessage());
        }
    }
}
