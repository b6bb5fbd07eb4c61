package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.config.AnalysisProperties;
import com.example.hoopstats_backend.config.EvaluationProperties;
import com.example.hoopstats_backend.dto.EvaluationOutcome;
import com.example.hoopstats_backend.engine.ClassifierRegistry;
import com.example.hoopstats_backend.exception.UnknownClassifierException;
import com.example.hoopstats_backend.model.SessionRecord;
import com.example.hoopstats_backend.service.Interfaces.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Analysis followed by automatic evaluation when ground truth exists for the video.
 */
@Service
public class AnalysisWorkflow {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisWorkflow.class);

    private final ClassifierRegistry registry;
    private final VideoAnalysisService analysisService;
    private final EvaluationService evaluationService;
    private final SessionStore sessionStore;
    private final AnalysisProperties analysisProps;
    private final EvaluationProperties evaluationProps;

    public AnalysisWorkflow(ClassifierRegistry registry, VideoAnalysisService analysisService,
                            EvaluationService evaluationService, SessionStore sessionStore,
                            AnalysisProperties analysisProps, EvaluationProperties evaluationProps) {
        this.registry = registry;
        this.analysisService = analysisService;
        this.evaluationService = evaluationService;
        this.sessionStore = sessionStore;
        this.analysisProps = analysisProps;
        this.evaluationProps = evaluationProps;
    }

    public record Result(SessionRecord session, EvaluationOutcome evaluation) {
    }

    /**
     * @param classifierId registry id, or {@code null} for the configured default.
     * @throws UnknownClassifierException before any decoding when the id is not registered.
     */
    public Result run(Path video, String classifierId, String videoName) {
        String id = classifierId == null || classifierId.isBlank() ? analysisProps.getDefaultClassifier() : classifierId;
        if (!registry.isRegistered(id)) {
            throw new UnknownClassifierException(id, registry.available());
        }

        SessionRecord session = analysisService.analyze(video, id, videoName);

        if (!evaluationProps.isEnabled() || session.videoName() == null) {
            return new Result(session, null);
        }
        LOGGER.info("Running evaluation...");
        EvaluationOutcome outcome = evaluationService.runEvaluation(session.videoName(), session.sessionId());
        if (!outcome.success()) {
            LOGGER.info("No evaluation for session={}: {} ({})", session.sessionId(), outcome.failure(), outcome.message());
            return new Result(session, outcome);
        }
        LOGGER.info("Score: {}%", outcome.score().overallScore());
        SessionRecord evaluated = sessionStore.get(session.sessionId()).orElse(session);
        return new Result(evaluated, outcome);
    }
}
