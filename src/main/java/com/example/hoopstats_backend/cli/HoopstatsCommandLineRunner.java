package com.example.hoopstats_backend.cli;

import com.example.hoopstats_backend.dto.ClassifierInfo;
import com.example.hoopstats_backend.dto.EvaluationOutcome;
import com.example.hoopstats_backend.engine.ClassifierRegistry;
import com.example.hoopstats_backend.model.SessionRecord;
import com.example.hoopstats_backend.service.AnalysisWorkflow;
import com.example.hoopstats_backend.service.EvaluationService;
import com.example.hoopstats_backend.service.Interfaces.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 *   analyze &lt;video&gt; [--classifier=id] [--name=video-name]
 *   evaluate &lt;video-name&gt; &lt;session-id&gt;
 *   sessions
 *   classifiers
 *   compact
 * </pre>
 */
@Component
@ConditionalOnProperty(prefix = "hoopstats.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HoopstatsCommandLineRunner implements ApplicationRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(HoopstatsCommandLineRunner.class);

    private final AnalysisWorkflow workflow;
    private final EvaluationService evaluationService;
    private final SessionStore sessionStore;
    private final ClassifierRegistry registry;

    public HoopstatsCommandLineRunner(AnalysisWorkflow workflow, EvaluationService evaluationService,
                                      SessionStore sessionStore, ClassifierRegistry registry) {
        this.workflow = workflow;
        this.evaluationService = evaluationService;
        this.sessionStore = sessionStore;
        this.registry = registry;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            return;
        }
        String command = positional.get(0);
        switch (command) {
            case "analyze" -> analyze(positional, args);
            case "evaluate" -> evaluate(positional);
            case "sessions" -> listSessions();
            case "classifiers" -> listClassifiers();
            case "compact" -> LOGGER.info("Session log compacted, {} sessions kept", sessionStore.compact());
            default -> usage("Unknown command: " + command);
        }
    }

    private void analyze(List<String> positional, ApplicationArguments args) {
        if (positional.size() < 2) {
            usage("analyze needs a video path");
            return;
        }
        Path video = Path.of(positional.get(1));
        String classifier = firstOption(args, "classifier");
        String name = firstOption(args, "name");

        AnalysisWorkflow.Result result = workflow.run(video, classifier, name);
        SessionRecord s = result.session();
        LOGGER.info("Session {}: {} detections, stats={}", s.sessionId(), s.totalDetections(), s.stats());
        if (s.evaluation() != null) {
            LOGGER.info("Evaluation overall={}%", s.evaluation().overallScore());
        }
    }

    private void evaluate(List<String> positional) {
        if (positional.size() < 3) {
            usage("evaluate needs a video name and a session id");
            return;
        }
        EvaluationOutcome outcome = evaluationService.runEvaluation(positional.get(1), positional.get(2));
        if (outcome.success()) {
            LOGGER.info("Evaluation complete! Overall score: {}%", outcome.score().overallScore());
        } else {
            LOGGER.warn("Could not evaluate: {} ({})", outcome.failure(), outcome.message());
        }
    }

    private void listSessions() {
        List<SessionRecord> sessions = sessionStore.listAll();
        LOGGER.info("{} sessions", sessions.size());
        for (SessionRecord s : sessions) {
            LOGGER.info("  {}  {}  {}  detections={} stats={}", s.sessionId(), s.videoName(), s.classifierUsed(),
                    s.totalDetections(), s.stats());
        }
    }

    private void listClassifiers() {
        for (ClassifierInfo info : registry.info()) {
            LOGGER.info("  {}  {}  loaded={} ready={}", info.id(), info.name(), info.loaded(), info.ready());
        }
    }

    private static String firstOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static void usage(String problem) {
        LOGGER.warn("{}. Usage: analyze <video> [--classifier=id] [--name=video-name] | evaluate <video-name> <session-id> | sessions | classifiers | compact", problem);
    }
}
