package com.example.hoopstats_backend.config;

import com.example.hoopstats_backend.engine.ClassifierRegistry;
import com.example.hoopstats_backend.engine.RemoteBallDetector;
import com.example.hoopstats_backend.engine.RemoteModelClassifier;
import com.example.hoopstats_backend.engine.TrajectoryHeuristicClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Registers every configured classifier under its short id. Nothing is loaded until a classifier is first used.
 */
@Configuration
public class ClassifierConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClassifierConfig.class);

    public static final String TRAJECTORY_ID = "yolo";

    @Bean
    public ClassifierRegistry classifierRegistry(InferenceProperties props,
                                                 @Qualifier("inferenceWebClient") WebClient client) {
        Duration timeout = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));
        ClassifierRegistry registry = new ClassifierRegistry();

        props.getModels().forEach((id, model) -> registry.register(id, model.getName(), () ->
                new RemoteModelClassifier(client, model.getName(), model.getModel(), model.getSampleFrames(),
                        model.getPrompts(), timeout)));

        InferenceProperties.BallDetector detector = props.getBallDetector();
        if (detector.isEnabled()) {
            registry.register(TRAJECTORY_ID, TrajectoryHeuristicClassifier.NAME, () ->
                    new TrajectoryHeuristicClassifier(
                            new RemoteBallDetector(client, detector.getModel(), detector.getBallLabel(), timeout)));
        }
        LOGGER.info("Classifiers registered: {}", registry.available());
        return registry;
    }
}
