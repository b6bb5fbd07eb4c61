package com.example.hoopstats_backend.engine;

import com.example.hoopstats_backend.dto.BoundingBox;
import com.example.hoopstats_backend.dto.InferenceRequest;
import com.example.hoopstats_backend.dto.InferenceResponse;
import com.example.hoopstats_backend.engine.Interfaces.BallDetector;
import com.example.hoopstats_backend.exception.InferenceException;
import com.example.hoopstats_backend.util.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;

import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Object detector on the model server; returns the first box labelled as the ball.
 */
public class RemoteBallDetector implements BallDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteBallDetector.class);

    private final WebClient client;
    private final String model;
    private final String ballLabel;
    private final Duration timeout;

    public RemoteBallDetector(WebClient client, String model, String ballLabel, Duration timeout) {
        this.client = client;
        this.model = model;
        this.ballLabel = ballLabel;
        this.timeout = timeout;
    }

    @Override
    public boolean initialize() {
        LOGGER.info("Loading detector model: {}", model);
        client.get()
                .uri("/v1/models/{model}", model)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new InferenceException("Detector " + model + " unavailable " + resp.statusCode() + ": " + body)))
                .toBodilessEntity()
                .timeout(timeout)
                .block();
        return true;
    }

    @Override
    public Optional<BoundingBox> detect(BufferedImage frame) {
        InferenceResponse response = client.post()
                .uri("/v1/detect")
                .bodyValue(new InferenceRequest(model, List.of(ImageCodec.toBase64Jpeg(frame)), List.of()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new InferenceException("Detector error " + resp.statusCode() + ": " + body)))
                .bodyToMono(InferenceResponse.class)
                .timeout(timeout)
                .block();
        if (response == null || response.boxes() == null) {
            return Optional.empty();
        }
        return response.boxes().stream()
                .filter(b -> ballLabel.equals(b.label()))
                .findFirst()
                .map(InferenceResponse.Box::toBoundingBox);
    }
}
