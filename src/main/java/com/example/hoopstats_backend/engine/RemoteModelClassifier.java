package com.example.hoopstats_backend.engine;

import com.example.hoopstats_backend.dto.ClassificationResult;
import com.example.hoopstats_backend.dto.InferenceRequest;
import com.example.hoopstats_backend.dto.InferenceResponse;
import com.example.hoopstats_backend.exception.InferenceException;
import com.example.hoopstats_backend.util.ImageCodec;
import com.example.hoopstats_backend.video.Clip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Video classification backed by a pretrained network hosted on the model server.
 * <p>
 * Samples {@code sampleFrames} evenly spaced frames of the clip and asks the server for the top label.
 * Zero-shot models additionally receive the candidate {@code prompts}.
 */
public class RemoteModelClassifier extends AbstractActionClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(RemoteModelClassifier.class);

    private final WebClient client;
    private final String displayName;
    private final String model;
    private final int sampleFrames;
    private final List<String> prompts;
    private final Duration timeout;

    public RemoteModelClassifier(WebClient client, String displayName, String model, int sampleFrames,
                                 List<String> prompts, Duration timeout) {
        if (sampleFrames <= 0) {
            throw new IllegalArgumentException("sampleFrames must be > 0 for " + displayName);
        }
        this.client = client;
        this.displayName = displayName;
        this.model = model;
        this.sampleFrames = sampleFrames;
        this.prompts = prompts == null ? List.of() : List.copyOf(prompts);
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return displayName;
    }

    @Override
    protected boolean loadResources() {
        client.get()
                .uri("/v1/models/{model}", model)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new InferenceException("Model " + model + " unavailable " + resp.statusCode() + ": " + body)))
                .toBodilessEntity()
                .timeout(timeout)
                .block();
        return true;
    }

    @Override
    protected ClassificationResult doClassify(Clip clip) {
        int[] indices = sampleIndices(clip.size(), sampleFrames);
        List<String> frames = new ArrayList<>(indices.length);
        for (int idx : indices) {
            frames.add(ImageCodec.toBase64Jpeg(clip.frames().get(idx).image()));
        }

        long start = System.currentTimeMillis();
        InferenceResponse response = client.post()
                .uri("/v1/classify")
                .bodyValue(new InferenceRequest(model, frames, prompts))
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> new InferenceException("Model server error " + resp.statusCode() + ": " + body)))
                .bodyToMono(InferenceResponse.class)
                .timeout(timeout)
                .block();
        LOGGER.debug("{} classified startFrame={} in {} ms", displayName, clip.startFrame(), System.currentTimeMillis() - start);

        if (response == null || response.label() == null || response.label().isBlank() || response.confidence() == null) {
            return ClassificationResult.error("empty model response");
        }
        double confidence = Math.max(0.0, Math.min(1.0, response.confidence()));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("classifier", displayName);
        meta.put("model", model);
        meta.put("num_frames_sampled", indices.length);
        if (response.scores() != null && !response.scores().isEmpty()) {
            meta.put("all_scores", response.scores());
        }
        return new ClassificationResult(response.label(), confidence, meta);
    }

    /**
     * {@code count} indices spread evenly over {@code [0, frameCount - 1]}, truncated toward zero.
     * Indices repeat when the clip is shorter than {@code count}.
     */
    static int[] sampleIndices(int frameCount, int count) {
        int[] out = new int[count];
        if (count == 1 || frameCount <= 1) {
            return out;
        }
        double step = (frameCount - 1) / (double) (count - 1);
        for (int i = 0; i < count; i++) {
            out[i] = Math.min(frameCount - 1, (int) (i * step));
        }
        return out;
    }
}
