package com.example.hoopstats_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "inference")
public class InferenceProperties {
    private String baseUrl = "http://127.0.0.1:8500";
    private long timeoutSeconds = 60;
    private Map<String, ModelSpec> models = defaultModels();
    private BallDetector ballDetector = new BallDetector();

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public Map<String, ModelSpec> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelSpec> models) {
        this.models = models;
    }

    public BallDetector getBallDetector() {
        return ballDetector;
    }

    public void setBallDetector(BallDetector ballDetector) {
        this.ballDetector = ballDetector;
    }

    private static Map<String, ModelSpec> defaultModels() {
        Map<String, ModelSpec> m = new LinkedHashMap<>();
        m.put("videomae", new ModelSpec("VideoMAE (Kinetics-400)", "MCG-NJU/videomae-base-finetuned-kinetics", 16, List.of()));
        m.put("timesformer", new ModelSpec("TimeSformer (Kinetics-400)", "facebook/timesformer-base-finetuned-k400", 8, List.of()));
        m.put("x3d", new ModelSpec("X3D-M (Kinetics-400)", "x3d_m", 16, List.of()));
        m.put("clip", new ModelSpec("CLIP zero-shot", "openai/clip-vit-base-patch32", 4, List.of(
                "a basketball player shooting the ball",
                "a basketball player passing the ball",
                "a basketball player dribbling the ball",
                "a basketball player dunking",
                "a basketball player blocking a shot",
                "a basketball player catching the ball")));
        m.put("vivit", new ModelSpec("ViViT (Kinetics-400)", "google/vivit-b-16x2-kinetics400", 32, List.of()));
        m.put("slowfast", new ModelSpec("SlowFast R50 (Kinetics-400)", "slowfast_r50", 32, List.of()));
        return m;
    }

    /** A classifier served by the model server. */
    public static class ModelSpec {
        private String name;
        private String model;
        private int sampleFrames = 16;
        private List<String> prompts = new ArrayList<>();

        public ModelSpec() {
        }

        public ModelSpec(String name, String model, int sampleFrames, List<String> prompts) {
            this.name = name;
            this.model = model;
            this.sampleFrames = sampleFrames;
            this.prompts = new ArrayList<>(prompts);
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getSampleFrames() {
            return sampleFrames;
        }

        public void setSampleFrames(int sampleFrames) {
            this.sampleFrames = sampleFrames;
        }

        public List<String> getPrompts() {
            return prompts;
        }

        public void setPrompts(List<String> prompts) {
            this.prompts = prompts;
        }
    }

    /** Object detector behind the {@code yolo} trajectory classifier. */
    public static class BallDetector {
        private boolean enabled = true;
        private String model = "yolov8n";
        private String ballLabel = "sports ball";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getBallLabel() {
            return ballLabel;
        }

        public void setBallLabel(String ballLabel) {
            this.ballLabel = ballLabel;
        }
    }
}
