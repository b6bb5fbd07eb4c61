package com.example.hoopstats_backend.engine;

import com.example.hoopstats_backend.dto.ClassificationResult;
import com.example.hoopstats_backend.engine.Interfaces.ActionClassifier;
import com.example.hoopstats_backend.video.Clip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared lifecycle for classifiers: guarded one-time initialisation and a {@code classify} that converts
 * any failure into the error sentinel.
 */
public abstract class AbstractActionClassifier implements ActionClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractActionClassifier.class);

    private final Object initLock = new Object();
    private volatile boolean ready;

    @Override
    public final boolean initialize() {
        if (ready) {
            return true;
        }
        synchronized (initLock) {
            if (ready) {
                return true;
            }
            LOGGER.info("Loading classifier {}", name());
            try {
                ready = loadResources();
            } catch (RuntimeException e) {
                LOGGER.error("Failed to load {}: {}", name(), e.getMessage(), e);
                ready = false;
            }
            if (ready) {
                LOGGER.info("Classifier {} loaded successfully", name());
            }
            return ready;
        }
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public final ClassificationResult classify(Clip clip) {
        if (!isReady()) {
            LOGGER.warn("{} classifier not ready", name());
            return ClassificationResult.unknown();
        }
        if (clip == null || clip.frames().isEmpty()) {
            return ClassificationResult.error("empty clip");
        }
        try {
            ClassificationResult result = doClassify(clip);
            return result != null ? result : ClassificationResult.error("no result");
        } catch (RuntimeException e) {
            LOGGER.warn("Error in {} classification startFrame={}: {}", name(), clip.startFrame(), e.toString());
            return ClassificationResult.error(e.getMessage());
        }
    }

    /**
     * @return {@code true} when resources loaded. May throw; the failure is logged and treated as not ready.
     */
    protected abstract boolean loadResources();

    protected abstract ClassificationResult doClassify(Clip clip);
}
