package com.example.hoopstats_backend.engine.Interfaces;

import com.example.hoopstats_backend.dto.ActionCategory;
import com.example.hoopstats_backend.dto.ClassificationResult;
import com.example.hoopstats_backend.video.Clip;

import java.util.List;
import java.util.Map;

/**
 * Labels a clip with a basketball action.
 */
public interface ActionClassifier {

    /**
     * Loads models or other heavy resources. A classifier that is already ready does nothing.
     *
     * @return {@code true} when the classifier is ready afterwards.
     */
    boolean initialize();

    boolean isReady();

    /**
     * Classifies one clip. Does not throw: internal failures yield {@link ClassificationResult#error(String)}.
     */
    ClassificationResult classify(Clip clip);

    /** Stable display name, recorded on every session produced with this classifier. */
    String name();

    /**
     * Keywords that this classifier's labels contain for each action category.
     */
    default Map<ActionCategory, List<String>> actionKeywordMapping() {
        return ActionCategory.defaultKeywords();
    }
}
