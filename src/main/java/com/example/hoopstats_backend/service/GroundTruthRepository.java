package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.config.EvaluationProperties;
import com.example.hoopstats_backend.exception.GroundTruthNotFoundException;
import com.example.hoopstats_backend.exception.StorageException;
import com.example.hoopstats_backend.model.GroundTruth;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads hand-authored ground truth. {@code trim.mp4} is looked up as {@code <ground-truth-dir>/trim.json}; when
 * that file is absent the configured default file is used, but only when its {@code video_name} names the same
 * video.
 */
@Component
public class GroundTruthRepository {
    private static final Logger LOGGER = LoggerFactory.getLogger(GroundTruthRepository.class);

    private final Path dir;
    private final String defaultFile;
    private final ObjectMapper mapper;

    public GroundTruthRepository(EvaluationProperties props, ObjectMapper mapper) {
        this.dir = Path.of(props.getGroundTruthDir()).toAbsolutePath().normalize();
        this.defaultFile = props.getDefaultGroundTruth();
        this.mapper = mapper;
    }

    public Optional<GroundTruth> find(String videoName) {
        String base = baseName(videoName);
        if (!base.isEmpty()) {
            Path perVideo = dir.resolve(base + ".json").normalize();
            if (perVideo.startsWith(dir) && Files.isRegularFile(perVideo)) {
                return Optional.of(read(perVideo, videoName));
            }
        }
        if (defaultFile != null && !defaultFile.isBlank()) {
            Path fallback = dir.resolve(defaultFile).normalize();
            if (Files.isRegularFile(fallback)) {
                GroundTruth gt = read(fallback, videoName);
                if (!base.isEmpty() && base.equals(baseName(gt.videoName()))) {
                    return Optional.of(gt);
                }
                LOGGER.debug("Default ground truth {} describes video={}, not {}", fallback, gt.videoName(), videoName);
            }
        }
        LOGGER.debug("No ground truth for video={} in {}", videoName, dir);
        return Optional.empty();
    }

    public GroundTruth load(String videoName) {
        return find(videoName).orElseThrow(() -> new GroundTruthNotFoundException(videoName));
    }

    private GroundTruth read(Path path, String videoName) {
        try {
            GroundTruth gt = mapper.readValue(path.toFile(), GroundTruth.class);
            LOGGER.info("Ground truth loaded video={} file={} events={}", videoName, path, gt.expectedDetections().size());
            return gt;
        } catch (IOException e) {
            throw new StorageException("Unreadable ground truth file: " + path, e);
        }
    }

    /** {@code videos/trim.mp4} becomes {@code trim}. */
    static String baseName(String videoName) {
        if (videoName == null || videoName.isBlank()) {
            return "";
        }
        String name = videoName.replace('\\', '/');
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        return name;
    }
}
