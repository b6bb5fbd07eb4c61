package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.exception.StorageException;
import com.example.hoopstats_backend.service.Interfaces.FrameStorage;
import com.example.hoopstats_backend.util.ImageCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

public class LocalFrameStorage implements FrameStorage {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalFrameStorage.class);

    private final Path framesDir;

    public LocalFrameStorage(Path baseDir, String framesPrefix) {
        Path base = baseDir.toAbsolutePath().normalize();
        this.framesDir = base.resolve(framesPrefix).normalize();
        if (!framesDir.startsWith(base)) {
            throw new StorageException("Frames prefix escapes base dir: " + framesPrefix);
        }
        try {
            Files.createDirectories(framesDir);
            LOGGER.info("LocalFrameStorage ready. frames={}", framesDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create frames directory " + framesDir, e);
        }
    }

    public static String fileName(String sessionId, int frameIndex) {
        return String.format(Locale.ROOT, "%s_frame_%04d.jpg", sessionId, frameIndex);
    }

    @Override
    public String save(String sessionId, int frameIndex, BufferedImage image) {
        String name = fileName(sessionId, frameIndex);
        Path target = safeResolve(name);
        try {
            Files.write(target, ImageCodec.toJpeg(image));
        } catch (IOException | UncheckedIOException e) {
            throw new StorageException("Frame write failed: " + target, e);
        }
        return name;
    }

    @Override
    public Path resolve(String fileName) {
        return safeResolve(fileName);
    }

    @Override
    public boolean exists(String fileName) {
        return Files.exists(safeResolve(fileName));
    }

    private Path safeResolve(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new StorageException("fileName is blank");
        }
        String normalized = fileName.replace('\\', '/').replaceAll("^/+", "");
        Path p = framesDir.resolve(normalized).normalize();
        if (!p.startsWith(framesDir)) {
            throw new StorageException("Invalid fileName (path traversal?): " + fileName);
        }
        return p;
    }
}
