package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.exception.StorageException;
import com.example.hoopstats_backend.model.EvaluationHistoryEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only log of evaluation outcomes, one JSON object per line.
 */
public class EvaluationHistoryLog {
    private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationHistoryLog.class);

    private final Path file;
    private final ObjectMapper mapper;

    public EvaluationHistoryLog(Path file, ObjectMapper mapper) {
        this.file = file.toAbsolutePath().normalize();
        this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
    }

    public synchronized void append(EvaluationHistoryEntry entry) {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, mapper.writeValueAsString(entry) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            LOGGER.debug("Evaluation history appended session={} file={}", entry.sessionId(), file);
        } catch (IOException e) {
            throw new StorageException("Cannot append evaluation history: " + file, e);
        }
    }

    /** Entries for one session, oldest first. */
    public synchronized List<EvaluationHistoryEntry> forSession(String sessionId) {
        List<EvaluationHistoryEntry> out = new ArrayList<>();
        for (EvaluationHistoryEntry e : readAll()) {
            if (sessionId != null && sessionId.equals(e.sessionId())) {
                out.add(e);
            }
        }
        return out;
    }

    public synchronized List<EvaluationHistoryEntry> readAll() {
        List<EvaluationHistoryEntry> out = new ArrayList<>();
        if (!Files.exists(file)) {
            return out;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    out.add(mapper.readValue(line, EvaluationHistoryEntry.class));
                } catch (JsonProcessingException e) {
                    LOGGER.warn("Skipping unreadable evaluation line in {}: {}", file, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Read failed: " + file, e);
        }
        return out;
    }
}
