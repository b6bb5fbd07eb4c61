package com.example.hoopstats_backend.service;

import com.example.hoopstats_backend.exception.SessionAlreadyExistsException;
import com.example.hoopstats_backend.exception.SessionNotFoundException;
import com.example.hoopstats_backend.exception.StorageException;
import com.example.hoopstats_backend.model.SessionRecord;
import com.example.hoopstats_backend.service.Interfaces.SessionStore;
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
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Session log with one JSON record per line.
 * <p>
 * The file is only ever appended to: an update writes a complete new version of the session and readers keep
 * the last version per id, ordered by the position of the id's first line. All file access goes through one
 * lock, so a single instance must own the file.
 */
public class JsonlSessionStore implements SessionStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonlSessionStore.class);

    private final Path file;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlSessionStore(Path file, ObjectMapper mapper) {
        this.file = file.toAbsolutePath().normalize();
        this.mapper = mapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
        try {
            Path parent = this.file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot create session directory for " + this.file, e);
        }
        LOGGER.info("JsonlSessionStore ready. file={}", this.file);
    }

    @Override
    public void create(SessionRecord record) {
        Objects.requireNonNull(record, "record");
        lock.lock();
        try {
            if (readLatest().containsKey(record.sessionId())) {
                throw new SessionAlreadyExistsException(record.sessionId());
            }
            append(record);
            LOGGER.info("Session stored id={} detections={}", record.sessionId(), record.totalDetections());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<SessionRecord> get(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(readLatest().get(sessionId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<SessionRecord> listAll() {
        lock.lock();
        try {
            List<SessionRecord> out = new ArrayList<>(readLatest().values());
            Collections.reverse(out);
            return out;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SessionRecord update(String sessionId, UnaryOperator<SessionRecord> change) {
        Objects.requireNonNull(change, "change");
        lock.lock();
        try {
            SessionRecord current = readLatest().get(sessionId);
            if (current == null) {
                throw new SessionNotFoundException(sessionId);
            }
            SessionRecord next = change.apply(current);
            if (next == null || !sessionId.equals(next.sessionId())) {
                throw new IllegalArgumentException("Update must keep session_id " + sessionId);
            }
            append(next);
            LOGGER.debug("Session updated id={}", sessionId);
            return next;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int compact() {
        lock.lock();
        try {
            Map<String, SessionRecord> latest = readLatest();
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (var writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                for (SessionRecord r : latest.values()) {
                    writer.write(toLine(r));
                }
            }
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            LOGGER.info("Session log compacted file={} sessions={}", file, latest.size());
            return latest.size();
        } catch (IOException e) {
            throw new StorageException("Compaction failed: " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private void append(SessionRecord record) {
        try {
            Files.writeString(file, toLine(record), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageException("Append failed: " + file, e);
        }
    }

    private String toLine(SessionRecord record) {
        try {
            return mapper.writeValueAsString(record) + "\n";
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize session " + record.sessionId(), e);
        }
    }

    /** Last version per id, keyed in order of first appearance. */
    private Map<String, SessionRecord> readLatest() {
        Map<String, SessionRecord> latest = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return latest;
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                SessionRecord r;
                try {
                    r = mapper.readValue(line, SessionRecord.class);
                } catch (JsonProcessingException e) {
                    LOGGER.warn("Skipping unreadable session line {} in {}: {}", lineNo, file, e.getOriginalMessage());
                    continue;
                }
                if (r.sessionId() == null) {
                    LOGGER.warn("Skipping session line {} without session_id", lineNo);
                    continue;
                }
                latest.put(r.sessionId(), r);
            }
        } catch (IOException e) {
            throw new StorageException("Read failed: " + file, e);
        }
        return latest;
    }
}
