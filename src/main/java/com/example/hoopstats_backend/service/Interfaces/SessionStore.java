package com.example.hoopstats_backend.service.Interfaces;

import com.example.hoopstats_backend.model.SessionRecord;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface SessionStore {

    /** Appends a new session. Throws {@code SessionAlreadyExistsException} when the id is already stored. */
    void create(SessionRecord record);

    Optional<SessionRecord> get(String sessionId);

    /** Latest version of every session, most recently created first. */
    List<SessionRecord> listAll();

    /**
     * Applies {@code change} to the latest version of the session and stores the result as a new version.
     *
     * @throws com.example.hoopstats_backend.exception.SessionNotFoundException if no such session exists.
     */
    SessionRecord update(String sessionId, UnaryOperator<SessionRecord> change);

    /** Drops superseded versions. Returns the number of sessions kept. */
    int compact();
}
