package me.fablestack.mechanics.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.port.outbound.SessionPort;
import me.fablestack.mechanics.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Service for managing game sessions. Sessions are cached in memory and
 * persisted to storage as one JSON document each, written atomically.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GameSessionService implements SessionPort {

    private static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, GameSession> sessionCache = new ConcurrentHashMap<>();

    @Override
    public GameSession create(String scenarioName) {
        GameSession session = GameSession.builder()
                .id(UUID.randomUUID().toString())
                .scenarioName(scenarioName)
                .createdAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        save(session);
        log.info("Created new session: {}", session.getId());
        return session;
    }

    @Override
    public Optional<GameSession> get(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        GameSession cached = sessionCache.get(sessionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<GameSession> loaded = load(sessionId + JSON_EXTENSION);
        // putIfAbsent keeps a single live instance per id, sessions are locked on
        loaded.ifPresent(session -> sessionCache.putIfAbsent(sessionId, session));
        return loaded.map(session -> sessionCache.get(sessionId));
    }

    @Override
    public void save(GameSession session) {
        session.setUpdatedAt(clock.instant());
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session: " + session.getId(), e);
        }
        storagePort.putTextAtomic(SESSIONS_DIR, session.getId() + JSON_EXTENSION, json, false).join();
        sessionCache.put(session.getId(), session);
        log.debug("Saved session: {}", session.getId());
    }

    @Override
    public void delete(String sessionId) {
        sessionCache.remove(sessionId);
        try {
            storagePort.deleteObject(SESSIONS_DIR, sessionId + JSON_EXTENSION).join();
            log.info("Deleted session: {}", sessionId);
        } catch (Exception e) {
            log.error("Failed to delete session: {}", sessionId, e);
        }
    }

    @Override
    public List<GameSession> listAll() {
        // Merge cached sessions with any on-disk sessions not yet loaded
        try {
            List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION)) {
                    continue;
                }
                load(file).ifPresent(session -> {
                    if (session.getId() != null && !session.getId().isBlank()) {
                        sessionCache.putIfAbsent(session.getId(), session);
                    }
                });
            }
        } catch (Exception e) { // NOSONAR
            log.warn("Failed to scan sessions directory: {}", e.getMessage());
        }
        return sessionCache.values().stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparing(GameSession::getCreatedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private Optional<GameSession> load(String fileName) {
        try {
            String json = storagePort.getText(SESSIONS_DIR, fileName).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            GameSession session = objectMapper.readValue(json, GameSession.class);
            if (session.getId() == null || session.getId().isBlank()) {
                session.setId(fileName.substring(0, fileName.length() - JSON_EXTENSION.length()));
            }
            log.debug("Loaded existing session: {}", session.getId());
            return Optional.of(session);
        } catch (IOException | RuntimeException e) { // NOSONAR - unreadable files are skipped
            log.warn("Failed to parse session file {}: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }
}
