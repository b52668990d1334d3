package me.fablestack.mechanics.port.outbound;

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

import me.fablestack.mechanics.domain.exception.NotFoundException;
import me.fablestack.mechanics.domain.model.GameSession;

import java.util.List;
import java.util.Optional;

/**
 * Port for managing game sessions. Abstracts session CRUD and persistence from
 * the mechanics services.
 */
public interface SessionPort {

    GameSession create(String scenarioName);

    Optional<GameSession> get(String sessionId);

    /**
     * Persists the session. Failures propagate so the caller can undo the
     * in-memory mutation that was being committed.
     */
    void save(GameSession session);

    void delete(String sessionId);

    List<GameSession> listAll();

    default GameSession getRequired(String sessionId) {
        return get(sessionId).orElseThrow(() -> new NotFoundException("Session not found: " + sessionId));
    }
}
