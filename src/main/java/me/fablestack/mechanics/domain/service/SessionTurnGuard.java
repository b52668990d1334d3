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

import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.domain.exception.StateConflictException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Admits at most one turn-resolution flow per session. A second concurrent
 * turn, mechanical call or rollback on the same session is rejected instead of
 * queued; distinct sessions never contend.
 */
@Component
@Slf4j
public class SessionTurnGuard {

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();

    /**
     * Claims the session.
     *
     * @throws StateConflictException
     *             if another flow holds the session
     */
    public Lease acquire(String sessionId, String purpose) {
        Lease lease = new Lease(sessionId, purpose);
        Lease existing = leases.putIfAbsent(sessionId, lease);
        if (existing != null) {
            log.warn("[Guard] Rejected {} on session {}: {} in progress", purpose, sessionId, existing.purpose);
            throw new StateConflictException(
                    "Session " + sessionId + " is busy (" + existing.purpose + " in progress)");
        }
        log.debug("[Guard] {} acquired session {}", purpose, sessionId);
        return lease;
    }

    public boolean isBusy(String sessionId) {
        return leases.containsKey(sessionId);
    }

    /**
     * Claim on one session. Closing is idempotent.
     */
    public final class Lease implements AutoCloseable {

        private final String sessionId;
        private final String purpose;

        private Lease(String sessionId, String purpose) {
            this.sessionId = sessionId;
            this.purpose = purpose;
        }

        @Override
        public void close() {
            if (leases.remove(sessionId, this)) {
                log.debug("[Guard] {} released session {}", purpose, sessionId);
            }
        }
    }
}
