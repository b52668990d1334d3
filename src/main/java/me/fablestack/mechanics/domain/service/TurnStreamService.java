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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.domain.exception.ErrorCode;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.exception.NarrationUnavailableException;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.NarrationRequest;
import me.fablestack.mechanics.domain.model.PlayerInput;
import me.fablestack.mechanics.domain.model.StreamFrame;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.model.TurnAction;
import me.fablestack.mechanics.domain.model.TurnMechanics;
import me.fablestack.mechanics.port.outbound.IntentResolverPort;
import me.fablestack.mechanics.port.outbound.NarratorPort;
import me.fablestack.mechanics.port.outbound.SessionPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs one player turn end to end: records the input, resolves and commits the
 * mechanics, then streams narration. The session is claimed for the whole
 * turn, including narration. It is released when the stream terminates or is
 * cancelled, but never while the mechanics phase is still running: a cancelled
 * turn keeps the session until its in-flight commit has finished.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnStreamService {

    static final String NARRATION_UNAVAILABLE_MESSAGE = "Narration unavailable";

    private final SessionPort sessionPort;
    private final SessionTurnGuard turnGuard;
    private final MechanicsService mechanicsService;
    private final StreamCoordinator streamCoordinator;
    private final IntentResolverPort intentResolverPort;
    private final NarratorPort narratorPort;

    public Flux<StreamFrame> streamTurn(String sessionId, PlayerInput input) {
        return Flux.defer(() -> {
            validate(input);
            GameSession session = sessionPort.getRequired(sessionId);
            TurnClaim claim = new TurnClaim(turnGuard.acquire(sessionId, "turn"));
            log.debug("[Stream] Turn started for session {}", sessionId);
            return streamCoordinator.coordinate(
                    () -> runMechanics(claim, session, input),
                    events -> narratorPort.narrate(new NarrationRequest(sessionId, input.getText(), events)),
                    new TimelineNarrationListener(session))
                    .doFinally(signal -> {
                        claim.streamEnded();
                        log.debug("[Stream] Turn for session {} ended: {}", sessionId, signal);
                    });
        }).onErrorResume(e -> Flux.just(StreamCoordinator.errorFrame(e), StreamFrame.endOfTurn()));
    }

    private TurnMechanics runMechanics(TurnClaim claim, GameSession session, PlayerInput input) {
        if (!claim.mechanicsStarted()) {
            log.debug("[Stream] Turn for session {} cancelled before its mechanics ran", session.getId());
            return TurnMechanics.committed(List.of());
        }
        try {
            return resolveMechanics(session, input);
        } finally {
            claim.mechanicsFinished();
        }
    }

    private TurnMechanics resolveMechanics(GameSession session, PlayerInput input) {
        List<TimelineEvent> events = new ArrayList<>();
        events.add(mechanicsService.recordUserInput(session, input.getText()));
        List<TurnAction> actions = intentResolverPort.resolve(session, input);
        for (TurnAction action : actions) {
            try {
                events.addAll(mechanicsService.applyAction(session, action));
            } catch (RuntimeException e) {
                log.warn("[Stream] Action {} rejected in session {}: {}", action.getType(), session.getId(),
                        e.getMessage());
                return new TurnMechanics(events, e);
            }
        }
        return TurnMechanics.committed(events);
    }

    private void validate(PlayerInput input) {
        if (input == null || input.getText() == null || input.getText().isBlank()) {
            throw new MechanicsValidationException("Player input text is required");
        }
    }

    /**
     * Releases the session lease once the stream has ended and no mechanics
     * are in flight, whichever happens last.
     */
    static final class TurnClaim {

        private final SessionTurnGuard.Lease lease;
        private boolean mechanicsRunning;
        private boolean streamEnded;
        private boolean released;

        TurnClaim(SessionTurnGuard.Lease lease) {
            this.lease = lease;
        }

        /**
         * @return false if the turn was already released and must not commit
         */
        synchronized boolean mechanicsStarted() {
            if (released) {
                return false;
            }
            mechanicsRunning = true;
            return true;
        }

        synchronized void mechanicsFinished() {
            mechanicsRunning = false;
            if (streamEnded) {
                release();
            }
        }

        synchronized void streamEnded() {
            streamEnded = true;
            if (!mechanicsRunning) {
                release();
            }
        }

        private void release() {
            if (!released) {
                released = true;
                lease.close();
            }
        }
    }

    private final class TimelineNarrationListener implements StreamCoordinator.NarrationListener {

        private final GameSession session;

        private TimelineNarrationListener(GameSession session) {
            this.session = session;
        }

        @Override
        public void onNarrationComplete(String text, List<String> speakers) {
            if (text.isBlank() && speakers.isEmpty()) {
                return;
            }
            mechanicsService.recordNarration(session, text, speakers);
        }

        @Override
        public TimelineEvent onNarrationUnavailable(NarrationUnavailableException failure) {
            return mechanicsService.recordSystemLog(session, NARRATION_UNAVAILABLE_MESSAGE,
                    ErrorCode.NARRATION_UNAVAILABLE, failure.getMessage());
        }
    }
}
