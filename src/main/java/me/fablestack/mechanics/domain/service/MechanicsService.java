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
import me.fablestack.mechanics.domain.exception.StateConflictException;
import me.fablestack.mechanics.domain.model.CombatActionResult;
import me.fablestack.mechanics.domain.model.CombatState;
import me.fablestack.mechanics.domain.model.CombatStep;
import me.fablestack.mechanics.domain.model.Combatant;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.InventorySnapshot;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.PendingEvent;
import me.fablestack.mechanics.domain.model.RestorePoint;
import me.fablestack.mechanics.domain.model.SkillCheckOutcome;
import me.fablestack.mechanics.domain.model.SkillCheckRequest;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.model.TimelineEventKind;
import me.fablestack.mechanics.domain.model.TurnAction;
import me.fablestack.mechanics.domain.model.Weapon;
import me.fablestack.mechanics.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Boundary of the mechanics core. Every mutating operation is all-or-nothing:
 * the outcome is decided first, then committed to the timeline and persisted
 * under the session monitor. If persisting fails the in-memory session is put
 * back as it was.
 *
 * <p>
 * Public session-level operations claim the session through
 * {@link SessionTurnGuard}. The {@code GameSession}-level variants are for
 * callers that already hold the claim, such as the turn stream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MechanicsService {

    private final SessionPort sessionPort;
    private final SessionTurnGuard turnGuard;
    private final TimelineService timelineService;
    private final SkillCheckResolver skillCheckResolver;
    private final CombatEngine combatEngine;
    private final InventoryService inventoryService;

    // ==================== Sessions ====================

    public GameSession createSession(String scenarioName) {
        return sessionPort.create(scenarioName);
    }

    public GameSession getSession(String sessionId) {
        return sessionPort.getRequired(sessionId);
    }

    public List<GameSession> listSessions() {
        return sessionPort.listAll();
    }

    public void deleteSession(String sessionId) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "delete")) {
            sessionPort.getRequired(sessionId);
            sessionPort.delete(sessionId);
        }
    }

    // ==================== Combat ====================

    public CombatState beginCombat(String sessionId, List<Combatant> roster) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "begin combat")) {
            GameSession session = sessionPort.getRequired(sessionId);
            commit(session, () -> {
                if (session.hasActiveCombat()) {
                    throw new StateConflictException(
                            "Session " + sessionId + " already has an active combat: " + session.getCombat().getId());
                }
                return combatEngine.begin(session.getId(), roster).events();
            });
            synchronized (session) {
                CombatState combat = session.getCombat();
                log.info("[Combat] Session {}: encounter {} started with {} combatants", sessionId, combat.getId(),
                        combat.getCombatants().size());
                return combat.deepCopy();
            }
        }
    }

    public CombatActionResult performAttack(String sessionId, String actorId, String targetId, Weapon weapon) {
        return performAttack(sessionId, actorId, targetId, weapon, 0, false);
    }

    public CombatActionResult performAttack(String sessionId, String actorId, String targetId, Weapon weapon,
            int attackModifier, boolean advantage) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "attack")) {
            GameSession session = sessionPort.getRequired(sessionId);
            return combatAction(session, () -> combatEngine.attack(session.getCombat(), actorId, targetId, weapon,
                    attackModifier, advantage));
        }
    }

    /**
     * Damage from traps, hazards or effects rather than an attack roll.
     */
    public CombatActionResult applyDirectDamage(String sessionId, String targetId, int amount, String source) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "damage")) {
            GameSession session = sessionPort.getRequired(sessionId);
            return combatAction(session,
                    () -> combatEngine.applyDirectDamage(session.getCombat(), targetId, amount, source));
        }
    }

    public CombatActionResult flee(String sessionId, String actorId) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "flee")) {
            GameSession session = sessionPort.getRequired(sessionId);
            return combatAction(session, () -> combatEngine.flee(session.getCombat(), actorId));
        }
    }

    public CombatActionResult passTurn(String sessionId, String actorId) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "pass")) {
            GameSession session = sessionPort.getRequired(sessionId);
            return combatAction(session, () -> combatEngine.pass(session.getCombat(), actorId));
        }
    }

    public Optional<CombatState> getCurrentCombat(String sessionId) {
        GameSession session = sessionPort.getRequired(sessionId);
        synchronized (session) {
            return Optional.ofNullable(session.getCombat()).map(CombatState::deepCopy);
        }
    }

    public List<CombatState> getArchivedCombats(String sessionId) {
        GameSession session = sessionPort.getRequired(sessionId);
        synchronized (session) {
            return session.getArchivedCombats().stream().map(CombatState::deepCopy).toList();
        }
    }

    // ==================== Skill checks & inventory ====================

    public SkillCheckOutcome performSkillCheck(String sessionId, SkillCheckRequest request) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "skill check")) {
            GameSession session = sessionPort.getRequired(sessionId);
            return skillCheck(session, request);
        }
    }

    public TimelineEvent applyInventoryDelta(String sessionId, String itemId, int quantityDelta,
            long currencyDelta) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "inventory")) {
            GameSession session = sessionPort.getRequired(sessionId);
            return commit(session,
                    () -> List.of(inventoryService.prepareDelta(session, itemId, quantityDelta, currencyDelta)))
                    .get(0);
        }
    }

    public InventorySnapshot getInventory(String sessionId) {
        GameSession session = sessionPort.getRequired(sessionId);
        synchronized (session) {
            return inventoryService.snapshot(session);
        }
    }

    // ==================== Timeline ====================

    public List<TimelineEvent> getHistory(String sessionId, Long fromSequence) {
        GameSession session = sessionPort.getRequired(sessionId);
        synchronized (session) {
            return timelineService.read(session, fromSequence, null);
        }
    }

    public List<RestorePoint> getRestorePoints(String sessionId) {
        GameSession session = sessionPort.getRequired(sessionId);
        synchronized (session) {
            return timelineService.restorePoints(session);
        }
    }

    /**
     * Truncates the timeline after {@code targetSequence} and rebuilds state.
     * Irreversible once persisted.
     *
     * @return the new last sequence number
     */
    public long restoreHistory(String sessionId, long targetSequence) {
        try (SessionTurnGuard.Lease lease = turnGuard.acquire(sessionId, "restore")) {
            GameSession session = sessionPort.getRequired(sessionId);
            synchronized (session) {
                SessionSnapshot snapshot = SessionSnapshot.of(session);
                long tail = timelineService.rollbackTo(session, targetSequence);
                try {
                    sessionPort.save(session);
                } catch (RuntimeException e) {
                    snapshot.restore(session);
                    log.error("[Timeline] Failed to persist rollback of session {}", sessionId, e);
                    throw e;
                }
                return tail;
            }
        }
    }

    // ==================== In-turn (caller holds the guard) ====================

    public TimelineEvent recordUserInput(GameSession session, String text) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.TEXT, text);
        return commit(session, () -> List.of(PendingEvent.of(TimelineEventKind.USER_INPUT, payload))).get(0);
    }

    /**
     * Resolves one structured action and commits its events.
     */
    public List<TimelineEvent> applyAction(GameSession session, TurnAction action) {
        if (action == null || action.getType() == null) {
            throw new MechanicsValidationException("Action type is required");
        }
        return switch (action.getType()) {
        case SKILL_CHECK -> List.of(skillCheck(session, toSkillCheckRequest(action)).event());
        case ATTACK -> combatAction(session, () -> combatEngine.attack(session.getCombat(), action.getActorId(),
                action.getTargetId(), action.getWeapon(),
                action.getAttackModifier() != null ? action.getAttackModifier() : 0,
                Boolean.TRUE.equals(action.getAdvantage()))).events();
        case FLEE -> combatAction(session, () -> combatEngine.flee(session.getCombat(), action.getActorId()))
                .events();
        case PASS -> combatAction(session, () -> combatEngine.pass(session.getCombat(), action.getActorId()))
                .events();
        case DAMAGE -> combatAction(session, () -> combatEngine.applyDirectDamage(session.getCombat(),
                action.getTargetId(), requireAmount(action), action.getSource())).events();
        case INVENTORY -> commit(session, () -> List.of(inventoryService.prepareDelta(session, action.getItemId(),
                action.getQuantityDelta() != null ? action.getQuantityDelta() : 0,
                action.getCurrencyDelta() != null ? action.getCurrencyDelta() : 0L)));
        };
    }

    public TimelineEvent recordNarration(GameSession session, String text, List<String> speakers) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.TEXT, text);
        if (speakers != null && !speakers.isEmpty()) {
            payload.put(PayloadKeys.SPEAKERS, List.copyOf(speakers));
        }
        return commit(session, () -> List.of(PendingEvent.of(TimelineEventKind.NARRATIVE_CHUNK, payload))).get(0);
    }

    public TimelineEvent recordSystemLog(GameSession session, String message, ErrorCode code, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.MESSAGE, message);
        if (code != null) {
            payload.put(PayloadKeys.CODE, code.getWireName());
        }
        if (reason != null) {
            payload.put(PayloadKeys.REASON, reason);
        }
        return commit(session, () -> List.of(PendingEvent.of(TimelineEventKind.SYSTEM_LOG, payload))).get(0);
    }

    // ==================== Internals ====================

    private SkillCheckOutcome skillCheck(GameSession session, SkillCheckRequest request) {
        SkillCheckResolver.Resolution resolution = skillCheckResolver.resolveWithEvent(request);
        TimelineEvent event = commit(session, () -> List.of(resolution.event())).get(0);
        return new SkillCheckOutcome(resolution.result(), event);
    }

    private CombatActionResult combatAction(GameSession session, Supplier<CombatStep> step) {
        List<TimelineEvent> events = commit(session, () -> step.get().events());
        synchronized (session) {
            CombatState combat = session.getCombat();
            if (combat == null && !session.getArchivedCombats().isEmpty()) {
                combat = session.getArchivedCombats().get(session.getArchivedCombats().size() - 1);
                log.info("[Combat] Session {}: encounter {} concluded with {}", session.getId(), combat.getId(),
                        combat.getOutcome());
            }
            return new CombatActionResult(events, combat != null ? combat.deepCopy() : null);
        }
    }

    /**
     * Decides, appends and persists under the session monitor. Sequence numbers
     * handed out to a failed commit are not reused.
     */
    private List<TimelineEvent> commit(GameSession session, Supplier<List<PendingEvent>> decision) {
        synchronized (session) {
            List<PendingEvent> drafts = decision.get();
            if (drafts.isEmpty()) {
                return List.of();
            }
            SessionSnapshot snapshot = SessionSnapshot.of(session);
            try {
                List<TimelineEvent> committed = timelineService.append(session, drafts);
                sessionPort.save(session);
                return committed;
            } catch (RuntimeException e) {
                snapshot.restore(session);
                log.error("[Timeline] Failed to commit {} events to session {}", drafts.size(), session.getId(), e);
                throw e;
            }
        }
    }

    private int requireAmount(TurnAction action) {
        if (action.getAmount() == null) {
            throw new MechanicsValidationException("Damage action needs an amount");
        }
        return action.getAmount();
    }

    private SkillCheckRequest toSkillCheckRequest(TurnAction action) {
        if (action.getStatValue() == null || action.getSkillRank() == null) {
            throw new MechanicsValidationException("Skill check needs statValue and skillRank");
        }
        return SkillCheckRequest.builder()
                .statValue(action.getStatValue())
                .skillRank(action.getSkillRank())
                .difficulty(action.getDifficulty())
                .statName(action.getStatName())
                .skillName(action.getSkillName())
                .build();
    }

    private record SessionSnapshot(List<TimelineEvent> timeline, CombatState combat,
            List<CombatState> archivedCombats, Map<String, Integer> items, long currency) {

        static SessionSnapshot of(GameSession session) {
            return new SessionSnapshot(new ArrayList<>(session.getTimeline()),
                    session.getCombat() != null ? session.getCombat().deepCopy() : null,
                    new ArrayList<>(session.getArchivedCombats()),
                    new LinkedHashMap<>(session.getItems()),
                    session.getCurrency());
        }

        void restore(GameSession session) {
            session.setTimeline(new ArrayList<>(timeline));
            session.setCombat(combat);
            session.setArchivedCombats(new ArrayList<>(archivedCombats));
            session.setItems(new LinkedHashMap<>(items));
            session.setCurrency(currency);
        }
    }
}
