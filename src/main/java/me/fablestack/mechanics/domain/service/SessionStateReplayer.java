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
import me.fablestack.mechanics.domain.model.CombatOutcome;
import me.fablestack.mechanics.domain.model.CombatPhase;
import me.fablestack.mechanics.domain.model.CombatState;
import me.fablestack.mechanics.domain.model.Combatant;
import me.fablestack.mechanics.domain.model.CombatantStatus;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds timeline events into session state (combat, archived combats,
 * inventory).
 *
 * <p>
 * The same fold is used when an event is committed and when the state is
 * rebuilt after a rollback, so replaying a timeline prefix always yields the
 * state the session had when that prefix was its whole history.
 */
@Component
@Slf4j
public class SessionStateReplayer {

    /**
     * Discards all derived state and replays the retained timeline.
     */
    public void rebuild(GameSession session) {
        session.setCombat(null);
        session.setArchivedCombats(new ArrayList<>());
        session.setItems(new LinkedHashMap<>());
        session.setCurrency(0);
        for (TimelineEvent event : session.getTimeline()) {
            apply(session, event);
        }
    }

    public void apply(GameSession session, TimelineEvent event) {
        Map<String, Object> payload = event.payload();
        switch (event.kind()) {
        case COMBAT_INFO -> applyCombatInfo(session, event);
        case COMBAT_DAMAGE -> applyDamage(session, payload);
        case COMBAT_TURN -> applyTurn(session, payload);
        case ITEM_ADDED, ITEM_REMOVED, CURRENCY_CHANGE -> applyInventory(session, payload);
        case USER_INPUT, SYSTEM_LOG, NARRATIVE_CHUNK, SKILL_CHECK, COMBAT_ATTACK, CHOICE_OFFERED -> {
            // record-only kinds
        }
        }
    }

    private void applyCombatInfo(GameSession session, TimelineEvent event) {
        Map<String, Object> payload = event.payload();
        String action = EventPayloads.string(payload, PayloadKeys.ACTION);
        if (PayloadKeys.ACTION_STARTED.equals(action)) {
            Map<String, Combatant> combatants = new LinkedHashMap<>();
            for (Map<String, Object> entry : EventPayloads.mapList(payload, PayloadKeys.ROSTER)) {
                Combatant combatant = EventPayloads.combatantFromMap(entry);
                combatants.put(combatant.getId(), combatant);
            }
            session.setCombat(CombatState.builder()
                    .id(EventPayloads.string(payload, PayloadKeys.COMBAT_ID))
                    .sessionId(session.getId())
                    .roundNumber(EventPayloads.integer(payload, PayloadKeys.ROUND))
                    .turnOrder(new ArrayList<>(EventPayloads.stringList(payload, PayloadKeys.TURN_ORDER)))
                    .activeIndex(EventPayloads.integer(payload, PayloadKeys.ACTIVE_INDEX))
                    .combatants(combatants)
                    .phase(CombatPhase.AWAITING_ACTION)
                    .startedAt(event.timestamp())
                    .build());
            return;
        }

        CombatState combat = currentCombat(session, payload);
        if (combat == null) {
            return;
        }
        if (PayloadKeys.ACTION_FLED.equals(action)) {
            Combatant combatant = combat.getCombatants().get(EventPayloads.string(payload, PayloadKeys.COMBATANT_ID));
            if (combatant != null) {
                combatant.setStatus(CombatantStatus.FLED);
            }
        } else if (PayloadKeys.ACTION_CONCLUDED.equals(action)) {
            combat.setPhase(CombatPhase.CONCLUDED);
            combat.setOutcome(CombatOutcome.valueOf(EventPayloads.string(payload, PayloadKeys.OUTCOME)));
            combat.setConcludedAt(event.timestamp());
            List<CombatState> archived = new ArrayList<>(session.getArchivedCombats());
            archived.add(combat);
            session.setArchivedCombats(archived);
            session.setCombat(null);
        } else {
            log.warn("[Timeline] Unknown combat-info action '{}' at sequence {}", action, event.sequenceNumber());
        }
    }

    private void applyDamage(GameSession session, Map<String, Object> payload) {
        CombatState combat = currentCombat(session, payload);
        if (combat == null) {
            return;
        }
        Combatant target = combat.getCombatants().get(EventPayloads.string(payload, PayloadKeys.TARGET_ID));
        if (target == null) {
            return;
        }
        target.setCurrentHp(EventPayloads.integer(payload, PayloadKeys.HP_AFTER));
        target.setStatus(CombatantStatus.valueOf(EventPayloads.string(payload, PayloadKeys.STATUS)));
    }

    private void applyTurn(GameSession session, Map<String, Object> payload) {
        CombatState combat = currentCombat(session, payload);
        if (combat == null) {
            return;
        }
        combat.setRoundNumber(EventPayloads.integer(payload, PayloadKeys.ROUND));
        combat.setActiveIndex(EventPayloads.integer(payload, PayloadKeys.ACTIVE_INDEX));
        combat.setPhase(CombatPhase.AWAITING_ACTION);
    }

    private void applyInventory(GameSession session, Map<String, Object> payload) {
        String itemId = EventPayloads.string(payload, PayloadKeys.ITEM_ID);
        long quantityDelta = EventPayloads.number(payload, PayloadKeys.QUANTITY_DELTA, 0);
        if (itemId != null && quantityDelta != 0) {
            Map<String, Integer> items = new LinkedHashMap<>(session.getItems());
            int quantity = Math.toIntExact(items.getOrDefault(itemId, 0) + quantityDelta);
            if (quantity > 0) {
                items.put(itemId, quantity);
            } else {
                items.remove(itemId);
            }
            session.setItems(items);
        }
        session.setCurrency(session.getCurrency() + EventPayloads.number(payload, PayloadKeys.CURRENCY_DELTA, 0));
    }

    private CombatState currentCombat(GameSession session, Map<String, Object> payload) {
        CombatState combat = session.getCombat();
        String combatId = EventPayloads.string(payload, PayloadKeys.COMBAT_ID);
        if (combat == null || !combat.getId().equals(combatId)) {
            log.warn("[Timeline] Ignoring event for combat {} while active combat is {}", combatId,
                    combat != null ? combat.getId() : "none");
            return null;
        }
        return combat;
    }
}
