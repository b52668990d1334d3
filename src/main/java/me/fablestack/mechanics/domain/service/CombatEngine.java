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
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.exception.NotFoundException;
import me.fablestack.mechanics.domain.exception.StateConflictException;
import me.fablestack.mechanics.domain.model.CombatOutcome;
import me.fablestack.mechanics.domain.model.CombatPhase;
import me.fablestack.mechanics.domain.model.CombatState;
import me.fablestack.mechanics.domain.model.CombatStep;
import me.fablestack.mechanics.domain.model.Combatant;
import me.fablestack.mechanics.domain.model.CombatantStatus;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.PendingEvent;
import me.fablestack.mechanics.domain.model.TimelineEventKind;
import me.fablestack.mechanics.domain.model.Weapon;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Combat state machine: initiative, attack and damage resolution, turn
 * sequencing and encounter conclusion.
 *
 * <p>
 * The engine is pure with respect to its input: every transition works on a
 * deep copy and returns the would-be state together with the events that
 * describe it. Nothing becomes real until those events are committed to the
 * session timeline. A rejected action therefore leaves no trace.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CombatEngine {

    static final int CRITICAL_ROLL = 20;
    static final int FUMBLE_ROLL = 1;
    static final int MIN_DAMAGE = 1;
    static final String DEFAULT_DAMAGE_SOURCE = "effect";

    private static final String ICON_CRITICAL = "🌟";
    private static final String ICON_MISS = "💨";
    private static final String ICON_DOWN = "💀";
    private static final String ICON_FLED = "🏃";
    private static final String ICON_VICTORY = "🏆";
    private static final String ICON_DEFEAT = "☠️";

    private final DiceRoller diceRoller;
    private final InitiativeCalculator initiativeCalculator;

    /**
     * Starts an encounter. Initiative is computed once and the turn order is
     * fixed for the rest of the fight.
     */
    public CombatStep begin(String sessionId, List<Combatant> roster) {
        List<Combatant> combatants = prepareRoster(roster);

        CombatState state = CombatState.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .phase(CombatPhase.ROLLING_INITIATIVE)
                .build();
        List<String> order = initiativeCalculator.order(combatants);
        Map<String, Combatant> byId = new LinkedHashMap<>();
        for (Combatant combatant : combatants) {
            byId.put(combatant.getId(), combatant);
        }
        state.setCombatants(byId);
        state.setTurnOrder(new ArrayList<>(order));
        state.setRoundNumber(1);
        state.setActiveIndex(firstAliveIndex(state));
        state.setPhase(CombatPhase.AWAITING_ACTION);

        List<PendingEvent> events = new ArrayList<>();
        Map<String, Object> started = new LinkedHashMap<>();
        started.put(PayloadKeys.ACTION, PayloadKeys.ACTION_STARTED);
        started.put(PayloadKeys.COMBAT_ID, state.getId());
        started.put(PayloadKeys.ROSTER, combatants.stream().map(EventPayloads::combatantToMap).toList());
        started.put(PayloadKeys.TURN_ORDER, List.copyOf(order));
        started.put(PayloadKeys.ROUND, state.getRoundNumber());
        started.put(PayloadKeys.ACTIVE_INDEX, state.getActiveIndex());
        events.add(PendingEvent.of(TimelineEventKind.COMBAT_INFO, started));
        events.add(turnEvent(state, true));

        log.debug("[Combat] Encounter {} prepared with {} combatants, order={}", state.getId(), combatants.size(),
                order);
        return new CombatStep(state, events);
    }

    public CombatStep attack(CombatState current, String actorId, String targetId, Weapon weapon) {
        return attack(current, actorId, targetId, weapon, 0, false);
    }

    /**
     * Resolves an attack by the active combatant.
     *
     * <p>
     * Roll is {@code d20 + ability + proficiency + attackModifier} where ability
     * is strength for melee and dexterity for ranged weapons. With advantage two
     * d20 are rolled and the higher one is kept. A natural 20 on the kept die
     * always hits and doubles damage; a natural 1 always misses.
     */
    public CombatStep attack(CombatState current, String actorId, String targetId, Weapon weapon,
            int attackModifier, boolean advantage) {
        CombatState state = requireOngoing(current).deepCopy();
        Combatant attacker = requireActiveActor(state, actorId);
        Combatant defender = requireTarget(state, attacker, targetId);
        Weapon used = weapon != null ? weapon : Weapon.unarmed();
        validateWeapon(used);
        state.setPhase(CombatPhase.RESOLVING_ACTION);

        List<Integer> rolls = new ArrayList<>();
        rolls.add(diceRoller.d20());
        if (advantage) {
            rolls.add(diceRoller.d20());
        }
        int natural = Collections.max(rolls);
        int abilityModifier = used.isMelee() ? attacker.getStrengthModifier() : attacker.getDexterityModifier();
        int total = natural + abilityModifier + attacker.getAttackBonus() + attackModifier;
        boolean critical = natural == CRITICAL_ROLL;
        boolean fumble = natural == FUMBLE_ROLL;
        boolean hit = critical || (!fumble && total >= defender.getArmorClass());

        List<PendingEvent> events = new ArrayList<>();
        Map<String, Object> attackPayload = new LinkedHashMap<>();
        attackPayload.put(PayloadKeys.COMBAT_ID, state.getId());
        attackPayload.put(PayloadKeys.ATTACKER_ID, attacker.getId());
        attackPayload.put(PayloadKeys.ATTACKER_NAME, attacker.getDisplayName());
        attackPayload.put(PayloadKeys.TARGET_ID, defender.getId());
        attackPayload.put(PayloadKeys.TARGET_NAME, defender.getDisplayName());
        attackPayload.put(PayloadKeys.WEAPON, used.name());
        attackPayload.put(PayloadKeys.WEAPON_KIND, used.kind().name());
        attackPayload.put(PayloadKeys.NATURAL_ROLL, natural);
        attackPayload.put(PayloadKeys.ROLLS, List.copyOf(rolls));
        attackPayload.put(PayloadKeys.ADVANTAGE, advantage);
        attackPayload.put(PayloadKeys.ATTACK_MODIFIER, attackModifier);
        attackPayload.put(PayloadKeys.ABILITY_MODIFIER, abilityModifier);
        attackPayload.put(PayloadKeys.PROFICIENCY_BONUS, attacker.getAttackBonus());
        attackPayload.put(PayloadKeys.TOTAL, total);
        attackPayload.put(PayloadKeys.TARGET_ARMOR_CLASS, defender.getArmorClass());
        attackPayload.put(PayloadKeys.HIT, hit);
        attackPayload.put(PayloadKeys.CRITICAL, critical);
        attackPayload.put(PayloadKeys.FUMBLE, fumble);
        events.add(new PendingEvent(TimelineEventKind.COMBAT_ATTACK, attackPayload,
                critical ? ICON_CRITICAL : hit ? null : ICON_MISS));

        if (hit) {
            int damage = computeDamage(attacker, used, critical);
            events.add(applyDamage(state, defender, damage, critical, null));
        }

        log.debug("[Combat] {} attacks {} with {}: d20={} total={} vs AC {} -> {}", attacker.getId(),
                defender.getId(), used.name(), rolls, total, defender.getArmorClass(), hit ? "hit" : "miss");
        finishAction(state, events);
        return new CombatStep(state, events);
    }

    /**
     * The active combatant leaves the fight. The encounter continues for
     * everyone else unless their side is now empty.
     */
    public CombatStep flee(CombatState current, String actorId) {
        CombatState state = requireOngoing(current).deepCopy();
        Combatant actor = requireActiveActor(state, actorId);
        state.setPhase(CombatPhase.RESOLVING_ACTION);
        actor.setStatus(CombatantStatus.FLED);

        List<PendingEvent> events = new ArrayList<>();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.ACTION, PayloadKeys.ACTION_FLED);
        payload.put(PayloadKeys.COMBAT_ID, state.getId());
        payload.put(PayloadKeys.COMBATANT_ID, actor.getId());
        payload.put(PayloadKeys.COMBATANT_NAME, actor.getDisplayName());
        events.add(new PendingEvent(TimelineEventKind.COMBAT_INFO, payload, ICON_FLED));

        log.debug("[Combat] {} fled encounter {}", actor.getId(), state.getId());
        finishAction(state, events);
        return new CombatStep(state, events);
    }

    /**
     * The active combatant ends their turn without acting.
     */
    public CombatStep pass(CombatState current, String actorId) {
        CombatState state = requireOngoing(current).deepCopy();
        requireActiveActor(state, actorId);
        state.setPhase(CombatPhase.RESOLVING_ACTION);
        List<PendingEvent> events = new ArrayList<>();
        finishAction(state, events);
        return new CombatStep(state, events);
    }

    /**
     * Applies damage that does not come from an attack, such as a trap or a
     * lingering effect. It may land on any standing combatant regardless of
     * whose turn it is. The turn only moves on if the active combatant went
     * down; the encounter concludes if a side has nobody left standing.
     */
    public CombatStep applyDirectDamage(CombatState current, String targetId, int amount, String source) {
        CombatState state = requireOngoing(current).deepCopy();
        if (amount < MIN_DAMAGE) {
            throw new MechanicsValidationException("Damage amount must be positive, got " + amount);
        }
        if (targetId == null || targetId.isBlank()) {
            throw new MechanicsValidationException("Target id is required");
        }
        Combatant target = state.getCombatants().get(targetId);
        if (target == null) {
            throw new NotFoundException("Combatant not found: " + targetId);
        }
        if (!target.isAlive()) {
            throw new StateConflictException("Target " + targetId + " is not standing");
        }
        String origin = source == null || source.isBlank() ? DEFAULT_DAMAGE_SOURCE : source.trim();
        state.setPhase(CombatPhase.RESOLVING_ACTION);

        List<PendingEvent> events = new ArrayList<>();
        events.add(applyDamage(state, target, amount, false, origin));
        log.debug("[Combat] {} takes {} damage from {}", target.getId(), amount, origin);

        if (state.getActiveCombatant().isAlive() && evaluateOutcome(state) == null) {
            state.setPhase(CombatPhase.AWAITING_ACTION);
        } else {
            finishAction(state, events);
        }
        return new CombatStep(state, events);
    }

    int computeDamage(Combatant attacker, Weapon weapon, boolean critical) {
        int damage = weapon.baseDamage() + (weapon.isMelee() ? attacker.getStrengthModifier() : 0);
        if (critical) {
            damage *= 2;
        }
        return Math.max(MIN_DAMAGE, damage);
    }

    private PendingEvent applyDamage(CombatState state, Combatant defender, int damage, boolean critical,
            String source) {
        int before = defender.getCurrentHp();
        int after = Math.max(0, before - damage);
        defender.setCurrentHp(after);
        if (after == 0) {
            defender.setStatus(CombatantStatus.DOWN);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.COMBAT_ID, state.getId());
        payload.put(PayloadKeys.TARGET_ID, defender.getId());
        payload.put(PayloadKeys.TARGET_NAME, defender.getDisplayName());
        payload.put(PayloadKeys.AMOUNT, damage);
        payload.put(PayloadKeys.HP_BEFORE, before);
        payload.put(PayloadKeys.HP_AFTER, after);
        payload.put(PayloadKeys.MAX_HP, defender.getMaxHp());
        payload.put(PayloadKeys.STATUS, defender.getStatus().name());
        payload.put(PayloadKeys.CRITICAL, critical);
        if (source != null) {
            payload.put(PayloadKeys.SOURCE, source);
        }
        return new PendingEvent(TimelineEventKind.COMBAT_DAMAGE, payload, after == 0 ? ICON_DOWN : null);
    }

    private void finishAction(CombatState state, List<PendingEvent> events) {
        CombatOutcome outcome = evaluateOutcome(state);
        if (outcome != null) {
            state.setPhase(CombatPhase.CONCLUDED);
            state.setOutcome(outcome);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put(PayloadKeys.ACTION, PayloadKeys.ACTION_CONCLUDED);
            payload.put(PayloadKeys.COMBAT_ID, state.getId());
            payload.put(PayloadKeys.OUTCOME, outcome.name());
            payload.put(PayloadKeys.ROUND, state.getRoundNumber());
            events.add(new PendingEvent(TimelineEventKind.COMBAT_INFO, payload,
                    outcome == CombatOutcome.VICTORY ? ICON_VICTORY
                            : outcome == CombatOutcome.FLED ? ICON_FLED : ICON_DEFEAT));
            log.debug("[Combat] Encounter {} concluded: {}", state.getId(), outcome);
            return;
        }
        state.setPhase(CombatPhase.ROUND_ADVANCE);
        boolean newRound = advance(state);
        state.setPhase(CombatPhase.AWAITING_ACTION);
        events.add(turnEvent(state, newRound));
    }

    /**
     * Moves to the next alive combatant in turn order.
     *
     * @return true when the order wrapped and a new round began
     */
    private boolean advance(CombatState state) {
        List<String> order = state.getTurnOrder();
        int size = order.size();
        boolean wrapped = false;
        for (int step = 1; step <= size; step++) {
            int index = state.getActiveIndex() + step;
            if (index >= size) {
                wrapped = true;
                index -= size;
            }
            if (state.getCombatants().get(order.get(index)).isAlive()) {
                state.setActiveIndex(index);
                if (wrapped) {
                    state.setRoundNumber(state.getRoundNumber() + 1);
                }
                return wrapped;
            }
        }
        throw new StateConflictException("No combatant left to act in encounter " + state.getId());
    }

    static CombatOutcome evaluateOutcome(CombatState state) {
        boolean enemiesStanding = false;
        boolean playersStanding = false;
        boolean playerFled = false;
        for (Combatant combatant : state.getCombatants().values()) {
            boolean playerFaction = combatant.getSide().isPlayerFaction();
            if (combatant.isAlive()) {
                if (playerFaction) {
                    playersStanding = true;
                } else {
                    enemiesStanding = true;
                }
            } else if (playerFaction && combatant.getStatus() == CombatantStatus.FLED) {
                playerFled = true;
            }
        }
        if (!enemiesStanding) {
            return CombatOutcome.VICTORY;
        }
        if (!playersStanding) {
            return playerFled ? CombatOutcome.FLED : CombatOutcome.DEFEAT;
        }
        return null;
    }

    private PendingEvent turnEvent(CombatState state, boolean newRound) {
        Combatant active = state.getActiveCombatant();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.COMBAT_ID, state.getId());
        payload.put(PayloadKeys.ROUND, state.getRoundNumber());
        payload.put(PayloadKeys.ACTIVE_INDEX, state.getActiveIndex());
        payload.put(PayloadKeys.ACTIVE_COMBATANT_ID, active.getId());
        payload.put(PayloadKeys.ACTIVE_COMBATANT_NAME, active.getDisplayName());
        payload.put(PayloadKeys.NEW_ROUND, newRound);
        return PendingEvent.of(TimelineEventKind.COMBAT_TURN, payload);
    }

    private List<Combatant> prepareRoster(List<Combatant> roster) {
        if (roster == null || roster.isEmpty()) {
            throw new MechanicsValidationException("Combat roster must not be empty");
        }
        List<Combatant> combatants = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (Combatant source : roster) {
            if (source == null) {
                throw new MechanicsValidationException("Combat roster must not contain empty entries");
            }
            Combatant combatant = source.copy();
            if (combatant.getId() == null || combatant.getId().isBlank()) {
                combatant.setId(UUID.randomUUID().toString());
            }
            if (!ids.add(combatant.getId())) {
                throw new MechanicsValidationException("Duplicate combatant id: " + combatant.getId());
            }
            validateCombatant(combatant);
            if (combatant.getDisplayName() == null || combatant.getDisplayName().isBlank()) {
                combatant.setDisplayName(combatant.getId());
            }
            combatant.setStatus(combatant.getCurrentHp() > 0 ? CombatantStatus.ALIVE : CombatantStatus.DOWN);
            combatants.add(combatant);
        }

        boolean hasPlayerSide = combatants.stream().anyMatch(c -> c.isAlive() && c.getSide().isPlayerFaction());
        boolean hasEnemySide = combatants.stream().anyMatch(c -> c.isAlive() && !c.getSide().isPlayerFaction());
        if (!hasPlayerSide || !hasEnemySide) {
            throw new MechanicsValidationException(
                    "Combat needs at least one standing combatant on each side");
        }
        return combatants;
    }

    private void validateCombatant(Combatant combatant) {
        String id = combatant.getId();
        if (combatant.getSide() == null) {
            throw new MechanicsValidationException("Combatant " + id + " has no side");
        }
        if (combatant.getMaxHp() <= 0) {
            throw new MechanicsValidationException("Combatant " + id + " must have positive max HP");
        }
        if (combatant.getCurrentHp() < 0 || combatant.getCurrentHp() > combatant.getMaxHp()) {
            throw new MechanicsValidationException("Combatant " + id + " has HP outside [0, maxHp]");
        }
        if (combatant.getMaxMp() < 0 || combatant.getCurrentMp() < 0
                || combatant.getCurrentMp() > combatant.getMaxMp()) {
            throw new MechanicsValidationException("Combatant " + id + " has MP outside [0, maxMp]");
        }
        if (combatant.getArmorClass() < 0) {
            throw new MechanicsValidationException("Combatant " + id + " has negative armor class");
        }
    }

    private void validateWeapon(Weapon weapon) {
        if (weapon.name() == null || weapon.name().isBlank()) {
            throw new MechanicsValidationException("Weapon name is required");
        }
        if (weapon.kind() == null) {
            throw new MechanicsValidationException("Weapon kind is required");
        }
        if (weapon.baseDamage() < 0) {
            throw new MechanicsValidationException("Weapon base damage must not be negative");
        }
    }

    private CombatState requireOngoing(CombatState state) {
        if (state == null) {
            throw new StateConflictException("No active combat");
        }
        if (state.isConcluded()) {
            throw new StateConflictException("Combat " + state.getId() + " has already concluded");
        }
        return state;
    }

    private Combatant requireActiveActor(CombatState state, String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new MechanicsValidationException("Actor id is required");
        }
        Combatant actor = state.getCombatants().get(actorId);
        if (actor == null) {
            throw new NotFoundException("Combatant not found: " + actorId);
        }
        Combatant active = state.getActiveCombatant();
        if (active == null || !active.getId().equals(actorId)) {
            throw new StateConflictException("It is not " + actor.getDisplayName() + "'s turn");
        }
        return actor;
    }

    private Combatant requireTarget(CombatState state, Combatant attacker, String targetId) {
        if (targetId == null || targetId.isBlank()) {
            throw new MechanicsValidationException("Target id is required");
        }
        Combatant target = state.getCombatants().get(targetId);
        if (target == null) {
            throw new NotFoundException("Combatant not found: " + targetId);
        }
        if (target.getId().equals(attacker.getId())) {
            throw new MechanicsValidationException("A combatant cannot attack itself");
        }
        if (!target.isAlive()) {
            throw new StateConflictException(target.getDisplayName() + " is no longer in the fight");
        }
        return target;
    }

    private int firstAliveIndex(CombatState state) {
        List<String> order = state.getTurnOrder();
        for (int i = 0; i < order.size(); i++) {
            if (state.getCombatants().get(order.get(i)).isAlive()) {
                return i;
            }
        }
        throw new MechanicsValidationException("Combat needs at least one standing combatant");
    }
}
