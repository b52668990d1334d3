package me.fablestack.mechanics.domain.model;

/**
 * Phases of the combat state machine. Callers only ever observe
 * {@link #AWAITING_ACTION} or {@link #CONCLUDED}; the other phases are passed
 * through while the engine resolves a request.
 */
public enum CombatPhase {
    NOT_STARTED, ROLLING_INITIATIVE, AWAITING_ACTION, RESOLVING_ACTION, ROUND_ADVANCE, CONCLUDED
}
