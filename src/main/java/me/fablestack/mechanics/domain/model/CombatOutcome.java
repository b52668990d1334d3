package me.fablestack.mechanics.domain.model;

/**
 * How a concluded encounter ended, from the player faction's point of view.
 */
public enum CombatOutcome {
    VICTORY, DEFEAT, FLED
}
