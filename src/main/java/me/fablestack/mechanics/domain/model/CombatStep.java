package me.fablestack.mechanics.domain.model;

import java.util.List;

/**
 * Result of one combat engine transition: the would-be state and the events
 * that must be committed for it to become real.
 */
public record CombatStep(CombatState state, List<PendingEvent> events) {

    public CombatStep {
        events = events != null ? List.copyOf(events) : List.of();
    }
}
