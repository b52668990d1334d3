package me.fablestack.mechanics.domain.model;

import java.util.List;

/**
 * Committed outcome of a combat action: the events recorded and the resulting
 * combat state. {@code combat} is the archived encounter when the action ended
 * the fight.
 */
public record CombatActionResult(List<TimelineEvent> events, CombatState combat) {

    public CombatActionResult {
        events = events != null ? List.copyOf(events) : List.of();
    }
}
