package me.fablestack.mechanics.domain.model;

import java.util.List;

/**
 * Mechanical half of a turn: the events committed before narration, and the
 * failure that stopped action resolution, if any.
 */
public record TurnMechanics(List<TimelineEvent> events, RuntimeException failure) {

    public TurnMechanics {
        events = events != null ? List.copyOf(events) : List.of();
    }

    public static TurnMechanics committed(List<TimelineEvent> events) {
        return new TurnMechanics(events, null);
    }

    public boolean failed() {
        return failure != null;
    }
}
