package me.fablestack.mechanics.domain.model;

import java.util.List;

/**
 * What the narrator is given for one turn: the player's text and the events
 * the turn committed. Nothing uncommitted ever reaches the narrator.
 */
public record NarrationRequest(String sessionId, String playerText, List<TimelineEvent> committedEvents) {

    public NarrationRequest {
        committedEvents = committedEvents != null ? List.copyOf(committedEvents) : List.of();
    }
}
