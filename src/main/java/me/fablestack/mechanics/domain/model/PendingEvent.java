package me.fablestack.mechanics.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event decided by a mechanics component but not yet committed. The timeline
 * stamps it with a sequence number and timestamp on append.
 */
public record PendingEvent(TimelineEventKind kind, Map<String, Object> payload, String displayIcon) {

    public PendingEvent {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    public static PendingEvent of(TimelineEventKind kind, Map<String, Object> payload) {
        return new PendingEvent(kind, payload, null);
    }
}
