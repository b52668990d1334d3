package me.fablestack.mechanics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable fact recorded in a session timeline. Sequence numbers are strictly
 * increasing per session and never reused.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TimelineEvent(long sequenceNumber, Instant timestamp, TimelineEventKind kind,
        Map<String, Object> payload, String displayIcon) {

    public TimelineEvent {
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }
}
