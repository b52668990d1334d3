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
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.PendingEvent;
import me.fablestack.mechanics.domain.model.RestorePoint;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.infrastructure.config.MechanicsProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only session timeline with restore points and rollback.
 *
 * <p>
 * Callers must hold the session monitor while appending or rolling back; the
 * service itself keeps no state besides the clock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimelineService {

    private final SessionStateReplayer replayer;
    private final MechanicsProperties properties;
    private final Clock clock;

    /**
     * Stamps the events with the next sequence numbers, appends them and folds
     * them into the session state.
     *
     * @return the committed events, in order
     */
    public List<TimelineEvent> append(GameSession session, List<PendingEvent> drafts) {
        Instant now = clock.instant();
        List<TimelineEvent> committed = new ArrayList<>(drafts.size());
        for (PendingEvent draft : drafts) {
            long sequence = session.getNextSequence();
            session.setNextSequence(sequence + 1);
            TimelineEvent event = TimelineEvent.builder()
                    .sequenceNumber(sequence)
                    .timestamp(now)
                    .kind(draft.kind())
                    .payload(draft.payload())
                    .displayIcon(draft.displayIcon() != null ? draft.displayIcon() : draft.kind().getDefaultIcon())
                    .build();
            session.getTimeline().add(event);
            replayer.apply(session, event);
            committed.add(event);
            log.debug("[Timeline] {} #{} {}", session.getId(), sequence, event.kind().getWireName());
        }
        return committed;
    }

    public TimelineEvent append(GameSession session, PendingEvent draft) {
        return append(session, List.of(draft)).get(0);
    }

    /**
     * Events with {@code from <= sequenceNumber <= to}, ordered. Null bounds are
     * open.
     */
    public List<TimelineEvent> read(GameSession session, Long from, Long to) {
        if (from != null && to != null && from > to) {
            throw new MechanicsValidationException("Range start " + from + " is after range end " + to);
        }
        return session.getTimeline().stream()
                .filter(event -> from == null || event.sequenceNumber() >= from)
                .filter(event -> to == null || event.sequenceNumber() <= to)
                .toList();
    }

    /**
     * One restore point per player input. Each points at the last event before
     * that input, so rolling back to it removes the whole turn.
     */
    public List<RestorePoint> restorePoints(GameSession session) {
        List<RestorePoint> points = new ArrayList<>();
        long previousSequence = 0;
        for (TimelineEvent event : session.getTimeline()) {
            if (event.kind().isTurnBoundary()) {
                points.add(new RestorePoint(previousSequence, event.timestamp(),
                        preview(EventPayloads.string(event.payload(), PayloadKeys.TEXT))));
            }
            previousSequence = event.sequenceNumber();
        }
        return points;
    }

    /**
     * Drops every event after {@code targetSequence} and rebuilds combat and
     * inventory from what remains. Sequence numbers handed out before stay
     * burned.
     *
     * @return the sequence number of the new last event, or 0 when the timeline
     *         is now empty
     */
    public long rollbackTo(GameSession session, long targetSequence) {
        long last = session.lastSequence();
        if (targetSequence < 0 || targetSequence > last) {
            throw new MechanicsValidationException(
                    "Restore target " + targetSequence + " is outside [0, " + last + "]");
        }
        List<TimelineEvent> retained = new ArrayList<>(read(session, null, targetSequence));
        int removed = session.getTimeline().size() - retained.size();
        session.setTimeline(retained);
        replayer.rebuild(session);
        log.info("[Timeline] Rolled back session {} to #{}: removed {} events", session.getId(), targetSequence,
                removed);
        return session.lastSequence();
    }

    String preview(String text) {
        if (text == null) {
            return "";
        }
        String normalized = text.strip().replaceAll("\\s+", " ");
        int limit = Math.max(1, properties.getTimeline().getRestorePreviewLength());
        if (normalized.length() <= limit) {
            return normalized;
        }
        return normalized.substring(0, limit);
    }
}
