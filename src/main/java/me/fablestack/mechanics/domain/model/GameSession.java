package me.fablestack.mechanics.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One player's playthrough. Owns the timeline, the active combat (at most
 * one), archived combats and the inventory. Persisted as a single JSON
 * document keyed by {@link #getId()}.
 *
 * <p>
 * Combat and inventory are derived state: they always equal the fold of the
 * retained timeline events, which is what makes rollback possible.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameSession {

    private String id;
    private String scenarioName;

    @Builder.Default
    private List<TimelineEvent> timeline = new ArrayList<>();

    /** Next sequence number to hand out. Never decreases, even on rollback. */
    @Builder.Default
    private long nextSequence = 1;

    private CombatState combat;

    @Builder.Default
    private List<CombatState> archivedCombats = new ArrayList<>();

    @Builder.Default
    private Map<String, Integer> items = new LinkedHashMap<>();

    private long currency;

    private Instant createdAt;
    private Instant updatedAt;

    public long lastSequence() {
        return timeline.isEmpty() ? 0 : timeline.get(timeline.size() - 1).sequenceNumber();
    }

    public boolean hasActiveCombat() {
        return combat != null && !combat.isConcluded();
    }
}
