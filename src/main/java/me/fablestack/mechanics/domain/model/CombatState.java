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

import com.fasterxml.jackson.annotation.JsonIgnore;
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
 * State of a single combat encounter. {@code turnOrder} is fixed when the
 * encounter starts; {@code roundNumber} increments only when
 * {@code activeIndex} wraps.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CombatState {

    private String id;
    private String sessionId;

    @Builder.Default
    private int roundNumber = 1;

    @Builder.Default
    private List<String> turnOrder = new ArrayList<>();

    private int activeIndex;

    @Builder.Default
    private Map<String, Combatant> combatants = new LinkedHashMap<>();

    @Builder.Default
    private CombatPhase phase = CombatPhase.NOT_STARTED;

    private CombatOutcome outcome;
    private Instant startedAt;
    private Instant concludedAt;

    @JsonIgnore
    public Combatant getActiveCombatant() {
        if (turnOrder == null || turnOrder.isEmpty() || activeIndex < 0 || activeIndex >= turnOrder.size()) {
            return null;
        }
        return combatants.get(turnOrder.get(activeIndex));
    }

    @JsonIgnore
    public boolean isConcluded() {
        return phase == CombatPhase.CONCLUDED;
    }

    /**
     * Returns a copy whose combatants can be mutated without touching this
     * instance.
     */
    public CombatState deepCopy() {
        Map<String, Combatant> copiedCombatants = new LinkedHashMap<>();
        combatants.forEach((id, combatant) -> copiedCombatants.put(id, combatant.copy()));
        return toBuilder()
                .turnOrder(new ArrayList<>(turnOrder))
                .combatants(copiedCombatants)
                .build();
    }
}
