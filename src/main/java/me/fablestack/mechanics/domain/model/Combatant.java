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

/**
 * Participant in a combat encounter. Owned by its {@link CombatState}; the
 * engine only mutates copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Combatant {

    private String id;
    private String displayName;
    private CombatSide side;

    private int currentHp;
    private int maxHp;
    private int currentMp;
    private int maxMp;
    private int armorClass;

    /** Proficiency bonus added to attack rolls. */
    private int attackBonus;

    private int strengthModifier;
    private int dexterityModifier;
    private int wisdomModifier;

    private int initiativeScore;

    @Builder.Default
    private CombatantStatus status = CombatantStatus.ALIVE;

    @JsonIgnore
    public boolean isAlive() {
        return status == CombatantStatus.ALIVE;
    }

    public Combatant copy() {
        return toBuilder().build();
    }
}
