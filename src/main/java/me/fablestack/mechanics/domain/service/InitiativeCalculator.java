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

import me.fablestack.mechanics.domain.model.Combatant;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic initiative. The score is the dexterity modifier plus half the
 * wisdom modifier (floored). Ties go to the higher dexterity modifier, then to
 * roster order.
 */
@Component
public class InitiativeCalculator {

    public int score(Combatant combatant) {
        return combatant.getDexterityModifier() + Math.floorDiv(combatant.getWisdomModifier(), 2);
    }

    /**
     * Assigns each combatant its initiative score and returns the ids in
     * acting order.
     */
    public List<String> order(List<Combatant> roster) {
        List<Combatant> sorted = new ArrayList<>(roster);
        for (Combatant combatant : sorted) {
            combatant.setInitiativeScore(score(combatant));
        }
        // List.sort is stable, so equal keys keep roster order
        sorted.sort(Comparator.comparingInt(Combatant::getInitiativeScore)
                .thenComparingInt(Combatant::getDexterityModifier)
                .reversed());
        return sorted.stream().map(Combatant::getId).toList();
    }
}
