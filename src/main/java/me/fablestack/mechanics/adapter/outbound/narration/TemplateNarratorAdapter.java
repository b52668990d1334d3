package me.fablestack.mechanics.adapter.outbound.narration;

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

import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.domain.model.NarrationRequest;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.port.outbound.NarratorPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic narrator that describes committed mechanics with fixed
 * sentence templates.
 *
 * <p>
 * Used when no prose generator is wired in. Output is split into word tokens
 * and opens with a {@code <<SPEAKER:Narrator>>} control tag, so it exercises
 * the same streaming path a generative narrator would.
 *
 * <p>
 * Narrator ID: {@code "template"}
 */
@Component
@Slf4j
public class TemplateNarratorAdapter implements NarratorPort {

    static final String SPEAKER_TAG = "<<SPEAKER:Narrator>>";

    @Override
    public String getNarratorId() {
        return "template";
    }

    @Override
    public Flux<String> narrate(NarrationRequest request) {
        List<String> sentences = new ArrayList<>();
        for (TimelineEvent event : request.committedEvents()) {
            String sentence = describe(event);
            if (sentence != null) {
                sentences.add(sentence);
            }
        }
        if (sentences.isEmpty()) {
            sentences.add("The world waits for your next move.");
        }
        log.debug("[Narrator] Session {}: {} sentences", request.sessionId(), sentences.size());
        return Flux.fromIterable(tokenize(SPEAKER_TAG + String.join(" ", sentences)));
    }

    String describe(TimelineEvent event) {
        Map<String, Object> p = event.payload();
        return switch (event.kind()) {
        case USER_INPUT -> null;
        case SKILL_CHECK -> Boolean.TRUE.equals(p.get(PayloadKeys.SUCCESS))
                ? "Your " + label(p, PayloadKeys.SKILL_NAME, "attempt") + " succeeds."
                : "Your " + label(p, PayloadKeys.SKILL_NAME, "attempt") + " falls short.";
        case COMBAT_ATTACK -> Boolean.TRUE.equals(p.get(PayloadKeys.HIT))
                ? p.get(PayloadKeys.ATTACKER_NAME) + " strikes " + p.get(PayloadKeys.TARGET_NAME) + "."
                : p.get(PayloadKeys.ATTACKER_NAME) + " misses " + p.get(PayloadKeys.TARGET_NAME) + ".";
        case COMBAT_DAMAGE -> "DOWN".equals(p.get(PayloadKeys.STATUS))
                ? p.get(PayloadKeys.TARGET_NAME) + " falls."
                : p.get(PayloadKeys.TARGET_NAME) + " takes " + p.get(PayloadKeys.AMOUNT) + " damage.";
        case COMBAT_TURN -> "It is " + p.get(PayloadKeys.ACTIVE_COMBATANT_NAME) + "'s turn.";
        case COMBAT_INFO -> describeCombatInfo(p);
        case ITEM_ADDED -> "You gain " + p.get(PayloadKeys.ITEM_ID) + ".";
        case ITEM_REMOVED -> "You lose " + p.get(PayloadKeys.ITEM_ID) + ".";
        case CURRENCY_CHANGE -> "Your purse now holds " + p.get(PayloadKeys.CURRENCY_AFTER) + " coins.";
        case SYSTEM_LOG, NARRATIVE_CHUNK, CHOICE_OFFERED -> null;
        };
    }

    private String describeCombatInfo(Map<String, Object> p) {
        Object action = p.get(PayloadKeys.ACTION);
        if (PayloadKeys.ACTION_STARTED.equals(action)) {
            return "Battle is joined.";
        }
        if (PayloadKeys.ACTION_FLED.equals(action)) {
            return p.get(PayloadKeys.COMBATANT_NAME) + " flees the fight.";
        }
        return "The fight ends in " + String.valueOf(p.get(PayloadKeys.OUTCOME)).toLowerCase(Locale.ROOT) + ".";
    }

    private String label(Map<String, Object> p, String key, String fallback) {
        Object value = p.get(key);
        return value != null ? value.toString() : fallback;
    }

    private List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        int start = 0;
        for (int i = 1; i <= text.length(); i++) {
            if (i == text.length() || text.charAt(i) == ' ') {
                tokens.add(text.substring(start, i));
                start = i;
            }
        }
        return tokens;
    }
}
