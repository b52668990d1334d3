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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;

/**
 * Closed set of timeline event kinds. Each kind carries its kebab-case wire
 * name and the icon the timeline view shows when the event carries none.
 */
public enum TimelineEventKind {

    USER_INPUT("user-input", "👤"),
    SYSTEM_LOG("system-log", "⚙️"),
    NARRATIVE_CHUNK("narrative-chunk", "📜"),
    SKILL_CHECK("skill-check", "🎲"),
    COMBAT_ATTACK("combat-attack", "⚔️"),
    COMBAT_DAMAGE("combat-damage", "💥"),
    COMBAT_TURN("combat-turn", "⏳"),
    COMBAT_INFO("combat-info", "🛡️"),
    ITEM_ADDED("item-added", "🎒"),
    ITEM_REMOVED("item-removed", "🎒"),
    CURRENCY_CHANGE("currency-change", "💰"),
    CHOICE_OFFERED("choice-offered", "🤔");

    private final String wireName;
    private final String defaultIcon;

    TimelineEventKind(String wireName, String defaultIcon) {
        this.wireName = wireName;
        this.defaultIcon = defaultIcon;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getDefaultIcon() {
        return defaultIcon;
    }

    /**
     * Whether events of this kind mutate mechanical state (combat, inventory)
     * or record a mechanical verdict.
     */
    public boolean isMechanical() {
        return switch (this) {
        case SKILL_CHECK, COMBAT_ATTACK, COMBAT_DAMAGE, COMBAT_TURN, COMBAT_INFO, ITEM_ADDED, ITEM_REMOVED,
                CURRENCY_CHANGE ->
            true;
        case USER_INPUT, SYSTEM_LOG, NARRATIVE_CHUNK, CHOICE_OFFERED -> false;
        };
    }

    /**
     * Turn boundaries are the events restore points are derived from.
     */
    public boolean isTurnBoundary() {
        return this == USER_INPUT;
    }

    @JsonCreator
    public static TimelineEventKind fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new MechanicsValidationException("Event kind is required");
        }
        String normalized = value.trim();
        for (TimelineEventKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        throw new MechanicsValidationException("Unknown event kind: " + value);
    }
}
