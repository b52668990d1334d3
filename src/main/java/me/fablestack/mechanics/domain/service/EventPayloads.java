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

import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.model.CombatSide;
import me.fablestack.mechanics.domain.model.Combatant;
import me.fablestack.mechanics.domain.model.CombatantStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed access to event payload maps. Payloads come back from JSON with
 * whatever numeric type Jackson picked, so numbers are always read through
 * {@link Number}.
 */
final class EventPayloads {

    private static final String ID = "id";
    private static final String DISPLAY_NAME = "displayName";
    private static final String SIDE = "side";
    private static final String CURRENT_HP = "currentHp";
    private static final String MAX_HP = "maxHp";
    private static final String CURRENT_MP = "currentMp";
    private static final String MAX_MP = "maxMp";
    private static final String ARMOR_CLASS = "armorClass";
    private static final String ATTACK_BONUS = "attackBonus";
    private static final String STRENGTH_MODIFIER = "strengthModifier";
    private static final String DEXTERITY_MODIFIER = "dexterityModifier";
    private static final String WISDOM_MODIFIER = "wisdomModifier";
    private static final String INITIATIVE_SCORE = "initiativeScore";
    private static final String STATUS = "status";

    private EventPayloads() {
    }

    static Map<String, Object> combatantToMap(Combatant combatant) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ID, combatant.getId());
        map.put(DISPLAY_NAME, combatant.getDisplayName());
        map.put(SIDE, combatant.getSide().name());
        map.put(CURRENT_HP, combatant.getCurrentHp());
        map.put(MAX_HP, combatant.getMaxHp());
        map.put(CURRENT_MP, combatant.getCurrentMp());
        map.put(MAX_MP, combatant.getMaxMp());
        map.put(ARMOR_CLASS, combatant.getArmorClass());
        map.put(ATTACK_BONUS, combatant.getAttackBonus());
        map.put(STRENGTH_MODIFIER, combatant.getStrengthModifier());
        map.put(DEXTERITY_MODIFIER, combatant.getDexterityModifier());
        map.put(WISDOM_MODIFIER, combatant.getWisdomModifier());
        map.put(INITIATIVE_SCORE, combatant.getInitiativeScore());
        map.put(STATUS, combatant.getStatus().name());
        return map;
    }

    static Combatant combatantFromMap(Map<String, Object> map) {
        return Combatant.builder()
                .id(string(map, ID))
                .displayName(string(map, DISPLAY_NAME))
                .side(CombatSide.valueOf(string(map, SIDE)))
                .currentHp(integer(map, CURRENT_HP))
                .maxHp(integer(map, MAX_HP))
                .currentMp(integer(map, CURRENT_MP))
                .maxMp(integer(map, MAX_MP))
                .armorClass(integer(map, ARMOR_CLASS))
                .attackBonus(integer(map, ATTACK_BONUS))
                .strengthModifier(integer(map, STRENGTH_MODIFIER))
                .dexterityModifier(integer(map, DEXTERITY_MODIFIER))
                .wisdomModifier(integer(map, WISDOM_MODIFIER))
                .initiativeScore(integer(map, INITIATIVE_SCORE))
                .status(CombatantStatus.valueOf(string(map, STATUS)))
                .build();
    }

    static String string(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    static int integer(Map<String, Object> payload, String key) {
        return (int) number(payload, key, 0L);
    }

    static long number(Map<String, Object> payload, String key, long defaultValue) {
        Object value = payload.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new MechanicsValidationException("Payload field " + key + " is not numeric: " + value);
    }

    static boolean bool(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value instanceof Boolean flag ? flag : Boolean.parseBoolean(String.valueOf(value));
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> mapList(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>();
        for (Object element : list) {
            if (element instanceof Map<?, ?> map) {
                result.add((Map<String, Object>) map);
            }
        }
        return result;
    }

    static List<String> stringList(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream().map(String::valueOf).toList();
    }
}
