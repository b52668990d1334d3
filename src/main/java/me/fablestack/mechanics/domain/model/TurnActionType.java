package me.fablestack.mechanics.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;

import java.util.Locale;

public enum TurnActionType {
    SKILL_CHECK, ATTACK, FLEE, PASS, DAMAGE, INVENTORY;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TurnActionType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new MechanicsValidationException("Action type is required");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new MechanicsValidationException("Unknown action type: " + value, e);
        }
    }
}
