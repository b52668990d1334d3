package me.fablestack.mechanics.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;

import java.util.Locale;

/**
 * Skill check difficulty. The offset is subtracted from the raw target, so a
 * favorable check gets an easier target.
 */
public enum Difficulty {

    FAVORABLE(-20), NORMAL(0), UNFAVORABLE(20);

    private final int offset;

    Difficulty(int offset) {
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Difficulty fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new MechanicsValidationException("Difficulty is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MechanicsValidationException("Unknown difficulty: " + value, e);
        }
    }
}
