package me.fablestack.mechanics.domain.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable error codes shared by API error bodies and turn-stream error frames.
 */
public enum ErrorCode {
    VALIDATION("validation"),
    STATE_CONFLICT("state_conflict"),
    NOT_FOUND("not_found"),
    NARRATION_UNAVAILABLE("narration_unavailable"),
    INTERNAL("internal");

    private final String wireName;

    ErrorCode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
