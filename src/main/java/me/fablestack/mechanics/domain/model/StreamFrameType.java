package me.fablestack.mechanics.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StreamFrameType {
    MECHANICAL_EVENT("mechanical_event"), NARRATION_TOKEN("narration_token"), ERROR("error"), END_OF_TURN(
            "end_of_turn");

    private final String wireName;

    StreamFrameType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
