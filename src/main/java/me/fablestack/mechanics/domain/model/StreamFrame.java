package me.fablestack.mechanics.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import me.fablestack.mechanics.domain.exception.ErrorCode;

/**
 * One frame of a turn stream. Mechanical events always precede narration
 * tokens and every stream ends with {@link StreamFrameType#END_OF_TURN}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamFrame(StreamFrameType type, TimelineEvent event, String token, StreamError error) {

    public static StreamFrame mechanical(TimelineEvent event) {
        return new StreamFrame(StreamFrameType.MECHANICAL_EVENT, event, null, null);
    }

    public static StreamFrame token(String token) {
        return new StreamFrame(StreamFrameType.NARRATION_TOKEN, null, token, null);
    }

    public static StreamFrame error(ErrorCode code, String message) {
        return new StreamFrame(StreamFrameType.ERROR, null, null, new StreamError(code, message));
    }

    public static StreamFrame endOfTurn() {
        return new StreamFrame(StreamFrameType.END_OF_TURN, null, null, null);
    }
}
