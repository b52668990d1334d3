package me.fablestack.mechanics.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.fablestack.mechanics.domain.model.PlayerInput;
import me.fablestack.mechanics.domain.model.StreamFrame;
import me.fablestack.mechanics.domain.service.TurnStreamService;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Streams one player turn as server-sent events. Each event is named after
 * the frame type; the stream always ends with an {@code end_of_turn} event,
 * errors included.
 */
@RestController
@RequestMapping("/api/sessions/{id}")
@RequiredArgsConstructor
public class TurnsController {

    private final TurnStreamService turnStreamService;

    @PostMapping(value = "/turns", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<StreamFrame>> streamTurn(@PathVariable String id,
            @RequestBody PlayerInput input) {
        return turnStreamService.streamTurn(id, input)
                .map(frame -> ServerSentEvent.<StreamFrame>builder()
                        .event(frame.type().getWireName())
                        .data(frame)
                        .build());
    }
}
