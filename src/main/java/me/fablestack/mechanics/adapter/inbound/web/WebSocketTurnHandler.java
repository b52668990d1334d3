package me.fablestack.mechanics.adapter.inbound.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.adapter.inbound.web.dto.TurnSocketRequest;
import me.fablestack.mechanics.domain.exception.ErrorCode;
import me.fablestack.mechanics.domain.model.PlayerInput;
import me.fablestack.mechanics.domain.model.StreamFrame;
import me.fablestack.mechanics.domain.service.TurnStreamService;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.UUID;

/**
 * Reactive WebSocket handler for turn streaming. Handles JSON messages: {
 * "sessionId": "...", "text": "...", "actions": [...] } and answers each with
 * the turn's frames as JSON text messages. Turns on one connection are played
 * one after another.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketTurnHandler implements WebSocketHandler {

    private final TurnStreamService turnStreamService;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        log.info("[WebSocket] Connection established: connectionId={}", connectionId);

        Flux<WebSocketMessage> outbound = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(this::handleIncoming)
                .map(frame -> session.textMessage(toJson(frame)));

        return session.send(outbound)
                .doFinally(signal -> log.info("[WebSocket] Connection closed: connectionId={}, signal={}",
                        connectionId, signal));
    }

    Flux<StreamFrame> handleIncoming(String payload) {
        TurnSocketRequest request;
        try {
            request = objectMapper.readValue(payload, TurnSocketRequest.class);
        } catch (JsonProcessingException | RuntimeException e) { // NOSONAR
            log.warn("[WebSocket] Failed to parse incoming message: {}", e.getMessage());
            return Flux.just(StreamFrame.error(ErrorCode.VALIDATION, "Malformed turn request"),
                    StreamFrame.endOfTurn());
        }
        PlayerInput input = PlayerInput.builder()
                .text(request.getText())
                .actions(request.getActions() != null ? new ArrayList<>(request.getActions()) : new ArrayList<>())
                .build();
        return turnStreamService.streamTurn(request.getSessionId(), input);
    }

    private String toJson(StreamFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize stream frame", e);
        }
    }
}
