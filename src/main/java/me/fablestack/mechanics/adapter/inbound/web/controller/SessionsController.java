package me.fablestack.mechanics.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.fablestack.mechanics.adapter.inbound.web.dto.CreateSessionRequest;
import me.fablestack.mechanics.adapter.inbound.web.dto.RestoreRequest;
import me.fablestack.mechanics.adapter.inbound.web.dto.RestoreResponse;
import me.fablestack.mechanics.adapter.inbound.web.dto.SessionSummaryDto;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.RestorePoint;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.service.MechanicsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Session management, timeline history and rollback endpoints.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private final MechanicsService mechanicsService;

    @PostMapping
    public Mono<ResponseEntity<SessionSummaryDto>> createSession(
            @RequestBody(required = false) CreateSessionRequest request) {
        String scenarioName = request != null ? request.getScenarioName() : null;
        GameSession session = mechanicsService.createSession(scenarioName);
        log.info("[API] Created session {}", session.getId());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toSummary(session)));
    }

    @GetMapping
    public Mono<ResponseEntity<List<SessionSummaryDto>>> listSessions() {
        List<SessionSummaryDto> dtos = mechanicsService.listSessions().stream()
                .map(this::toSummary)
                .toList();
        return Mono.just(ResponseEntity.ok(dtos));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SessionSummaryDto>> getSession(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(toSummary(mechanicsService.getSession(id))));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSession(@PathVariable String id) {
        mechanicsService.deleteSession(id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/{id}/history")
    public Mono<ResponseEntity<List<TimelineEvent>>> getHistory(@PathVariable String id,
            @RequestParam(required = false) Long from) {
        return Mono.just(ResponseEntity.ok(mechanicsService.getHistory(id, from)));
    }

    @GetMapping("/{id}/restore-points")
    public Mono<ResponseEntity<List<RestorePoint>>> getRestorePoints(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(mechanicsService.getRestorePoints(id)));
    }

    @PostMapping("/{id}/restore")
    public Mono<ResponseEntity<RestoreResponse>> restore(@PathVariable String id,
            @RequestBody RestoreRequest request) {
        if (request == null || request.getTargetSequence() == null) {
            throw new MechanicsValidationException("targetSequence is required");
        }
        long tail = mechanicsService.restoreHistory(id, request.getTargetSequence());
        return Mono.just(ResponseEntity.ok(new RestoreResponse(id, tail)));
    }

    private SessionSummaryDto toSummary(GameSession session) {
        synchronized (session) {
            return SessionSummaryDto.builder()
                    .id(session.getId())
                    .scenarioName(session.getScenarioName())
                    .eventCount(session.getTimeline().size())
                    .lastSequence(session.lastSequence())
                    .inCombat(session.hasActiveCombat())
                    .currency(session.getCurrency())
                    .createdAt(formatInstant(session.getCreatedAt()))
                    .updatedAt(formatInstant(session.getUpdatedAt()))
                    .build();
        }
    }

    private String formatInstant(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
