package me.fablestack.mechanics.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.fablestack.mechanics.adapter.inbound.web.dto.InventoryDeltaRequest;
import me.fablestack.mechanics.adapter.inbound.web.dto.SkillCheckRequestDto;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.model.Difficulty;
import me.fablestack.mechanics.domain.model.InventorySnapshot;
import me.fablestack.mechanics.domain.model.SkillCheckOutcome;
import me.fablestack.mechanics.domain.model.SkillCheckRequest;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.service.MechanicsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Skill check and inventory endpoints.
 */
@RestController
@RequestMapping("/api/sessions/{id}")
@RequiredArgsConstructor
public class MechanicsController {

    private final MechanicsService mechanicsService;

    @PostMapping("/skill-checks")
    public Mono<ResponseEntity<SkillCheckOutcome>> performSkillCheck(@PathVariable String id,
            @RequestBody SkillCheckRequestDto request) {
        if (request == null || request.getStatValue() == null || request.getSkillRank() == null) {
            throw new MechanicsValidationException("statValue and skillRank are required");
        }
        SkillCheckRequest skillCheck = SkillCheckRequest.builder()
                .statValue(request.getStatValue())
                .skillRank(request.getSkillRank())
                .difficulty(Difficulty.fromValue(request.getDifficulty()))
                .statName(request.getStatName())
                .skillName(request.getSkillName())
                .build();
        return Mono.just(ResponseEntity.ok(mechanicsService.performSkillCheck(id, skillCheck)));
    }

    @PostMapping("/inventory")
    public Mono<ResponseEntity<TimelineEvent>> applyInventoryDelta(@PathVariable String id,
            @RequestBody InventoryDeltaRequest request) {
        if (request == null) {
            throw new MechanicsValidationException("Inventory delta is required");
        }
        int quantityDelta = request.getQuantityDelta() != null ? request.getQuantityDelta() : 0;
        long currencyDelta = request.getCurrencyDelta() != null ? request.getCurrencyDelta() : 0L;
        return Mono.just(ResponseEntity.ok(
                mechanicsService.applyInventoryDelta(id, request.getItemId(), quantityDelta, currencyDelta)));
    }

    @GetMapping("/inventory")
    public Mono<ResponseEntity<InventorySnapshot>> getInventory(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(mechanicsService.getInventory(id)));
    }
}
