package me.fablestack.mechanics.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.fablestack.mechanics.adapter.inbound.web.dto.AttackRequest;
import me.fablestack.mechanics.adapter.inbound.web.dto.BeginCombatRequest;
import me.fablestack.mechanics.adapter.inbound.web.dto.CombatOverviewDto;
import me.fablestack.mechanics.adapter.inbound.web.dto.CombatantActionRequest;
import me.fablestack.mechanics.adapter.inbound.web.dto.DirectDamageRequest;
import me.fablestack.mechanics.domain.exception.MechanicsValidationException;
import me.fablestack.mechanics.domain.model.CombatActionResult;
import me.fablestack.mechanics.domain.model.CombatState;
import me.fablestack.mechanics.domain.service.MechanicsService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Combat encounter endpoints. Actions are only accepted from the combatant
 * whose turn it is.
 */
@RestController
@RequestMapping("/api/sessions/{id}/combat")
@RequiredArgsConstructor
public class CombatController {

    private final MechanicsService mechanicsService;

    @PostMapping
    public Mono<ResponseEntity<CombatState>> beginCombat(@PathVariable String id,
            @RequestBody BeginCombatRequest request) {
        if (request == null) {
            throw new MechanicsValidationException("Combat roster is required");
        }
        CombatState combat = mechanicsService.beginCombat(id, request.getRoster());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(combat));
    }

    @GetMapping
    public Mono<ResponseEntity<CombatOverviewDto>> getCombat(@PathVariable String id) {
        CombatOverviewDto overview = CombatOverviewDto.builder()
                .active(mechanicsService.getCurrentCombat(id).orElse(null))
                .archived(mechanicsService.getArchivedCombats(id))
                .build();
        return Mono.just(ResponseEntity.ok(overview));
    }

    @PostMapping("/attacks")
    public Mono<ResponseEntity<CombatActionResult>> attack(@PathVariable String id,
            @RequestBody AttackRequest request) {
        if (request == null) {
            throw new MechanicsValidationException("Attack request is required");
        }
        return Mono.just(ResponseEntity.ok(mechanicsService.performAttack(id, request.getActorId(),
                request.getTargetId(), request.getWeapon(), request.getAttackModifier(), request.isAdvantage())));
    }

    @PostMapping("/damage")
    public Mono<ResponseEntity<CombatActionResult>> damage(@PathVariable String id,
            @RequestBody DirectDamageRequest request) {
        if (request == null || request.getAmount() == null) {
            throw new MechanicsValidationException("Damage amount is required");
        }
        return Mono.just(ResponseEntity.ok(mechanicsService.applyDirectDamage(id, request.getTargetId(),
                request.getAmount(), request.getSource())));
    }

    @PostMapping("/flee")
    public Mono<ResponseEntity<CombatActionResult>> flee(@PathVariable String id,
            @RequestBody CombatantActionRequest request) {
        return Mono.just(ResponseEntity.ok(mechanicsService.flee(id, actorId(request))));
    }

    @PostMapping("/pass")
    public Mono<ResponseEntity<CombatActionResult>> pass(@PathVariable String id,
            @RequestBody CombatantActionRequest request) {
        return Mono.just(ResponseEntity.ok(mechanicsService.passTurn(id, actorId(request))));
    }

    private String actorId(CombatantActionRequest request) {
        if (request == null) {
            throw new MechanicsValidationException("actorId is required");
        }
        return request.getActorId();
    }
}
