package me.fablestack.mechanics.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request naming the combatant whose turn it is, for flee and pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CombatantActionRequest {
    private String actorId;
}
