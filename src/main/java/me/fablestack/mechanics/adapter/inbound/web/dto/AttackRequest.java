package me.fablestack.mechanics.adapter.inbound.web.dto;

import me.fablestack.mechanics.domain.model.Weapon;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttackRequest {
    private String actorId;
    private String targetId;
    private Weapon weapon;
    private int attackModifier;
    private boolean advantage;
}
