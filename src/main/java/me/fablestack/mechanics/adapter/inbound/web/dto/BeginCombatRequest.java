package me.fablestack.mechanics.adapter.inbound.web.dto;

import me.fablestack.mechanics.domain.model.Combatant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BeginCombatRequest {
    private List<Combatant> roster;
}
