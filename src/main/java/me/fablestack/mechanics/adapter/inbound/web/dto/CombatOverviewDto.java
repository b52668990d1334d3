package me.fablestack.mechanics.adapter.inbound.web.dto;

import me.fablestack.mechanics.domain.model.CombatState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CombatOverviewDto {
    private CombatState active;
    private List<CombatState> archived;
}
