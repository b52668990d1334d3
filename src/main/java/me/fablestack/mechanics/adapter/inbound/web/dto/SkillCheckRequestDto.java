package me.fablestack.mechanics.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillCheckRequestDto {
    private Integer statValue;
    private Integer skillRank;
    private String difficulty;
    private String statName;
    private String skillName;
}
