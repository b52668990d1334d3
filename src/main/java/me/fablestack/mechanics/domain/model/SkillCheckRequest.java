package me.fablestack.mechanics.domain.model;

import lombok.Builder;

/**
 * Input of a percentile skill check. Stat and skill names are labels only and
 * are copied into the recorded event.
 */
@Builder
public record SkillCheckRequest(int statValue, int skillRank, Difficulty difficulty, String statName,
        String skillName) {
}
