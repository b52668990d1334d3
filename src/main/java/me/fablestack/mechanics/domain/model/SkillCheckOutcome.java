package me.fablestack.mechanics.domain.model;

/**
 * Skill check verdict together with the event that records it.
 */
public record SkillCheckOutcome(SkillCheckResult result, TimelineEvent event) {
}
