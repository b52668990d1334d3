package me.fablestack.mechanics.domain.model;

/**
 * Verdict of a skill check. {@code margin} is {@code target - roll}; degree
 * bands are left to presentation.
 */
public record SkillCheckResult(int target, int roll, boolean success, int margin) {
}
