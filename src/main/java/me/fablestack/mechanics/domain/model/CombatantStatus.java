package me.fablestack.mechanics.domain.model;

public enum CombatantStatus {
    ALIVE, DOWN, FLED
}
