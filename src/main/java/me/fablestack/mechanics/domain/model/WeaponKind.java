package me.fablestack.mechanics.domain.model;

public enum WeaponKind {
    MELEE, RANGED
}
