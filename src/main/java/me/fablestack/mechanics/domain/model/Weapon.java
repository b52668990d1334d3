package me.fablestack.mechanics.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

/**
 * Weapon used for an attack. Melee attacks use the strength modifier for the
 * attack roll and add it to damage; ranged attacks use dexterity and add
 * nothing.
 */
@Builder
public record Weapon(String name, WeaponKind kind, int baseDamage) {

    public static final String UNARMED_STRIKE = "unarmed_strike";

    public static Weapon unarmed() {
        return new Weapon(UNARMED_STRIKE, WeaponKind.MELEE, 1);
    }

    @JsonIgnore
    public boolean isMelee() {
        return kind != WeaponKind.RANGED;
    }
}
