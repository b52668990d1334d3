package me.fablestack.mechanics.domain.model;

/**
 * Which faction a combatant fights for. Players and allies form one side.
 */
public enum CombatSide {
    PLAYER, ALLY, ENEMY;

    public boolean isPlayerFaction() {
        return this != ENEMY;
    }
}
