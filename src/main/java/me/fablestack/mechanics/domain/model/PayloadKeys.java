package me.fablestack.mechanics.domain.model;

/**
 * Payload keys shared by the components that write events and the replayer
 * that folds them back into session state.
 */
public final class PayloadKeys {

    public static final String ACTION = "action";
    public static final String MESSAGE = "message";
    public static final String TEXT = "text";

    public static final String COMBAT_ID = "combatId";
    public static final String ROSTER = "roster";
    public static final String TURN_ORDER = "turnOrder";
    public static final String ROUND = "round";
    public static final String ACTIVE_INDEX = "activeIndex";
    public static final String ACTIVE_COMBATANT_ID = "activeCombatantId";
    public static final String ACTIVE_COMBATANT_NAME = "activeCombatantName";
    public static final String NEW_ROUND = "newRound";
    public static final String OUTCOME = "outcome";
    public static final String COMBATANT_ID = "combatantId";
    public static final String COMBATANT_NAME = "combatantName";

    public static final String ATTACKER_ID = "attackerId";
    public static final String ATTACKER_NAME = "attackerName";
    public static final String TARGET_ID = "targetId";
    public static final String TARGET_NAME = "targetName";
    public static final String WEAPON = "weapon";
    public static final String WEAPON_KIND = "weaponKind";
    public static final String NATURAL_ROLL = "naturalRoll";
    public static final String ROLLS = "rolls";
    public static final String ADVANTAGE = "advantage";
    public static final String ATTACK_MODIFIER = "attackModifier";
    public static final String ABILITY_MODIFIER = "abilityModifier";
    public static final String PROFICIENCY_BONUS = "proficiencyBonus";
    public static final String TOTAL = "total";
    public static final String TARGET_ARMOR_CLASS = "targetArmorClass";
    public static final String HIT = "hit";
    public static final String CRITICAL = "critical";
    public static final String FUMBLE = "fumble";

    public static final String AMOUNT = "amount";
    public static final String HP_BEFORE = "hpBefore";
    public static final String HP_AFTER = "hpAfter";
    public static final String MAX_HP = "maxHp";
    public static final String STATUS = "status";
    public static final String SOURCE = "source";

    public static final String STAT_NAME = "statName";
    public static final String SKILL_NAME = "skillName";
    public static final String STAT_VALUE = "statValue";
    public static final String SKILL_RANK = "skillRank";
    public static final String DIFFICULTY = "difficulty";
    public static final String ROLL = "roll";
    public static final String TARGET = "target";
    public static final String SUCCESS = "success";
    public static final String MARGIN = "margin";

    public static final String ITEM_ID = "itemId";
    public static final String QUANTITY_DELTA = "quantityDelta";
    public static final String QUANTITY_AFTER = "quantityAfter";
    public static final String CURRENCY_DELTA = "currencyDelta";
    public static final String CURRENCY_AFTER = "currencyAfter";

    public static final String SPEAKERS = "speakers";
    public static final String TAGS = "tags";
    public static final String REASON = "reason";
    public static final String CODE = "code";
    public static final String SCENARIO = "scenario";

    public static final String ACTION_STARTED = "started";
    public static final String ACTION_FLED = "fled";
    public static final String ACTION_CONCLUDED = "concluded";

    private PayloadKeys() {
    }
}
