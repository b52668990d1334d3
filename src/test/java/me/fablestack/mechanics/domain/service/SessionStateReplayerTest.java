package me.fablestack.mechanics.domain.service;

import me.fablestack.mechanics.domain.model.CombatOutcome;
import me.fablestack.mechanics.domain.model.CombatSide;
import me.fablestack.mechanics.domain.model.CombatState;
import me.fablestack.mechanics.domain.model.Combatant;
import me.fablestack.mechanics.domain.model.GameSession;
import me.fablestack.mechanics.domain.model.PayloadKeys;
import me.fablestack.mechanics.domain.model.TimelineEvent;
import me.fablestack.mechanics.domain.model.TimelineEventKind;
import me.fablestack.mechanics.domain.model.Weapon;
import me.fablestack.mechanics.domain.model.WeaponKind;
import me.fablestack.mechanics.testsupport.MechanicsFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionStateReplayerTest {

    private static final Weapon LONGSWORD = new Weapon("longsword", WeaponKind.MELEE, 6);

    private MechanicsFixture fixture;
    private MechanicsService mechanics;
    private String sessionId;

    @BeforeEach
    void setUp() {
        fixture = new MechanicsFixture();
        mechanics = fixture.mechanicsService;
        sessionId = fixture.sessionPort.create("The Sunken Keep").getId();
    }

    private GameSession replayed(GameSession session) {
        GameSession copy = GameSession.builder()
                .id(session.getId())
                .timeline(new ArrayList<>(session.getTimeline()))
                .build();
        fixture.replayer.rebuild(copy);
        return copy;
    }

    @Test
    void shouldRebuildSameStateAsLiveCommits() {
        mechanics.applyInventoryDelta(sessionId, "torch", 3, 25);
        mechanics.beginCombat(sessionId, List.of(MechanicsFixture.hero(), MechanicsFixture.goblin()));
        fixture.dice.enqueue(15, 12);
        mechanics.performAttack(sessionId, "hero", "goblin", LONGSWORD);
        mechanics.performAttack(sessionId, "goblin", "hero", Weapon.unarmed());
        mechanics.applyInventoryDelta(sessionId, "torch", -1, -5);

        GameSession live = mechanics.getSession(sessionId);
        GameSession rebuilt = replayed(live);

        assertEquals(live.getCombat(), rebuilt.getCombat());
        assertEquals(live.getItems(), rebuilt.getItems());
        assertEquals(live.getCurrency(), rebuilt.getCurrency());
        assertEquals(11, rebuilt.getCombat().getCombatants().get("goblin").getCurrentHp());
        assertEquals(Map.of("torch", 2), rebuilt.getItems());
        assertEquals(20, rebuilt.getCurrency());
    }

    @Test
    void shouldReplayDirectDamageAndTheTurnItForces() {
        Combatant ally = MechanicsFixture.hero().toBuilder().id("ally").side(CombatSide.ALLY)
                .dexterityModifier(0).wisdomModifier(0).build();
        mechanics.beginCombat(sessionId, List.of(MechanicsFixture.hero(), MechanicsFixture.goblin(), ally));
        mechanics.applyDirectDamage(sessionId, "goblin", 4, "trap");
        mechanics.applyDirectDamage(sessionId, "hero", 30, "poison");

        GameSession live = mechanics.getSession(sessionId);
        GameSession rebuilt = replayed(live);

        assertEquals(live.getCombat(), rebuilt.getCombat());
        assertEquals(16, rebuilt.getCombat().getCombatants().get("goblin").getCurrentHp());
        assertEquals("goblin", rebuilt.getCombat().getActiveCombatant().getId());
    }

    @Test
    void shouldRestoreHpAndInventoryWhenRollingBackMidCombat() {
        mechanics.beginCombat(sessionId, List.of(MechanicsFixture.hero(), MechanicsFixture.goblin()));
        long beforeAttack = mechanics.getSession(sessionId).lastSequence();
        fixture.dice.enqueue(15);
        mechanics.performAttack(sessionId, "hero", "goblin", LONGSWORD);
        mechanics.applyInventoryDelta(sessionId, "goblin_ear", 1, 0);

        mechanics.restoreHistory(sessionId, beforeAttack);

        CombatState combat = mechanics.getCurrentCombat(sessionId).orElseThrow();
        assertEquals(20, combat.getCombatants().get("goblin").getCurrentHp());
        assertEquals("hero", combat.getActiveCombatant().getId());
        assertTrue(mechanics.getInventory(sessionId).items().isEmpty());
    }

    @Test
    void shouldArchiveConcludedCombatAndReviveItOnRollback() {
        mechanics.beginCombat(sessionId, List.of(MechanicsFixture.hero(),
                MechanicsFixture.goblin().toBuilder().currentHp(5).build()));
        long beforeAttack = mechanics.getSession(sessionId).lastSequence();
        fixture.dice.enqueue(15);
        mechanics.performAttack(sessionId, "hero", "goblin", LONGSWORD);

        GameSession session = mechanics.getSession(sessionId);
        assertNull(session.getCombat());
        assertEquals(1, session.getArchivedCombats().size());
        assertEquals(CombatOutcome.VICTORY, session.getArchivedCombats().get(0).getOutcome());
        assertEquals(MechanicsFixture.FIXED_TIME, session.getArchivedCombats().get(0).getConcludedAt());

        mechanics.restoreHistory(sessionId, beforeAttack);

        assertTrue(mechanics.getCurrentCombat(sessionId).isPresent());
        assertTrue(mechanics.getArchivedCombats(sessionId).isEmpty());
    }

    @Test
    void shouldIgnoreEventsForAnotherCombat() {
        GameSession session = GameSession.builder().id("session-9").build();
        TimelineEvent stray = TimelineEvent.builder()
                .sequenceNumber(1)
                .timestamp(MechanicsFixture.FIXED_TIME)
                .kind(TimelineEventKind.COMBAT_DAMAGE)
                .payload(Map.of(PayloadKeys.COMBAT_ID, "other", PayloadKeys.TARGET_ID, "hero",
                        PayloadKeys.HP_AFTER, 0, PayloadKeys.STATUS, "DOWN"))
                .build();

        fixture.replayer.apply(session, stray);

        assertNull(session.getCombat());
    }

    @Test
    void shouldDropItemsWhoseQuantityReachesZero() {
        mechanics.applyInventoryDelta(sessionId, "potion", 2, 0);
        mechanics.applyInventoryDelta(sessionId, "potion", -2, 0);

        assertTrue(replayed(mechanics.getSession(sessionId)).getItems().isEmpty());
    }
}
