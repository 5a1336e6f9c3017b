package com.example.d20sim.combat;

import com.example.d20sim.day.DayState;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.Team;
import com.example.d20sim.util.DiceRoller;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the encounter state machine, termination and initiative order.
 */
public class EncounterTest {

    private static Encounter encounter(CombatContext context, List<StubCombatant> party,
                                       List<StubCombatant> monsters, int maxRounds) {
        return new Encounter(1, party, monsters, new DayState(), context, maxRounds);
    }

    private static StubCombatant pc(String name, int hp, StubCombatant.Behavior behavior, CombatContext context) {
        return StubCombatant.create(name, Team.PARTY, hp, behavior, context);
    }

    private static StubCombatant monster(String name, int hp, StubCombatant.Behavior behavior,
                                         CombatContext context) {
        return StubCombatant.create(name, Team.MONSTERS, hp, behavior, context);
    }

    // === Outcomes ===

    @Test
    void testPartyVictory() {
        CombatContext ctx = CombatContext.seeded(1L);
        Encounter e = encounter(ctx,
                List.of(pc("Hero", 10, StubCombatant.strike(100), ctx)),
                List.of(monster("Rat", 1, StubCombatant.idle(), ctx)), 100);

        assertEquals(EncounterState.NOT_STARTED, e.getState());
        assertEquals(EncounterOutcome.PARTY_VICTORY, e.run());
        assertEquals(EncounterState.CONCLUDED, e.getState());
        assertEquals(1, e.getRound());
    }

    @Test
    void testMonsterVictory() {
        CombatContext ctx = CombatContext.seeded(2L);
        Encounter e = encounter(ctx,
                List.of(pc("Hero", 10, StubCombatant.idle(), ctx), pc("Sidekick", 10, StubCombatant.idle(), ctx)),
                List.of(monster("Ogre", 50, StubCombatant.strike(100), ctx)), 100);

        assertEquals(EncounterOutcome.MONSTER_VICTORY, e.run());
        assertEquals(2, e.getRound());
    }

    @Test
    void testSimultaneousDefeat() {
        CombatContext ctx = CombatContext.seeded(3L);
        Encounter e = encounter(ctx,
                List.of(pc("Hero", 10, StubCombatant.idle(), ctx)),
                List.of(monster("Bomb", 5, StubCombatant.selfDestruct(100), ctx)), 100);

        assertEquals(EncounterOutcome.SIMULTANEOUS_DEFEAT, e.run());
    }

    @Test
    void testStalemateAtRoundCap() {
        CombatContext ctx = CombatContext.seeded(4L);
        Encounter e = encounter(ctx,
                List.of(pc("Hero", 10, StubCombatant.idle(), ctx)),
                List.of(monster("Statue", 10, StubCombatant.idle(), ctx)), 3);

        assertEquals(EncounterOutcome.STALEMATE, e.run());
        assertEquals(3, e.getRound());
    }

    // === State machine ===

    @Test
    void testCannotStartTwice() {
        CombatContext ctx = CombatContext.seeded(5L);
        Encounter e = encounter(ctx,
                List.of(pc("Hero", 10, StubCombatant.idle(), ctx)),
                List.of(monster("Statue", 10, StubCombatant.idle(), ctx)), 10);
        e.start();
        assertEquals(EncounterState.ACTIVE, e.getState());
        assertThrows(IllegalStateException.class, e::start);
    }

    @Test
    void testNoRoundsAfterConclusion() {
        CombatContext ctx = CombatContext.seeded(6L);
        Encounter e = encounter(ctx,
                List.of(pc("Hero", 10, StubCombatant.strike(100), ctx)),
                List.of(monster("Rat", 1, StubCombatant.idle(), ctx)), 10);
        e.run();
        assertThrows(IllegalStateException.class, e::playRound);
    }

    @Test
    void testInvalidRoundCap() {
        CombatContext ctx = CombatContext.seeded(7L);
        assertThrows(IllegalArgumentException.class, () -> encounter(ctx,
                List.of(pc("Hero", 10, StubCombatant.idle(), ctx)),
                List.of(monster("Rat", 1, StubCombatant.idle(), ctx)), 0));
    }

    @Test
    void testUnconsciousCombatantsDoNotAct() {
        CombatContext ctx = CombatContext.seeded(8L);
        StubCombatant fallen = pc("Fallen", 10, StubCombatant.strike(100), ctx);
        fallen.takeDamage(Damage.of(10, DamageType.FORCE), null, false);
        Encounter e = encounter(ctx,
                List.of(fallen, pc("Hero", 10, StubCombatant.idle(), ctx)),
                List.of(monster("Statue", 10, StubCombatant.idle(), ctx)), 2);

        assertEquals(EncounterOutcome.STALEMATE, e.run());
        assertEquals(10, e.getMonsters().get(0).getHitPoints());
    }

    // === Targeting ===

    @Test
    void testChooseTargetOnlyConsciousFoes() {
        CombatContext ctx = CombatContext.seeded(9L);
        StubCombatant hero = pc("Hero", 10, StubCombatant.idle(), ctx);
        StubCombatant down = monster("Down", 5, StubCombatant.idle(), ctx);
        StubCombatant up = monster("Up", 5, StubCombatant.idle(), ctx);
        down.takeDamage(Damage.of(5, DamageType.FORCE), null, false);
        Encounter e = encounter(ctx, List.of(hero), List.of(down, up), 10);

        for (int i = 0; i < 20; i++) {
            assertSame(up, e.chooseTarget(hero));
        }
        assertEquals(List.of(up), e.chooseTargets(hero, 3, Targeting.any()));
        assertEquals(3, e.chooseTargetsWithReplacement(hero, 3, Targeting.any()).size());
        assertNull(e.chooseTarget(hero, Targeting.undead()));
    }

    // === Initiative ===

    @Test
    void testInitiativeOrder_descendingWithPartyWinningTies() {
        for (long seed = 0; seed < 20; seed++) {
            CombatContext ctx = new CombatContext(new DiceRoller(seed),
                    CombatTrace.recording());
            List<StubCombatant> party = new ArrayList<>();
            List<StubCombatant> monsters = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                party.add(pc("Hero " + i, 10, StubCombatant.idle(), ctx));
                monsters.add(monster("Goon " + i, 10, StubCombatant.idle(), ctx));
            }
            Encounter e = encounter(ctx, party, monsters, 1);
            e.start();

            Map<String, Integer> rolls = new HashMap<>();
            for (TraceEvent event : ctx.getTrace().getEvents()) {
                if (event.getType() == TraceEvent.Type.INITIATIVE) {
                    rolls.put(event.getActor(), event.getRoll());
                }
            }
            List<Combatant> order = e.getTurnOrder();
            assertEquals(16, order.size());
            for (int i = 1; i < order.size(); i++) {
                Combatant before = order.get(i - 1);
                Combatant after = order.get(i);
                int r1 = rolls.get(before.getName());
                int r2 = rolls.get(after.getName());
                assertTrue(r1 >= r2, "Initiative not descending at " + i + " for seed " + seed);
                if (r1 == r2) {
                    assertFalse(before.getTeam() == Team.MONSTERS && after.getTeam() == Team.PARTY,
                            "Monster placed before party member on a tie for seed " + seed);
                }
            }
        }
    }

    // === Lair and legendary actions ===

    private static StubCombatant.Behavior logging(List<String> log, String entry) {
        return (self, encounter) -> {
            log.add(entry);
            return true;
        };
    }

    @Test
    void testLairActionLosesTiesAtTwenty() {
        CombatContext ctx = CombatContext.seeded(10L);
        List<String> log = new ArrayList<>();
        StubCombatant hero = pc("Hero", 10, logging(log, "Hero"), ctx).withInitiative(20);
        StubCombatant lord = monster("Lord", 10, logging(log, "Lord"), ctx)
                .withInitiative(5).withLairAction(logging(log, "Lair"));
        Encounter e = encounter(ctx, List.of(hero), List.of(lord), 10);
        e.start();
        e.playRound();

        assertEquals(List.of("Hero", "Lair", "Lord"), log);
        assertEquals(List.of(hero, lord), e.getTurnOrder());
    }

    @Test
    void testLairActionBeforeSlowerCombatants() {
        CombatContext ctx = CombatContext.seeded(11L);
        List<String> log = new ArrayList<>();
        StubCombatant hero = pc("Hero", 10, logging(log, "Hero"), ctx).withInitiative(19);
        StubCombatant lord = monster("Lord", 10, logging(log, "Lord"), ctx)
                .withInitiative(21).withLairAction(logging(log, "Lair"));
        Encounter e = encounter(ctx, List.of(hero), List.of(lord), 10);
        e.start();
        e.playRound();

        assertEquals(List.of("Lord", "Lair", "Hero"), log);
    }

    @Test
    void testNoLairActionWhileOwnerIsDown() {
        CombatContext ctx = CombatContext.seeded(12L);
        List<String> log = new ArrayList<>();
        StubCombatant lord = monster("Lord", 10, StubCombatant.idle(), ctx).withLairAction(logging(log, "Lair"));
        lord.takeDamage(Damage.of(10, DamageType.FORCE), null, false);
        Encounter e = encounter(ctx,
                List.of(pc("Hero", 10, StubCombatant.idle(), ctx)),
                List.of(lord, monster("Minion", 10, StubCombatant.idle(), ctx)), 3);

        assertEquals(EncounterOutcome.STALEMATE, e.run());
        assertTrue(log.isEmpty());
    }

    @Test
    void testLegendaryActionsAfterOtherTurns() {
        CombatContext ctx = CombatContext.seeded(13L);
        List<String> log = new ArrayList<>();
        StubCombatant fast = pc("Fast", 10, logging(log, "Fast"), ctx).withInitiative(30);
        StubCombatant middle = pc("Middle", 10, logging(log, "Middle"), ctx).withInitiative(20);
        StubCombatant slow = pc("Slow", 10, logging(log, "Slow"), ctx).withInitiative(10);
        StubCombatant lord = monster("Lord", 10, logging(log, "Lord"), ctx)
                .withInitiative(15).withLegendaryActions(2, logging(log, "Legendary"));
        Encounter e = encounter(ctx, List.of(fast, middle, slow), List.of(lord), 10);
        e.start();
        e.playRound();

        // Two uses before its own turn, refreshed at the start of it
        assertEquals(List.of("Fast", "Legendary", "Middle", "Legendary", "Lord", "Slow", "Legendary"), log);
        assertEquals(1, lord.getLegendaryActionsLeft());
    }

    @Test
    void testLegendaryActionCanEndTheEncounter() {
        CombatContext ctx = CombatContext.seeded(14L);
        StubCombatant hero = pc("Hero", 10, StubCombatant.idle(), ctx).withInitiative(30);
        StubCombatant lord = monster("Lord", 50, StubCombatant.idle(), ctx)
                .withInitiative(1).withLegendaryActions(3, StubCombatant.strike(100));
        Encounter e = encounter(ctx, List.of(hero), List.of(lord), 10);

        assertEquals(EncounterOutcome.MONSTER_VICTORY, e.run());
        assertEquals(1, e.getRound());
        assertEquals(2, lord.getLegendaryActionsLeft());
    }
}
