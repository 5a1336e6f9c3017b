package com.example.d20sim.day;

import com.example.d20sim.bestiary.Bestiary;
import com.example.d20sim.combat.CombatContext;
import com.example.d20sim.combat.EncounterOutcome;
import com.example.d20sim.combat.StubCombatant;
import com.example.d20sim.party.PartyRoster;
import com.example.d20sim.party.PlayerCharacter;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for running a whole day and scoring it.
 */
public class AdventuringDayTest {

    private static DayResult run(int level, MonsterGroup group, long seed) {
        CombatContext ctx = CombatContext.seeded(seed);
        List<PlayerCharacter> party = PartyRoster.createParty(PartyRoster.DEFAULT_PARTY, level, ctx);
        DayState state = new DayState();
        DayResult result = new AdventuringDay(party, List.of(group), state, ctx, 100).run();
        assertEquals(DayPhase.SCORED, state.getPhase());
        return result;
    }

    // === Whole days ===

    @Test
    void testHarmlessMonstersEveryoneSurvives() {
        DayResult result = run(1, new MonsterGroup("Scarecrow", StubCombatant.factory(1, StubCombatant.idle()), 2), 1L);
        assertEquals(4, result.getSurvivors());
        assertEquals(4, result.getPartySize());
        assertEquals(6, result.getEncountersPlayed());
        assertEquals(Collections.nCopies(6, EncounterOutcome.PARTY_VICTORY), result.getOutcomes());
        assertEquals(List.of("Cleric", "Fighter", "Rogue", "Wizard"), result.getSurvivorNames());
    }

    @Test
    void testDayEndsAtTotalPartyKill() {
        DayResult result = run(1, new MonsterGroup("Titan", StubCombatant.factory(100000, StubCombatant.blast(1000)), 1), 2L);
        assertEquals(0, result.getSurvivors());
        assertEquals(1, result.getEncountersPlayed());
        assertEquals(EncounterOutcome.MONSTER_VICTORY, result.getOutcomes().get(0));
        assertFalse(result.isSimultaneousDefeat());
    }

    @Test
    void testSimultaneousDefeatScoresZero() {
        DayResult result = run(1, new MonsterGroup("Bomb", StubCombatant.factory(1000, StubCombatant.selfDestruct(1000)), 1), 3L);
        assertTrue(result.isSimultaneousDefeat());
        assertEquals(0, result.getSurvivors());
        assertTrue(result.getSurvivorNames().isEmpty());
        assertEquals(1, result.getEncountersPlayed());
    }

    @Test
    void testSurvivorsWithinPartySize() {
        MonsterGroup kobolds = new MonsterGroup("Kobold", Bestiary.getFactory("Kobold"), 4);
        for (long seed = 0; seed < 20; seed++) {
            DayResult result = run(1, kobolds, seed);
            assertTrue(result.getSurvivors() >= 0 && result.getSurvivors() <= 4);
            assertTrue(result.getEncountersPlayed() >= 1 && result.getEncountersPlayed() <= 6);
            assertEquals(result.getSurvivors(), result.getSurvivorNames().size());
        }
    }

    // === Validation ===

    @Test
    void testInvalidDay() {
        CombatContext ctx = CombatContext.seeded(1L);
        List<PlayerCharacter> party = PartyRoster.createParty(List.of("Fighter"), 1, ctx);
        MonsterGroup group = new MonsterGroup("Scarecrow", StubCombatant.factory(1, StubCombatant.idle()), 1);
        assertThrows(IllegalArgumentException.class,
                () -> new AdventuringDay(List.of(), List.of(group), new DayState(), ctx, 100));
        assertThrows(IllegalArgumentException.class,
                () -> new AdventuringDay(party, List.of(), new DayState(), ctx, 100));
    }

    @Test
    void testMonsterGroupNumbersInstances() {
        CombatContext ctx = CombatContext.seeded(1L);
        MonsterGroup group = new MonsterGroup("Scarecrow", StubCombatant.factory(1, StubCombatant.idle()), 3);
        assertEquals("Scarecrow 2", group.spawn(ctx).get(1).getName());
        assertEquals("Scarecrow", new MonsterGroup("Scarecrow", group.factory(), 1).spawn(ctx).get(0).getName());
        assertThrows(IllegalArgumentException.class, () -> new MonsterGroup("Nobody", group.factory(), 0));
    }
}
