package com.example.d20sim.bestiary;

import com.example.d20sim.combat.CombatContext;
import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Weapon;
import com.example.d20sim.util.Dice;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the parametric test creature.
 */
public class TestCreatureStatsTest {

    @Test
    void testParse() {
        TestCreatureStats stats = TestCreatureStats.parse("5,12,10,20");
        assertEquals(new TestCreatureStats(5, 12, 10, 20, 1, 2), stats);
        assertEquals(new TestCreatureStats(6, 15, 24, 60, 2, 3), TestCreatureStats.parse(" 6, 15, 24, 60, 2, 3"));
    }

    @Test
    void testParse_invalid() {
        assertThrows(IllegalArgumentException.class, () -> TestCreatureStats.parse("5,12,10"));
        assertThrows(IllegalArgumentException.class, () -> TestCreatureStats.parse("5,12,ten,20"));
        assertThrows(IllegalArgumentException.class, () -> TestCreatureStats.parse("5,12,10,20,0"));
        assertThrows(IllegalArgumentException.class, () -> TestCreatureStats.parse("5,12,10,0"));
        assertThrows(IllegalArgumentException.class, () -> TestCreatureStats.parse(""));
    }

    @Test
    void testTemplateMatchesTargets() {
        MonsterTemplate template = new TestCreatureStats(5, 12, 10, 20).toTemplate();
        Weapon slam = template.getAttacks().get(0);

        // 2d6 + 3 averages 10
        assertEquals(Dice.of(2, 6), slam.getDice());
        assertEquals(3, slam.getDamageBonus());
        // 4d8 + 2 averages 20
        assertEquals(Dice.of(4, 8), template.getHitPointDice());
        assertEquals(2, template.getHitPointBonus());
        assertEquals(12, template.getArmorClass());

        Combatant creature = template.spawn("Test", CombatContext.seeded(1L));
        assertEquals(5, slam.attackModifier(creature));
        assertEquals(12, creature.getArmorClass());
        assertTrue(creature.getMaxHitPoints() >= 6 && creature.getMaxHitPoints() <= 34);
    }

    @Test
    void testDamageSplitAcrossAttacks() {
        MonsterTemplate template = new TestCreatureStats(4, 13, 20, 30, 2, 2).toTemplate();
        Weapon slam = template.getAttacks().get(0);
        assertEquals(2, template.getAttacksPerRound());
        // 10 per attack: 2d6 + 3
        assertEquals(Dice.of(2, 6), slam.getDice());
        assertEquals(3, slam.getDamageBonus());
    }

    @Test
    void testSmallValues() {
        MonsterTemplate template = new TestCreatureStats(3, 10, 3, 1).toTemplate();
        assertEquals(0, template.getAttacks().get(0).getDice().getCount());
        assertEquals(3, template.getAttacks().get(0).getDamageBonus());
        assertEquals(1, template.spawn("Test", CombatContext.seeded(1L)).getMaxHitPoints());
    }
}
