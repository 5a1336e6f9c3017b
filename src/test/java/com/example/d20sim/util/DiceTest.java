package com.example.d20sim.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for dice notation, roll bounds and the seeded roller.
 */
public class DiceTest {

    // === Parsing ===

    @Test
    void testParse() {
        assertEquals(Dice.of(2, 6), Dice.parse("2d6"));
        assertEquals(Dice.of(1, 20), Dice.parse("d20"));
        assertEquals(Dice.of(3, 8), Dice.parse(" 3D8 "));
    }

    @Test
    void testParse_invalid() {
        assertThrows(IllegalArgumentException.class, () -> Dice.parse("2x6"));
        assertThrows(IllegalArgumentException.class, () -> Dice.parse("2d6+1"));
        assertThrows(IllegalArgumentException.class, () -> Dice.parse(""));
        assertThrows(IllegalArgumentException.class, () -> Dice.parse(null));
    }

    @Test
    void testInvalidDice() {
        assertThrows(IllegalArgumentException.class, () -> Dice.of(-1, 6));
        assertThrows(IllegalArgumentException.class, () -> Dice.of(1, 0));
    }

    // === Bounds ===

    @Test
    void testRollBounds() {
        DiceRoller roller = new DiceRoller(7L);
        Dice dice = Dice.of(3, 6).plus(Dice.of(2, 4));
        assertEquals(5, dice.minimum());
        assertEquals(26, dice.maximum());
        for (int i = 0; i < 1000; i++) {
            int r = dice.roll(roller);
            assertTrue(r >= 5 && r <= 26, "Roll out of range: " + r);
        }
    }

    @Test
    void testZeroDice() {
        assertEquals(0, Dice.of(0, 6).roll(new DiceRoller(1L)));
    }

    @Test
    void testGreatWeaponRerollStaysInRange() {
        DiceRoller roller = new DiceRoller(11L);
        Dice greatsword = Dice.greatWeapon(2, 6);
        for (int i = 0; i < 1000; i++) {
            int r = greatsword.roll(roller);
            assertTrue(r >= 2 && r <= 12);
        }
        assertEquals("2d6r2", greatsword.toString());
    }

    @Test
    void testMean() {
        assertEquals(4, Dice.mean(6));
        assertEquals(5, Dice.mean(8));
        assertEquals(6, Dice.mean(10));
    }

    // === Roller ===

    @Test
    void testSameSeedSameRolls() {
        DiceRoller a = new DiceRoller(99L);
        DiceRoller b = new DiceRoller(99L);
        for (int i = 0; i < 100; i++) {
            assertEquals(a.roll(20), b.roll(20));
        }
    }

    @Test
    void testAdvantageNeverBelowSingleRollRange() {
        DiceRoller roller = new DiceRoller(3L);
        for (int i = 0; i < 500; i++) {
            int r = roller.d20(true, false);
            assertTrue(r >= 1 && r <= 20);
        }
    }

    @Test
    void testSample() {
        DiceRoller roller = new DiceRoller(5L);
        List<String> items = List.of("a", "b", "c", "d");
        List<String> two = roller.sample(items, 2);
        assertEquals(2, two.size());
        assertNotEquals(two.get(0), two.get(1));
        assertEquals(items, roller.sample(items, 10));
        assertNull(roller.pick(List.of()));
        assertTrue(roller.sampleWithReplacement(List.of(), 3).isEmpty());
    }
}
