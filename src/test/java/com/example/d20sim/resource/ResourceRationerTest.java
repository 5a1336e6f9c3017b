package com.example.d20sim.resource;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for spreading limited uses across the encounters of a rest interval.
 */
public class ResourceRationerTest {

    // === Allotments ===

    @Test
    void testFrontLoaded() {
        // A wizard's 10 slots over a 6 encounter day
        assertArrayEquals(new int[] {2, 2, 2, 2, 1, 1},
                ResourceRationer.allot(10, 6, Loading.FRONT_LOADED));
    }

    @Test
    void testBackLoaded() {
        assertArrayEquals(new int[] {1, 1, 2, 2, 2, 2},
                ResourceRationer.allot(10, 6, Loading.BACK_LOADED));
    }

    @Test
    void testSingleUseOverTwoEncounters() {
        assertArrayEquals(new int[] {1, 0}, ResourceRationer.allot(1, 2, Loading.FRONT_LOADED));
        assertArrayEquals(new int[] {0, 1}, ResourceRationer.allot(1, 2, Loading.BACK_LOADED));
    }

    @Test
    void testEvenSplitIgnoresLoading() {
        assertArrayEquals(ResourceRationer.allot(6, 3, Loading.FRONT_LOADED),
                ResourceRationer.allot(6, 3, Loading.BACK_LOADED));
        assertArrayEquals(new int[] {0, 0, 0}, ResourceRationer.allot(0, 3, Loading.FRONT_LOADED));
    }

    @Test
    void testSumAndSymmetry() {
        for (int total = 0; total <= 15; total++) {
            for (int n = 1; n <= 7; n++) {
                int[] front = ResourceRationer.allot(total, n, Loading.FRONT_LOADED);
                int[] back = ResourceRationer.allot(total, n, Loading.BACK_LOADED);
                assertEquals(total, Arrays.stream(front).sum());
                assertEquals(total, Arrays.stream(back).sum());
                for (int i = 0; i < n; i++) {
                    assertEquals(front[i], back[n - 1 - i], "Back loading mirrors front loading");
                    assertTrue(front[i] == total / n || front[i] == total / n + 1);
                }
            }
        }
    }

    @Test
    void testInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> ResourceRationer.allot(-1, 2, Loading.FRONT_LOADED));
        assertThrows(IllegalArgumentException.class, () -> ResourceRationer.allot(3, 0, Loading.FRONT_LOADED));
    }

    // === Schedule ===

    @Test
    void testScheduleReserves() {
        RationingSchedule schedule = ResourceRationer.schedule(3, 2, Loading.BACK_LOADED);
        assertArrayEquals(new int[] {1, 2}, schedule.getAllotments());
        assertEquals(2, schedule.reserveAt(0));
        assertEquals(0, schedule.reserveAt(1));

        assertTrue(schedule.mayUse(3, 0));
        assertFalse(schedule.mayUse(2, 0), "Two uses are held back for the second encounter");
        assertTrue(schedule.mayUse(2, 1));
        assertTrue(schedule.mayUse(1, 1));
        assertFalse(schedule.mayUse(0, 1));
    }

    @Test
    void testScheduleClampsEncounterIndex() {
        RationingSchedule schedule = ResourceRationer.schedule(2, 2, Loading.FRONT_LOADED);
        assertEquals(schedule.reserveAt(1), schedule.reserveAt(5));
        assertEquals(schedule.reserveAt(0), schedule.reserveAt(-1));
    }

    // === Pools and slots ===

    @Test
    void testResourcePool() {
        ResourcePool pool = new ResourcePool("action surge", 1, RechargeType.SHORT_REST);
        assertTrue(pool.spend());
        assertFalse(pool.spend());
        assertEquals(0, pool.getRemaining());
        pool.recharge();
        assertEquals(1, pool.getRemaining());
        assertThrows(IllegalArgumentException.class, () -> new ResourcePool("x", -1, RechargeType.LONG_REST));
    }

    @Test
    void testSpellSlots() {
        SpellSlots slots = new SpellSlots(4, 3, 2);
        assertEquals(9, slots.getRemaining());
        assertEquals(3, slots.getHighestLevel());
        assertEquals(3, slots.highestAvailable(1));
        assertEquals(1, slots.lowestAvailable(1));
        assertEquals(2, slots.lowestAvailable(2));

        slots.spend(3);
        slots.spend(3);
        assertEquals(2, slots.highestAvailable(1));
        assertEquals(0, slots.highestAvailable(3));
        assertThrows(IllegalStateException.class, () -> slots.spend(3));

        assertTrue(slots.recover(3));
        assertFalse(slots.recover(1), "Cannot exceed the maximum");
        slots.recharge();
        assertEquals(9, slots.getRemaining());
    }
}
