package com.example.d20sim.day;

import com.example.d20sim.combat.EncounterOutcome;
import com.example.d20sim.resource.RechargeType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rest scheduling within a day.
 */
public class DayStateTest {

    @Test
    void testShortRestsBetweenPairs() {
        DayState day = new DayState(6, 2);
        boolean[] expected = {false, true, false, true, false, false};
        for (int i = 0; i < 6; i++) {
            day.setEncounterIndex(i);
            assertEquals(expected[i], day.isShortRestDue(), "After encounter " + i);
        }
    }

    @Test
    void testIntervalPositions() {
        DayState day = new DayState(6, 2);
        day.setEncounterIndex(3);
        assertEquals(1, day.indexWithinInterval(RechargeType.SHORT_REST));
        assertEquals(3, day.indexWithinInterval(RechargeType.LONG_REST));
        assertEquals(2, day.intervalLength(RechargeType.SHORT_REST));
        assertEquals(6, day.intervalLength(RechargeType.LONG_REST));
    }

    @Test
    void testShortFinalInterval() {
        DayState day = new DayState(5, 2);
        day.setEncounterIndex(4);
        assertEquals(0, day.indexWithinInterval(RechargeType.SHORT_REST));
        assertEquals(1, day.intervalLength(RechargeType.SHORT_REST));
        assertFalse(day.isShortRestDue());
    }

    @Test
    void testOutcomes() {
        DayState day = new DayState();
        day.recordOutcome(EncounterOutcome.PARTY_VICTORY);
        assertFalse(day.isSimultaneousDefeat());
        day.recordOutcome(EncounterOutcome.SIMULTANEOUS_DEFEAT);
        assertTrue(day.isSimultaneousDefeat());
        assertEquals(2, day.getOutcomes().size());
    }

    @Test
    void testInvalidCounts() {
        assertThrows(IllegalArgumentException.class, () -> new DayState(0, 2));
        assertThrows(IllegalArgumentException.class, () -> new DayState(6, 0));
    }
}
