package com.example.d20sim.sim;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the summary statistics over survivor counts.
 */
public class SurvivalStatisticsTest {

    @Test
    void testMean() {
        assertEquals(2.5, SurvivalStatistics.mean(new int[]{1, 2, 3, 4}), 1e-9);
        assertEquals(0.0, SurvivalStatistics.mean(new int[0]), 1e-9);
    }

    @Test
    void testStandardDeviation_sample() {
        // Squares sum to 5, over n - 1 = 3
        assertEquals(Math.sqrt(5.0 / 3.0), SurvivalStatistics.standardDeviation(new int[]{1, 2, 3, 4}), 1e-9);
        assertEquals(0.0, SurvivalStatistics.standardDeviation(new int[]{4, 4, 4}), 1e-9);
    }

    @Test
    void testStandardDeviation_tooFewValues() {
        assertEquals(0.0, SurvivalStatistics.standardDeviation(new int[]{3}), 1e-9);
        assertEquals(0.0, SurvivalStatistics.standardDeviation(new int[0]), 1e-9);
    }

    @Test
    void testHistogram() {
        int[] counts = SurvivalStatistics.histogram(new int[]{0, 4, 4, 2, 3, 4}, 4);
        assertArrayEquals(new int[]{1, 0, 1, 1, 3}, counts);
    }

    @Test
    void testHistogram_outOfRange() {
        assertThrows(IllegalStateException.class, () -> SurvivalStatistics.histogram(new int[]{5}, 4));
        assertThrows(IllegalStateException.class, () -> SurvivalStatistics.histogram(new int[]{-1}, 4));
    }
}
