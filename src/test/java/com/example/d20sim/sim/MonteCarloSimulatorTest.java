package com.example.d20sim.sim;

import com.example.d20sim.bestiary.TestCreatureStats;
import com.example.d20sim.combat.CombatTrace;
import com.example.d20sim.day.DayResult;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for running batches of days and aggregating their survivors.
 */
public class MonteCarloSimulatorTest {

    private static SimulationConfig.Builder kobolds(int count) {
        return SimulationConfig.builder().monsters(Map.of("Kobold", count));
    }

    // === Reproducibility ===

    @Test
    void testSameSeedSameSurvival() {
        SimulationConfig config = kobolds(4).days(50).seed(123L).build();
        int[] first = MonteCarloSimulator.simulate(config).getSurvival();
        int[] second = MonteCarloSimulator.simulate(config).getSurvival();
        assertArrayEquals(first, second);
    }

    @Test
    void testThreadCountDoesNotChangeResults() {
        SimulationConfig serial = kobolds(4).days(80).seed(77L).threads(1).build();
        SimulationConfig parallel = serial.toBuilder().threads(4).build();
        assertArrayEquals(MonteCarloSimulator.simulate(serial).getSurvival(),
                MonteCarloSimulator.simulate(parallel).getSurvival());
    }

    @Test
    void testDaySeedsArePrefixStable() {
        long[] ten = MonteCarloSimulator.daySeeds(5L, 10);
        long[] three = MonteCarloSimulator.daySeeds(5L, 3);
        assertArrayEquals(three, Arrays.copyOf(ten, 3));
    }

    @Test
    void testDebugReplaysFirstDay() {
        SimulationConfig config = kobolds(4).days(10).seed(31L).build();
        DebugReport report = MonteCarloSimulator.debug(config);
        DayResult silent = MonteCarloSimulator.runDay(config, MonteCarloSimulator.daySeeds(31L, 1)[0],
                CombatTrace.silent());

        assertEquals(silent.getSurvivors(), report.getResult().getSurvivors());
        assertEquals(silent.getOutcomes(), report.getResult().getOutcomes());
        assertEquals(MonteCarloSimulator.simulate(config).getSurvival()[0], report.getResult().getSurvivors());
        assertFalse(report.getEvents().isEmpty());
        assertTrue(report.render().contains("Survivors: "));
    }

    @Test
    void testDebugTraceReproducible() {
        // Level 4 parties use class features whose targets are gathered in maps
        for (long seed = 0; seed < 20; seed++) {
            SimulationConfig config = SimulationConfig.builder()
                    .monsters(Map.of("Orc", 4)).partyLevel(4).days(1).seed(seed).build();
            String first = MonteCarloSimulator.debug(config).render();
            String second = MonteCarloSimulator.debug(config).render();
            assertEquals(first, second, "trace differs for seed " + seed);
        }
    }

    // === Aggregates ===

    @Test
    void testResultShape() {
        SimulationResult result = MonteCarloSimulator.simulate(kobolds(4).days(40).seed(8L).build());
        assertEquals(40, result.getSurvival().length);
        assertEquals(40, Arrays.stream(result.getHistogram()).sum());
        assertEquals(5, result.getHistogram().length);
        assertTrue(result.getMean() >= 0.0 && result.getMean() <= 4.0);
        assertTrue(result.getStandardDeviation() >= 0.0);
        assertTrue(result.summaryLine().startsWith("Level  1 Kobold 4 Survival "), result.summaryLine());
        assertTrue(result.summaryLine().contains(" +/- "));
    }

    @Test
    void testMoreMonstersFewerSurvivors() {
        double few = MonteCarloSimulator.simulate(kobolds(4).days(1000).seed(11L).build()).getMean();
        double many = MonteCarloSimulator.simulate(kobolds(8).days(1000).seed(11L).build()).getMean();
        assertTrue(many < few, "8 kobolds (" + many + ") should be deadlier than 4 (" + few + ")");
    }

    @Test
    void testSeedsAgreeStatistically() {
        double a = MonteCarloSimulator.simulate(kobolds(4).days(1000).seed(1L).build()).getMean();
        double b = MonteCarloSimulator.simulate(kobolds(4).days(1000).seed(2L).build()).getMean();
        assertEquals(a, b, 0.1);
    }

    @Test
    void testConvenienceOverload() {
        SimulationResult result = MonteCarloSimulator.simulate(Map.of("Goblin", 2), 2,
                List.of("Fighter", "Cleric"), 20);
        assertEquals(20, result.getSurvival().length);
        assertEquals(3, result.getHistogram().length);
    }

    @Test
    void testTestCreature() {
        SimulationConfig config = SimulationConfig.builder()
                .monsters(Map.of("Test", 2))
                .testStats(new TestCreatureStats(4, 12, 6, 15))
                .days(30).seed(4L).build();
        SimulationResult result = MonteCarloSimulator.simulate(config);
        assertEquals(30, result.getSurvival().length);
        assertTrue(result.summaryLine().contains("Test  4 12  6 15  1  2 2"), result.summaryLine());
    }
}
