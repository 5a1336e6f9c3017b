package com.example.d20sim.tools;

import com.example.d20sim.sim.ConfigurationException;
import com.example.d20sim.sim.SimulationConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for command line parsing.
 */
public class SimulatorCliTest {

    @Test
    void testNoArgumentsUsesDefaults() {
        SimulatorCli.Options options = SimulatorCli.parse(new String[]{"-s", "1"});
        assertFalse(options.debug);
        assertFalse(options.help);
        assertEquals(Map.of("Kobold", 4), options.config.getMonsters());
        assertEquals(1000, options.config.getDays());
    }

    @Test
    void testAllOptions() {
        SimulatorCli.Options options = SimulatorCli.parse(new String[]{
                "-a", "25", "-c", "Fighter,Wizard", "-m", "Goblin,Orc", "-n", "3,1",
                "-p", "4", "-s", "99", "-j", "2", "-d"});
        SimulationConfig config = options.config;
        assertTrue(options.debug);
        assertEquals(25, config.getDays());
        assertEquals(List.of("Fighter", "Wizard"), config.getClasses());
        assertEquals(List.of("Goblin", "Orc"), List.copyOf(config.getMonsters().keySet()));
        assertEquals(3, config.getMonsters().get("Goblin"));
        assertEquals(4, config.getPartyLevel());
        assertEquals(99L, config.getSeed());
        assertEquals(2, config.getThreads());
    }

    @Test
    void testLongOptions() {
        SimulatorCli.Options options = SimulatorCli.parse(new String[]{
                "--adventuring-days", "7", "--party-level", "2", "--seed", "3"});
        assertEquals(7, options.config.getDays());
        assertEquals(2, options.config.getPartyLevel());
    }

    @Test
    void testMonstersWithoutCountsUseDefaultCount() {
        SimulatorCli.Options options = SimulatorCli.parse(new String[]{"-m", "Zombie", "-s", "1"});
        assertEquals(Map.of("Zombie", 4), options.config.getMonsters());
    }

    @Test
    void testTestStatsSelectTestCreature() {
        SimulatorCli.Options options = SimulatorCli.parse(new String[]{"-t", "5,12,10,20", "-s", "1"});
        assertEquals(Map.of("Test", 4), options.config.getMonsters());
        assertEquals(20, options.config.getTestStats().hitPoints());
    }

    @Test
    void testHelp() {
        assertTrue(SimulatorCli.parse(new String[]{"-h"}).help);
        assertEquals(0, SimulatorCli.run(new String[]{"--help"}));
    }

    // === Errors ===

    @Test
    void testMismatchedLists() {
        assertThrows(ConfigurationException.class,
                () -> SimulatorCli.parse(new String[]{"-m", "Kobold,Goblin", "-n", "4"}));
    }

    @Test
    void testUnknownOption() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> SimulatorCli.parse(new String[]{"--frobnicate"}));
        assertTrue(e.getMessage().contains("--frobnicate"));
    }

    @Test
    void testMalformedValues() {
        assertThrows(ConfigurationException.class, () -> SimulatorCli.parse(new String[]{"-a", "many"}));
        assertThrows(ConfigurationException.class, () -> SimulatorCli.parse(new String[]{"-p"}));
        assertThrows(ConfigurationException.class, () -> SimulatorCli.parse(new String[]{"-t", "1,2"}));
    }

    @Test
    void testRunReportsBadConfiguration() {
        assertEquals(2, SimulatorCli.run(new String[]{"-m", "Beholder"}));
    }

    @Test
    void testRunSmallBatch() {
        assertEquals(0, SimulatorCli.run(new String[]{"-a", "3", "-s", "5"}));
        assertEquals(0, SimulatorCli.run(new String[]{"-a", "1", "-s", "5", "-d"}));
    }
}
