package com.example.d20sim.sim;

import com.example.d20sim.bestiary.TestCreatureStats;
import com.example.d20sim.day.MonsterGroup;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for validating and normalizing simulation input.
 */
public class SimulationConfigTest {

    // === Defaults ===

    @Test
    void testDefaultsFromBundledResource() {
        SimulationConfig config = SimulationConfig.defaults().seed(1L).build();
        assertEquals(1000, config.getDays());
        assertEquals(1, config.getPartyLevel());
        assertEquals(List.of("Cleric", "Fighter", "Rogue", "Wizard"), config.getClasses());
        assertEquals(Map.of("Kobold", 4), config.getMonsters());
        assertEquals(100, config.getMaxRounds());
        assertEquals(6, config.getEncountersPerDay());
        assertEquals(2, config.getEncountersPerShortRest());
        assertEquals(1L, config.getSeed());
    }

    @Test
    void testToBuilderKeepsValues() {
        SimulationConfig config = SimulationConfig.builder().seed(9L).days(12).partyLevel(3).build();
        SimulationConfig copy = config.toBuilder().build();
        assertEquals(config.getMonsters(), copy.getMonsters());
        assertEquals(12, copy.getDays());
        assertEquals(3, copy.getPartyLevel());
        assertEquals(9L, copy.getSeed());
    }

    // === Normalization ===

    @Test
    void testMonsterNamesCanonicalAndMerged() {
        SimulationConfig config = SimulationConfig.builder()
                .monsters(List.of(" kobold", "GOBLIN", "Kobold"), List.of(2, 1, 3))
                .build();
        Map<String, Integer> monsters = config.getMonsters();
        assertEquals(List.of("Kobold", "Goblin"), List.copyOf(monsters.keySet()));
        assertEquals(5, monsters.get("Kobold"));
        assertEquals("Kobold 5 Goblin 1", config.describeMonsters());
    }

    @Test
    void testClassesTrimmed() {
        SimulationConfig config = SimulationConfig.builder().classes(List.of(" Fighter", "wizard ")).build();
        assertEquals(List.of("Fighter", "wizard"), config.getClasses());
    }

    @Test
    void testMonsterGroupsResolveFactories() {
        List<MonsterGroup> groups = SimulationConfig.builder()
                .monsters(List.of("Orc", "Wolf"), List.of(1, 2)).build().monsterGroups();
        assertEquals(2, groups.size());
        assertEquals("Wolf", groups.get(1).name());
        assertEquals(2, groups.get(1).count());
        assertNotNull(groups.get(0).factory());
    }

    @Test
    void testDescribeTestCreature() {
        SimulationConfig config = SimulationConfig.builder()
                .monsters(List.of("test"), List.of(3))
                .testStats(new TestCreatureStats(5, 12, 10, 20))
                .build();
        assertEquals("Test  5 12 10 20  1  2 3", config.describeMonsters());
    }

    // === Validation ===

    @Test
    void testMismatchedMonsterLists() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> SimulationConfig.builder().monsters(List.of("Kobold", "Goblin"), List.of(4)).build());
        assertTrue(e.getMessage().contains("2 monster names but 1 counts"));
    }

    @Test
    void testUnknownMonster() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> SimulationConfig.builder().monsters(List.of("Tarrasque"), List.of(1)).build());
        assertTrue(e.getMessage().contains("Tarrasque"));
    }

    @Test
    void testBadCounts() {
        assertThrows(ConfigurationException.class,
                () -> SimulationConfig.builder().monsters(List.of("Kobold"), List.of(0)).build());
        assertThrows(ConfigurationException.class,
                () -> SimulationConfig.builder().monsters(List.of("Kobold"), Arrays.asList((Integer) null)).build());
        assertThrows(ConfigurationException.class,
                () -> SimulationConfig.builder().monsters(List.of(), List.of()).build());
    }

    @Test
    void testTestCreatureNeedsStats() {
        assertThrows(ConfigurationException.class,
                () -> SimulationConfig.builder().monsters(List.of("Test"), List.of(1)).build());
    }

    @Test
    void testOutOfRangeValues() {
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().partyLevel(0).build());
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().partyLevel(9).build());
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().days(0).build());
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().threads(0).build());
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().maxRounds(0).build());
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().encountersPerDay(0).build());
    }

    @Test
    void testUnsupportedClass() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> SimulationConfig.builder().classes(List.of("Fighter", "Bard")).build());
        assertTrue(e.getMessage().contains("Bard"));
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().classes(List.of()).build());
    }
}
