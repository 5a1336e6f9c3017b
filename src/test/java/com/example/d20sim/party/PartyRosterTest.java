package com.example.d20sim.party;

import com.example.d20sim.combat.CombatContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for class lookup and party creation.
 */
public class PartyRosterTest {

    @Test
    void testDefaultClassesRegistered() {
        for (String className : PartyRoster.DEFAULT_PARTY) {
            assertTrue(PartyRoster.exists(className), className);
        }
        assertTrue(PartyRoster.getClassNames().containsAll(PartyRoster.DEFAULT_PARTY));
    }

    @Test
    void testCaseInsensitiveLookup() {
        assertTrue(PartyRoster.exists("wizard"));
        assertEquals("Wizard", PartyRoster.canonicalName("WIZARD"));
        assertFalse(PartyRoster.exists("Bard"));
        assertFalse(PartyRoster.exists(null));
        assertNull(PartyRoster.getFactory("Bard"));
    }

    @Test
    void testCreateDefaultParty() {
        List<PlayerCharacter> party = PartyRoster.createParty(PartyRoster.DEFAULT_PARTY, 3, CombatContext.seeded(1L));
        assertEquals(4, party.size());
        assertTrue(party.get(0) instanceof Cleric);
        assertTrue(party.get(1) instanceof Fighter);
        assertTrue(party.get(2) instanceof Rogue);
        assertTrue(party.get(3) instanceof Wizard);
        for (PlayerCharacter pc : party) {
            assertEquals(3, pc.getLevel());
            assertEquals(pc.getMaxHitPoints(), pc.getHitPoints());
            assertNotNull(pc.getTurnPlan());
        }
    }

    @Test
    void testDuplicateClassesAreNumbered() {
        List<PlayerCharacter> party = PartyRoster.createParty(List.of("Fighter", "fighter", "Wizard"), 1,
                CombatContext.seeded(1L));
        assertEquals("Fighter 1", party.get(0).getName());
        assertEquals("Fighter 2", party.get(1).getName());
        assertEquals("Wizard", party.get(2).getName());
    }

    @Test
    void testUnknownClass() {
        assertThrows(IllegalArgumentException.class,
                () -> PartyRoster.createParty(List.of("Fighter", "Bard"), 1, CombatContext.seeded(1L)));
    }

    @Test
    void testLevelOutOfRange() {
        assertThrows(IllegalArgumentException.class,
                () -> PartyRoster.createParty(List.of("Fighter"), 0, CombatContext.seeded(1L)));
        assertThrows(IllegalArgumentException.class,
                () -> PartyRoster.createParty(List.of("Fighter"), 9, CombatContext.seeded(1L)));
    }
}
