package com.example.d20sim.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parsing and the small rules carried by the model enums.
 */
@DisplayName("Model enum Tests")
public class ModelEnumsTest {

    // === Ability ===

    @ParameterizedTest
    @CsvSource({
        "str, STRENGTH",
        "DEX, DEXTERITY",
        "constitution, CONSTITUTION",
        " wis , WISDOM"
    })
    @DisplayName("Abilities parse from abbreviations and full names")
    void testAbilityFromString(String input, Ability expected) {
        assertEquals(expected, Ability.fromString(input));
    }

    @Test
    @DisplayName("Only Int, Wis and Cha are mental")
    void testMentalAbilities() {
        assertTrue(Ability.INTELLIGENCE.isMental());
        assertTrue(Ability.CHARISMA.isMental());
        assertFalse(Ability.DEXTERITY.isMental());
        assertNull(Ability.fromString("luck"));
    }

    // === Damage types ===

    @ParameterizedTest
    @CsvSource({
        "fire, FIRE",
        "magic slashing, MAGIC_SLASHING",
        "magic_piercing, MAGIC_PIERCING",
        "RADIANT, RADIANT"
    })
    @DisplayName("Damage types accept spaces or underscores")
    void testDamageTypeFromString(String input, DamageType expected) {
        assertEquals(expected, DamageType.fromString(input));
    }

    @ParameterizedTest
    @EnumSource(value = DamageType.class,
            names = {"BLUDGEONING", "PIERCING", "SLASHING", "MAGIC_BLUDGEONING", "MAGIC_PIERCING", "MAGIC_SLASHING"})
    @DisplayName("Weapon damage types are physical")
    void testPhysicalDamage(DamageType type) {
        assertTrue(type.isPhysical());
    }

    @ParameterizedTest
    @ValueSource(strings = {"acid", "cold", "force", "necrotic", "poison", "thunder"})
    @DisplayName("Energy damage types are not physical")
    void testNonPhysicalDamage(String name) {
        assertFalse(DamageType.fromString(name).isPhysical());
    }

    // === Armor ===

    @ParameterizedTest
    @CsvSource({
        "HEAVY, 18, 3, 18",
        "MEDIUM, 14, 3, 16",
        "MEDIUM, 14, -1, 13",
        "LIGHT, 11, 3, 14",
        "NONE, 10, 2, 12"
    })
    @DisplayName("Armor class caps Dexterity by armor type")
    void testArmorClass(ArmorType type, int base, int dex, int expected) {
        assertEquals(expected, type.armorClass(base, dex));
    }

    @Test
    @DisplayName("Missing armor type means no armor")
    void testArmorTypeFromString() {
        assertEquals(ArmorType.NONE, ArmorType.fromString(""));
        assertEquals(ArmorType.MEDIUM, ArmorType.fromString("medium"));
        assertNull(ArmorType.fromString("mithral"));
    }

    // === Features, skills, teams ===

    @Test
    @DisplayName("Feature names accept spaces and hyphens")
    void testFeatureFromString() {
        assertEquals(Feature.UNDEAD_FORTITUDE, Feature.fromString("undead fortitude"));
        assertEquals(Feature.KEEN_SENSES, Feature.fromString("keen-senses"));
        assertNull(Feature.fromString("flight"));
    }

    @Test
    @DisplayName("Skills know their ability")
    void testSkillAbility() {
        assertEquals(Ability.DEXTERITY, Skill.fromString("stealth").getAbility());
        assertEquals(Ability.WISDOM, Skill.PERCEPTION.getAbility());
        assertNull(Skill.fromString("arcana"));
    }

    @ParameterizedTest
    @EnumSource(Team.class)
    @DisplayName("Each team opposes the other")
    void testOpposingTeam(Team team) {
        assertNotEquals(team, team.opposing());
        assertEquals(team, team.opposing().opposing());
    }
}
