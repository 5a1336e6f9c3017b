package com.example.d20sim.bestiary;

import com.example.d20sim.combat.CombatContext;
import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Weapon;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.Feature;
import com.example.d20sim.util.Dice;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the bundled stat blocks and monster lookup.
 */
public class BestiaryTest {

    private static final List<String> BUNDLED = List.of("Kobold", "Giant rat", "Bandit", "Goblin", "Wolf",
            "Zombie", "Orc", "Hobgoblin", "Gnoll", "Ghoul", "Giant toad", "Aboleth");

    @Test
    void testBundledMonstersLoaded() {
        assertTrue(Bestiary.getMonsterNames().containsAll(BUNDLED));
        for (String name : BUNDLED) {
            assertNotNull(Bestiary.getTemplate(name), name);
        }
    }

    @Test
    void testLookupIsCaseInsensitive() {
        assertTrue(Bestiary.exists("KOBOLD"));
        assertEquals("Giant rat", Bestiary.canonicalName("giant RAT"));
        assertEquals(Bestiary.TEST_CREATURE, Bestiary.canonicalName("test"));
        assertTrue(Bestiary.isTestCreature("TEST"));
        assertNull(Bestiary.canonicalName("Dragon"));
        assertNull(Bestiary.getFactory("Dragon"));
    }

    @Test
    void testKobold() {
        MonsterTemplate kobold = Bestiary.getTemplate("Kobold");
        assertTrue(kobold.hasBehavior(MonsterBehavior.PACK_TACTICS));
        assertEquals(Dice.of(1, 4), kobold.getAttacks().get(0).getDice());

        Combatant k = Bestiary.getFactory("Kobold").create("Kobold 1", 0, CombatContext.seeded(3L));
        assertEquals("Kobold 1", k.getName());
        assertEquals(12, k.getArmorClass());
        // 2d6 - 2, at least 1
        assertTrue(k.getMaxHitPoints() >= 1 && k.getMaxHitPoints() <= 10);
        assertEquals(k.getMaxHitPoints(), k.getHitPoints());
    }

    @Test
    void testSpecialMonsters() {
        MonsterTemplate zombie = Bestiary.getTemplate("Zombie");
        assertTrue(zombie.getTraits().contains(Feature.UNDEAD_FORTITUDE));
        assertTrue(zombie.getImmunities().contains(DamageType.POISON));

        MonsterTemplate gnoll = Bestiary.getTemplate("Gnoll");
        assertTrue(gnoll.hasBehavior(MonsterBehavior.RAMPAGE));
        assertEquals(2, gnoll.getAttacks().size());

        MonsterTemplate ghoul = Bestiary.getTemplate("Ghoul");
        assertTrue(ghoul.hasBehavior(MonsterBehavior.PARALYZING_CLAWS));
        assertFalse(ghoul.getAttacks().get(1).isProficient());

        Combatant spawned = ghoul.spawn("Ghoul", CombatContext.seeded(1L));
        assertTrue(spawned.isUndead());
        assertEquals(1.0, spawned.getUndeadRating().doubleValue(), 1e-9);
    }

    @Test
    void testGiantToad() {
        MonsterTemplate toad = Bestiary.getTemplate("Giant toad");
        assertTrue(toad.hasBehavior(MonsterBehavior.GRAPPLE));
        assertTrue(toad.hasBehavior(MonsterBehavior.SWALLOW));
        assertEquals(13, toad.getEscapeDc().intValue());
        assertEquals(Dice.of(3, 6), toad.getDigestionDice());
        assertEquals(DamageType.ACID, toad.getDigestionType());
        assertEquals(0, toad.getRegurgitateThreshold());
        assertEquals(DamageType.POISON, toad.getAttacks().get(0).getSecondaryType());

        Monster spawned = toad.spawn("Toad", CombatContext.seeded(2L));
        assertEquals(11, spawned.getArmorClass());
        assertEquals(13, spawned.escapeDc());
    }

    @Test
    void testAboleth() {
        MonsterTemplate aboleth = Bestiary.getTemplate("Aboleth");
        assertEquals(3, aboleth.getLegendaryActions());
        assertEquals("Tail", aboleth.getLegendaryAttack().getName());
        assertEquals(3, aboleth.getAttacksPerRound());

        List<LairAction> lair = aboleth.getLairActions();
        assertEquals(2, lair.size());
        assertEquals(DamageType.PSYCHIC, lair.get(0).getDamageType());
        assertFalse(lair.get(0).isHalfOnSuccess());
        assertEquals(Ability.STRENGTH, lair.get(1).getSave());
        assertTrue(lair.get(1).knocksProne());

        Monster spawned = aboleth.spawn("Aboleth", CombatContext.seeded(2L));
        assertEquals(17, spawned.getArmorClass());
        assertTrue(spawned.hasLairAction());
        assertEquals(3, spawned.getLegendaryActionsLeft());
        // 8 + 4 proficiency + 2 Wisdom
        assertEquals(14, lair.get(0).saveDc(spawned));
    }

    @Test
    void testRegisterCustomTemplate() {
        MonsterTemplate dummy = MonsterTemplate.builder("Training dummy")
                .armorClass(5)
                .hitDice(1, 4)
                .attack(Weapon.builder("Flail").dice(Dice.d(4)).build())
                .build();
        Bestiary.registerTemplate(dummy);
        assertTrue(Bestiary.exists("training dummy"));
        assertSame(dummy, Bestiary.getTemplate("Training Dummy"));
    }

    // === Template validation ===

    @Test
    void testTemplateValidation() {
        Weapon bite = Weapon.builder("Bite").build();
        assertThrows(IllegalArgumentException.class, () -> MonsterTemplate.builder("Blob").build());
        assertThrows(IllegalArgumentException.class,
                () -> MonsterTemplate.builder("Gnawer").attack(bite).behavior(MonsterBehavior.RAMPAGE).build());
        assertThrows(IllegalArgumentException.class,
                () -> MonsterTemplate.builder("Lazy").attack(bite).attacksPerRound(0).build());

        assertThrows(IllegalArgumentException.class,
                () -> MonsterTemplate.builder("Gulper").attack(bite).behavior(MonsterBehavior.SWALLOW).build());
        assertThrows(IllegalArgumentException.class,
                () -> MonsterTemplate.builder("Tailless").attack(bite).legendaryActions(3, "Tail").build());

        MonsterTemplate plain = MonsterTemplate.builder("Plain").attack(bite).build();
        assertTrue(plain.hasBehavior(MonsterBehavior.PLAIN_ATTACK));
        assertNull(plain.getLegendaryAttack());
        assertTrue(plain.getLairActions().isEmpty());
    }

    @Test
    void testLairActionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LairAction("Nothing", null, null,
                Ability.DEXTERITY, Ability.WISDOM, true, false, 2));
        assertThrows(IllegalArgumentException.class, () -> new LairAction("Untyped", Dice.of(2, 6), null,
                Ability.DEXTERITY, Ability.WISDOM, true, false, 2));
        assertThrows(IllegalArgumentException.class, () -> new LairAction("Aimless", null, null,
                Ability.STRENGTH, Ability.WISDOM, true, true, 0));
    }

    @Test
    void testBehaviorFromString() {
        assertEquals(MonsterBehavior.PACK_TACTICS, MonsterBehavior.fromString("pack tactics"));
        assertEquals(MonsterBehavior.NIMBLE_ESCAPE, MonsterBehavior.fromString("Nimble-Escape"));
        assertNull(MonsterBehavior.fromString("breath weapon"));
    }
}
