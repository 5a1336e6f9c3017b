package com.example.d20sim.bestiary;

import com.example.d20sim.combat.Weapon;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.Skill;
import com.example.d20sim.util.Dice;

/**
 * Target statistics for the parametric "Test" monster: total attack modifier,
 * armor class, damage per round, hit points, attacks per round and proficiency.
 */
public record TestCreatureStats(int attack, int armorClass, int damage, int hitPoints,
                                int attacksPerRound, int proficiency) {
    
    public TestCreatureStats {
        if (attacksPerRound < 1) {
            throw new IllegalArgumentException("Test creature needs at least one attack per round, got "
                    + attacksPerRound);
        }
        if (hitPoints < 1) {
            throw new IllegalArgumentException("Test creature needs positive hit points, got " + hitPoints);
        }
    }
    
    public TestCreatureStats(int attack, int armorClass, int damage, int hitPoints) {
        this(attack, armorClass, damage, hitPoints, 1, 2);
    }
    
    /**
     * Stat block approximating these numbers: hit points as a multiple of 2d8
     * plus a constant, and each attack as a multiple of 2d6 plus a damage bonus.
     */
    public MonsterTemplate toTemplate() {
        int damagePerAttack = damage / attacksPerRound;
        Weapon weapon = Weapon.builder("Slam")
                .dice(Dice.of(2 * ((damagePerAttack + 2) / 7), 6))
                .damageType(DamageType.BLUDGEONING)
                .attackBonus(attack - proficiency)
                .damageBonus((damagePerAttack + 2) % 7 - 2)
                .build();
        return MonsterTemplate.builder(Bestiary.TEST_CREATURE)
                .abilities(0, 0, 0, 0, 0, 0)
                .armorClass(armorClass)
                .proficiency(proficiency)
                .hitDice(1, 8)
                .hitPoints(Dice.of(2 * ((hitPoints + 2) / 9), 8), (hitPoints + 2) % 9 - 2)
                .save(Ability.DEXTERITY)
                .save(Ability.CONSTITUTION)
                .save(Ability.WISDOM)
                .skill(Skill.PERCEPTION)
                .attack(weapon)
                .attacksPerRound(attacksPerRound)
                .behavior(MonsterBehavior.PLAIN_ATTACK)
                .build();
    }
    
    /**
     * Parse {@code attack,ac,damage,hp[,attacks[,proficiency]]}.
     * @throws IllegalArgumentException if the text is malformed
     */
    public static TestCreatureStats parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Test creature stats are empty");
        }
        String[] parts = text.split(",");
        if (parts.length < 4 || parts.length > 6) {
            throw new IllegalArgumentException("Expected attack,ac,damage,hp[,attacks[,proficiency]] but got '"
                    + text + "'");
        }
        int[] values = new int[6];
        values[4] = 1;
        values[5] = 2;
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Test creature stat '" + parts[i].trim() + "' is not a number", e);
            }
        }
        return new TestCreatureStats(values[0], values[1], values[2], values[3], values[4], values[5]);
    }
}
