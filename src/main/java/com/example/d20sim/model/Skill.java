package com.example.d20sim.model;

/**
 * Skills that affect combat: hiding, noticing hidden creatures, and a few
 * proficiencies carried by stat blocks.
 */
public enum Skill {
    ACROBATICS(Ability.DEXTERITY),
    ATHLETICS(Ability.STRENGTH),
    INSIGHT(Ability.WISDOM),
    INTIMIDATION(Ability.CHARISMA),
    MEDICINE(Ability.WISDOM),
    PERCEPTION(Ability.WISDOM),
    PERSUASION(Ability.CHARISMA),
    STEALTH(Ability.DEXTERITY);
    
    private final Ability ability;
    
    Skill(Ability ability) {
        this.ability = ability;
    }
    
    public Ability getAbility() {
        return ability;
    }
    
    public static Skill fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        try {
            return Skill.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
