package com.example.d20sim.model;

/**
 * The six abilities. Combatants store the modifier for each, never the raw score.
 */
public enum Ability {
    STRENGTH("str"),
    DEXTERITY("dex"),
    CONSTITUTION("con"),
    INTELLIGENCE("int"),
    WISDOM("wis"),
    CHARISMA("cha");
    
    private final String abbreviation;
    
    Ability(String abbreviation) {
        this.abbreviation = abbreviation;
    }
    
    public String getAbbreviation() {
        return abbreviation;
    }
    
    /**
     * Mental abilities, relevant to Gnome Cunning.
     */
    public boolean isMental() {
        return this == INTELLIGENCE || this == WISDOM || this == CHARISMA;
    }
    
    /**
     * Parse an ability from its full name or three-letter abbreviation, case-insensitive.
     * @return the ability, or null if the string matches nothing
     */
    public static Ability fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        String s = str.trim();
        for (Ability a : values()) {
            if (a.abbreviation.equalsIgnoreCase(s) || a.name().equalsIgnoreCase(s)) {
                return a;
            }
        }
        return null;
    }
}
