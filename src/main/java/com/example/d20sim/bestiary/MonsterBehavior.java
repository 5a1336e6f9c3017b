package com.example.d20sim.bestiary;

/**
 * Combat behaviors a monster's stat block can carry. A monster may have several;
 * together they decide how its attack action plays out.
 */
public enum MonsterBehavior {
    
    PLAIN_ATTACK("Attacks a random foe with its first weapon"),
    PACK_TACTICS("Advantage on attacks while another ally is standing"),
    NIMBLE_ESCAPE("Hides as a bonus action after attacking"),
    KNOCKDOWN("A hit forces a Strength save or the target falls prone"),
    MARTIAL_ADVANTAGE("Extra 2d6 damage while another ally is standing"),
    RAMPAGE("Bonus action bite after dropping a target"),
    PARALYZING_CLAWS("Claws paralyze on a failed Constitution save; paralyzed targets are bitten"),
    GRAPPLE("A hit with the main weapon grapples and restrains the target; the grappled foe is attacked first"),
    SWALLOW("A hit on the grappled foe swallows it instead; swallowed foes are digested every turn");
    
    private final String description;
    
    MonsterBehavior(String description) {
        this.description = description;
    }
    
    public String getDescription() {
        return description;
    }
    
    /**
     * Parse a behavior from a string, case-insensitive; spaces and hyphens are
     * read as underscores.
     * @return null if the text names no behavior
     */
    public static MonsterBehavior fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        String normalized = str.trim().toUpperCase().replace(' ', '_').replace('-', '_');
        for (MonsterBehavior b : values()) {
            if (b.name().equals(normalized)) return b;
        }
        return null;
    }
}
