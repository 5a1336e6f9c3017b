package com.example.d20sim.model;

/**
 * Conditions a combatant can be under. Most are granted by an attached
 * {@code Duration}; prone is tracked as a plain flag.
 */
public enum Condition {
    
    /** Attacks against have advantage; own attacks have disadvantage */
    BLINDED("Blinded"),
    
    /** Disadvantage on attacks and ability checks */
    FRIGHTENED("Frightened"),
    
    /** Cannot be seen without blindsight */
    INVISIBLE("Invisible"),
    
    /** Incapacitated; fails Str and Dex saves; hits against are critical */
    PARALYZED("Paralyzed"),
    
    /** Disadvantage on attacks and ability checks */
    POISONED("Poisoned"),
    
    /** Knocked down; stands up at the start of its turn */
    PRONE("Prone"),
    
    /** Disadvantage on attacks and Dex saves; attacks against have advantage */
    RESTRAINED("Restrained"),
    
    /** Using the action also spends the bonus action, no reactions */
    SLOWED("Slowed"),
    
    /** Incapacitated; fails Str and Dex saves */
    STUNNED("Stunned"),
    
    /** Turned undead: no action or reaction */
    TURNED("Turned"),
    
    /** Adds a d4 to attack rolls and saving throws */
    BLESSED("Blessed"),
    
    /** Next attack against has advantage (Guiding Bolt) */
    MARKED("Marked"),
    
    /** Held by another creature; escaping takes an action */
    GRAPPLED("Grappled"),
    
    /** Inside another creature: can only attack the swallower, out of reach of healing */
    SWALLOWED("Swallowed");
    
    private final String displayName;
    
    Condition(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
