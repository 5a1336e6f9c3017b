package com.example.d20sim.model;

/**
 * Damage types. Magical weapon damage is tracked separately from mundane
 * weapon damage so that resistance to nonmagical attacks can be modeled.
 */
public enum DamageType {
    ACID("acid", false),
    BLUDGEONING("bludgeoning", true),
    COLD("cold", false),
    FIRE("fire", false),
    FORCE("force", false),
    LIGHTNING("lightning", false),
    MAGIC_BLUDGEONING("magic bludgeoning", true),
    MAGIC_PIERCING("magic piercing", true),
    MAGIC_SLASHING("magic slashing", true),
    NECROTIC("necrotic", false),
    PIERCING("piercing", true),
    POISON("poison", false),
    PSYCHIC("psychic", false),
    RADIANT("radiant", false),
    SLASHING("slashing", true),
    THUNDER("thunder", false);
    
    private final String displayName;
    private final boolean physical;
    
    DamageType(String displayName, boolean physical) {
        this.displayName = displayName;
        this.physical = physical;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    /** Bludgeoning, piercing or slashing, magical or not. */
    public boolean isPhysical() {
        return physical;
    }
    
    /**
     * Parse a damage type, case-insensitive. Accepts "magic_slashing" and "magic slashing".
     * @return the damage type, or null if the string matches nothing
     */
    public static DamageType fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        String normalized = str.trim().replace(' ', '_').toUpperCase();
        try {
            return DamageType.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
