package com.example.d20sim.model;

/**
 * Passive features that alter the core rules for the combatant holding them.
 * Active abilities (Second Wind, Sneak Attack, spells) are implemented by the
 * combatant's turn plan instead.
 */
public enum Feature {
    
    /** Advantage on saves against being charmed */
    CHARM_ADVANTAGE,
    
    /** Advantage on Int, Wis and Cha saves against magic */
    GNOME_CUNNING,
    
    /** Advantage on saves against magic */
    MAGIC_RESISTANCE,
    
    /** Advantage on saves against poison */
    POISON_ADVANTAGE,
    
    /** Reduces bludgeoning, piercing and slashing damage by 3 */
    HEAVY_ARMOR_MASTER,
    
    /** Advantage on concentration saves */
    WAR_CASTER,
    
    /** No damage on a successful Dex save for half, half on a failure */
    EVASION,
    
    /** Cannot be surprised-advantaged by hidden attackers */
    ALERT,
    
    /** Sees hidden and invisible creatures */
    BLINDSIGHT,
    
    /** Immune to the ghoul's paralysis (elves) */
    GHOUL_PARALYSIS_IMMUNITY,
    
    /** Damaging save cantrips still deal half damage on a success */
    POTENT_CANTRIP,
    
    /** Healing spells restore an extra 2 + slot level */
    DISCIPLE_OF_LIFE,
    
    /** Healing others with a spell also heals the caster 2 + slot level */
    BLESSED_HEALER,
    
    /** Advantage on Perception checks from smell or hearing */
    KEEN_SENSES,
    
    /** Drops to 1 hp instead of 0 on a successful Con save */
    UNDEAD_FORTITUDE;
    
    /**
     * Parse a feature name, case-insensitive, with spaces or hyphens for underscores.
     * @return null if the text names no feature
     */
    public static Feature fromString(String str) {
        if (str == null || str.isEmpty()) return null;
        try {
            return Feature.valueOf(str.trim().toUpperCase().replace(' ', '_').replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
