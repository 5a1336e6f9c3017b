package com.example.d20sim.model;

/**
 * Armor categories. Determines how much of the Dexterity modifier applies to armor class.
 */
public enum ArmorType {
    NONE("None"),
    LIGHT("Light"),
    MEDIUM("Medium"),
    HEAVY("Heavy");
    
    private final String displayName;
    
    ArmorType(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    /**
     * Compute armor class from the armor's base value and the wearer's Dexterity modifier.
     */
    public int armorClass(int base, int dexModifier) {
        switch (this) {
            case HEAVY:
                return base;
            case MEDIUM:
                return base + Math.min(2, dexModifier);
            default:
                return base + dexModifier;
        }
    }
    
    public static ArmorType fromString(String str) {
        if (str == null || str.isEmpty()) return NONE;
        try {
            return ArmorType.valueOf(str.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
