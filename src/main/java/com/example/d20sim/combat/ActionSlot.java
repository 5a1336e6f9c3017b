package com.example.d20sim.combat;

/**
 * The part of a turn's action economy a tactic uses.
 */
public enum ActionSlot {
    ACTION("action"),
    BONUS_ACTION("bonus action"),
    REACTION("reaction"),
    FREE("free");
    
    private final String displayName;
    
    ActionSlot(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
