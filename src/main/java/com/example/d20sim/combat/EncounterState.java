package com.example.d20sim.combat;

/**
 * Lifecycle of an encounter. An encounter is never reused once concluded.
 */
public enum EncounterState {
    
    /** Created; nobody has rolled initiative */
    NOT_STARTED("Not started"),
    
    /** Rounds are being played */
    ACTIVE("Active"),
    
    /** One or both sides are down, or the round cap was hit */
    CONCLUDED("Concluded");
    
    private final String displayName;
    
    EncounterState(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
