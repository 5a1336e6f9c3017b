package com.example.d20sim.day;

/**
 * Where an adventuring day currently is.
 */
public enum DayPhase {
    ENCOUNTER("Encounter"),
    SHORT_REST("Short rest"),
    END_OF_DAY("End of day"),
    SCORED("Scored");
    
    private final String displayName;
    
    DayPhase(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
