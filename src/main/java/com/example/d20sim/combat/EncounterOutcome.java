package com.example.d20sim.combat;

public enum EncounterOutcome {
    PARTY_VICTORY("Party victory"),
    MONSTER_VICTORY("Monster victory"),
    /** Both sides went down during the same turn; the day scores zero */
    SIMULTANEOUS_DEFEAT("Simultaneous defeat"),
    /** The round cap was reached with both sides standing */
    STALEMATE("Stalemate");
    
    private final String displayName;
    
    EncounterOutcome(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
