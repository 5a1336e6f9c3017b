package com.example.d20sim.model;

/**
 * The two sides of every encounter.
 */
public enum Team {
    PARTY("Party"),
    MONSTERS("Monsters");
    
    private final String displayName;
    
    Team(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    public Team opposing() {
        return this == PARTY ? MONSTERS : PARTY;
    }
}
