package com.example.d20sim.resource;

/**
 * When a limited resource refills.
 */
public enum RechargeType {
    SHORT_REST("short rest"),
    LONG_REST("long rest");
    
    private final String displayName;
    
    RechargeType(String displayName) {
        this.displayName = displayName;
    }
    
    public String getDisplayName() {
        return displayName;
    }
}
