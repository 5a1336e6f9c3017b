package com.example.d20sim.combat;

public enum AttackOutcome {
    HIT,
    CRITICAL,
    MISS,
    NO_TARGET;
    
    public boolean isHit() {
        return this == HIT || this == CRITICAL;
    }
}
