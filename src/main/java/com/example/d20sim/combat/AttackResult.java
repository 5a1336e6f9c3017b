package com.example.d20sim.combat;

/**
 * What happened when a weapon or spell attack was resolved.
 */
public class AttackResult {
    
    private static final AttackResult NO_TARGET = new AttackResult(AttackOutcome.NO_TARGET, 0, 0, 0);
    
    private final AttackOutcome outcome;
    private final int naturalRoll;
    private final int total;
    private final int damageDealt;
    
    public AttackResult(AttackOutcome outcome, int naturalRoll, int total, int damageDealt) {
        this.outcome = outcome;
        this.naturalRoll = naturalRoll;
        this.total = total;
        this.damageDealt = damageDealt;
    }
    
    public static AttackResult noTarget() {
        return NO_TARGET;
    }
    
    public AttackOutcome getOutcome() { return outcome; }
    public int getNaturalRoll() { return naturalRoll; }
    public int getTotal() { return total; }
    public int getDamageDealt() { return damageDealt; }
    
    public boolean isHit() { return outcome.isHit(); }
    
    public boolean isCritical() { return outcome == AttackOutcome.CRITICAL; }
}
