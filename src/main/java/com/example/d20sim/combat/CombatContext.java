package com.example.d20sim.combat;

import com.example.d20sim.util.DiceRoller;

/**
 * The per-day services every combatant and action shares: the dice and the trace.
 */
public class CombatContext {
    
    private final DiceRoller dice;
    private final CombatTrace trace;
    
    public CombatContext(DiceRoller dice, CombatTrace trace) {
        this.dice = dice;
        this.trace = trace;
    }
    
    public static CombatContext seeded(long seed) {
        return new CombatContext(new DiceRoller(seed), CombatTrace.silent());
    }
    
    public DiceRoller getDice() { return dice; }
    
    public CombatTrace getTrace() { return trace; }
}
