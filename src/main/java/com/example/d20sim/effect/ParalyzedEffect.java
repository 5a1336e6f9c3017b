package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.Condition;
import com.example.d20sim.model.SaveType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Paralysis: the bearer is incapacitated and loses concentration. It repeats a
 * Constitution save at the end of each of its turns, ending the effect on a
 * success. Counts down on the paralyzer's turns.
 */
public class ParalyzedEffect extends Duration {
    
    private static final Set<Condition> CONDITIONS = EnumSet.of(Condition.PARALYZED);
    
    private final int saveDc;
    
    public ParalyzedEffect(Combatant paralyzer, Combatant target, int rounds, int saveDc) {
        super("Paralysis", target, paralyzer, rounds, Clock.KEEPER_TURN_START);
        this.saveDc = saveDc;
    }
    
    public int getSaveDc() { return saveDc; }
    
    @Override
    public Set<Condition> getConditions() {
        return CONDITIONS;
    }
    
    @Override
    public void onApply() {
        bearer.endConcentration();
    }
    
    @Override
    public void onBearerTurnEnd(Encounter encounter) {
        if (bearer.isConscious() && bearer.savingThrow(Ability.CONSTITUTION, saveDc, SaveType.ORDINARY)) {
            end();
        }
    }
}
