package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.model.Condition;

/**
 * Turned undead take no actions or reactions. Damage ends the effect.
 */
public class TurnedEffect extends ConditionEffect {
    
    public TurnedEffect(Combatant turner, Combatant undead) {
        super("Turn Undead", undead, turner, Combatant.STANDARD_DURATION_ROUNDS, Clock.KEEPER_TURN_START,
                Condition.TURNED);
    }
    
    @Override
    public boolean endsOnDamage() {
        return true;
    }
}
