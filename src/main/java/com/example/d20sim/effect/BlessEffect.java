package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.model.Condition;

/** Adds a d4 to attack rolls and saves while the caster concentrates. */
public class BlessEffect extends ConditionEffect {
    
    public BlessEffect(Combatant caster, Combatant target) {
        super("Bless", target, caster, UNTIL_ENDED, Clock.NONE, Condition.BLESSED);
    }
}
