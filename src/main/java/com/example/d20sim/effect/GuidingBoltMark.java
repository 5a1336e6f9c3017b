package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.model.Condition;

/**
 * The next attack against the bearer has advantage. Lasts until the end of
 * the caster's next turn.
 */
public class GuidingBoltMark extends ConditionEffect {
    
    public GuidingBoltMark(Combatant caster, Combatant target) {
        super("Guiding Bolt", target, caster, 2, Clock.KEEPER_TURN_END, Condition.MARKED);
    }
}
