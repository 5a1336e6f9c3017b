package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.model.Condition;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A duration whose only effect is to grant conditions.
 */
public class ConditionEffect extends Duration {
    
    private final Set<Condition> conditions;
    
    public ConditionEffect(String source, Combatant bearer, Combatant keeper, int rounds, Clock clock,
                           Condition first, Condition... rest) {
        super(source, bearer, keeper, rounds, clock);
        this.conditions = Collections.unmodifiableSet(EnumSet.of(first, rest));
    }
    
    @Override
    public Set<Condition> getConditions() {
        return conditions;
    }
}
