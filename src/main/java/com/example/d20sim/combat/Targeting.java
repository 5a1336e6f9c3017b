package com.example.d20sim.combat;

import com.example.d20sim.model.DamageType;

import java.util.function.Predicate;

/**
 * Common target filters.
 */
public final class Targeting {
    
    private Targeting() {
    }
    
    public static Predicate<Combatant> any() {
        return c -> true;
    }
    
    public static Predicate<Combatant> notImmuneTo(DamageType type) {
        return c -> !c.isImmuneTo(type);
    }
    
    /** Targets the observer can see. */
    public static Predicate<Combatant> visibleTo(Combatant observer) {
        return c -> !c.isHiddenFrom(observer);
    }
    
    /** Not swallowed, so within reach of spells and attacks from outside. */
    public static Predicate<Combatant> reachable() {
        return c -> !c.isSwallowed();
    }
    
    public static Predicate<Combatant> unconscious() {
        return c -> c.getHitPoints() <= 0;
    }
    
    public static Predicate<Combatant> undead() {
        return Combatant::isUndead;
    }
    
    public static Predicate<Combatant> livingCreature() {
        return c -> !c.isUndead() && !c.isConstruct();
    }
}
