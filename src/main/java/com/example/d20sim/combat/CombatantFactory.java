package com.example.d20sim.combat;

/**
 * Produces a fresh, initialized combatant.
 */
@FunctionalInterface
public interface CombatantFactory {
    
    /**
     * @param name display name for this instance, e.g. "Kobold 3"
     * @param level party level; monsters ignore it
     * @param context dice and trace of the day the combatant will take part in
     */
    Combatant create(String name, int level, CombatContext context);
}
