package com.example.d20sim.spell;

/**
 * Functional interface for spell implementations. Handlers resolve the spell's
 * effects synchronously against the targets already chosen by the caster.
 */
@FunctionalInterface
public interface SpellHandler {
    /**
     * Resolve the spell.
     * @param ctx caster, slot level, targets and encounter
     * @return true if the spell took effect
     */
    boolean cast(SpellContext ctx);
}
