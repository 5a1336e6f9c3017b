package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;

import java.util.*;

/**
 * A caster's concentration on a spell. Every duration the spell created is
 * linked here and ends with it.
 */
public class ConcentrationEffect extends Duration {
    
    private final List<Duration> linked = new ArrayList<>();
    
    public ConcentrationEffect(String spell, Combatant caster) {
        super(spell, caster, caster, Combatant.STANDARD_DURATION_ROUNDS, Clock.NONE);
    }
    
    public void link(Duration duration) {
        linked.add(duration);
    }
    
    public List<Duration> getLinked() {
        return Collections.unmodifiableList(linked);
    }
    
    @Override
    protected void onEnd() {
        for (Duration d : new ArrayList<>(linked)) {
            d.end();
        }
    }
}
