package com.example.d20sim.combat;

import java.util.*;

/**
 * A combatant's behavior as an ordered list of steps. Each step is a priority
 * list of tactics: the first tactic whose action slot is still free and which
 * performs successfully is the one taken for that step, and its slot is spent.
 * Later steps still run, so a turn can be "cast a bonus action spell, then
 * attack with the action".
 */
public class TurnPlan {
    
    private final List<List<Tactic>> steps;
    
    private TurnPlan(List<List<Tactic>> steps) {
        this.steps = steps;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public List<List<Tactic>> getSteps() {
        return steps;
    }
    
    /**
     * Run the plan for one turn. Stops early if the actor drops or becomes
     * incapacitated partway through.
     */
    public void execute(Combatant actor, Encounter encounter) {
        for (List<Tactic> step : steps) {
            if (!actor.isConscious() || actor.isIncapacitated()) {
                return;
            }
            for (Tactic tactic : step) {
                if (actor.hasSlot(tactic.getSlot()) && tactic.perform(encounter)) {
                    actor.spendSlot(tactic.getSlot());
                    break;
                }
            }
        }
    }
    
    public static class Builder {
        private final List<List<Tactic>> steps = new ArrayList<>();
        
        /** Add a step made of alternatives in priority order. */
        public Builder step(Tactic... alternatives) {
            steps.add(List.of(alternatives));
            return this;
        }
        
        public Builder step(List<Tactic> alternatives) {
            steps.add(List.copyOf(alternatives));
            return this;
        }
        
        public TurnPlan build() {
            return new TurnPlan(Collections.unmodifiableList(new ArrayList<>(steps)));
        }
    }
}
