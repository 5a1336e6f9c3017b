package com.example.d20sim.combat;

import java.util.function.Predicate;

/**
 * One candidate action in a turn plan. {@link #perform(Encounter)} returns
 * false when the tactic does not apply right now (no valid target, resource
 * held in reserve); in that case it must not have changed anything.
 */
public interface Tactic {
    
    String getName();
    
    ActionSlot getSlot();
    
    boolean perform(Encounter encounter);
    
    static Tactic of(String name, ActionSlot slot, Predicate<Encounter> action) {
        return new Tactic() {
            @Override
            public String getName() { return name; }
            
            @Override
            public ActionSlot getSlot() { return slot; }
            
            @Override
            public boolean perform(Encounter encounter) { return action.test(encounter); }
            
            @Override
            public String toString() { return name + " (" + slot.getDisplayName() + ")"; }
        };
    }
}
