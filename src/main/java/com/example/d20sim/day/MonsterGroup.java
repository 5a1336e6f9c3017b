package com.example.d20sim.day;

import com.example.d20sim.combat.CombatContext;
import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.CombatantFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * A number of identical monsters fought together in every encounter of the day.
 */
public record MonsterGroup(String name, CombatantFactory factory, int count) {
    
    public MonsterGroup {
        if (count < 1) {
            throw new IllegalArgumentException("Monster count for " + name + " must be positive, got " + count);
        }
    }
    
    /** Fresh instances, numbered when there is more than one. */
    public List<Combatant> spawn(CombatContext context) {
        List<Combatant> monsters = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            monsters.add(factory.create(count > 1 ? name + " " + i : name, 0, context));
        }
        return monsters;
    }
}
