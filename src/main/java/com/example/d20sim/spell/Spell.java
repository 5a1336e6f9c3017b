package com.example.d20sim.spell;

import com.example.d20sim.model.DamageType;

/**
 * A stateless spell template shared by every caster who knows it.
 */
public class Spell {
    
    public enum School {
        DIVINE,
        ARCANE
    }
    
    private final String name;
    private final int level;
    private final boolean concentration;
    private final School school;
    private final DamageType damageType;
    
    public Spell(String name, int level, boolean concentration, School school, DamageType damageType) {
        this.name = name;
        this.level = level;
        this.concentration = concentration;
        this.school = school;
        this.damageType = damageType;
    }
    
    public String getName() { return name; }
    
    /** 0 for cantrips. */
    public int getLevel() { return level; }
    
    public boolean isCantrip() { return level == 0; }
    
    public boolean isConcentration() { return concentration; }
    
    public School getSchool() { return school; }
    
    /** Damage the spell deals, null for healing and buffs. */
    public DamageType getDamageType() { return damageType; }
    
    @Override
    public String toString() {
        return name;
    }
}
