package com.example.d20sim.combat;

import com.example.d20sim.model.DamageType;

import java.util.*;

/**
 * Rolled damage, possibly of several types (a mace with radiant Divine Strike).
 * Immutable.
 */
public final class Damage {
    
    public static final class Part {
        private final int amount;
        private final DamageType type;
        
        Part(int amount, DamageType type) {
            this.amount = amount;
            this.type = type;
        }
        
        public int getAmount() { return amount; }
        public DamageType getType() { return type; }
    }
    
    private final List<Part> parts;
    
    private Damage(List<Part> parts) {
        this.parts = Collections.unmodifiableList(parts);
    }
    
    public static Damage of(int amount, DamageType type) {
        List<Part> parts = new ArrayList<>();
        parts.add(new Part(amount, type));
        return new Damage(parts);
    }
    
    public Damage plus(int amount, DamageType type) {
        List<Part> combined = new ArrayList<>(parts);
        combined.add(new Part(amount, type));
        return new Damage(combined);
    }
    
    /** Each part halved, rounding down. */
    public Damage half() {
        List<Part> halved = new ArrayList<>();
        for (Part p : parts) {
            halved.add(new Part(p.amount / 2, p.type));
        }
        return new Damage(halved);
    }
    
    public List<Part> getParts() { return parts; }
    
    public DamageType getPrimaryType() {
        return parts.get(0).type;
    }
    
    public boolean includes(DamageType type) {
        for (Part p : parts) {
            if (p.type == type) return true;
        }
        return false;
    }
    
    /** Sum before resistances. */
    public int getTotal() {
        int total = 0;
        for (Part p : parts) total += p.amount;
        return total;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Part p : parts) {
            if (sb.length() > 0) sb.append(" + ");
            sb.append(p.amount).append(' ').append(p.type.getDisplayName());
        }
        return sb.toString();
    }
}
