package com.example.d20sim.combat;

import com.example.d20sim.util.Dice;

/**
 * Per-attack adjustments supplied by the attacker's tactic.
 */
public final class AttackOptions {
    
    public static final AttackOptions NONE = new AttackOptions(false, false, null, false, false);
    
    private final boolean advantage;
    private final boolean disadvantage;
    private final Dice extraDice;
    private final boolean critOnHit;
    private final boolean omitAbilityDamage;
    
    private AttackOptions(boolean advantage, boolean disadvantage, Dice extraDice,
                          boolean critOnHit, boolean omitAbilityDamage) {
        this.advantage = advantage;
        this.disadvantage = disadvantage;
        this.extraDice = extraDice;
        this.critOnHit = critOnHit;
        this.omitAbilityDamage = omitAbilityDamage;
    }
    
    public static AttackOptions withAdvantage(boolean advantage) {
        return NONE.advantage(advantage);
    }
    
    public AttackOptions advantage(boolean value) {
        return new AttackOptions(value, disadvantage, extraDice, critOnHit, omitAbilityDamage);
    }
    
    public AttackOptions disadvantage(boolean value) {
        return new AttackOptions(advantage, value, extraDice, critOnHit, omitAbilityDamage);
    }
    
    /** Extra damage dice rolled on a hit, doubled on a critical (Sneak Attack). */
    public AttackOptions extraDice(Dice dice) {
        return new AttackOptions(advantage, disadvantage, dice, critOnHit, omitAbilityDamage);
    }
    
    /** Any hit is a critical hit (Assassinate). */
    public AttackOptions critOnHit(boolean value) {
        return new AttackOptions(advantage, disadvantage, extraDice, value, omitAbilityDamage);
    }
    
    /** Leave the ability modifier off the damage (off-hand attacks). */
    public AttackOptions omitAbilityDamage(boolean value) {
        return new AttackOptions(advantage, disadvantage, extraDice, critOnHit, value);
    }
    
    public boolean hasAdvantage() { return advantage; }
    public boolean hasDisadvantage() { return disadvantage; }
    public Dice getExtraDice() { return extraDice; }
    public boolean isCritOnHit() { return critOnHit; }
    public boolean isOmitAbilityDamage() { return omitAbilityDamage; }
}
