package com.example.d20sim.combat;

import com.example.d20sim.model.Ability;
import com.example.d20sim.model.Condition;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.util.Dice;

/**
 * An attack definition: dice, damage type, the ability it uses and fixed
 * bonuses. Also used for spell attacks. Immutable; build with {@link #builder(String)}.
 */
public final class Weapon {
    
    private final String name;
    private final Dice dice;
    private final DamageType damageType;
    private final Ability ability;
    private final boolean proficient;
    private final boolean addAbilityToDamage;
    private final int attackBonus;
    private final int damageBonus;
    private final Dice secondaryDice;
    private final DamageType secondaryType;
    
    private Weapon(Builder b) {
        this.name = b.name;
        this.dice = b.dice;
        this.damageType = b.damageType;
        this.ability = b.ability;
        this.proficient = b.proficient;
        this.addAbilityToDamage = b.addAbilityToDamage;
        this.attackBonus = b.attackBonus;
        this.damageBonus = b.damageBonus;
        this.secondaryDice = b.secondaryDice;
        this.secondaryType = b.secondaryType;
    }
    
    public static Builder builder(String name) {
        return new Builder(name);
    }
    
    public String getName() { return name; }
    public Dice getDice() { return dice; }
    public DamageType getDamageType() { return damageType; }
    public Ability getAbility() { return ability; }
    public boolean isProficient() { return proficient; }
    public int getAttackBonus() { return attackBonus; }
    public int getDamageBonus() { return damageBonus; }
    public Dice getSecondaryDice() { return secondaryDice; }
    public DamageType getSecondaryType() { return secondaryType; }
    
    /** Whether the target would take no damage at all from this weapon. */
    public boolean isUselessAgainst(Combatant target) {
        return target.isImmuneTo(damageType) && (secondaryDice == null || target.isImmuneTo(secondaryType));
    }
    
    public int attackModifier(Combatant wielder) {
        int modifier = wielder.getAbility(ability) + attackBonus + wielder.getAttackModifier();
        if (proficient) modifier += wielder.getProficiency();
        return modifier;
    }
    
    /**
     * Attack a target and apply damage on a hit. A natural roll at or above the
     * wielder's critical threshold is a critical hit, a natural 1 always misses,
     * and any hit against a paralyzed target is critical.
     */
    public AttackResult attack(Combatant wielder, Combatant target, AttackOptions options) {
        if (target == null) {
            return AttackResult.noTarget();
        }
        CombatContext ctx = wielder.getContext();
        boolean advantage = options.hasAdvantage() || wielder.hasAttackAdvantage(target);
        boolean disadvantage = options.hasDisadvantage() || wielder.hasAttackDisadvantage(target);
        target.consumeMarks();
        
        int natural = ctx.getDice().d20(advantage, disadvantage);
        int total = natural + attackModifier(wielder);
        if (wielder.hasCondition(Condition.BLESSED)) {
            total += ctx.getDice().d4();
        }
        boolean critical = natural >= wielder.getCritThreshold();
        boolean hit = critical || (natural > 1 && total >= target.getArmorClass());
        if (hit && (options.isCritOnHit() || target.hasCondition(Condition.PARALYZED))) {
            critical = true;
        }
        wielder.reveal();
        
        AttackOutcome outcome = critical ? AttackOutcome.CRITICAL : hit ? AttackOutcome.HIT : AttackOutcome.MISS;
        ctx.getTrace().record(TraceEvent.Type.ATTACK, wielder, name, target, total, 0,
                outcome.name().toLowerCase() + " vs AC " + target.getArmorClass()
                + (advantage && !disadvantage ? ", advantage" : "")
                + (disadvantage && !advantage ? ", disadvantage" : ""));
        
        int dealt = 0;
        if (hit) {
            dealt = target.takeDamage(rollDamage(wielder, critical, options), wielder, true);
        }
        return new AttackResult(outcome, natural, total, dealt);
    }
    
    /**
     * Roll damage. Critical hits roll every die (extra dice included) once per
     * point of the wielder's critical multiplier.
     */
    public Damage rollDamage(Combatant wielder, boolean critical, AttackOptions options) {
        CombatContext ctx = wielder.getContext();
        int rolls = critical ? wielder.getCritMultiplier() : 1;
        Dice primary = dice.plus(options.getExtraDice());
        int amount = damageBonus + wielder.getDamageModifier();
        for (int i = 0; i < rolls; i++) {
            amount += primary.roll(ctx.getDice());
        }
        if (addAbilityToDamage && !options.isOmitAbilityDamage()) {
            amount += wielder.getAbility(ability);
        }
        Damage damage = Damage.of(amount, damageType);
        if (secondaryDice != null) {
            int secondary = 0;
            for (int i = 0; i < rolls; i++) {
                secondary += secondaryDice.roll(ctx.getDice());
            }
            damage = damage.plus(secondary, secondaryType);
        }
        return damage;
    }
    
    @Override
    public String toString() {
        return name + " " + dice + " " + damageType.getDisplayName();
    }
    
    public static class Builder {
        private final String name;
        private Dice dice = Dice.d(4);
        private DamageType damageType = DamageType.BLUDGEONING;
        private Ability ability = Ability.STRENGTH;
        private boolean proficient = true;
        private boolean addAbilityToDamage = true;
        private int attackBonus = 0;
        private int damageBonus = 0;
        private Dice secondaryDice;
        private DamageType secondaryType;
        
        private Builder(String name) {
            this.name = name;
        }
        
        public Builder dice(Dice dice) { this.dice = dice; return this; }
        public Builder damageType(DamageType type) { this.damageType = type; return this; }
        public Builder ability(Ability ability) { this.ability = ability; return this; }
        public Builder proficient(boolean proficient) { this.proficient = proficient; return this; }
        public Builder addAbilityToDamage(boolean add) { this.addAbilityToDamage = add; return this; }
        public Builder attackBonus(int bonus) { this.attackBonus = bonus; return this; }
        public Builder damageBonus(int bonus) { this.damageBonus = bonus; return this; }
        
        public Builder secondary(Dice dice, DamageType type) {
            this.secondaryDice = dice;
            this.secondaryType = type;
            return this;
        }
        
        public Weapon build() {
            if (dice == null || damageType == null || ability == null) {
                throw new IllegalStateException("Weapon " + name + " needs dice, damage type and ability");
            }
            return new Weapon(this);
        }
    }
}
