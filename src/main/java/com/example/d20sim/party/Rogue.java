package com.example.d20sim.party;

import com.example.d20sim.combat.*;
import com.example.d20sim.model.*;
import com.example.d20sim.util.Dice;

import java.util.EnumSet;
import java.util.List;

/**
 * Assassin rogue fighting with a rapier and, from level 4, an off-hand rapier.
 */
public class Rogue extends PlayerCharacter {
    
    private Weapon rapier;
    private Dice sneakAttackDice;
    private boolean sneakAttackUsed;
    
    public Rogue(String name, int level) {
        super(name, level);
    }
    
    @Override
    protected void initializeFeatures() {
        abilities.put(Ability.STRENGTH, -1);
        abilities.put(Ability.DEXTERITY, level >= 8 ? 4 : 3);
        abilities.put(Ability.CONSTITUTION, 2);
        abilities.put(Ability.INTELLIGENCE, 1);
        abilities.put(Ability.WISDOM, 2);
        abilities.put(Ability.CHARISMA, 0);
        
        hitDieSides = 8;
        armorType = ArmorType.LIGHT;
        if (level >= 4) {
            baseArmorClass = 13;
        } else if (level >= 2) {
            baseArmorClass = 12;
        } else {
            baseArmorClass = 11;
        }
        saveProficiencies.add(Ability.DEXTERITY);
        saveProficiencies.add(Ability.INTELLIGENCE);
        skillProficiencies.addAll(EnumSet.of(Skill.ACROBATICS, Skill.INSIGHT, Skill.PERCEPTION, Skill.STEALTH));
        skillExpertise.addAll(EnumSet.of(Skill.PERCEPTION, Skill.STEALTH));
        
        // Half-elf
        features.add(Feature.CHARM_ADVANTAGE);
        features.add(Feature.GHOUL_PARALYSIS_IMMUNITY);
        if (level >= 7) features.add(Feature.EVASION);
        
        Weapon.Builder weapon = Weapon.builder("Rapier").dice(Dice.d(8)).ability(Ability.DEXTERITY);
        if (level >= 6) {
            weapon.damageType(DamageType.MAGIC_PIERCING).attackBonus(1).damageBonus(1);
        } else {
            weapon.damageType(DamageType.PIERCING);
        }
        rapier = weapon.build();
        sneakAttackDice = Dice.of((level + 1) / 2, 6);
    }
    
    public Weapon getRapier() { return rapier; }
    
    public Dice getSneakAttackDice() { return sneakAttackDice; }
    
    @Override
    protected void onTurnStart(Encounter encounter) {
        sneakAttackUsed = false;
    }
    
    @Override
    protected TurnPlan buildTurnPlan() {
        TurnPlan.Builder plan = TurnPlan.builder()
                .step(Tactic.of("Attack", ActionSlot.ACTION, e -> weaponAttack(e, false)));
        if (level >= 4) {
            plan.step(Tactic.of("Off-hand attack", ActionSlot.BONUS_ACTION,
                    e -> !sneakAttackUsed && weaponAttack(e, true)));
        }
        if (level >= 2) {
            plan.step(Tactic.of("Hide", ActionSlot.BONUS_ACTION, e -> {
                hide();
                return true;
            }));
        }
        return plan.build();
    }
    
    /**
     * Attack a surprised foe if there is one, otherwise any foe. Sneak Attack
     * applies once per turn with advantage, or with another ally standing and
     * no disadvantage.
     */
    boolean weaponAttack(Encounter encounter, boolean offHand) {
        Combatant target = encounter.chooseTarget(this, Combatant::isSurprised);
        if (target == null) {
            target = encounter.chooseTarget(this);
        }
        if (target == null) return false;
        
        AttackOptions options = AttackOptions.NONE.omitAbilityDamage(offHand);
        if (level >= 3 && target.isSurprised()) {
            options = options.advantage(true).critOnHit(true);
            if (!sneakAttackUsed) {
                options = options.extraDice(sneakAttackDice);
                sneakAttackUsed = true;
            }
        } else if (!sneakAttackUsed && canSneakAttack(encounter, target)) {
            options = options.extraDice(sneakAttackDice);
            sneakAttackUsed = true;
        }
        rapier.attack(this, target, options);
        return true;
    }
    
    private boolean canSneakAttack(Encounter encounter, Combatant target) {
        if (hasAttackDisadvantage(target)) return false;
        if (hasAttackAdvantage(target)) return true;
        List<Combatant> helpers = Encounter.filter(encounter.livingAllies(this),
                c -> c != this && !c.isIncapacitated());
        return !helpers.isEmpty();
    }
    
    /** Uncanny Dodge: halve the damage of an attack from a visible attacker. */
    @Override
    protected Damage modifyIncomingDamage(Damage damage, Combatant source, boolean fromAttack) {
        if (level >= 5 && fromAttack && source != null && isConscious() && !isIncapacitated()
                && hasSlot(ActionSlot.REACTION) && !source.isHiddenFrom(this)) {
            spendSlot(ActionSlot.REACTION);
            trace().note(TraceEvent.Type.ABILITY, this, "Uncanny Dodge", source, null);
            return damage.half();
        }
        return damage;
    }
}
