package com.example.d20sim.party;

import com.example.d20sim.combat.*;
import com.example.d20sim.day.DayState;
import com.example.d20sim.model.*;
import com.example.d20sim.resource.Loading;
import com.example.d20sim.resource.RechargeType;
import com.example.d20sim.resource.ResourcePool;
import com.example.d20sim.util.Dice;

import java.util.EnumSet;

/**
 * Champion fighter with a greatsword. Action Surge is rationed front-loaded
 * over each short-rest interval; Second Wind is used whenever hit points run low.
 */
public class Fighter extends PlayerCharacter {
    
    public static final String SECOND_WIND = "second wind";
    public static final String ACTION_SURGE = "action surge";
    
    private Weapon greatsword;
    private int attacksPerAction = 1;
    
    public Fighter(String name, int level) {
        super(name, level);
    }
    
    @Override
    protected void initializeFeatures() {
        int strength = 3 + (level >= 4 ? 1 : 0) + (level >= 8 ? 1 : 0);
        abilities.put(Ability.STRENGTH, strength);
        abilities.put(Ability.DEXTERITY, 1);
        abilities.put(Ability.CONSTITUTION, level >= 6 ? 4 : 3);
        abilities.put(Ability.INTELLIGENCE, -1);
        abilities.put(Ability.WISDOM, 1);
        abilities.put(Ability.CHARISMA, 0);
        
        hitDieSides = 10;
        armorType = ArmorType.HEAVY;
        if (level >= 5) {
            baseArmorClass = 18;
        } else if (level >= 3) {
            baseArmorClass = 17;
        } else {
            baseArmorClass = 16;
        }
        saveProficiencies.add(Ability.STRENGTH);
        saveProficiencies.add(Ability.CONSTITUTION);
        skillProficiencies.addAll(EnumSet.of(Skill.ACROBATICS, Skill.ATHLETICS, Skill.INTIMIDATION, Skill.PERCEPTION));
        skillDisadvantage.add(Skill.STEALTH);
        
        // Mountain dwarf
        resistances.add(DamageType.POISON);
        features.add(Feature.POISON_ADVANTAGE);
        
        if (level >= 3) critThreshold = 19;
        if (level >= 4) features.add(Feature.HEAVY_ARMOR_MASTER);
        if (level >= 5) attacksPerAction = 2;
        
        Weapon.Builder weapon = Weapon.builder("Greatsword").dice(Dice.greatWeapon(2, 6));
        if (level >= 6) {
            weapon.damageType(DamageType.MAGIC_SLASHING).attackBonus(1).damageBonus(1);
        } else {
            weapon.damageType(DamageType.SLASHING);
        }
        greatsword = weapon.build();
        
        addResource(new ResourcePool(SECOND_WIND, 1, RechargeType.SHORT_REST));
        if (level >= 2) {
            addResource(new ResourcePool(ACTION_SURGE, 1, RechargeType.SHORT_REST));
            ration(ACTION_SURGE, Loading.FRONT_LOADED);
        }
    }
    
    public Weapon getGreatsword() { return greatsword; }
    
    @Override
    protected TurnPlan buildTurnPlan() {
        return TurnPlan.builder()
                .step(Tactic.of("Second Wind", ActionSlot.BONUS_ACTION, e -> secondWind(false)))
                .step(Tactic.of("Attack", ActionSlot.ACTION, this::attackAction))
                .step(Tactic.of("Action Surge", ActionSlot.FREE, this::actionSurge))
                .build();
    }
    
    /**
     * Heal d10 + level once per short rest. In combat only when hit points are
     * at or below {@code max - min(max / 2, 10 + level)}.
     */
    private boolean secondWind(boolean resting) {
        if (!hasResource(SECOND_WIND)) return false;
        int hp = getHitPoints();
        int max = getMaxHitPoints();
        boolean worthIt = resting
                ? hp > 0 && hp < max
                : hp <= max - Math.min(max / 2, 10 + level);
        if (!worthIt) return false;
        ((ResourcePool) getResource(SECOND_WIND)).spend();
        trace().note(TraceEvent.Type.ABILITY, this, "Second Wind", null, null);
        heal(dice().roll(10) + level, this);
        return true;
    }
    
    private boolean attackAction(Encounter encounter) {
        int attacks = hasCondition(Condition.SLOWED) ? 1 : attacksPerAction;
        boolean attacked = false;
        for (int i = 0; i < attacks; i++) {
            Combatant target = encounter.chooseTarget(this);
            if (target == null) break;
            greatsword.attack(this, target, AttackOptions.NONE);
            attacked = true;
        }
        return attacked;
    }
    
    private boolean actionSurge(Encounter encounter) {
        if (!mayUse(ACTION_SURGE) || !encounter.hasLivingFoes(this)) return false;
        ((ResourcePool) getResource(ACTION_SURGE)).spend();
        trace().note(TraceEvent.Type.ABILITY, this, "Action Surge", null, null);
        return attackAction(encounter);
    }
    
    /** Use an unspent Second Wind before it refreshes. */
    @Override
    protected void onShortRest(DayState day) {
        secondWind(true);
    }
}
