package com.example.d20sim.party;

import com.example.d20sim.combat.*;
import com.example.d20sim.day.DayState;
import com.example.d20sim.effect.SpiritGuardiansEffect;
import com.example.d20sim.effect.SpiritualWeaponEffect;
import com.example.d20sim.effect.TurnedEffect;
import com.example.d20sim.model.*;
import com.example.d20sim.resource.Loading;
import com.example.d20sim.resource.RechargeType;
import com.example.d20sim.resource.ResourcePool;
import com.example.d20sim.resource.SpellSlots;
import com.example.d20sim.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static com.example.d20sim.spell.DivineSpellHandler.*;

/**
 * Life Domain cleric: the party's healer.
 *
 * <p>Heals downed allies whenever it can, regardless of rationing. Spell slots
 * are otherwise rationed back-loaded over the day and Channel Divinity
 * back-loaded over each short-rest interval.
 */
public class Cleric extends Spellcaster {
    
    private static final Logger logger = LoggerFactory.getLogger(Cleric.class);
    
    public static final String CHANNEL_DIVINITY = "channel divinity";
    
    private Weapon mace;
    /** Highest undead challenge rating destroyed by Turn Undead, negative if none */
    private double destroyUndeadRating = -1;
    
    public Cleric(String name, int level) {
        super(name, level, Ability.WISDOM);
    }
    
    @Override
    protected void initializeFeatures() {
        abilities.put(Ability.STRENGTH, level >= 4 ? 3 : 2);
        abilities.put(Ability.DEXTERITY, -1);
        abilities.put(Ability.CONSTITUTION, 2);
        abilities.put(Ability.INTELLIGENCE, 0);
        abilities.put(Ability.WISDOM, level >= 8 ? 4 : 3);
        abilities.put(Ability.CHARISMA, 1);
        
        hitDieSides = 8;
        armorType = ArmorType.HEAVY;
        baseArmorClass = level >= 5 ? 20 : 18;
        saveProficiencies.add(Ability.WISDOM);
        saveProficiencies.add(Ability.CHARISMA);
        skillProficiencies.addAll(EnumSet.of(Skill.INSIGHT, Skill.MEDICINE, Skill.PERSUASION));
        skillDisadvantage.add(Skill.STEALTH);
        
        features.add(Feature.WAR_CASTER);
        features.add(Feature.DISCIPLE_OF_LIFE);
        if (level >= 6) features.add(Feature.BLESSED_HEALER);
        
        Weapon.Builder weapon = Weapon.builder("Mace").dice(Dice.d(6));
        if (level >= 6) {
            weapon.damageType(DamageType.MAGIC_BLUDGEONING).attackBonus(1).damageBonus(1);
        } else {
            weapon.damageType(DamageType.BLUDGEONING);
        }
        if (level >= 8) {
            weapon.secondary(Dice.d(8), DamageType.RADIANT);
        }
        mace = weapon.build();
        
        initializeSpellSlots();
        ration(SpellSlots.RESOURCE_NAME, Loading.BACK_LOADED);
        
        if (level >= 2) {
            addResource(new ResourcePool(CHANNEL_DIVINITY, level >= 6 ? 2 : 1, RechargeType.SHORT_REST));
            ration(CHANNEL_DIVINITY, Loading.BACK_LOADED);
        }
        if (level >= 8) {
            destroyUndeadRating = 1.0;
        } else if (level >= 5) {
            destroyUndeadRating = 0.5;
        }
    }
    
    /** Death Ward is cast on the cleric after the long rest, using a 4th level slot. */
    @Override
    public void startDay(DayState day) {
        if (level >= 7 && slots.remainingAt(4) > 0) {
            slots.spend(4);
            grantDeathWard();
            trace().note(TraceEvent.Type.SPELL, this, "Death Ward", this, "level 4");
        }
    }
    
    public Weapon getMace() { return mace; }
    
    // Turn
    
    @Override
    protected TurnPlan buildTurnPlan() {
        return TurnPlan.builder()
                .step(Tactic.of(MASS_HEALING_WORD, ActionSlot.BONUS_ACTION, this::massHealingWord),
                        Tactic.of(AID, ActionSlot.ACTION, this::aid),
                        Tactic.of(HEALING_WORD, ActionSlot.BONUS_ACTION, this::healingWordOnAlly),
                        Tactic.of(HEALING_WORD + " (self)", ActionSlot.BONUS_ACTION, this::healingWordOnSelf),
                        Tactic.of("Turn Undead", ActionSlot.ACTION, this::turnUndead),
                        Tactic.of(SPIRIT_GUARDIANS, ActionSlot.ACTION, this::spiritGuardians),
                        Tactic.of(SPIRITUAL_WEAPON, ActionSlot.BONUS_ACTION, this::spiritualWeapon),
                        Tactic.of(BLESS, ActionSlot.ACTION, this::bless),
                        Tactic.of(GUIDING_BOLT, ActionSlot.ACTION, this::guidingBolt))
                .step(Tactic.of("Spiritual Weapon attack", ActionSlot.BONUS_ACTION, this::spiritualWeaponAttack))
                .step(Tactic.of("Mace or Sacred Flame", ActionSlot.ACTION, this::maceOrSacredFlame))
                .build();
    }
    
    private boolean massHealingWord(Encounter encounter) {
        int slot = slots.lowestAvailable(3);
        if (slot == 0 || isSwallowed() || encounter.unconsciousAllies(this).size() < 2) return false;
        List<Combatant> wounded = Encounter.filter(encounter.getAllies(this),
                Targeting.reachable().and(c -> c.getHitPoints() < c.getMaxHitPoints()));
        return cast(MASS_HEALING_WORD, slot, unconsciousFirst(wounded, 6), encounter);
    }
    
    private boolean aid(Encounter encounter) {
        int slot = slots.lowestAvailable(2);
        if (slot == 0 || isSwallowed()) return false;
        List<Combatant> downUnaided = Encounter.filter(encounter.unconsciousAllies(this), c -> !c.isAided());
        if (downUnaided.size() < 2) return false;
        List<Combatant> unaided = Encounter.filter(encounter.getAllies(this),
                Targeting.reachable().and(c -> !c.isAided()));
        return cast(AID, slot, unconsciousFirst(unaided, 3), encounter);
    }
    
    private boolean healingWordOnAlly(Encounter encounter) {
        if (isSwallowed()) return false;
        Combatant target = encounter.getDice().pick(encounter.unconsciousAllies(this));
        return target != null && castLowest(HEALING_WORD, List.of(target), encounter);
    }
    
    private boolean healingWordOnSelf(Encounter encounter) {
        return getHitPoints() <= getMaxHitPoints() / 4 && castLowest(HEALING_WORD, List.of(this), encounter);
    }
    
    private boolean turnUndead(Encounter encounter) {
        if (!mayUse(CHANNEL_DIVINITY)) return false;
        List<Combatant> undead = Encounter.filter(encounter.livingFoes(this), Targeting.undead());
        if (undead.size() < 2) return false;
        ((ResourcePool) getResource(CHANNEL_DIVINITY)).spend();
        trace().note(TraceEvent.Type.ABILITY, this, "Turn Undead", null, null);
        for (Combatant target : encounter.getDice().sample(undead, 2)) {
            if (target.savingThrow(Ability.WISDOM, spellSaveDc(), SaveType.TURN_UNDEAD)) continue;
            if (target.getUndeadRating() <= destroyUndeadRating) {
                target.destroy();
            } else {
                target.attach(new TurnedEffect(this, target));
            }
        }
        return true;
    }
    
    private boolean spiritGuardians(Encounter encounter) {
        if (!maySpendSlot() || isConcentrating() || slots.highestAvailable(3) == 0) return false;
        List<Combatant> targets = encounter.chooseTargets(this, 2,
                Targeting.notImmuneTo(DamageType.RADIANT).and(c -> !c.hasDuration(SpiritGuardiansEffect.class)));
        return targets.size() > 1 && castHighest(SPIRIT_GUARDIANS, targets, encounter);
    }
    
    private boolean spiritualWeapon(Encounter encounter) {
        if (!maySpendSlot() || hasDuration(SpiritualWeaponEffect.class) || slots.highestAvailable(2) == 0) {
            return false;
        }
        Combatant target = encounter.chooseTarget(this, Targeting.notImmuneTo(DamageType.FORCE));
        return target != null && castHighest(SPIRITUAL_WEAPON, List.of(target), encounter);
    }
    
    private boolean bless(Encounter encounter) {
        if (!maySpendSlot() || isConcentrating() || isSwallowed() || slots.lowestAvailable(1) != 1) return false;
        List<Combatant> unblessed = Encounter.filter(encounter.getAllies(this),
                Targeting.reachable().and(c -> !c.hasCondition(Condition.BLESSED)));
        if (unblessed.size() < 3) return false;
        return cast(BLESS, 1, encounter.getDice().sample(unblessed, 3), encounter);
    }
    
    private boolean guidingBolt(Encounter encounter) {
        if (!maySpendSlot()) return false;
        Combatant target = encounter.chooseTarget(this, Targeting.notImmuneTo(DamageType.RADIANT));
        return target != null && castHighest(GUIDING_BOLT, List.of(target), encounter);
    }
    
    private boolean spiritualWeaponAttack(Encounter encounter) {
        List<SpiritualWeaponEffect> active = getDurations(SpiritualWeaponEffect.class);
        if (active.isEmpty()) return false;
        Combatant target = encounter.chooseTarget(this);
        if (target == null) return false;
        active.get(0).getWeapon().attack(this, target, AttackOptions.NONE);
        return true;
    }
    
    /** Sacred Flame half the time, the mace when the target is hidden or shrugs off radiant damage. */
    private boolean maceOrSacredFlame(Encounter encounter) {
        Combatant target = encounter.chooseTarget(this);
        if (target == null) return false;
        if (target.isImmuneTo(DamageType.RADIANT) || target.isHiddenFrom(this)
                || hasCondition(Condition.BLINDED) || encounter.getDice().chance(0.5)) {
            mace.attack(this, target, AttackOptions.NONE);
            return true;
        }
        return castCantrip(SACRED_FLAME, List.of(target), encounter);
    }
    
    /**
     * Up to {@code n} of the candidates, every unconscious one first. Returns all
     * candidates if there are no more than {@code n}.
     */
    private List<Combatant> unconsciousFirst(List<Combatant> candidates, int n) {
        if (candidates.size() <= n) return candidates;
        List<Combatant> down = Encounter.filter(candidates, Targeting.unconscious());
        if (down.size() >= n) return dice().sample(down, n);
        List<Combatant> chosen = new ArrayList<>(down);
        chosen.addAll(dice().sample(Encounter.filter(candidates, Combatant::isConscious), n - down.size()));
        return chosen;
    }
    
    // After the fight
    
    @Override
    public void endEncounter(Encounter encounter) {
        List<Combatant> allies = encounter.getAllies(this);
        if (level >= 2 && mayUse(CHANNEL_DIVINITY)) {
            preserveLife(allies);
        }
        revive(allies, encounter);
    }
    
    @Override
    public void endOfDay(DayState day, List<Combatant> party) {
        revive(party, null);
    }
    
    /**
     * Preserve Life: share 5 x level hit points one at a time, always to the ally
     * with the fewest, among allies at or below half their maximum, stopping each
     * ally at half.
     */
    void preserveLife(List<Combatant> allies) {
        List<Combatant> wounded = new ArrayList<>();
        for (Combatant ally : allies) {
            if (ally.getHitPoints() <= ally.getMaxHitPoints() / 2) wounded.add(ally);
        }
        if (wounded.isEmpty()) return;
        
        ((ResourcePool) getResource(CHANNEL_DIVINITY)).spend();
        trace().note(TraceEvent.Type.ABILITY, this, "Preserve Life", null, wounded.size() + " allies");
        Map<Combatant, Integer> healing = new LinkedHashMap<>();
        for (int i = 0; i < 5 * level && !wounded.isEmpty(); i++) {
            Combatant lowest = null;
            for (Combatant c : wounded) {
                int hp = c.getHitPoints() + healing.getOrDefault(c, 0);
                if (lowest == null || hp < lowest.getHitPoints() + healing.getOrDefault(lowest, 0)) {
                    lowest = c;
                }
            }
            int given = healing.merge(lowest, 1, Integer::sum);
            if (lowest.getHitPoints() + given >= lowest.getMaxHitPoints() / 2) {
                wounded.remove(lowest);
            }
        }
        for (Map.Entry<Combatant, Integer> e : healing.entrySet()) {
            e.getKey().heal(e.getValue(), this);
        }
    }
    
    /**
     * Bring downed allies back: Cure Wounds on each if there are enough slots,
     * otherwise Prayer of Healing, otherwise Cure Wounds on as many as possible.
     */
    void revive(List<Combatant> allies, Encounter encounter) {
        if (!isConscious()) return;
        List<Combatant> down = Encounter.filter(allies, Targeting.unconscious());
        if (down.isEmpty()) return;
        
        if (slots.getRemaining() >= down.size()) {
            for (Combatant ally : down) {
                castLowest(CURE_WOUNDS, List.of(ally), encounter);
            }
        } else if (slots.lowestAvailable(2) > 0) {
            List<Combatant> wounded = Encounter.filter(allies, c -> c.getHitPoints() < c.getMaxHitPoints());
            cast(PRAYER_OF_HEALING, slots.lowestAvailable(2), unconsciousFirst(wounded, 6), encounter);
        } else if (slots.remainingAt(1) > 0) {
            for (Combatant ally : dice().sample(down, slots.remainingAt(1))) {
                cast(CURE_WOUNDS, 1, List.of(ally), encounter);
            }
        } else {
            logger.debug("{} has no slots left to revive {} allies", name, down.size());
        }
    }
}
