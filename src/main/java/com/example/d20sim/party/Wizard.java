package com.example.d20sim.party;

import com.example.d20sim.combat.*;
import com.example.d20sim.day.DayState;
import com.example.d20sim.model.*;
import com.example.d20sim.resource.Loading;
import com.example.d20sim.resource.RechargeType;
import com.example.d20sim.resource.ResourcePool;
import com.example.d20sim.resource.SpellSlots;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static com.example.d20sim.spell.ArcaneSpellHandler.*;

/**
 * Gnome evocation wizard. Spell slots are rationed front-loaded over the day;
 * once the encounter's share is spent the wizard falls back on cantrips.
 */
public class Wizard extends Spellcaster {
    
    private static final Logger logger = LoggerFactory.getLogger(Wizard.class);
    
    public static final String ARCANE_RECOVERY = "arcane recovery";
    
    public Wizard(String name, int level) {
        super(name, level, Ability.INTELLIGENCE);
    }
    
    @Override
    protected void initializeFeatures() {
        int intelligence = 3 + (level >= 4 ? 1 : 0) + (level >= 8 ? 1 : 0);
        abilities.put(Ability.STRENGTH, -1);
        abilities.put(Ability.DEXTERITY, 2);
        abilities.put(Ability.CONSTITUTION, 2);
        abilities.put(Ability.INTELLIGENCE, intelligence);
        abilities.put(Ability.WISDOM, 1);
        abilities.put(Ability.CHARISMA, 0);
        
        hitDieSides = 6;
        // Mage Armor, cast before the day starts
        armorType = ArmorType.NONE;
        baseArmorClass = 13;
        saveProficiencies.add(Ability.INTELLIGENCE);
        saveProficiencies.add(Ability.WISDOM);
        
        features.add(Feature.GNOME_CUNNING);
        if (level >= 6) {
            features.add(Feature.POTENT_CANTRIP);
            spellAttackItemBonus = 1;
        }
        
        initializeSpellSlots();
        ration(SpellSlots.RESOURCE_NAME, Loading.FRONT_LOADED);
        addResource(new ResourcePool(ARCANE_RECOVERY, 1, RechargeType.LONG_REST));
    }
    
    @Override
    protected TurnPlan buildTurnPlan() {
        return TurnPlan.builder()
                .step(Tactic.of("Leveled spell", ActionSlot.ACTION, this::leveledSpell),
                        Tactic.of("Cantrip", ActionSlot.ACTION, this::cantrip))
                .build();
    }
    
    /** A named candidate spell and the targets it would go to. */
    private static final class Option {
        final String spell;
        final List<Combatant> targets;
        
        Option(String spell, List<Combatant> targets) {
            this.spell = spell;
            this.targets = targets;
        }
    }
    
    private boolean leveledSpell(Encounter encounter) {
        if (!maySpendSlot()) return false;
        List<Combatant> foes = encounter.livingFoes(this);
        if (foes.isEmpty()) return false;
        List<Combatant> visible = Encounter.filter(foes, Targeting.visibleTo(this));
        
        int slot = slots.highestAvailable(4);
        if (slot > 0 && foes.size() == 1 && visible.size() == 1) {
            Combatant target = foes.get(0);
            if (!target.isImmuneTo(DamageType.NECROTIC) && Targeting.livingCreature().test(target)) {
                return cast(BLIGHT, slot, List.of(target), encounter);
            }
        }
        
        slot = slots.highestAvailable(3);
        if (slot > 0 && foes.size() > 1) {
            Option choice = pick(encounter,
                    option(encounter, FIREBALL, 2, Targeting.notImmuneTo(DamageType.FIRE)),
                    option(encounter, LIGHTNING_BOLT, 2, Targeting.notImmuneTo(DamageType.LIGHTNING)));
            if (choice != null) return cast(choice.spell, slot, choice.targets, encounter);
        }
        
        slot = slots.highestAvailable(2);
        if (slot > 0) {
            Option choice = pick(encounter,
                    option(encounter, MELFS_ACID_ARROW, 1, Targeting.notImmuneTo(DamageType.ACID)),
                    option(encounter, SCORCHING_RAY, 1, Targeting.notImmuneTo(DamageType.FIRE)));
            if (choice != null) return cast(choice.spell, slot, choice.targets, encounter);
        }
        
        slot = slots.highestAvailable(1);
        if (slot > 0) {
            Option choice = levelOneSpell(encounter, foes, visible, slot);
            if (choice != null) return cast(choice.spell, slot, choice.targets, encounter);
        }
        return false;
    }
    
    /**
     * Chromatic Orb against a lone visible foe, otherwise Burning Hands, Magic
     * Missile or Thunderwave, skipping whichever the foes shrug off.
     */
    private Option levelOneSpell(Encounter encounter, List<Combatant> foes, List<Combatant> visible, int slot) {
        if (foes.size() == 1 && visible.size() == 1) {
            Combatant target = visible.get(0);
            if (!target.isImmuneTo(DamageType.COLD) || !target.isImmuneTo(DamageType.THUNDER)) {
                return new Option(CHROMATIC_ORB, List.of(target));
            }
        }
        Option magicMissile = new Option(MAGIC_MISSILE, encounter.chooseTargetsWithReplacement(this, slot + 2,
                Targeting.visibleTo(this).and(Targeting.notImmuneTo(DamageType.FORCE))));
        return pick(encounter,
                option(encounter, BURNING_HANDS, 2, Targeting.notImmuneTo(DamageType.FIRE)),
                magicMissile,
                option(encounter, THUNDERWAVE, 2, Targeting.notImmuneTo(DamageType.THUNDER)));
    }
    
    /** Fire Bolt, Acid Splash on two visible foes, or Poison Spray on a visible one. */
    private boolean cantrip(Encounter encounter) {
        Predicate<Combatant> visible = Targeting.visibleTo(this);
        Option choice = pick(encounter,
                option(encounter, FIRE_BOLT, 1, Targeting.notImmuneTo(DamageType.FIRE)),
                option(encounter, ACID_SPLASH, 2, visible.and(Targeting.notImmuneTo(DamageType.ACID))),
                option(encounter, POISON_SPRAY, 1, visible.and(Targeting.notImmuneTo(DamageType.POISON))));
        if (choice == null) {
            // Everything standing shrugs off all three; throw a Fire Bolt anyway
            Combatant target = encounter.chooseTarget(this);
            return target != null && castCantrip(FIRE_BOLT, List.of(target), encounter);
        }
        return castCantrip(choice.spell, choice.targets, encounter);
    }
    
    private Option option(Encounter encounter, String spell, int count, Predicate<Combatant> filter) {
        return new Option(spell, encounter.chooseTargets(this, count, filter));
    }
    
    /** Uniformly one of the options that found targets, or null. */
    private Option pick(Encounter encounter, Option... options) {
        List<Option> usable = new ArrayList<>();
        for (Option option : options) {
            if (!option.targets.isEmpty()) usable.add(option);
        }
        return encounter.getDice().pick(usable);
    }
    
    /**
     * Arcane Recovery, once per day at the first short rest: regain slots
     * totalling up to half the wizard level (rounded up), highest levels first.
     */
    @Override
    protected void onShortRest(DayState day) {
        ResourcePool recovery = (ResourcePool) getResource(ARCANE_RECOVERY);
        if (!isConscious() || !recovery.isAvailable()) return;
        recovery.spend();
        int budget = (level + 1) / 2;
        int recovered = 0;
        for (int slotLevel = slots.getHighestLevel(); slotLevel >= 1; slotLevel--) {
            while (budget >= slotLevel && slots.recover(slotLevel)) {
                budget -= slotLevel;
                recovered++;
            }
        }
        trace().note(TraceEvent.Type.REST, this, "Arcane Recovery", null, recovered + " slots");
        logger.debug("{} recovered {} spell slots", name, recovered);
    }
}
