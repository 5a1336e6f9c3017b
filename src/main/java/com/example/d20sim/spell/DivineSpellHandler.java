package com.example.d20sim.spell;

import com.example.d20sim.combat.AttackOptions;
import com.example.d20sim.combat.AttackResult;
import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Damage;
import com.example.d20sim.combat.Weapon;
import com.example.d20sim.effect.BlessEffect;
import com.example.d20sim.effect.GuidingBoltMark;
import com.example.d20sim.effect.SpiritGuardiansEffect;
import com.example.d20sim.effect.SpiritualWeaponEffect;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.Feature;
import com.example.d20sim.model.SaveType;
import com.example.d20sim.party.Spellcaster;
import com.example.d20sim.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the divine spells and resolves each of them.
 */
public class DivineSpellHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(DivineSpellHandler.class);
    
    public static final String AID = "Aid";
    public static final String BLESS = "Bless";
    public static final String CURE_WOUNDS = "Cure Wounds";
    public static final String GUIDING_BOLT = "Guiding Bolt";
    public static final String HEALING_WORD = "Healing Word";
    public static final String MASS_HEALING_WORD = "Mass Healing Word";
    public static final String PRAYER_OF_HEALING = "Prayer of Healing";
    public static final String SACRED_FLAME = "Sacred Flame";
    public static final String SPIRIT_GUARDIANS = "Spirit Guardians";
    public static final String SPIRITUAL_WEAPON = "Spiritual Weapon";
    
    private DivineSpellHandler() {
    }
    
    static void registerAll() {
        registerDivine(new Spell(SACRED_FLAME, 0, false, Spell.School.DIVINE, DamageType.RADIANT),
                DivineSpellHandler::handleSacredFlame);
        registerDivine(new Spell(BLESS, 1, true, Spell.School.DIVINE, null), DivineSpellHandler::handleBless);
        registerDivine(new Spell(CURE_WOUNDS, 1, false, Spell.School.DIVINE, null),
                ctx -> heal(ctx, ctx.getSlotLevel(), 8));
        registerDivine(new Spell(GUIDING_BOLT, 1, false, Spell.School.DIVINE, DamageType.RADIANT),
                DivineSpellHandler::handleGuidingBolt);
        registerDivine(new Spell(HEALING_WORD, 1, false, Spell.School.DIVINE, null),
                ctx -> heal(ctx, ctx.getSlotLevel(), 4));
        registerDivine(new Spell(AID, 2, false, Spell.School.DIVINE, null), DivineSpellHandler::handleAid);
        registerDivine(new Spell(PRAYER_OF_HEALING, 2, false, Spell.School.DIVINE, null),
                ctx -> heal(ctx, ctx.getSlotLevel(), 8));
        registerDivine(new Spell(SPIRITUAL_WEAPON, 2, false, Spell.School.DIVINE, DamageType.FORCE),
                DivineSpellHandler::handleSpiritualWeapon);
        registerDivine(new Spell(MASS_HEALING_WORD, 3, false, Spell.School.DIVINE, null),
                ctx -> heal(ctx, ctx.getSlotLevel() - 2, 4));
        registerDivine(new Spell(SPIRIT_GUARDIANS, 3, true, Spell.School.DIVINE, DamageType.RADIANT),
                DivineSpellHandler::handleSpiritGuardians);
        logger.debug("Registered divine spells");
    }
    
    private static void registerDivine(Spell spell, SpellHandler handler) {
        SpellRegistry.register(spell, handler);
    }
    
    // Healing
    
    /**
     * Heal every target by its own roll of {@code count}d{@code sides} plus the
     * caster's spellcasting modifier. Disciple of Life adds 2 + slot level per
     * target; Blessed Healer heals the caster 2 + slot level when anyone else
     * was healed.
     */
    private static boolean heal(SpellContext ctx, int count, int sides) {
        Spellcaster caster = ctx.getCaster();
        int bonus = caster.getAbility(caster.getSpellAbility());
        if (caster.hasFeature(Feature.DISCIPLE_OF_LIFE)) {
            bonus += 2 + ctx.getSlotLevel();
        }
        boolean healedOther = false;
        for (Combatant target : ctx.getTargets()) {
            target.heal(ctx.getDice().roll(Math.max(1, count), sides) + bonus, caster);
            if (target != caster) healedOther = true;
        }
        if (healedOther && caster.hasFeature(Feature.BLESSED_HEALER)) {
            caster.heal(2 + ctx.getSlotLevel(), caster);
        }
        return true;
    }
    
    private static boolean handleAid(SpellContext ctx) {
        int bonus = 5 * (ctx.getSlotLevel() - 1);
        boolean any = false;
        for (Combatant target : ctx.getTargets()) {
            if (target.grantAid(bonus)) any = true;
        }
        return any;
    }
    
    // Buffs
    
    private static boolean handleBless(SpellContext ctx) {
        for (Combatant target : ctx.getTargets()) {
            BlessEffect bless = new BlessEffect(ctx.getCaster(), target);
            target.attach(bless);
            ctx.getConcentration().link(bless);
        }
        return true;
    }
    
    // Damage
    
    private static boolean handleSacredFlame(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        Combatant target = ctx.getTarget();
        int amount = ctx.getDice().roll(caster.cantripDice(), 8);
        target.savingThrowForDamage(Ability.DEXTERITY, caster.spellSaveDc(), SaveType.MAGIC,
                Damage.of(amount, DamageType.RADIANT), caster.hasFeature(Feature.POTENT_CANTRIP), caster);
        return true;
    }
    
    private static boolean handleGuidingBolt(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        Combatant target = ctx.getTarget();
        Weapon bolt = caster.spellAttack(GUIDING_BOLT, Dice.of(3 + ctx.getSlotLevel(), 6), DamageType.RADIANT);
        AttackResult result = bolt.attack(caster, target, AttackOptions.NONE);
        if (result.isHit() && target.isConscious()) {
            target.attach(new GuidingBoltMark(caster, target));
        }
        return true;
    }
    
    /** Summon the weapon and attack with it at once. */
    private static boolean handleSpiritualWeapon(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        Weapon weapon = Weapon.builder(SPIRITUAL_WEAPON)
                .dice(Dice.of(Math.max(1, ctx.getSlotLevel() / 2), 8))
                .damageType(DamageType.FORCE)
                .ability(caster.getSpellAbility())
                .attackBonus(caster.getSpellAttackItemBonus())
                .build();
        caster.attach(new SpiritualWeaponEffect(caster, weapon));
        weapon.attack(caster, ctx.getTarget(), AttackOptions.NONE);
        return true;
    }
    
    private static boolean handleSpiritGuardians(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        for (Combatant target : ctx.getTargets()) {
            SpiritGuardiansEffect guardians =
                    new SpiritGuardiansEffect(caster, target, ctx.getSlotLevel(), caster.spellSaveDc());
            target.attach(guardians);
            ctx.getConcentration().link(guardians);
        }
        return true;
    }
}
