package com.example.d20sim.spell;

import com.example.d20sim.combat.AttackOptions;
import com.example.d20sim.combat.AttackResult;
import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Damage;
import com.example.d20sim.combat.Targeting;
import com.example.d20sim.combat.Weapon;
import com.example.d20sim.effect.AcidArrowEffect;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.Feature;
import com.example.d20sim.model.SaveType;
import com.example.d20sim.party.Spellcaster;
import com.example.d20sim.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers the arcane spells and resolves each of them. Area spells roll
 * damage once and apply it to every target.
 */
public class ArcaneSpellHandler {
    
    private static final Logger logger = LoggerFactory.getLogger(ArcaneSpellHandler.class);
    
    public static final String ACID_SPLASH = "Acid Splash";
    public static final String BLIGHT = "Blight";
    public static final String BURNING_HANDS = "Burning Hands";
    public static final String CHROMATIC_ORB = "Chromatic Orb";
    public static final String FIRE_BOLT = "Fire Bolt";
    public static final String FIREBALL = "Fireball";
    public static final String LIGHTNING_BOLT = "Lightning Bolt";
    public static final String MAGIC_MISSILE = "Magic Missile";
    public static final String MELFS_ACID_ARROW = "Melf's Acid Arrow";
    public static final String POISON_SPRAY = "Poison Spray";
    public static final String SCORCHING_RAY = "Scorching Ray";
    public static final String THUNDERWAVE = "Thunderwave";
    
    private ArcaneSpellHandler() {
    }
    
    static void registerAll() {
        // Cantrips
        registerArcane(new Spell(FIRE_BOLT, 0, false, Spell.School.ARCANE, DamageType.FIRE),
                ArcaneSpellHandler::handleFireBolt);
        registerArcane(new Spell(ACID_SPLASH, 0, false, Spell.School.ARCANE, DamageType.ACID),
                ctx -> saveCantrip(ctx, 6, DamageType.ACID, Ability.DEXTERITY));
        registerArcane(new Spell(POISON_SPRAY, 0, false, Spell.School.ARCANE, DamageType.POISON),
                ctx -> saveCantrip(ctx, 12, DamageType.POISON, Ability.CONSTITUTION));
        
        // 1st level
        registerArcane(new Spell(BURNING_HANDS, 1, false, Spell.School.ARCANE, DamageType.FIRE),
                ctx -> area(ctx, Dice.of(2 + ctx.getSlotLevel(), 6), DamageType.FIRE, Ability.DEXTERITY));
        registerArcane(new Spell(THUNDERWAVE, 1, false, Spell.School.ARCANE, DamageType.THUNDER),
                ctx -> area(ctx, Dice.of(1 + ctx.getSlotLevel(), 8), DamageType.THUNDER, Ability.CONSTITUTION));
        registerArcane(new Spell(MAGIC_MISSILE, 1, false, Spell.School.ARCANE, DamageType.FORCE),
                ArcaneSpellHandler::handleMagicMissile);
        registerArcane(new Spell(CHROMATIC_ORB, 1, false, Spell.School.ARCANE, DamageType.COLD),
                ArcaneSpellHandler::handleChromaticOrb);
        
        // 2nd level
        registerArcane(new Spell(MELFS_ACID_ARROW, 2, false, Spell.School.ARCANE, DamageType.ACID),
                ArcaneSpellHandler::handleAcidArrow);
        registerArcane(new Spell(SCORCHING_RAY, 2, false, Spell.School.ARCANE, DamageType.FIRE),
                ArcaneSpellHandler::handleScorchingRay);
        
        // 3rd level
        registerArcane(new Spell(FIREBALL, 3, false, Spell.School.ARCANE, DamageType.FIRE),
                ctx -> area(ctx, Dice.of(5 + ctx.getSlotLevel(), 6), DamageType.FIRE, Ability.DEXTERITY));
        registerArcane(new Spell(LIGHTNING_BOLT, 3, false, Spell.School.ARCANE, DamageType.LIGHTNING),
                ctx -> area(ctx, Dice.of(5 + ctx.getSlotLevel(), 6), DamageType.LIGHTNING, Ability.DEXTERITY));
        
        // 4th level
        registerArcane(new Spell(BLIGHT, 4, false, Spell.School.ARCANE, DamageType.NECROTIC),
                ArcaneSpellHandler::handleBlight);
        logger.debug("Registered arcane spells");
    }
    
    private static void registerArcane(Spell spell, SpellHandler handler) {
        SpellRegistry.register(spell, handler);
    }
    
    private static boolean handleFireBolt(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        Weapon bolt = caster.spellAttack(FIRE_BOLT, Dice.of(caster.cantripDice(), 10), DamageType.FIRE);
        bolt.attack(caster, ctx.getTarget(), AttackOptions.NONE);
        return true;
    }
    
    /** Save cantrip: full damage on a failure, nothing on a success unless Potent Cantrip. */
    private static boolean saveCantrip(SpellContext ctx, int sides, DamageType type, Ability save) {
        Spellcaster caster = ctx.getCaster();
        int amount = ctx.getDice().roll(caster.cantripDice(), sides);
        for (Combatant target : ctx.getTargets()) {
            target.savingThrowForDamage(save, caster.spellSaveDc(), SaveType.MAGIC, Damage.of(amount, type),
                    caster.hasFeature(Feature.POTENT_CANTRIP), caster);
        }
        return true;
    }
    
    /** Save for half against damage rolled once for all targets. */
    private static boolean area(SpellContext ctx, Dice dice, DamageType type, Ability save) {
        Spellcaster caster = ctx.getCaster();
        Damage damage = Damage.of(dice.roll(ctx.getDice()), type);
        for (Combatant target : ctx.getTargets()) {
            target.savingThrowForDamage(save, caster.spellSaveDc(), SaveType.MAGIC, damage, true, caster);
        }
        return true;
    }
    
    /** Every dart hits for the same d4 + 1; targets are the darts' destinations. */
    private static boolean handleMagicMissile(SpellContext ctx) {
        int amount = ctx.getDice().roll(4) + 1;
        for (Combatant target : ctx.getTargets()) {
            target.takeDamage(Damage.of(amount, DamageType.FORCE), ctx.getCaster(), false);
        }
        return true;
    }
    
    private static boolean handleChromaticOrb(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        Combatant target = ctx.getTarget();
        DamageType type = target.isImmuneTo(DamageType.COLD) ? DamageType.THUNDER : DamageType.COLD;
        caster.spellAttack(CHROMATIC_ORB, Dice.of(2 + ctx.getSlotLevel(), 8), type)
                .attack(caster, target, AttackOptions.NONE);
        return true;
    }
    
    /** Half damage on a miss; on a hit more acid burns at the end of the target's next turn. */
    private static boolean handleAcidArrow(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        Combatant target = ctx.getTarget();
        Dice dice = Dice.of(2 + ctx.getSlotLevel(), 4);
        AttackResult result = caster.spellAttack(MELFS_ACID_ARROW, dice, DamageType.ACID)
                .attack(caster, target, AttackOptions.NONE);
        if (!result.isHit()) {
            target.takeDamage(Damage.of(dice.roll(ctx.getDice()) / 2, DamageType.ACID), caster, false);
        } else if (target.isConscious()) {
            target.attach(new AcidArrowEffect(caster, target, ctx.getSlotLevel()));
        }
        return true;
    }
    
    /** One ray per slot level plus one, each aimed at a fresh random target. */
    private static boolean handleScorchingRay(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        Weapon ray = caster.spellAttack(SCORCHING_RAY, Dice.of(2, 6), DamageType.FIRE);
        Combatant target = ctx.getTarget();
        for (int i = 0; i < ctx.getSlotLevel() + 1; i++) {
            if (i > 0) {
                target = ctx.getEncounter().chooseTarget(caster, Targeting.notImmuneTo(DamageType.FIRE));
            }
            if (target == null) break;
            ray.attack(caster, target, AttackOptions.NONE);
        }
        return true;
    }
    
    private static boolean handleBlight(SpellContext ctx) {
        Spellcaster caster = ctx.getCaster();
        Combatant target = ctx.getTarget();
        if (target.isUndead() || target.isConstruct()) {
            return false;
        }
        int amount = ctx.getDice().roll(4 + ctx.getSlotLevel(), 8);
        target.savingThrowForDamage(Ability.CONSTITUTION, caster.spellSaveDc(), SaveType.MAGIC,
                Damage.of(amount, DamageType.NECROTIC), true, caster);
        return true;
    }
}
