package com.example.d20sim.party;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.combat.TraceEvent;
import com.example.d20sim.combat.Weapon;
import com.example.d20sim.effect.ConcentrationEffect;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.spell.Spell;
import com.example.d20sim.spell.SpellContext;
import com.example.d20sim.spell.SpellRegistry;
import com.example.d20sim.resource.SpellSlots;
import com.example.d20sim.util.Dice;

import java.util.List;

/**
 * A player character with full-caster spell slots.
 */
public abstract class Spellcaster extends PlayerCharacter {
    
    /** Slots per spell level for full casters of levels 1 to 8 */
    private static final int[][] SLOT_TABLE = {
        {2},
        {3},
        {4, 2},
        {4, 3},
        {4, 3, 2},
        {4, 3, 3},
        {4, 3, 3, 1},
        {4, 3, 3, 2},
    };
    
    protected final Ability spellAbility;
    protected SpellSlots slots;
    /** Bonus to spell attack rolls from a magic focus */
    protected int spellAttackItemBonus = 0;
    
    protected Spellcaster(String name, int level, Ability spellAbility) {
        super(name, level);
        this.spellAbility = spellAbility;
    }
    
    public static int[] slotsForLevel(int level) {
        return SLOT_TABLE[level - 1].clone();
    }
    
    protected void initializeSpellSlots() {
        slots = new SpellSlots(slotsForLevel(level));
        addResource(slots);
    }
    
    public SpellSlots getSlots() { return slots; }
    
    public Ability getSpellAbility() { return spellAbility; }
    
    public int getSpellAttackItemBonus() { return spellAttackItemBonus; }
    
    public int spellSaveDc() {
        return 8 + getAbility(spellAbility) + proficiency;
    }
    
    /** Number of damage dice for cantrips at this character level. */
    public int cantripDice() {
        if (level >= 17) return 4;
        if (level >= 11) return 3;
        if (level >= 5) return 2;
        return 1;
    }
    
    /** A ranged spell attack; the spellcasting modifier is not added to damage. */
    public Weapon spellAttack(String name, Dice dice, DamageType type) {
        return Weapon.builder(name)
                .dice(dice)
                .damageType(type)
                .ability(spellAbility)
                .attackBonus(spellAttackItemBonus)
                .addAbilityToDamage(false)
                .build();
    }
    
    /** Whether spell slots may be spent in this encounter under the rationing schedule. */
    public boolean maySpendSlot() {
        return mayUse(SpellSlots.RESOURCE_NAME);
    }
    
    /**
     * Cast a spell at the given slot level. Nothing is spent when there are no targets.
     * @return true if the spell was cast
     * @throws IllegalArgumentException for an unknown spell or a slot below the spell's level
     */
    public boolean cast(String spellName, int slotLevel, List<Combatant> targets, Encounter encounter) {
        Spell spell = SpellRegistry.getSpell(spellName);
        if (spell == null) {
            throw new IllegalArgumentException("Unknown spell: " + spellName);
        }
        if (targets == null || targets.isEmpty()) {
            return false;
        }
        if (!spell.isCantrip()) {
            if (slotLevel < spell.getLevel()) {
                throw new IllegalArgumentException(spellName + " needs a slot of level " + spell.getLevel()
                        + ", got " + slotLevel);
            }
            slots.spend(slotLevel);
        }
        trace().note(TraceEvent.Type.SPELL, this, spell.getName(), targets.get(0),
                (spell.isCantrip() ? "cantrip" : "level " + slotLevel)
                + (targets.size() > 1 ? ", " + targets.size() + " targets" : ""));
        
        SpellContext ctx = new SpellContext(this, spell, spell.isCantrip() ? 0 : slotLevel, targets, encounter);
        if (spell.isConcentration()) {
            ConcentrationEffect concentration = new ConcentrationEffect(spell.getName(), this);
            beginConcentration(concentration);
            ctx.setConcentration(concentration);
        }
        return SpellRegistry.getHandler(spellName).cast(ctx);
    }
    
    /** Cast with the highest slot available at or above the spell's level. */
    public boolean castHighest(String spellName, List<Combatant> targets, Encounter encounter) {
        int slot = slots.highestAvailable(SpellRegistry.getSpell(spellName).getLevel());
        return slot > 0 && cast(spellName, slot, targets, encounter);
    }
    
    /** Cast with the lowest slot available at or above the spell's level. */
    public boolean castLowest(String spellName, List<Combatant> targets, Encounter encounter) {
        int slot = slots.lowestAvailable(SpellRegistry.getSpell(spellName).getLevel());
        return slot > 0 && cast(spellName, slot, targets, encounter);
    }
    
    public boolean castCantrip(String spellName, List<Combatant> targets, Encounter encounter) {
        return cast(spellName, 0, targets, encounter);
    }
}
