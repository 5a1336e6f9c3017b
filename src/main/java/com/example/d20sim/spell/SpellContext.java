package com.example.d20sim.spell;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.effect.ConcentrationEffect;
import com.example.d20sim.party.Spellcaster;
import com.example.d20sim.util.DiceRoller;

import java.util.Collections;
import java.util.List;

/**
 * Everything a spell handler needs for one casting. The concentration effect
 * is set for concentration spells so that handlers can link their durations.
 */
public class SpellContext {
    private final Spellcaster caster;
    private final Spell spell;
    private final int slotLevel;
    private final List<Combatant> targets;
    private final Encounter encounter;
    private ConcentrationEffect concentration;
    
    public SpellContext(Spellcaster caster, Spell spell, int slotLevel, List<Combatant> targets, Encounter encounter) {
        this.caster = caster;
        this.spell = spell;
        this.slotLevel = slotLevel;
        this.targets = Collections.unmodifiableList(targets);
        this.encounter = encounter;
    }
    
    public Spellcaster getCaster() { return caster; }
    public Spell getSpell() { return spell; }
    public int getSlotLevel() { return slotLevel; }
    public List<Combatant> getTargets() { return targets; }
    public Combatant getTarget() { return targets.get(0); }
    public Encounter getEncounter() { return encounter; }
    public DiceRoller getDice() { return caster.getContext().getDice(); }
    
    public ConcentrationEffect getConcentration() { return concentration; }
    public void setConcentration(ConcentrationEffect concentration) { this.concentration = concentration; }
}
