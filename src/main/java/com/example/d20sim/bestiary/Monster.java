package com.example.d20sim.bestiary;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.AttackOptions;
import com.example.d20sim.combat.Damage;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.combat.TraceEvent;
import com.example.d20sim.combat.TurnPlan;
import com.example.d20sim.combat.Weapon;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.Feature;
import com.example.d20sim.model.SaveType;
import com.example.d20sim.model.Team;

import java.util.List;

/**
 * A monster spawned from a {@link MonsterTemplate}.
 */
public class Monster extends Combatant {
    
    private final MonsterTemplate template;
    
    /** Index of the lair action used next */
    private int nextLairAction;
    
    public Monster(String name, MonsterTemplate template) {
        super(name, Team.MONSTERS);
        this.template = template;
    }
    
    public MonsterTemplate getTemplate() { return template; }
    
    @Override
    protected void initializeFeatures() {
        for (Ability a : Ability.values()) {
            abilities.put(a, template.getAbility(a));
        }
        armorType = template.getArmorType();
        baseArmorClass = template.getArmorClass();
        proficiency = template.getProficiency();
        hitDieSides = template.getHitDieSides();
        totalHitDice = template.getHitDice();
        saveProficiencies.addAll(template.getSaveProficiencies());
        skillProficiencies.addAll(template.getSkillProficiencies());
        skillExpertise.addAll(template.getSkillExpertise());
        immunities.addAll(template.getImmunities());
        resistances.addAll(template.getResistances());
        vulnerabilities.addAll(template.getVulnerabilities());
        features.addAll(template.getTraits());
        undeadRating = template.getUndeadRating();
        construct = template.isConstruct();
        legendaryActions = template.getLegendaryActions();
    }
    
    @Override
    protected int computeMaxHitPoints() {
        int rolled = template.getHitPointDice().roll(dice()) + template.getHitPointBonus();
        return Math.max(1, rolled + totalHitDice * getAbility(Ability.CONSTITUTION));
    }
    
    @Override
    protected TurnPlan buildTurnPlan() {
        return new MonsterTactics(this, template).plan();
    }
    
    @Override
    public void resetConditions() {
        super.resetConditions();
        nextLairAction = 0;
    }
    
    /** DC to escape this monster's grapple. */
    public int escapeDc() {
        Integer dc = template.getEscapeDc();
        return dc != null ? dc : 8 + getProficiency() + getAbility(Ability.STRENGTH);
    }
    
    // Lair and legendary actions
    
    @Override
    public boolean hasLairAction() {
        return !template.getLairActions().isEmpty();
    }
    
    /** The stat block's lair actions in turn, starting over each encounter. */
    @Override
    protected void lairAction(Encounter encounter) {
        List<LairAction> actions = template.getLairActions();
        LairAction action = actions.get(nextLairAction);
        nextLairAction = (nextLairAction + 1) % actions.size();
        action.resolve(this, encounter);
    }
    
    @Override
    protected void legendaryAction(Encounter encounter) {
        Weapon weapon = template.getLegendaryAttack();
        Combatant target = encounter.chooseTarget(this);
        if (weapon != null && target != null) {
            weapon.attack(this, target, AttackOptions.NONE);
        }
    }
    
    /** Undead Fortitude: a Constitution save of 5 + damage taken leaves it at 1 hit point, unless radiant. */
    @Override
    protected boolean preventDropping(Damage damage, int total) {
        if (!hasFeature(Feature.UNDEAD_FORTITUDE) || damage.includes(DamageType.RADIANT)) {
            return false;
        }
        if (savingThrow(Ability.CONSTITUTION, 5 + total, SaveType.ORDINARY)) {
            setHitPoints(1);
            trace().note(TraceEvent.Type.ABILITY, this, "Undead Fortitude", null, "stays at 1 hp");
            return true;
        }
        return false;
    }
}
