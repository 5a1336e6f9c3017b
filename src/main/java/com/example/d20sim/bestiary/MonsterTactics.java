package com.example.d20sim.bestiary;

import com.example.d20sim.combat.*;
import com.example.d20sim.effect.GrappledEffect;
import com.example.d20sim.effect.ParalyzedEffect;
import com.example.d20sim.effect.SwallowedEffect;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.Condition;
import com.example.d20sim.model.Feature;
import com.example.d20sim.model.SaveType;
import com.example.d20sim.util.Dice;

import java.util.List;

import static com.example.d20sim.bestiary.MonsterBehavior.*;

/**
 * Turns a monster's behaviors into its turn plan. The first listed attack is
 * the main weapon; the second is the bite used by Rampage and against
 * paralyzed targets. A grappler holds one foe at a time and attacks it first.
 */
class MonsterTactics {
    
    static final Dice MARTIAL_ADVANTAGE_DICE = Dice.of(2, 6);
    static final int PARALYSIS_ROUNDS = 10;
    
    private final Monster monster;
    private final MonsterTemplate template;
    
    MonsterTactics(Monster monster, MonsterTemplate template) {
        this.monster = monster;
        this.template = template;
    }
    
    TurnPlan plan() {
        TurnPlan.Builder plan = TurnPlan.builder()
                .step(Tactic.of(template.getAttacks().get(0).getName(), ActionSlot.ACTION, this::attackAction));
        if (template.hasBehavior(NIMBLE_ESCAPE)) {
            plan.step(Tactic.of("Hide", ActionSlot.BONUS_ACTION, e -> {
                monster.hide();
                return true;
            }));
        }
        return plan.build();
    }
    
    private boolean attackAction(Encounter encounter) {
        for (Combatant held : monster.getHeld(Condition.GRAPPLED)) {
            if (!held.isConscious()) monster.release(held, Condition.GRAPPLED);
        }
        boolean attacked = false;
        for (int i = 0; i < template.getAttacksPerRound(); i++) {
            Combatant target = grappledFoe();
            if (target == null) target = encounter.chooseTarget(monster);
            if (target == null) break;
            attack(encounter, target);
            attacked = true;
        }
        return attacked;
    }
    
    private Combatant grappledFoe() {
        List<Combatant> held = monster.getHeld(Condition.GRAPPLED);
        return held.isEmpty() ? null : held.get(0);
    }
    
    private void attack(Encounter encounter, Combatant target) {
        List<Weapon> attacks = template.getAttacks();
        boolean grappled = monster.getHeld(Condition.GRAPPLED).contains(target);
        boolean allyStanding = encounter.livingAllies(monster).size() > 1;
        boolean paralyzing = template.hasBehavior(PARALYZING_CLAWS);
        
        Weapon weapon = attacks.get(0);
        if (paralyzing && target.hasCondition(Condition.PARALYZED)) {
            weapon = attacks.get(1);
        }
        AttackOptions options = AttackOptions.NONE;
        if (template.hasBehavior(PACK_TACTICS) && allyStanding) {
            options = options.advantage(true);
        }
        if (template.hasBehavior(MARTIAL_ADVANTAGE) && allyStanding) {
            options = options.extraDice(MARTIAL_ADVANTAGE_DICE);
        }
        AttackResult result = weapon.attack(monster, target, options);
        
        if (result.isHit() && target.isConscious()) {
            if (template.hasBehavior(KNOCKDOWN) && !target.hasCondition(Condition.PRONE)
                    && !target.savingThrow(Ability.STRENGTH, saveDc(Ability.STRENGTH), SaveType.ORDINARY)) {
                target.knockProne();
            }
            if (paralyzing && weapon == attacks.get(0) && !target.hasFeature(Feature.GHOUL_PARALYSIS_IMMUNITY)) {
                int dc = saveDc(Ability.CONSTITUTION);
                if (!target.savingThrow(Ability.CONSTITUTION, dc, SaveType.ORDINARY)) {
                    target.attach(new ParalyzedEffect(monster, target, PARALYSIS_ROUNDS, dc));
                }
            }
            if (template.hasBehavior(GRAPPLE) && weapon == attacks.get(0)) {
                grappleOrSwallow(target, grappled);
            }
        }
        if (template.hasBehavior(RAMPAGE) && !target.isConscious() && monster.hasSlot(ActionSlot.BONUS_ACTION)) {
            Combatant next = encounter.chooseTarget(monster);
            if (next != null) {
                monster.spendSlot(ActionSlot.BONUS_ACTION);
                attacks.get(1).attack(monster, next, AttackOptions.NONE);
            }
        }
    }
    
    /** A hit on the held foe swallows it if the monster's gullet is empty; otherwise a free monster grapples. */
    private void grappleOrSwallow(Combatant target, boolean grappled) {
        if (grappled) {
            if (template.hasBehavior(SWALLOW) && monster.getHeld(Condition.SWALLOWED).isEmpty()) {
                monster.release(target, Condition.GRAPPLED);
                target.attach(new SwallowedEffect(monster, target, template.getDigestionDice(),
                        template.getDigestionType(), template.getRegurgitateThreshold(),
                        template.getRegurgitateDc()));
            }
        } else if (monster.getHeld(Condition.GRAPPLED).isEmpty()) {
            target.attach(new GrappledEffect(monster, target, true, monster.escapeDc()));
        }
    }
    
    private int saveDc(Ability ability) {
        return 8 + monster.getProficiency() + monster.getAbility(ability);
    }
}
