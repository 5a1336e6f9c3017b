package com.example.d20sim.effect;

import com.example.d20sim.combat.ActionSlot;
import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.combat.TraceEvent;
import com.example.d20sim.model.Condition;
import com.example.d20sim.model.Skill;

import java.util.EnumSet;
import java.util.Set;

/**
 * Held by a grappler until it escapes, the grappler lets go or drops.
 *
 * <p>A restraining grapple is worth escaping: the bearer spends its action at
 * the start of each turn on an Athletics or Acrobatics check, whichever is
 * better, against the escape DC.
 */
public class GrappledEffect extends Duration {

    private final boolean restraining;
    private final int escapeDc;

    public GrappledEffect(Combatant grappler, Combatant target, boolean restraining, int escapeDc) {
        super("Grapple", target, grappler, UNTIL_ENDED, Clock.NONE);
        this.restraining = restraining;
        this.escapeDc = escapeDc;
    }

    public boolean isRestraining() { return restraining; }

    public int getEscapeDc() { return escapeDc; }

    @Override
    public Set<Condition> getConditions() {
        return restraining ? EnumSet.of(Condition.GRAPPLED, Condition.RESTRAINED) : EnumSet.of(Condition.GRAPPLED);
    }

    @Override
    public boolean endsWhenKeeperFalls() {
        return true;
    }

    @Override
    public void onBearerTurnStart(Encounter encounter) {
        if (!restraining || !bearer.isConscious() || bearer.isIncapacitated()
                || !bearer.hasSlot(ActionSlot.ACTION)) {
            return;
        }
        bearer.spendSlot(ActionSlot.ACTION);
        Skill skill = bearer.skillModifier(Skill.ATHLETICS) >= bearer.skillModifier(Skill.ACROBATICS)
                ? Skill.ATHLETICS : Skill.ACROBATICS;
        int check = bearer.rollSkill(skill);
        boolean escaped = check >= escapeDc;
        bearer.getContext().getTrace().record(TraceEvent.Type.ABILITY, bearer, "Escape grapple", keeper, check, 0,
                (escaped ? "success" : "failure") + " vs DC " + escapeDc);
        if (escaped) {
            end();
        }
    }
}
