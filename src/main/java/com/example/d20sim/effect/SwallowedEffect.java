package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Damage;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.Condition;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.SaveType;
import com.example.d20sim.util.Dice;

import java.util.EnumSet;
import java.util.Set;

/**
 * Inside the swallower: blinded, restrained and digested at the start of each
 * of the swallower's turns. If the bearer deals at least the threshold in one
 * of its own turns, the swallower makes a Constitution save or regurgitates
 * everything it has swallowed. A threshold of 0 means it never does. The
 * bearer comes out prone.
 */
public class SwallowedEffect extends Duration {

    private static final Set<Condition> CONDITIONS =
            EnumSet.of(Condition.SWALLOWED, Condition.BLINDED, Condition.RESTRAINED);

    private final Dice digestion;
    private final DamageType digestionType;
    private final int regurgitateThreshold;
    private final int regurgitateDc;

    /** Damage the bearer has dealt the swallower since its turn started */
    private int damageThisTurn;

    public SwallowedEffect(Combatant swallower, Combatant target, Dice digestion, DamageType digestionType,
                           int regurgitateThreshold, int regurgitateDc) {
        super("Swallow", target, swallower, UNTIL_ENDED, Clock.NONE);
        this.digestion = digestion;
        this.digestionType = digestionType;
        this.regurgitateThreshold = regurgitateThreshold;
        this.regurgitateDc = regurgitateDc;
    }

    public int getDamageThisTurn() { return damageThisTurn; }

    @Override
    public Set<Condition> getConditions() {
        return CONDITIONS;
    }

    @Override
    public boolean endsWhenKeeperFalls() {
        return true;
    }

    @Override
    public void onApply() {
        bearer.endConcentration();
    }

    @Override
    public void onKeeperTurnStart(Encounter encounter) {
        if (digestion != null && keeper.isConscious()) {
            bearer.takeDamage(Damage.of(digestion.roll(encounter.getDice()), digestionType), keeper, false);
        }
    }

    @Override
    public void onKeeperDamaged(int amount, Combatant source) {
        if (source == bearer) {
            damageThisTurn += amount;
        }
    }

    @Override
    public void onBearerTurnStart(Encounter encounter) {
        damageThisTurn = 0;
    }

    @Override
    public void onBearerTurnEnd(Encounter encounter) {
        if (regurgitateThreshold <= 0 || damageThisTurn < regurgitateThreshold || !keeper.isConscious()) {
            return;
        }
        if (!keeper.savingThrow(Ability.CONSTITUTION, regurgitateDc, SaveType.ORDINARY)) {
            keeper.release(null, Condition.SWALLOWED);
        }
    }

    @Override
    protected void onEnd() {
        bearer.knockProne();
    }
}
