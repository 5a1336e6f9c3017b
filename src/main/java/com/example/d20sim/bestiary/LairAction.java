package com.example.d20sim.bestiary;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Damage;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.combat.Targeting;
import com.example.d20sim.combat.TraceEvent;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.SaveType;
import com.example.d20sim.util.Dice;

import java.util.List;

/**
 * A lair action: a saving throw forced on a few random foes at initiative
 * count 20. Damage is rolled once for every target; a failed save may also
 * knock the target prone. The DC is 8 + proficiency + the owner's modifier in
 * {@code dcAbility}. Immutable.
 */
public class LairAction {

    private final String name;
    private final Dice damage;
    private final DamageType damageType;
    private final Ability save;
    private final Ability dcAbility;
    private final boolean halfOnSuccess;
    private final boolean knockProne;
    private final int targets;

    public LairAction(String name, Dice damage, DamageType damageType, Ability save, Ability dcAbility,
                      boolean halfOnSuccess, boolean knockProne, int targets) {
        if (damage != null && damageType == null) {
            throw new IllegalArgumentException(name + " deals damage of no type");
        }
        if (damage == null && !knockProne) {
            throw new IllegalArgumentException(name + " neither deals damage nor knocks prone");
        }
        if (targets < 1) {
            throw new IllegalArgumentException(name + " must have at least one target");
        }
        this.name = name;
        this.damage = damage;
        this.damageType = damageType;
        this.save = save;
        this.dcAbility = dcAbility;
        this.halfOnSuccess = halfOnSuccess;
        this.knockProne = knockProne;
        this.targets = targets;
    }

    public String getName() { return name; }
    public Dice getDamage() { return damage; }
    public DamageType getDamageType() { return damageType; }
    public Ability getSave() { return save; }
    public Ability getDcAbility() { return dcAbility; }
    public boolean isHalfOnSuccess() { return halfOnSuccess; }
    public boolean knocksProne() { return knockProne; }
    public int getTargets() { return targets; }

    public int saveDc(Combatant owner) {
        return 8 + owner.getProficiency() + owner.getAbility(dcAbility);
    }

    void resolve(Combatant owner, Encounter encounter) {
        List<Combatant> chosen = encounter.chooseTargets(owner, targets, Targeting.any());
        if (chosen.isEmpty()) return;
        int dc = saveDc(owner);
        int amount = damage == null ? 0 : damage.roll(encounter.getDice());
        encounter.getTrace().note(TraceEvent.Type.ABILITY, owner, name, null, chosen.size() + " targets");
        for (Combatant target : chosen) {
            boolean saved = target.savingThrow(save, dc, SaveType.ORDINARY);
            if (damage != null && (!saved || halfOnSuccess)) {
                Damage dealt = Damage.of(amount, damageType);
                target.takeDamage(saved ? dealt.half() : dealt, owner, false);
            }
            if (knockProne && !saved && target.isConscious()) {
                target.knockProne();
            }
        }
    }

    @Override
    public String toString() {
        return name + " (" + save.getAbbreviation() + " save, " + targets + " targets"
                + (damage != null ? ", " + damage + " " + damageType.name().toLowerCase() : "")
                + (knockProne ? ", prone" : "") + ")";
    }
}
