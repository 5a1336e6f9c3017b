package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Damage;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.DamageType;
import com.example.d20sim.model.SaveType;

/**
 * Spirits around the caster that burn a creature starting its turn among them.
 * A creature in several casters' guardians takes only the strongest.
 */
public class SpiritGuardiansEffect extends Duration {
    
    private final int diceCount;
    private final int saveDc;
    
    public SpiritGuardiansEffect(Combatant caster, Combatant target, int diceCount, int saveDc) {
        super("Spirit Guardians", target, caster, UNTIL_ENDED, Clock.NONE);
        this.diceCount = diceCount;
        this.saveDc = saveDc;
    }
    
    public int getDiceCount() { return diceCount; }
    
    @Override
    public void onBearerTurnStart(Encounter encounter) {
        if (!bearer.isConscious() || strongest() != this) {
            return;
        }
        int amount = encounter.getDice().roll(diceCount, 8);
        bearer.savingThrowForDamage(Ability.WISDOM, saveDc, SaveType.MAGIC,
                Damage.of(amount, DamageType.RADIANT), true, keeper);
    }
    
    private SpiritGuardiansEffect strongest() {
        SpiritGuardiansEffect best = null;
        for (SpiritGuardiansEffect other : bearer.getDurations(SpiritGuardiansEffect.class)) {
            if (best == null || other.diceCount > best.diceCount) best = other;
        }
        return best;
    }
}
