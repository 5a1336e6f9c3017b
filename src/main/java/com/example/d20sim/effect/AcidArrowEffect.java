package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Damage;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.model.DamageType;

/**
 * Lingering acid from Melf's Acid Arrow, burning once at the end of the
 * target's next turn.
 */
public class AcidArrowEffect extends Duration {
    
    private final int slotLevel;
    
    public AcidArrowEffect(Combatant caster, Combatant target, int slotLevel) {
        super("Melf's Acid Arrow", target, caster, UNTIL_ENDED, Clock.NONE);
        this.slotLevel = slotLevel;
    }
    
    @Override
    public void onBearerTurnEnd(Encounter encounter) {
        int amount = encounter.getDice().roll(slotLevel, 4);
        bearer.takeDamage(Damage.of(amount, DamageType.ACID), keeper, false);
        end();
    }
}
