package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Weapon;

/**
 * A floating spectral weapon the caster can attack with as a bonus action.
 */
public class SpiritualWeaponEffect extends Duration {
    
    private final Weapon weapon;
    
    public SpiritualWeaponEffect(Combatant caster, Weapon weapon) {
        super("Spiritual Weapon", caster, caster, Combatant.STANDARD_DURATION_ROUNDS, Clock.KEEPER_TURN_START);
        this.weapon = weapon;
    }
    
    public Weapon getWeapon() { return weapon; }
}
