package com.example.d20sim.effect;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.combat.TraceEvent;
import com.example.d20sim.model.Condition;

import java.util.Collections;
import java.util.Set;

/**
 * A timed or triggered effect attached to a combatant (the bearer).
 *
 * <p>The countdown runs on a clock: the start or end of either the bearer's
 * turns or the keeper's turns. The keeper is usually whoever caused the
 * effect; Paralysis from a ghoul counts down on the ghoul's turns while the
 * paralyzed creature is the one trying to save. A negative round count means
 * the effect lasts until something ends it.
 */
public abstract class Duration {
    
    public enum Clock {
        BEARER_TURN_START,
        BEARER_TURN_END,
        KEEPER_TURN_START,
        KEEPER_TURN_END,
        /** No countdown; ended by a hook, by concentration or by the encounter */
        NONE
    }
    
    public static final int UNTIL_ENDED = -1;
    
    protected final String source;
    protected final Combatant bearer;
    protected final Combatant keeper;
    private final Clock clock;
    private int remainingRounds;
    private boolean ended = false;
    
    protected Duration(String source, Combatant bearer, Combatant keeper, int rounds, Clock clock) {
        this.source = source;
        this.bearer = bearer;
        this.keeper = keeper;
        this.remainingRounds = rounds;
        this.clock = clock;
    }
    
    public String getSource() { return source; }
    
    public Combatant getBearer() { return bearer; }
    
    public Combatant getKeeper() { return keeper; }
    
    public Clock getClock() { return clock; }
    
    public int getRemainingRounds() { return remainingRounds; }
    
    public boolean isEnded() { return ended; }
    
    /** Conditions the bearer has while this lasts. */
    public Set<Condition> getConditions() {
        return Collections.emptySet();
    }
    
    public final boolean grants(Condition condition) {
        return !ended && getConditions().contains(condition);
    }
    
    /** Whether losing hit points ends this effect. */
    public boolean endsOnDamage() {
        return false;
    }
    
    /** Whether the keeper dropping to 0 hit points ends this effect (grapples, swallowing). */
    public boolean endsWhenKeeperFalls() {
        return false;
    }
    
    /** Called once the duration is attached to its bearer. */
    public void onApply() {
    }
    
    public void onBearerTurnStart(Encounter encounter) {
    }
    
    public void onBearerTurnEnd(Encounter encounter) {
    }
    
    public void onKeeperTurnStart(Encounter encounter) {
    }
    
    /** The keeper lost {@code amount} hit points to {@code source}. */
    public void onKeeperDamaged(int amount, Combatant source) {
    }
    
    protected void onEnd() {
    }
    
    /** Count down one round; ends the effect when the count reaches zero. */
    public final void tick() {
        if (ended || remainingRounds < 0) return;
        remainingRounds--;
        if (remainingRounds <= 0) {
            end();
        }
    }
    
    public final void end() {
        if (ended) return;
        ended = true;
        bearer.detach(this);
        bearer.getContext().getTrace().note(TraceEvent.Type.CONDITION, keeper, source, bearer, "ended");
        onEnd();
    }
    
    @Override
    public String toString() {
        return source + " on " + bearer.getName()
                + (remainingRounds >= 0 ? " (" + remainingRounds + " rounds)" : "");
    }
}
