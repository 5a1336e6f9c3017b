package com.example.d20sim.day;

import com.example.d20sim.combat.EncounterOutcome;
import com.example.d20sim.resource.RechargeType;

import java.util.*;

/**
 * Day-scoped state passed explicitly into every encounter: where in the day
 * we are, how long the rest intervals are, and what has happened so far.
 */
public class DayState {
    
    public static final int DEFAULT_ENCOUNTERS_PER_DAY = 6;
    public static final int DEFAULT_ENCOUNTERS_PER_SHORT_REST = 2;
    
    private final int encountersPerDay;
    private final int encountersPerShortRest;
    private int encounterIndex = 0;
    private DayPhase phase = DayPhase.ENCOUNTER;
    private boolean simultaneousDefeat = false;
    private final List<EncounterOutcome> outcomes = new ArrayList<>();
    
    public DayState() {
        this(DEFAULT_ENCOUNTERS_PER_DAY, DEFAULT_ENCOUNTERS_PER_SHORT_REST);
    }
    
    public DayState(int encountersPerDay, int encountersPerShortRest) {
        if (encountersPerDay < 1 || encountersPerShortRest < 1) {
            throw new IllegalArgumentException("Encounter counts must be positive: "
                    + encountersPerDay + "/" + encountersPerShortRest);
        }
        this.encountersPerDay = encountersPerDay;
        this.encountersPerShortRest = encountersPerShortRest;
    }
    
    public int getEncountersPerDay() { return encountersPerDay; }
    
    public int getEncountersPerShortRest() { return encountersPerShortRest; }
    
    /** 0-based index of the current (or next) encounter. */
    public int getEncounterIndex() { return encounterIndex; }
    
    public void setEncounterIndex(int encounterIndex) {
        this.encounterIndex = encounterIndex;
    }
    
    public int getEncountersSinceShortRest() {
        return encounterIndex % encountersPerShortRest;
    }
    
    public int getEncountersSinceLongRest() {
        return encounterIndex;
    }
    
    /** Whether a short rest follows the encounter at the current index. */
    public boolean isShortRestDue() {
        int played = encounterIndex + 1;
        return played % encountersPerShortRest == 0 && played < encountersPerDay;
    }
    
    /** Position within the rest interval that refills resources of the given type. */
    public int indexWithinInterval(RechargeType recharge) {
        return recharge == RechargeType.SHORT_REST ? getEncountersSinceShortRest() : getEncountersSinceLongRest();
    }
    
    /**
     * Number of encounters in the current interval for resources of the given
     * type. The last short-rest interval of the day may be shorter.
     */
    public int intervalLength(RechargeType recharge) {
        if (recharge == RechargeType.LONG_REST) {
            return encountersPerDay;
        }
        int start = encounterIndex - getEncountersSinceShortRest();
        return Math.min(encountersPerShortRest, encountersPerDay - start);
    }
    
    public DayPhase getPhase() { return phase; }
    
    public void setPhase(DayPhase phase) {
        this.phase = phase;
    }
    
    public boolean isSimultaneousDefeat() { return simultaneousDefeat; }
    
    public void recordOutcome(EncounterOutcome outcome) {
        outcomes.add(outcome);
        if (outcome == EncounterOutcome.SIMULTANEOUS_DEFEAT) {
            simultaneousDefeat = true;
        }
    }
    
    public List<EncounterOutcome> getOutcomes() {
        return Collections.unmodifiableList(outcomes);
    }
}
