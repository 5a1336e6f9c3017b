package com.example.d20sim.day;

import com.example.d20sim.combat.EncounterOutcome;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one adventuring day.
 */
public class DayResult {
    
    private final int survivors;
    private final int partySize;
    private final List<EncounterOutcome> outcomes;
    private final boolean simultaneousDefeat;
    private final List<String> survivorNames;
    
    public DayResult(int survivors, int partySize, List<EncounterOutcome> outcomes,
                     boolean simultaneousDefeat, List<String> survivorNames) {
        if (survivors < 0 || survivors > partySize) {
            throw new IllegalStateException("Survivors " + survivors + " outside [0, " + partySize + "]");
        }
        this.survivors = survivors;
        this.partySize = partySize;
        this.outcomes = Collections.unmodifiableList(outcomes);
        this.simultaneousDefeat = simultaneousDefeat;
        this.survivorNames = Collections.unmodifiableList(survivorNames);
    }
    
    /** Player characters above 0 hit points at the end of the day; 0 after a simultaneous defeat. */
    public int getSurvivors() { return survivors; }
    
    public int getPartySize() { return partySize; }
    
    public List<EncounterOutcome> getOutcomes() { return outcomes; }
    
    public int getEncountersPlayed() { return outcomes.size(); }
    
    public boolean isSimultaneousDefeat() { return simultaneousDefeat; }
    
    public List<String> getSurvivorNames() { return survivorNames; }
    
    @Override
    public String toString() {
        return "DayResult{survivors=" + survivors + "/" + partySize + ", outcomes=" + outcomes
                + (simultaneousDefeat ? ", simultaneous defeat" : "") + "}";
    }
}
