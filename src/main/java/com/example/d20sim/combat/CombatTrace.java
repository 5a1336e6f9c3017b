package com.example.d20sim.combat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Sink for action-level combat events. A recording trace keeps every event for
 * the debug report; a silent trace keeps nothing. Either way each event is
 * written to the log at DEBUG.
 */
public class CombatTrace {
    
    private static final Logger logger = LoggerFactory.getLogger(CombatTrace.class);
    
    private final boolean recording;
    private final List<TraceEvent> events = new ArrayList<>();
    private int encounter = 0;
    private int round = 0;
    
    private CombatTrace(boolean recording) {
        this.recording = recording;
    }
    
    public static CombatTrace recording() {
        return new CombatTrace(true);
    }
    
    public static CombatTrace silent() {
        return new CombatTrace(false);
    }
    
    public boolean isRecording() { return recording; }
    
    public void beginEncounter(int encounterNumber) {
        this.encounter = encounterNumber;
        this.round = 0;
    }
    
    public void setRound(int round) {
        this.round = round;
    }
    
    public int getEncounter() { return encounter; }
    
    public int getRound() { return round; }
    
    public void record(TraceEvent.Type type, Combatant actor, String action, Combatant target,
                       Integer roll, int hpDelta, String detail) {
        record(type, actor == null ? null : actor.getName(), action,
                target == null ? null : target.getName(), roll, hpDelta, detail);
    }
    
    public void record(TraceEvent.Type type, String actor, String action, String target,
                       Integer roll, int hpDelta, String detail) {
        if (!recording && !logger.isDebugEnabled()) {
            return;
        }
        TraceEvent event = new TraceEvent(encounter, round, type, actor, action, target, roll, hpDelta, detail);
        if (recording) {
            events.add(event);
        }
        logger.debug("{}", event);
    }
    
    /** Shorthand for an event with no roll or hit point change. */
    public void note(TraceEvent.Type type, Combatant actor, String action, Combatant target, String detail) {
        record(type, actor, action, target, null, 0, detail);
    }
    
    public List<TraceEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }
}
