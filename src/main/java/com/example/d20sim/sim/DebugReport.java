package com.example.d20sim.sim;

import com.example.d20sim.combat.TraceEvent;
import com.example.d20sim.day.DayResult;

import java.util.Collections;
import java.util.List;

/**
 * A single traced day: its result and every recorded event in order.
 */
public class DebugReport {
    
    private final DayResult result;
    private final List<TraceEvent> events;
    
    public DebugReport(DayResult result, List<TraceEvent> events) {
        this.result = result;
        this.events = Collections.unmodifiableList(events);
    }
    
    public DayResult getResult() { return result; }
    
    public List<TraceEvent> getEvents() { return events; }
    
    /** One event per line. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (TraceEvent event : events) {
            sb.append(event).append('\n');
        }
        sb.append("Survivors: ").append(result.getSurvivors()).append('/').append(result.getPartySize());
        if (result.isSimultaneousDefeat()) {
            sb.append(" (simultaneous defeat)");
        }
        return sb.toString();
    }
}
