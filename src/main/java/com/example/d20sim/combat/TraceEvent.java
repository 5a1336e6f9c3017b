package com.example.d20sim.combat;

/**
 * One entry of a day's combat trace. Immutable; {@link #toString()} is stable
 * so that two traces from the same seed compare equal line by line.
 */
public class TraceEvent {
    
    public enum Type {
        ENCOUNTER_START,    // A new encounter began
        INITIATIVE,         // Initiative roll
        TURN,               // A combatant's turn began
        ATTACK,             // Attack roll against armor class
        SAVE,               // Saving throw
        DAMAGE,             // Hit points lost
        HEAL,               // Hit points regained
        CONDITION,          // Condition or duration gained or lost
        SPELL,              // Spell cast
        ABILITY,            // Class feature or monster trait used
        REST,               // Short rest or end of day recovery
        OUTCOME             // Encounter or day concluded
    }
    
    private final int encounter;
    private final int round;
    private final Type type;
    private final String actor;
    private final String action;
    private final String target;
    private final Integer roll;
    private final int hpDelta;
    private final String detail;
    
    public TraceEvent(int encounter, int round, Type type, String actor, String action,
                      String target, Integer roll, int hpDelta, String detail) {
        this.encounter = encounter;
        this.round = round;
        this.type = type;
        this.actor = actor;
        this.action = action;
        this.target = target;
        this.roll = roll;
        this.hpDelta = hpDelta;
        this.detail = detail;
    }
    
    public int getEncounter() { return encounter; }
    public int getRound() { return round; }
    public Type getType() { return type; }
    public String getActor() { return actor; }
    public String getAction() { return action; }
    public String getTarget() { return target; }
    public Integer getRoll() { return roll; }
    public int getHpDelta() { return hpDelta; }
    public String getDetail() { return detail; }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("[E").append(encounter).append(" R").append(round).append("] ");
        sb.append(type);
        if (actor != null) sb.append(' ').append(actor);
        if (action != null) sb.append(": ").append(action);
        if (target != null) sb.append(" -> ").append(target);
        if (roll != null) sb.append(" roll=").append(roll);
        if (hpDelta != 0) sb.append(" hp").append(hpDelta > 0 ? "+" : "").append(hpDelta);
        if (detail != null && !detail.isEmpty()) sb.append(" (").append(detail).append(')');
        return sb.toString();
    }
}
