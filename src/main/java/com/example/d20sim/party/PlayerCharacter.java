package com.example.d20sim.party;

import com.example.d20sim.combat.Combatant;
import com.example.d20sim.combat.Encounter;
import com.example.d20sim.combat.TraceEvent;
import com.example.d20sim.day.DayState;
import com.example.d20sim.model.Ability;
import com.example.d20sim.model.Team;
import com.example.d20sim.resource.LimitedResource;
import com.example.d20sim.resource.Loading;
import com.example.d20sim.resource.RationingSchedule;
import com.example.d20sim.resource.RechargeType;
import com.example.d20sim.resource.ResourceRationer;
import com.example.d20sim.util.Dice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A member of the party. Player characters last the whole day: hit points and
 * resources carry over between encounters, and limited resources are rationed
 * across the encounters of each rest interval.
 */
public abstract class PlayerCharacter extends Combatant {
    
    private static final Logger logger = LoggerFactory.getLogger(PlayerCharacter.class);
    
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 8;
    
    protected final int level;
    
    /** Resources spent according to a rationing schedule, with their loading */
    private final Map<String, Loading> rationed = new LinkedHashMap<>();
    private final Map<String, RationingSchedule> schedules = new HashMap<>();
    private final Map<String, Integer> intervalPositions = new HashMap<>();
    
    protected PlayerCharacter(String name, int level) {
        super(name, Team.PARTY);
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Party level " + level + " outside " + MIN_LEVEL + "-" + MAX_LEVEL);
        }
        this.level = level;
        this.proficiency = proficiencyForLevel(level);
        this.totalHitDice = level;
    }
    
    public static int proficiencyForLevel(int level) {
        return (level - 1) / 4 + 2;
    }
    
    public int getLevel() { return level; }
    
    /** Fixed hit points: full die at first level, the die's mean after that. */
    @Override
    protected int computeMaxHitPoints() {
        int mean = Dice.mean(hitDieSides);
        return Math.max(1, hitDieSides - mean + level * (mean + getAbility(Ability.CONSTITUTION)));
    }
    
    // Rationing
    
    /** Spend this resource according to a schedule with the given loading. */
    protected void ration(String resourceName, Loading loading) {
        rationed.put(resourceName, loading);
    }
    
    /**
     * Consult the rationing scheduler. At the first encounter of a rest interval
     * the schedule is recomputed from what is left of each rationed resource.
     */
    @Override
    public void startEncounter(Encounter encounter) {
        super.startEncounter(encounter);
        DayState day = encounter.getDayState();
        for (Map.Entry<String, Loading> entry : rationed.entrySet()) {
            LimitedResource resource = getResource(entry.getKey());
            if (resource == null) continue;
            RechargeType recharge = resource.getRechargeType();
            int position = day.indexWithinInterval(recharge);
            if (position == 0 || !schedules.containsKey(entry.getKey())) {
                RationingSchedule schedule = ResourceRationer.schedule(resource.getRemaining(),
                        day.intervalLength(recharge), entry.getValue());
                schedules.put(entry.getKey(), schedule);
                logger.debug("{} rations {} as {}", name, entry.getKey(), schedule);
            }
            intervalPositions.put(entry.getKey(), position);
        }
    }
    
    /**
     * Whether a use of the resource is available and not held in reserve for a
     * later encounter of the interval.
     */
    public boolean mayUse(String resourceName) {
        LimitedResource resource = getResource(resourceName);
        if (resource == null || !resource.isAvailable()) return false;
        RationingSchedule schedule = schedules.get(resourceName);
        if (schedule == null) return true;
        return schedule.mayUse(resource.getRemaining(), intervalPositions.getOrDefault(resourceName, 0));
    }
    
    public RationingSchedule getSchedule(String resourceName) {
        return schedules.get(resourceName);
    }
    
    // Day lifecycle
    
    /** Called once before the first encounter of the day. */
    public void startDay(DayState day) {
    }
    
    /**
     * Short rest: encounter state clears, class features run, short-rest
     * resources refill, then hit dice are spent while hit points are at or below
     * {@code max - min(max / 2, hit die size)}.
     */
    public void shortRest(DayState day) {
        resetConditions();
        onShortRest(day);
        for (LimitedResource resource : getResources()) {
            if (resource.getRechargeType() == RechargeType.SHORT_REST) {
                resource.recharge();
            }
        }
        
        int threshold = getMaxHitPoints() - Math.min(getMaxHitPoints() / 2, hitDieSides);
        while (isConscious() && getHitPoints() <= threshold && getHitDiceRemaining() > 0) {
            spendHitDie();
        }
        trace().note(TraceEvent.Type.REST, this, "Short rest", null,
                getHitPoints() + "/" + getMaxHitPoints() + " hp, " + getHitDiceRemaining() + " hit dice left");
    }
    
    /** Class features used during a short rest, before short-rest resources refill. */
    protected void onShortRest(DayState day) {
    }
    
    /** Last chance to act after the final encounter, before survivors are counted. */
    public void endOfDay(DayState day, List<Combatant> party) {
    }
}
