package com.example.d20sim.combat;

import com.example.d20sim.day.DayState;
import com.example.d20sim.model.Team;
import com.example.d20sim.util.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/**
 * One combat between the party and a group of monsters.
 * Runs NOT_STARTED -> ACTIVE -> CONCLUDED and is discarded afterwards.
 */
public class Encounter {
    
    private static final Logger logger = LoggerFactory.getLogger(Encounter.class);
    
    /** Rounds after which an encounter is called a stalemate */
    public static final int DEFAULT_MAX_ROUNDS = 100;
    
    /** Initiative count of lair actions; they lose ties */
    public static final int LAIR_INITIATIVE = 20;
    
    /** 1-based position of this encounter in the day */
    private final int number;
    
    private final List<Combatant> party;
    private final List<Combatant> monsters;
    private final DayState dayState;
    private final CombatContext context;
    private final int maxRounds;
    
    private EncounterState state = EncounterState.NOT_STARTED;
    private EncounterOutcome outcome;
    
    /** Combatants in initiative order, fixed once the encounter starts */
    private List<Combatant> turnOrder = Collections.emptyList();
    
    /** Turns and lair actions in the order they are played each round */
    private List<TurnSlot> slots = Collections.emptyList();
    
    private int round = 0;
    
    public Encounter(int number, List<? extends Combatant> party, List<? extends Combatant> monsters,
                     DayState dayState, CombatContext context, int maxRounds) {
        if (maxRounds < 1) {
            throw new IllegalArgumentException("maxRounds must be positive: " + maxRounds);
        }
        this.number = number;
        this.party = Collections.unmodifiableList(new ArrayList<>(party));
        this.monsters = Collections.unmodifiableList(new ArrayList<>(monsters));
        this.dayState = dayState;
        this.context = context;
        this.maxRounds = maxRounds;
    }
    
    // State
    
    public EncounterState getState() { return state; }
    
    public boolean isActive() { return state == EncounterState.ACTIVE; }
    
    public EncounterOutcome getOutcome() { return outcome; }
    
    public int getNumber() { return number; }
    
    public int getRound() { return round; }
    
    public int getMaxRounds() { return maxRounds; }
    
    public DayState getDayState() { return dayState; }
    
    public CombatContext getContext() { return context; }
    
    public DiceRoller getDice() { return context.getDice(); }
    
    public CombatTrace getTrace() { return context.getTrace(); }
    
    public List<Combatant> getParty() { return party; }
    
    public List<Combatant> getMonsters() { return monsters; }
    
    public List<Combatant> getTurnOrder() { return turnOrder; }
    
    // Flow
    
    /**
     * Play the encounter to the end.
     */
    public EncounterOutcome run() {
        start();
        while (state == EncounterState.ACTIVE) {
            playRound();
        }
        return outcome;
    }
    
    /**
     * Start every combatant's encounter and fix initiative order. Initiative is a
     * stable descending sort over the party followed by the monsters, so ties go
     * to the party. Each lair action comes after all of them at count 20, so it
     * loses ties.
     */
    public void start() {
        if (state != EncounterState.NOT_STARTED) {
            throw new IllegalStateException("Encounter " + number + " already " + state.getDisplayName());
        }
        getTrace().beginEncounter(number);
        getTrace().record(TraceEvent.Type.ENCOUNTER_START, (String) null, null, null, null, 0,
                party.size() + " characters vs " + monsters.size() + " monsters");
        
        List<Combatant> all = new ArrayList<>(party);
        all.addAll(monsters);
        for (Combatant c : all) {
            c.startEncounter(this);
        }
        
        List<TurnSlot> order = new ArrayList<>();
        for (Combatant c : all) {
            int roll = c.rollInitiative();
            order.add(new TurnSlot(c, false, roll));
            getTrace().record(TraceEvent.Type.INITIATIVE, c, null, null, roll, 0, null);
        }
        for (Combatant c : all) {
            if (c.hasLairAction()) {
                order.add(new TurnSlot(c, true, LAIR_INITIATIVE));
                getTrace().record(TraceEvent.Type.INITIATIVE, c, "Lair", null, LAIR_INITIATIVE, 0, null);
            }
        }
        order.sort(Comparator.comparingInt((TurnSlot t) -> t.initiative).reversed());
        slots = Collections.unmodifiableList(order);
        
        List<Combatant> combatants = new ArrayList<>();
        for (TurnSlot slot : order) {
            if (!slot.lair) combatants.add(slot.combatant);
        }
        turnOrder = Collections.unmodifiableList(combatants);
        
        state = EncounterState.ACTIVE;
        checkTermination(true, true);
    }
    
    /**
     * Play one round: every conscious combatant takes a turn in initiative order,
     * and the end of the encounter is checked after each turn. At the end of
     * each turn every other combatant with legendary actions left uses one.
     */
    public void playRound() {
        if (state != EncounterState.ACTIVE) {
            throw new IllegalStateException("Encounter " + number + " is " + state.getDisplayName());
        }
        round++;
        getTrace().setRound(round);
        
        for (TurnSlot slot : slots) {
            if (state != EncounterState.ACTIVE) break;
            Combatant c = slot.combatant;
            if (c.getHitPoints() <= 0) continue;
            
            boolean partyStanding = isStanding(party);
            boolean monstersStanding = isStanding(monsters);
            if (slot.lair) {
                c.takeLairAction(this);
                checkTermination(partyStanding, monstersStanding);
                continue;
            }
            c.resolveTurn(this);
            checkTermination(partyStanding, monstersStanding);
            for (Combatant other : turnOrder) {
                if (state != EncounterState.ACTIVE) break;
                if (other != c && other.takeLegendaryAction(this)) {
                    checkTermination(partyStanding, monstersStanding);
                }
            }
        }
        
        if (state == EncounterState.ACTIVE && round >= maxRounds) {
            logger.warn("Encounter {} reached the {}-round cap with both sides standing", number, maxRounds);
            conclude(EncounterOutcome.STALEMATE);
        }
    }
    
    private void checkTermination(boolean partyWasStanding, boolean monstersWereStanding) {
        boolean partyStanding = isStanding(party);
        boolean monstersStanding = isStanding(monsters);
        if (partyStanding && monstersStanding) {
            return;
        }
        if (!partyStanding && !monstersStanding && partyWasStanding && monstersWereStanding) {
            conclude(EncounterOutcome.SIMULTANEOUS_DEFEAT);
        } else if (!partyStanding) {
            conclude(EncounterOutcome.MONSTER_VICTORY);
        } else {
            conclude(EncounterOutcome.PARTY_VICTORY);
        }
    }
    
    private void conclude(EncounterOutcome result) {
        outcome = result;
        state = EncounterState.CONCLUDED;
        getTrace().record(TraceEvent.Type.OUTCOME, (String) null, result.getDisplayName(), null, null, 0,
                "after " + round + " rounds");
    }
    
    private static boolean isStanding(List<Combatant> side) {
        for (Combatant c : side) {
            if (c.getHitPoints() > 0) return true;
        }
        return false;
    }
    
    // Sides
    
    public List<Combatant> getAllies(Combatant c) {
        return c.getTeam() == Team.PARTY ? party : monsters;
    }
    
    public List<Combatant> getFoes(Combatant c) {
        return c.getTeam() == Team.PARTY ? monsters : party;
    }
    
    public List<Combatant> livingAllies(Combatant c) {
        return filter(getAllies(c), Combatant::isConscious);
    }
    
    /**
     * Conscious foes within reach. A swallowed combatant can only reach its
     * swallower, and swallowed foes are out of everyone else's reach.
     */
    public List<Combatant> livingFoes(Combatant c) {
        Combatant swallower = c.getSwallower();
        if (swallower != null) {
            return swallower.isConscious() ? List.of(swallower) : Collections.emptyList();
        }
        return filter(getFoes(c), Targeting.reachable().and(Combatant::isConscious));
    }
    
    /** Downed allies within reach, so not swallowed. */
    public List<Combatant> unconsciousAllies(Combatant c) {
        return filter(getAllies(c), Targeting.unconscious().and(Targeting.reachable()));
    }
    
    public boolean hasLivingFoes(Combatant c) {
        return !livingFoes(c).isEmpty();
    }
    
    // Targeting
    
    /**
     * Pick a random conscious foe.
     * @return null if there is none
     */
    public Combatant chooseTarget(Combatant chooser) {
        return chooseTarget(chooser, Targeting.any());
    }
    
    /**
     * Pick a random conscious foe passing the filter.
     * @return null if there is none
     */
    public Combatant chooseTarget(Combatant chooser, Predicate<Combatant> filter) {
        return getDice().pick(filter(livingFoes(chooser), filter));
    }
    
    /**
     * Pick up to {@code n} distinct conscious foes passing the filter. If there
     * are no more than {@code n}, all of them are returned.
     */
    public List<Combatant> chooseTargets(Combatant chooser, int n, Predicate<Combatant> filter) {
        return getDice().sample(filter(livingFoes(chooser), filter), n);
    }
    
    /** Pick {@code n} conscious foes with replacement. */
    public List<Combatant> chooseTargetsWithReplacement(Combatant chooser, int n, Predicate<Combatant> filter) {
        return getDice().sampleWithReplacement(filter(livingFoes(chooser), filter), n);
    }
    
    public static List<Combatant> filter(List<Combatant> combatants, Predicate<Combatant> filter) {
        List<Combatant> result = new ArrayList<>();
        for (Combatant c : combatants) {
            if (filter.test(c)) result.add(c);
        }
        return result;
    }
    
    private static final class TurnSlot {
        final Combatant combatant;
        final boolean lair;
        final int initiative;
        
        TurnSlot(Combatant combatant, boolean lair, int initiative) {
            this.combatant = combatant;
            this.lair = lair;
            this.initiative = initiative;
        }
    }
}
