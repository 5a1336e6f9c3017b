package com.example.d20sim.day;

import com.example.d20sim.combat.*;
import com.example.d20sim.party.PlayerCharacter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One trial: the same party fights a fresh set of monsters in each encounter of
 * the day, with short rests between groups of encounters, then is scored.
 */
public class AdventuringDay {
    
    private static final Logger logger = LoggerFactory.getLogger(AdventuringDay.class);
    
    private final List<PlayerCharacter> party;
    private final List<MonsterGroup> monsters;
    private final DayState state;
    private final CombatContext context;
    private final int maxRounds;
    
    public AdventuringDay(List<PlayerCharacter> party, List<MonsterGroup> monsters, DayState state,
                          CombatContext context, int maxRounds) {
        if (party.isEmpty()) {
            throw new IllegalArgumentException("The party is empty");
        }
        if (monsters.isEmpty()) {
            throw new IllegalArgumentException("No monsters to fight");
        }
        this.party = new ArrayList<>(party);
        this.monsters = new ArrayList<>(monsters);
        this.state = state;
        this.context = context;
        this.maxRounds = maxRounds;
    }
    
    public DayState getState() { return state; }
    
    /**
     * Play out the day. Stops early when the whole party is down or an
     * encounter ends in simultaneous defeat.
     */
    public DayResult run() {
        List<Combatant> members = new ArrayList<>(party);
        for (PlayerCharacter pc : party) {
            pc.startDay(state);
        }
        
        for (int index = 0; index < state.getEncountersPerDay(); index++) {
            state.setEncounterIndex(index);
            state.setPhase(DayPhase.ENCOUNTER);
            
            List<Combatant> foes = new ArrayList<>();
            for (MonsterGroup group : monsters) {
                foes.addAll(group.spawn(context));
            }
            Encounter encounter = new Encounter(index + 1, party, foes, state, context, maxRounds);
            EncounterOutcome outcome = encounter.run();
            state.recordOutcome(outcome);
            logger.debug("Encounter {} ended in {} after {} rounds", index + 1, outcome, encounter.getRound());
            if (state.isSimultaneousDefeat()) {
                break;
            }
            
            for (PlayerCharacter pc : party) {
                if (pc.isConscious()) pc.endEncounter(encounter);
            }
            if (livingMembers() == 0) {
                break;
            }
            
            if (state.isShortRestDue()) {
                state.setPhase(DayPhase.SHORT_REST);
                for (PlayerCharacter pc : party) {
                    pc.shortRest(state);
                }
            } else {
                for (PlayerCharacter pc : party) {
                    pc.resetConditions();
                }
            }
        }
        
        state.setPhase(DayPhase.END_OF_DAY);
        if (!state.isSimultaneousDefeat()) {
            for (PlayerCharacter pc : party) {
                if (pc.isConscious()) pc.endOfDay(state, members);
            }
        }
        state.setPhase(DayPhase.SCORED);
        return score();
    }
    
    private int livingMembers() {
        int living = 0;
        for (PlayerCharacter pc : party) {
            if (pc.isConscious()) living++;
        }
        return living;
    }
    
    private DayResult score() {
        List<String> survivors = new ArrayList<>();
        if (!state.isSimultaneousDefeat()) {
            for (PlayerCharacter pc : party) {
                if (pc.isConscious()) survivors.add(pc.getName());
            }
        }
        return new DayResult(survivors.size(), party.size(), new ArrayList<>(state.getOutcomes()),
                state.isSimultaneousDefeat(), survivors);
    }
}
