package com.example.d20sim.sim;

import com.example.d20sim.combat.CombatContext;
import com.example.d20sim.combat.CombatTrace;
import com.example.d20sim.day.AdventuringDay;
import com.example.d20sim.day.DayResult;
import com.example.d20sim.day.DayState;
import com.example.d20sim.party.PartyRoster;
import com.example.d20sim.party.PlayerCharacter;
import com.example.d20sim.util.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Runs many independent adventuring days and aggregates how many party members
 * survive each. Every day draws its own seed from the batch seed up front, so
 * the results do not depend on the number of threads.
 */
public class MonteCarloSimulator {
    
    private static final Logger logger = LoggerFactory.getLogger(MonteCarloSimulator.class);
    
    /**
     * Simulate with defaults for everything but the inputs given.
     * @throws ConfigurationException for an unknown name or an out-of-range value
     */
    public static SimulationResult simulate(Map<String, Integer> monsters, int partyLevel,
                                            List<String> classes, int days) {
        return simulate(SimulationConfig.builder()
                .monsters(monsters)
                .partyLevel(partyLevel)
                .classes(classes)
                .days(days)
                .build());
    }
    
    public static SimulationResult simulate(SimulationConfig config) {
        long start = System.currentTimeMillis();
        long[] seeds = daySeeds(config.getSeed(), config.getDays());
        int[] survival = new int[seeds.length];
        
        if (config.getThreads() <= 1 || seeds.length == 1) {
            for (int i = 0; i < seeds.length; i++) {
                survival[i] = runDay(config, seeds[i], CombatTrace.silent()).getSurvivors();
            }
        } else {
            runParallel(config, seeds, survival);
        }
        
        long elapsed = System.currentTimeMillis() - start;
        SimulationResult result = new SimulationResult(config, survival, elapsed);
        logger.info("{} days of level {} {} vs {}: mean {} std {} ({} ms, seed {})",
                config.getDays(), config.getPartyLevel(), config.getClasses(), config.describeMonsters(),
                String.format("%.4f", result.getMean()), String.format("%.4f", result.getStandardDeviation()),
                elapsed, config.getSeed());
        return result;
    }
    
    private static void runParallel(SimulationConfig config, long[] seeds, int[] survival) {
        ExecutorService pool = Executors.newFixedThreadPool(config.getThreads(), r -> {
            Thread t = new Thread(r, "d20sim-day");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (long seed : seeds) {
                futures.add(pool.submit(() -> runDay(config, seed, CombatTrace.silent()).getSurvivors()));
            }
            for (int i = 0; i < futures.size(); i++) {
                survival[i] = futures.get(i).get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Simulation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Simulated day failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }
    
    /**
     * Run one day with every action traced. It is the same day the batch with
     * this configuration's seed would run first.
     */
    public static DebugReport debug(SimulationConfig config) {
        CombatTrace trace = CombatTrace.recording();
        DayResult result = runDay(config, daySeeds(config.getSeed(), 1)[0], trace);
        return new DebugReport(result, trace.getEvents());
    }
    
    static long[] daySeeds(long batchSeed, int days) {
        DiceRoller master = new DiceRoller(batchSeed);
        long[] seeds = new long[days];
        for (int i = 0; i < days; i++) {
            seeds[i] = master.nextSeed();
        }
        return seeds;
    }
    
    /** One day with a fresh party and fresh monsters. */
    static DayResult runDay(SimulationConfig config, long seed, CombatTrace trace) {
        CombatContext context = new CombatContext(new DiceRoller(seed), trace);
        List<PlayerCharacter> party = PartyRoster.createParty(config.getClasses(), config.getPartyLevel(), context);
        DayState state = new DayState(config.getEncountersPerDay(), config.getEncountersPerShortRest());
        return new AdventuringDay(party, config.monsterGroups(), state, context, config.getMaxRounds()).run();
    }
}
