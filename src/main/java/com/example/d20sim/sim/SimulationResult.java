package com.example.d20sim.sim;

import java.util.Arrays;

/**
 * Survivor counts of a batch of days and their summary statistics.
 */
public class SimulationResult {
    
    private final SimulationConfig config;
    private final int[] survival;
    private final double mean;
    private final double standardDeviation;
    private final int[] histogram;
    private final long elapsedMillis;
    
    public SimulationResult(SimulationConfig config, int[] survival, long elapsedMillis) {
        this.config = config;
        this.survival = survival.clone();
        this.mean = SurvivalStatistics.mean(survival);
        this.standardDeviation = SurvivalStatistics.standardDeviation(survival);
        this.histogram = SurvivalStatistics.histogram(survival, config.getClasses().size());
        this.elapsedMillis = elapsedMillis;
    }
    
    public SimulationConfig getConfig() { return config; }
    
    /** Survivors per day, in day order. */
    public int[] getSurvival() { return survival.clone(); }
    
    public double getMean() { return mean; }
    
    public double getStandardDeviation() { return standardDeviation; }
    
    /** Index i holds the number of days that ended with i survivors. */
    public int[] getHistogram() { return histogram.clone(); }
    
    public long getElapsedMillis() { return elapsedMillis; }
    
    /** E.g. {@code Level  1 Kobold 4 Survival 3.1234 +/- 0.9876}. */
    public String summaryLine() {
        return String.format("Level %2d %s Survival %6.4f +/- %6.4f",
                config.getPartyLevel(), config.describeMonsters(), mean, standardDeviation);
    }
    
    @Override
    public String toString() {
        return summaryLine() + " " + Arrays.toString(histogram);
    }
}
