package com.example.d20sim.sim;

/**
 * Summary statistics over per-day survivor counts.
 */
public final class SurvivalStatistics {
    
    private SurvivalStatistics() {
    }
    
    public static double mean(int[] values) {
        if (values.length == 0) return 0.0;
        long sum = 0;
        for (int v : values) sum += v;
        return (double) sum / values.length;
    }
    
    /** Sample standard deviation (n - 1 in the denominator); 0 for fewer than two values. */
    public static double standardDeviation(int[] values) {
        if (values.length < 2) return 0.0;
        double mean = mean(values);
        double squares = 0.0;
        for (int v : values) {
            double d = v - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (values.length - 1));
    }
    
    /** Number of days with each survivor count from 0 to {@code partySize}. */
    public static int[] histogram(int[] values, int partySize) {
        int[] counts = new int[partySize + 1];
        for (int v : values) {
            if (v < 0 || v > partySize) {
                throw new IllegalStateException("Survivor count " + v + " outside [0, " + partySize + "]");
            }
            counts[v]++;
        }
        return counts;
    }
}
