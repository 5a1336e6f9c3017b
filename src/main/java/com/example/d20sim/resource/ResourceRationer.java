package com.example.d20sim.resource;

/**
 * Spreads an integer number of uses across the encounters before the next rest.
 * Each encounter gets the even share {@code total / n}; the {@code total % n}
 * leftover uses go one each to the first encounters (front-loaded) or the last
 * encounters (back-loaded).
 */
public final class ResourceRationer {
    
    private ResourceRationer() {
    }
    
    /**
     * Per-encounter allotments for {@code total} uses over {@code encounters} encounters.
     * @throws IllegalArgumentException if {@code total} is negative or {@code encounters} is not positive
     */
    public static int[] allot(int total, int encounters, Loading loading) {
        if (total < 0) {
            throw new IllegalArgumentException("Negative total: " + total);
        }
        if (encounters < 1) {
            throw new IllegalArgumentException("Need at least one encounter, got " + encounters);
        }
        int share = total / encounters;
        int leftover = total % encounters;
        int[] allotments = new int[encounters];
        for (int i = 0; i < encounters; i++) {
            boolean extra = loading == Loading.FRONT_LOADED
                    ? i < leftover
                    : encounters - i <= leftover;
            allotments[i] = share + (extra ? 1 : 0);
        }
        return allotments;
    }
    
    public static RationingSchedule schedule(int total, int encounters, Loading loading) {
        return new RationingSchedule(total, allot(total, encounters, loading));
    }
}
