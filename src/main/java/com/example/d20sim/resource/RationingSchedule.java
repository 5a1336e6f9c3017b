package com.example.d20sim.resource;

import java.util.Arrays;

/**
 * The allotment of a resource's uses across the encounters of one rest
 * interval, with the reserve that must be held back after each encounter.
 */
public class RationingSchedule {
    
    private final int total;
    private final int[] allotments;
    private final int[] reserves;
    
    RationingSchedule(int total, int[] allotments) {
        int sum = Arrays.stream(allotments).sum();
        if (sum != total) {
            throw new IllegalStateException("Allotments " + Arrays.toString(allotments)
                    + " sum to " + sum + ", expected " + total);
        }
        this.total = total;
        this.allotments = allotments.clone();
        this.reserves = new int[allotments.length];
        int spent = 0;
        for (int i = 0; i < allotments.length; i++) {
            if (allotments[i] < 0) {
                throw new IllegalStateException("Negative allotment in " + Arrays.toString(allotments));
            }
            spent += allotments[i];
            reserves[i] = total - spent;
        }
    }
    
    public int getTotal() { return total; }
    
    public int getEncounters() { return allotments.length; }
    
    public int[] getAllotments() { return allotments.clone(); }
    
    public int allotmentAt(int encounter) {
        return allotments[clamp(encounter)];
    }
    
    /** Uses that must still be unspent after the given encounter of the interval. */
    public int reserveAt(int encounter) {
        return reserves[clamp(encounter)];
    }
    
    /**
     * Whether a use may be spent during the given encounter with
     * {@code remaining} uses left.
     */
    public boolean mayUse(int remaining, int encounter) {
        return remaining > reserveAt(encounter);
    }
    
    private int clamp(int encounter) {
        if (allotments.length == 0) {
            throw new IllegalStateException("Empty rationing schedule");
        }
        return Math.max(0, Math.min(encounter, allotments.length - 1));
    }
    
    @Override
    public String toString() {
        return Arrays.toString(allotments);
    }
}
