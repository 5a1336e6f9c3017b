package com.example.d20sim.resource;

import java.util.Arrays;

/**
 * Spell slots by level (index 0 is 1st level). Rationed as one resource by
 * total count; which level to spend is decided at cast time.
 */
public class SpellSlots implements LimitedResource {
    
    public static final String RESOURCE_NAME = "spell slots";
    
    private final int[] maximum;
    private final int[] remaining;
    
    public SpellSlots(int... slotsPerLevel) {
        this.maximum = slotsPerLevel.clone();
        this.remaining = slotsPerLevel.clone();
    }
    
    @Override
    public String getName() { return RESOURCE_NAME; }
    
    @Override
    public int getRemaining() {
        return Arrays.stream(remaining).sum();
    }
    
    @Override
    public int getMaximum() {
        return Arrays.stream(maximum).sum();
    }
    
    @Override
    public RechargeType getRechargeType() { return RechargeType.LONG_REST; }
    
    @Override
    public void recharge() {
        System.arraycopy(maximum, 0, remaining, 0, maximum.length);
    }
    
    /** Highest slot level this caster has at all, 0 for none. */
    public int getHighestLevel() {
        return maximum.length;
    }
    
    public int remainingAt(int level) {
        if (level < 1 || level > remaining.length) return 0;
        return remaining[level - 1];
    }
    
    public int maximumAt(int level) {
        if (level < 1 || level > maximum.length) return 0;
        return maximum[level - 1];
    }
    
    /**
     * Lowest level with a slot left that is at least {@code minimumLevel}.
     * @return the slot level, or 0 if none is left
     */
    public int lowestAvailable(int minimumLevel) {
        for (int level = Math.max(1, minimumLevel); level <= remaining.length; level++) {
            if (remaining[level - 1] > 0) return level;
        }
        return 0;
    }
    
    /**
     * Highest level with a slot left that is at least {@code minimumLevel}.
     * @return the slot level, or 0 if none is left
     */
    public int highestAvailable(int minimumLevel) {
        for (int level = remaining.length; level >= Math.max(1, minimumLevel); level--) {
            if (remaining[level - 1] > 0) return level;
        }
        return 0;
    }
    
    /**
     * Spend a slot of exactly the given level.
     * @throws IllegalStateException if no slot of that level remains
     */
    public void spend(int level) {
        if (remainingAt(level) <= 0) {
            throw new IllegalStateException("No level " + level + " slot left in " + this);
        }
        remaining[level - 1]--;
    }
    
    /**
     * Regain a spent slot of the given level, never beyond the maximum.
     * @return true if a slot was regained
     */
    public boolean recover(int level) {
        if (level < 1 || level > remaining.length || remaining[level - 1] >= maximum[level - 1]) {
            return false;
        }
        remaining[level - 1]++;
        return true;
    }
    
    @Override
    public String toString() {
        return RESOURCE_NAME + " " + Arrays.toString(remaining) + "/" + Arrays.toString(maximum);
    }
}
