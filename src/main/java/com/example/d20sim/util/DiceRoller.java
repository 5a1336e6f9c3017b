package com.example.d20sim.util;

import java.util.*;

/**
 * The single source of randomness for one adventuring day.
 * Every roll and every random choice made during a day goes through one
 * instance, so a day replays exactly from its seed.
 */
public class DiceRoller {
    
    private final long seed;
    private final SplittableRandom random;
    
    public DiceRoller(long seed) {
        this.seed = seed;
        this.random = new SplittableRandom(seed);
    }
    
    public long getSeed() { return seed; }
    
    /**
     * Roll one die.
     * @return a value in [1, sides]
     */
    public int roll(int sides) {
        if (sides < 1) {
            throw new IllegalArgumentException("Die must have at least one side: " + sides);
        }
        return random.nextInt(sides) + 1;
    }
    
    /**
     * Roll {@code count} dice of {@code sides} sides and sum them.
     */
    public int roll(int count, int sides) {
        int total = 0;
        for (int i = 0; i < count; i++) {
            total += roll(sides);
        }
        return total;
    }
    
    /**
     * Roll dice, rerolling each die once if it shows {@code rerollAtOrBelow} or less
     * (Great Weapon Fighting). The second result stands.
     */
    public int rollWithReroll(int count, int sides, int rerollAtOrBelow) {
        int total = 0;
        for (int i = 0; i < count; i++) {
            int r = roll(sides);
            if (r <= rerollAtOrBelow) {
                r = roll(sides);
            }
            total += r;
        }
        return total;
    }
    
    public int d20() {
        return roll(20);
    }
    
    /**
     * Roll a d20 with advantage and/or disadvantage. Having both cancels out.
     */
    public int d20(boolean advantage, boolean disadvantage) {
        if (advantage == disadvantage) {
            return d20();
        }
        int first = d20();
        int second = d20();
        return advantage ? Math.max(first, second) : Math.min(first, second);
    }
    
    public int d4() {
        return roll(4);
    }
    
    public double nextDouble() {
        return random.nextDouble();
    }
    
    /** True with the given probability. */
    public boolean chance(double probability) {
        return random.nextDouble() < probability;
    }
    
    /** Draw a seed for a derived stream, e.g. one per simulated day. */
    public long nextSeed() {
        return random.nextLong();
    }
    
    /**
     * Pick one element uniformly.
     * @return the element, or null if the list is empty
     */
    public <T> T pick(List<T> items) {
        if (items == null || items.isEmpty()) return null;
        return items.get(random.nextInt(items.size()));
    }
    
    /**
     * Sample {@code n} distinct elements uniformly. If there are no more than
     * {@code n} elements, all of them are returned in their original order.
     */
    public <T> List<T> sample(List<T> items, int n) {
        if (items.size() <= n) {
            return new ArrayList<>(items);
        }
        List<T> pool = new ArrayList<>(items);
        List<T> chosen = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            chosen.add(pool.remove(random.nextInt(pool.size())));
        }
        return chosen;
    }
    
    /**
     * Sample {@code n} elements uniformly with replacement.
     * @return an empty list if {@code items} is empty
     */
    public <T> List<T> sampleWithReplacement(List<T> items, int n) {
        List<T> chosen = new ArrayList<>(n);
        if (items.isEmpty()) return chosen;
        for (int i = 0; i < n; i++) {
            chosen.add(items.get(random.nextInt(items.size())));
        }
        return chosen;
    }
}
