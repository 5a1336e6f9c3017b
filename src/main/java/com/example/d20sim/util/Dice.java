package com.example.d20sim.util;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An immutable dice expression such as {@code 2d6}, optionally with a Great
 * Weapon Fighting reroll threshold and a set of extra dice that ride along
 * with the base dice (Sneak Attack, Martial Advantage).
 */
public final class Dice {
    
    private static final Pattern NOTATION = Pattern.compile("(\\d*)d(\\d+)");
    
    private final int count;
    private final int sides;
    private final int rerollAtOrBelow;
    private final Dice extra;
    
    private Dice(int count, int sides, int rerollAtOrBelow, Dice extra) {
        if (count < 0 || sides < 1) {
            throw new IllegalArgumentException("Invalid dice " + count + "d" + sides);
        }
        this.count = count;
        this.sides = sides;
        this.rerollAtOrBelow = rerollAtOrBelow;
        this.extra = extra;
    }
    
    public static Dice of(int count, int sides) {
        return new Dice(count, sides, 0, null);
    }
    
    /** A single die. */
    public static Dice d(int sides) {
        return new Dice(1, sides, 0, null);
    }
    
    /** Dice that reroll ones and twos once. */
    public static Dice greatWeapon(int count, int sides) {
        return new Dice(count, sides, 2, null);
    }
    
    /**
     * Parse {@code NdX} or {@code dX} notation.
     * @throws IllegalArgumentException if the text is not dice notation
     */
    public static Dice parse(String notation) {
        if (notation == null) {
            throw new IllegalArgumentException("Dice notation is null");
        }
        Matcher m = NOTATION.matcher(notation.trim().toLowerCase());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid dice notation: " + notation);
        }
        int count = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
        return of(count, Integer.parseInt(m.group(2)));
    }
    
    /** Integer mean of one die of the given size, as used for fixed hit points. */
    public static int mean(int sides) {
        return sides / 2 + 1;
    }
    
    /** These dice plus additional dice rolled alongside them. */
    public Dice plus(Dice additional) {
        if (additional == null) return this;
        return new Dice(count, sides, rerollAtOrBelow, extra == null ? additional : extra.plus(additional));
    }
    
    public int roll(DiceRoller roller) {
        int total = rerollAtOrBelow > 0
                ? roller.rollWithReroll(count, sides, rerollAtOrBelow)
                : roller.roll(count, sides);
        if (extra != null) {
            total += extra.roll(roller);
        }
        return total;
    }
    
    public int getCount() { return count; }
    public int getSides() { return sides; }
    public int getRerollAtOrBelow() { return rerollAtOrBelow; }
    public Dice getExtra() { return extra; }
    
    /** Lowest possible total. */
    public int minimum() {
        return count + (extra == null ? 0 : extra.minimum());
    }
    
    /** Highest possible total. */
    public int maximum() {
        return count * sides + (extra == null ? 0 : extra.maximum());
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dice)) return false;
        Dice other = (Dice) o;
        return count == other.count && sides == other.sides
                && rerollAtOrBelow == other.rerollAtOrBelow && Objects.equals(extra, other.extra);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(count, sides, rerollAtOrBelow, extra);
    }
    
    @Override
    public String toString() {
        String base = count + "d" + sides;
        if (rerollAtOrBelow > 0) base += "r" + rerollAtOrBelow;
        return extra == null ? base : base + "+" + extra;
    }
}
