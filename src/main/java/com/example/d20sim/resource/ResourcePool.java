package com.example.d20sim.resource;

/**
 * A simple counted resource such as Channel Divinity or Action Surge.
 */
public class ResourcePool implements LimitedResource {
    
    private final String name;
    private final RechargeType rechargeType;
    private int maximum;
    private int remaining;
    
    public ResourcePool(String name, int maximum, RechargeType rechargeType) {
        if (maximum < 0) {
            throw new IllegalArgumentException("Negative maximum for " + name + ": " + maximum);
        }
        this.name = name;
        this.maximum = maximum;
        this.remaining = maximum;
        this.rechargeType = rechargeType;
    }
    
    @Override
    public String getName() { return name; }
    
    @Override
    public int getRemaining() { return remaining; }
    
    @Override
    public int getMaximum() { return maximum; }
    
    @Override
    public RechargeType getRechargeType() { return rechargeType; }
    
    @Override
    public void recharge() {
        remaining = maximum;
    }
    
    /**
     * Spend one use.
     * @return false if the pool was empty
     */
    public boolean spend() {
        if (remaining <= 0) return false;
        remaining--;
        return true;
    }
    
    public void setMaximum(int maximum) {
        this.maximum = maximum;
        this.remaining = Math.min(remaining, maximum);
    }
    
    @Override
    public String toString() {
        return name + " " + remaining + "/" + maximum;
    }
}
