package com.example.d20sim.resource;

/**
 * A pool of uses that refills at a rest.
 */
public interface LimitedResource {
    
    String getName();
    
    int getRemaining();
    
    int getMaximum();
    
    RechargeType getRechargeType();
    
    /** Refill to maximum. */
    void recharge();
    
    default boolean isAvailable() {
        return getRemaining() > 0;
    }
}
