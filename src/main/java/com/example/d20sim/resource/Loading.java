package com.example.d20sim.resource;

/**
 * Which end of a rest interval receives the uses left over after an even split.
 */
public enum Loading {
    /** Spend early: leftover uses go to the first encounters */
    FRONT_LOADED,
    /** Hold back: leftover uses go to the last encounters */
    BACK_LOADED
}
