package com.example.d20sim.model;

/**
 * Labels a saving throw so that features granting advantage against a
 * particular kind of effect can recognize it.
 */
public enum SaveType {
    ORDINARY,
    MAGIC,
    POISON,
    CHARM,
    TURN_UNDEAD
}
