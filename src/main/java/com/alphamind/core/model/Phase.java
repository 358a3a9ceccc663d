package com.alphamind.core.model;

/**
 * Coarse stage of a trial's progress, derived from its output.
 */
public enum Phase {
    PLANNING,
    EVOLVING,
    BACKTESTING,
    ANALYZING,
    COMPLETED
}
