package com.alphamind.core.model;

/**
 * Kind of supervised trial.
 */
public enum TaskKind {
    MINING,
    BACKTEST
}
