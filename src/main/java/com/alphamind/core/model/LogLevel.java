package com.alphamind.core.model;

/**
 * Severity assigned to a single line of trial output.
 */
public enum LogLevel {
    INFO,
    WARNING,
    ERROR,
    SUCCESS
}
