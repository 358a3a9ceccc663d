package com.alphamind.core.classify;

/**
 * How a phase rule's pattern is matched against a line.
 */
public enum MatchMode {
    CONTAINS,
    CONTAINS_IGNORE_CASE,
    REGEX
}
