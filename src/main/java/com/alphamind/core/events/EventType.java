package com.alphamind.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Type of a {@link TaskEvent}, serialized in lower case.
 */
public enum EventType {
    PROGRESS,
    LOG,
    METRICS,
    RESULT,
    ERROR,
    HEARTBEAT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
