package com.alphamind.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One retained line of trial output.
 *
 * @param id        short random identifier
 * @param timestamp when the line was read
 * @param level     classified severity
 * @param message   the line, truncated to {@link #MAX_MESSAGE_LENGTH} characters
 */
public record LogEntry(
    String id,
    Instant timestamp,
    LogLevel level,
    String message
) implements Serializable {

    public static final int MAX_MESSAGE_LENGTH = 500;

    public static LogEntry of(LogLevel level, String line) {
        return new LogEntry(UUID.randomUUID().toString().substring(0, 8), Instant.now(), level,
                truncate(line, MAX_MESSAGE_LENGTH));
    }

    public static String truncate(String s, int max) {
        if (s == null) return "";
        if (s.length() <= max) return s;
        // never split a surrogate pair
        int end = max > 0 && Character.isHighSurrogate(s.charAt(max - 1)) ? max - 1 : max;
        return s.substring(0, end);
    }
}
