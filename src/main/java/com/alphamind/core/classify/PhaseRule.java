package com.alphamind.core.classify;

import com.alphamind.core.model.Phase;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * One row of the phase table: lines matching {@code pattern} move the trial to {@code phase}.
 */
public final class PhaseRule {

    private final String pattern;
    private final MatchMode mode;
    private final Phase phase;
    private final Pattern regex;
    private final String lowerPattern;

    public PhaseRule(String pattern, MatchMode mode, Phase phase) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("phase rule pattern cannot be empty");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase rule for '" + pattern + "' has no phase");
        }
        this.pattern = pattern;
        this.mode = mode == null ? MatchMode.CONTAINS : mode;
        this.phase = phase;
        this.regex = this.mode == MatchMode.REGEX ? Pattern.compile(pattern) : null;
        this.lowerPattern = pattern.toLowerCase(Locale.ROOT);
    }

    public boolean matches(String line) {
        return switch (mode) {
            case CONTAINS -> line.contains(pattern);
            case CONTAINS_IGNORE_CASE -> line.toLowerCase(Locale.ROOT).contains(lowerPattern);
            case REGEX -> regex.matcher(line).find();
        };
    }

    public Phase phase() {
        return phase;
    }

    @Override
    public String toString() {
        return mode + "(" + pattern + ") -> " + phase;
    }
}
