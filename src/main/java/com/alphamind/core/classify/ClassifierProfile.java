package com.alphamind.core.classify;

import com.alphamind.core.model.LogLevel;
import com.alphamind.core.model.Phase;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled, immutable form of a {@link ClassifierProperties.Profile}. Every method is a pure
 * function of one line, so the table can be tested without running a trial.
 */
public final class ClassifierProfile {

    /** {@code NAME=<value>} tokens; NAME must not be the tail of a longer identifier. */
    private static final Pattern METRIC_TOKEN =
            Pattern.compile("(?<![A-Za-z0-9_])([A-Za-z][A-Za-z0-9_]*)\\s*=\\s*([^,;)\\s]+)");

    private final String name;
    private final Phase initialPhase;
    private final List<String> noise;
    private final List<PhaseRule> phaseRules;
    private final List<String> progressKeywords;
    private final List<String> errorMarkers;
    private final List<String> warningMarkers;
    private final List<String> successMarkers;
    private final List<String> infoMarkers;
    private final Map<String, String> metricKeys;
    private final Pattern roundPattern;
    private final int forwardEvery;

    private ClassifierProfile(String name, ClassifierProperties.Profile p) {
        this.name = name;
        this.initialPhase = p.getInitialPhase() != null ? p.getInitialPhase() : Phase.PLANNING;
        this.noise = copy(p.getNoise());
        this.phaseRules = p.getPhaseRules() == null ? List.of() : p.getPhaseRules().stream()
                .map(r -> new PhaseRule(r.getPattern(), r.getMatch(), r.getPhase()))
                .toList();
        this.progressKeywords = copy(p.getProgressKeywords());
        this.errorMarkers = copy(p.getErrorMarkers());
        this.warningMarkers = copy(p.getWarningMarkers());
        this.successMarkers = copy(p.getSuccessMarkers()).stream()
                .map(s -> s.toLowerCase(Locale.ROOT)).toList();
        this.infoMarkers = copy(p.getInfoMarkers());
        this.metricKeys = p.getMetricKeys() == null ? Map.of() : Map.copyOf(p.getMetricKeys());
        this.roundPattern = p.getRoundPattern() == null || p.getRoundPattern().isBlank()
                ? null : Pattern.compile(p.getRoundPattern());
        this.forwardEvery = Math.max(1, p.getForwardEvery());
    }

    public static ClassifierProfile from(String name, ClassifierProperties.Profile properties) {
        return new ClassifierProfile(name, properties);
    }

    public String name() {
        return name;
    }

    public Phase initialPhase() {
        return initialPhase;
    }

    public boolean isNoise(String line) {
        return containsAny(line, noise);
    }

    /**
     * First matching phase rule wins.
     */
    public Optional<Phase> phaseFor(String line) {
        for (PhaseRule rule : phaseRules) {
            if (rule.matches(line)) {
                return Optional.of(rule.phase());
            }
        }
        return Optional.empty();
    }

    public boolean hasPhaseRules() {
        return !phaseRules.isEmpty();
    }

    public boolean isProgressLine(String line) {
        return containsAny(line, progressKeywords);
    }

    public LogLevel severityOf(String line) {
        if (containsAny(line, errorMarkers)) {
            return LogLevel.ERROR;
        }
        if (containsAny(line, warningMarkers)) {
            return LogLevel.WARNING;
        }
        if (containsAny(line.toLowerCase(Locale.ROOT), successMarkers)) {
            return LogLevel.SUCCESS;
        }
        return LogLevel.INFO;
    }

    /**
     * Extracts the known {@code NAME=<number>} metrics of a line, keyed by canonical metric key.
     * Values that do not parse as finite numbers are skipped.
     */
    public Map<String, Double> extractMetrics(String line) {
        if (metricKeys.isEmpty() || line.indexOf('=') < 0) {
            return Map.of();
        }
        Map<String, Double> found = new LinkedHashMap<>();
        Matcher m = METRIC_TOKEN.matcher(line);
        while (m.find()) {
            String key = metricKeys.get(m.group(1));
            if (key == null) {
                continue;
            }
            try {
                double value = Double.parseDouble(m.group(2));
                if (Double.isFinite(value)) {
                    found.put(key, value);
                }
            } catch (NumberFormatException ignored) {
                // not a number, e.g. "IC=n/a"
            }
        }
        return found;
    }

    public OptionalInt roundOf(String line) {
        if (roundPattern == null) {
            return OptionalInt.empty();
        }
        Matcher m = roundPattern.matcher(line);
        if (!m.find() || m.groupCount() < 1) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Whether the {@code lineNumber}-th retained line should also be streamed live.
     */
    public boolean shouldForward(long lineNumber, LogLevel level, String line) {
        return lineNumber % forwardEvery == 0
                || level == LogLevel.ERROR
                || level == LogLevel.WARNING
                || containsAny(line, infoMarkers);
    }

    private static boolean containsAny(String line, List<String> needles) {
        for (String needle : needles) {
            if (line.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> copy(List<String> values) {
        return values == null ? List.of() : values.stream().filter(s -> s != null && !s.isEmpty()).toList();
    }
}
