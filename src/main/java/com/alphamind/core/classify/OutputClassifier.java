package com.alphamind.core.classify;

import com.alphamind.core.events.TaskReporter;
import com.alphamind.core.model.LogEntry;
import com.alphamind.core.model.LogLevel;
import com.alphamind.core.model.Phase;

import java.util.Map;
import java.util.Optional;

/**
 * Turns one trial's output lines into log, progress and metric updates on its task.
 * <p>
 * Holds the trial's phase state machine. One instance per trial process; not thread-safe.
 */
public class OutputClassifier {

    static final int PROGRESS_MESSAGE_LENGTH = 200;

    private final ClassifierProfile profile;
    private final TaskReporter reporter;

    private Phase phase;
    private long retainedLines;
    private boolean transitioned;

    public OutputClassifier(ClassifierProfile profile, TaskReporter reporter) {
        this.profile = profile;
        this.reporter = reporter;
        this.phase = profile.initialPhase();
    }

    public void accept(String rawLine) {
        if (rawLine == null) {
            return;
        }
        String line = rawLine.stripTrailing();
        if (line.isBlank() || profile.isNoise(line)) {
            return;
        }
        retainedLines++;

        LogLevel level = profile.severityOf(line);
        reporter.log(LogEntry.of(level, line), profile.shouldForward(retainedLines, level, line));

        Optional<Phase> next = profile.phaseFor(line);
        if (next.isPresent() && next.get() != phase) {
            phase = next.get();
            transitioned = true;
            reporter.phase(phase, LogEntry.truncate(line, PROGRESS_MESSAGE_LENGTH));
        } else if (profile.isProgressLine(line)) {
            reporter.progressMessage(LogEntry.truncate(line, PROGRESS_MESSAGE_LENGTH));
        }

        profile.roundOf(line).ifPresent(reporter::round);

        Map<String, Double> metrics = profile.extractMetrics(line);
        if (!metrics.isEmpty()) {
            reporter.metrics(metrics);
        }
    }

    public Phase phase() {
        return phase;
    }

    public long retainedLines() {
        return retainedLines;
    }

    /**
     * Whether any phase rule ever moved this trial to a new phase.
     */
    public boolean transitioned() {
        return transitioned;
    }
}
