package com.alphamind.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Progress snapshot of a task.
 *
 * @param phase        current phase
 * @param currentRound evolution round reported by the trial (0 until seen)
 * @param totalRounds  rounds requested for the trial
 * @param percent      0..100
 * @param message      latest progress message
 * @param timestamp    when this progress was last changed
 */
public record TaskProgress(
    Phase phase,
    int currentRound,
    int totalRounds,
    int percent,
    String message,
    Instant timestamp
) implements Serializable {

    public static TaskProgress initial(Phase phase, int totalRounds, String message) {
        return new TaskProgress(phase, 0, totalRounds, 0, message, Instant.now());
    }

    public TaskProgress withPhase(Phase newPhase, String newMessage) {
        return new TaskProgress(newPhase, currentRound, totalRounds, percent, newMessage, Instant.now());
    }

    public TaskProgress withMessage(String newMessage) {
        return new TaskProgress(phase, currentRound, totalRounds, percent, newMessage, Instant.now());
    }

    public TaskProgress withRound(int round) {
        int pct = totalRounds > 0 ? Math.min(99, round * 100 / totalRounds) : percent;
        return new TaskProgress(phase, round, totalRounds, Math.max(percent, pct), message, Instant.now());
    }

    public TaskProgress finished(String newMessage) {
        return new TaskProgress(Phase.COMPLETED, currentRound, totalRounds, 100, newMessage, Instant.now());
    }
}
