package com.alphamind.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("TaskProgress")
    class TaskProgressTests {

        @Test
        @DisplayName("round updates percent as round over total, capped at 99")
        void roundUpdatesPercent() {
            var progress = TaskProgress.initial(Phase.PLANNING, 3, "start");

            assertEquals(33, progress.withRound(1).percent());
            assertEquals(66, progress.withRound(2).percent());
            assertEquals(99, progress.withRound(3).percent());
            assertEquals(99, progress.withRound(7).percent());
            assertEquals(2, progress.withRound(2).currentRound());
        }

        @Test
        @DisplayName("percent never goes backwards")
        void percentIsMonotonic() {
            var progress = TaskProgress.initial(Phase.EVOLVING, 4, "start").withRound(3);
            assertEquals(75, progress.percent());
            assertEquals(75, progress.withRound(1).percent());
        }

        @Test
        @DisplayName("round without a total keeps percent")
        void roundWithoutTotal() {
            var progress = TaskProgress.initial(Phase.BACKTESTING, 0, "start").withRound(5);
            assertEquals(0, progress.percent());
            assertEquals(5, progress.currentRound());
        }

        @Test
        @DisplayName("finished moves to COMPLETED at 100 percent")
        void finished() {
            var progress = TaskProgress.initial(Phase.EVOLVING, 3, "start").withRound(1).finished("done");
            assertEquals(Phase.COMPLETED, progress.phase());
            assertEquals(100, progress.percent());
            assertEquals("done", progress.message());
            assertEquals(1, progress.currentRound());
        }
    }

    @Nested
    @DisplayName("MiningRequest")
    class MiningRequestTests {

        @Test
        @DisplayName("directions take precedence over the single direction")
        void directionsWin() {
            var request = new MiningRequest("momentum", List.of("value", "quality"), null, null, null, null, null, null);
            assertEquals(List.of("value", "quality"), request.branchDirections());
        }

        @Test
        @DisplayName("single direction becomes one branch")
        void singleDirection() {
            var request = new MiningRequest("momentum", List.of(), null, null, null, null, null, null);
            assertEquals(List.of("momentum"), request.branchDirections());
        }

        @Test
        @DisplayName("no direction yields no named branches")
        void noDirection() {
            var request = new MiningRequest("  ", null, null, null, null, null, null, null);
            assertTrue(request.branchDirections().isEmpty());
        }

        @Test
        @DisplayName("max rounds defaults to 3")
        void defaultRounds() {
            assertEquals(3, new MiningRequest(null, null, null, null, null, null, null, null).effectiveMaxRounds());
            assertEquals(5, new MiningRequest(null, null, null, 5, null, null, null, null).effectiveMaxRounds());
            assertEquals(3, new MiningRequest(null, null, null, 0, null, null, null, null).effectiveMaxRounds());
        }
    }

    @Nested
    @DisplayName("LogEntry and TaskStatus")
    class LogEntryTests {

        @Test
        @DisplayName("messages are truncated to 500 characters")
        void truncatesMessages() {
            var entry = LogEntry.of(LogLevel.INFO, "x".repeat(800));
            assertEquals(500, entry.message().length());
            assertEquals(8, entry.id().length());
        }

        @Test
        @DisplayName("truncation keeps a surrogate pair whole")
        void truncatesBeforeSurrogatePair() {
            String line = "x".repeat(499) + "🚀" + "tail";

            String message = LogEntry.of(LogLevel.INFO, line).message();

            assertEquals(499, message.length());
            assertFalse(Character.isHighSurrogate(message.charAt(message.length() - 1)));
            assertEquals("ab", LogEntry.truncate("ab🚀", 3));
        }

        @Test
        @DisplayName("only RUNNING is non-terminal")
        void terminalStatuses() {
            assertFalse(TaskStatus.RUNNING.isTerminal());
            assertTrue(TaskStatus.COMPLETED.isTerminal());
            assertTrue(TaskStatus.FAILED.isTerminal());
            assertTrue(TaskStatus.CANCELLED.isTerminal());
        }

        @Test
        @DisplayName("backtest factor source defaults to custom")
        void defaultFactorSource() {
            assertEquals("custom", new BacktestRequest("lib.json", null, null).effectiveFactorSource());
            assertEquals("combined", new BacktestRequest("lib.json", "combined", null).effectiveFactorSource());
        }
    }
}
