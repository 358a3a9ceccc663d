package com.alphamind.core.classify;

import com.alphamind.core.model.LogLevel;
import com.alphamind.core.model.Phase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class ClassifierProfileTest {

    private final ClassifierProfile mining =
            ClassifierProfile.from("mining", ClassifierProperties.Profile.miningDefaults());
    private final ClassifierProfile backtest =
            ClassifierProfile.from("backtest", ClassifierProperties.Profile.backtestDefaults());

    @Nested
    @DisplayName("noise")
    class NoiseTests {

        @Test
        @DisplayName("denylisted substrings are noise")
        void denylisted() {
            assertTrue(mining.isNoise("/usr/lib/python3/pandas: FutureWarning: use observed=True"));
            assertTrue(mining.isNoise("[common_infra] init"));
            assertTrue(backtest.isNoise("[LightGBM] num_leaves is set=31"));
            assertFalse(mining.isNoise("Running factor_propose"));
        }
    }

    @Nested
    @DisplayName("phase rules")
    class PhaseRuleTests {

        @Test
        @DisplayName("maps mining log wording to phases")
        void mapsWording() {
            assertEquals(Optional.of(Phase.EVOLVING), mining.phaseFor("Start factor_propose step"));
            assertEquals(Optional.of(Phase.BACKTESTING), mining.phaseFor("Start factor_backtest step"));
            assertEquals(Optional.of(Phase.BACKTESTING), mining.phaseFor("Running Backtest on csi300"));
            assertEquals(Optional.of(Phase.ANALYZING), mining.phaseFor("Start feedback step"));
            assertEquals(Optional.of(Phase.EVOLVING), mining.phaseFor("Start factor_calculate step"));
            assertEquals(Optional.of(Phase.PLANNING), mining.phaseFor("Planning 3 directions"));
            assertEquals(Optional.of(Phase.PLANNING), mining.phaseFor("正在规划方向"));
            assertEquals(Optional.of(Phase.COMPLETED), mining.phaseFor("进化完成"));
            assertEquals(Optional.of(Phase.COMPLETED), mining.phaseFor("程序执行完成"));
            assertEquals(Optional.empty(), mining.phaseFor("loading market data"));
        }

        @Test
        @DisplayName("first matching rule wins")
        void firstMatchWins() {
            // also contains "feedback", which comes later in the table
            assertEquals(Optional.of(Phase.EVOLVING), mining.phaseFor("factor_propose using feedback"));
        }

        @Test
        @DisplayName("regex rules match anywhere in the line")
        void regexRules() {
            var properties = new ClassifierProperties.Profile();
            properties.setPhaseRules(List.of(
                    new ClassifierProperties.Rule("^\\[loop \\d+\\] eval", MatchMode.REGEX, Phase.ANALYZING)));
            var profile = ClassifierProfile.from("custom", properties);

            assertEquals(Optional.of(Phase.ANALYZING), profile.phaseFor("[loop 4] eval started"));
            assertEquals(Optional.empty(), profile.phaseFor("x [loop 4] eval started"));
        }

        @Test
        @DisplayName("backtest profile has no phase rules and starts BACKTESTING")
        void backtestProfile() {
            assertFalse(backtest.hasPhaseRules());
            assertEquals(Phase.BACKTESTING, backtest.initialPhase());
            assertEquals(Phase.PLANNING, mining.initialPhase());
        }
    }

    @Nested
    @DisplayName("severity")
    class SeverityTests {

        @Test
        @DisplayName("error beats warning beats success")
        void precedence() {
            assertEquals(LogLevel.ERROR, mining.severityOf("ERROR: Warning ignored, success"));
            assertEquals(LogLevel.ERROR, mining.severityOf("ValueError raised"));
            assertEquals(LogLevel.WARNING, mining.severityOf("WARNING: slow query"));
            assertEquals(LogLevel.SUCCESS, mining.severityOf("Task SUCCESS"));
            assertEquals(LogLevel.SUCCESS, mining.severityOf("因子计算完成"));
            assertEquals(LogLevel.INFO, mining.severityOf("loading market data"));
        }

        @Test
        @DisplayName("backtest treats check marks as success")
        void checkMark() {
            assertEquals(LogLevel.SUCCESS, backtest.severityOf("✓ model trained"));
            assertEquals(LogLevel.INFO, mining.severityOf("✓ model trained"));
        }
    }

    @Nested
    @DisplayName("metrics")
    class MetricTests {

        @Test
        @DisplayName("extracts known metrics under canonical keys")
        void extractsKnownMetrics() {
            Map<String, Double> metrics = mining.extractMetrics("Factor result (RankIC=0.0016,IC=0.01)");

            assertEquals(0.0016, metrics.get("rankIc"));
            assertEquals(0.01, metrics.get("ic"));
            assertEquals(2, metrics.size());
        }

        @Test
        @DisplayName("handles spacing, exponents and semicolons")
        void formats() {
            Map<String, Double> metrics = mining.extractMetrics("ICIR = 1.5e-2; ARR=0.12 MDD=-0.08 Sharpe=1.3");

            assertEquals(0.015, metrics.get("icir"), 1e-12);
            assertEquals(0.12, metrics.get("annualReturn"));
            assertEquals(-0.08, metrics.get("maxDrawdown"));
            assertEquals(1.3, metrics.get("sharpeRatio"));
        }

        @Test
        @DisplayName("ignores unknown names and unparsable values")
        void ignoresGarbage() {
            assertTrue(mining.extractMetrics("IC=n/a, foo=1.0").isEmpty());
            assertTrue(mining.extractMetrics("no metrics here").isEmpty());
            assertTrue(mining.extractMetrics("IC=NaN").isEmpty());
        }

        @Test
        @DisplayName("does not match a known name inside a longer identifier")
        void wholeNames() {
            assertTrue(mining.extractMetrics("my_IC=0.5").isEmpty());
        }
    }

    @Nested
    @DisplayName("rounds and forwarding")
    class RoundTests {

        @Test
        @DisplayName("round pattern captures the round number")
        void roundNumber() {
            assertEquals(OptionalInt.of(2), mining.roundOf("===== Round 2 ====="));
            assertEquals(OptionalInt.of(3), mining.roundOf("round: 3 started"));
            assertEquals(OptionalInt.empty(), mining.roundOf("background job"));
            assertEquals(OptionalInt.empty(), backtest.roundOf("Round 2"));
        }

        @Test
        @DisplayName("mining forwards every third line plus errors, warnings and info lines")
        void miningThrottle() {
            assertFalse(mining.shouldForward(1, LogLevel.INFO, "plain"));
            assertFalse(mining.shouldForward(2, LogLevel.SUCCESS, "plain"));
            assertTrue(mining.shouldForward(3, LogLevel.INFO, "plain"));
            assertTrue(mining.shouldForward(4, LogLevel.ERROR, "plain"));
            assertTrue(mining.shouldForward(5, LogLevel.WARNING, "plain"));
            assertTrue(mining.shouldForward(7, LogLevel.INFO, "2024-01-01 INFO starting"));
        }

        @Test
        @DisplayName("backtest forwards every line")
        void backtestForwardsAll() {
            assertTrue(backtest.shouldForward(1, LogLevel.INFO, "plain"));
            assertTrue(backtest.shouldForward(2, LogLevel.INFO, "plain"));
        }

        @Test
        @DisplayName("backtest progress keywords")
        void progressKeywords() {
            assertTrue(backtest.isProgressLine("加载数据..."));
            assertTrue(backtest.isProgressLine("模型训练中"));
            assertFalse(backtest.isProgressLine("plain"));
            assertFalse(mining.isProgressLine("加载数据..."));
        }
    }
}
