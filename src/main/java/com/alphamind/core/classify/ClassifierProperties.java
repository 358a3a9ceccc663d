package com.alphamind.core.classify;

import com.alphamind.core.model.Phase;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative output-classification tables, one profile per trial kind.
 * <p>
 * The defaults mirror the wording of the factor-mining and backtest programs' logs. A list set in
 * configuration replaces the default list as a whole.
 */
@Component
@ConfigurationProperties(prefix = "alphamind.classifier")
public class ClassifierProperties {

    private Profile mining = Profile.miningDefaults();
    private Profile backtest = Profile.backtestDefaults();

    public Profile getMining() { return mining; }
    public void setMining(Profile mining) { this.mining = mining; }
    public Profile getBacktest() { return backtest; }
    public void setBacktest(Profile backtest) { this.backtest = backtest; }

    public static class Profile {
        private Phase initialPhase = Phase.PLANNING;
        private List<String> noise = new ArrayList<>();
        private List<Rule> phaseRules = new ArrayList<>();
        private List<String> progressKeywords = new ArrayList<>();
        private List<String> errorMarkers = new ArrayList<>(List.of("ERROR", "Error"));
        private List<String> warningMarkers = new ArrayList<>(List.of("WARNING", "Warning"));
        /** Matched case-insensitively. */
        private List<String> successMarkers = new ArrayList<>(List.of("完成", "success"));
        private List<String> infoMarkers = new ArrayList<>(List.of("INFO"));
        /** Metric name as printed by the trial -> metric key stored on the task. */
        private Map<String, String> metricKeys = new LinkedHashMap<>();
        /** Regex with one group capturing the current evolution round; blank disables. */
        private String roundPattern = "";
        /** Forward every n-th line live (errors, warnings and info lines always). */
        private int forwardEvery = 3;

        static Profile miningDefaults() {
            var p = new Profile();
            p.initialPhase = Phase.PLANNING;
            p.noise = new ArrayList<>(List.of(
                    "field data contains nan",
                    "common_infra",
                    "PyTorch models are skipped",
                    "UserWarning: pkg_resources",
                    "FutureWarning",
                    "UserWarning",
                    "Training until validation scores",
                    "Did not meet early stopping"));
            p.phaseRules = new ArrayList<>(List.of(
                    new Rule("factor_propose", MatchMode.CONTAINS, Phase.EVOLVING),
                    new Rule("factor_backtest", MatchMode.CONTAINS, Phase.BACKTESTING),
                    new Rule("backtest", MatchMode.CONTAINS_IGNORE_CASE, Phase.BACKTESTING),
                    new Rule("feedback", MatchMode.CONTAINS, Phase.ANALYZING),
                    new Rule("factor_calculate", MatchMode.CONTAINS, Phase.EVOLVING),
                    new Rule("规划", MatchMode.CONTAINS, Phase.PLANNING),
                    new Rule("planning", MatchMode.CONTAINS_IGNORE_CASE, Phase.PLANNING),
                    new Rule("进化完成", MatchMode.CONTAINS, Phase.COMPLETED),
                    new Rule("程序执行完成", MatchMode.CONTAINS, Phase.COMPLETED)));
            p.metricKeys = defaultMetricKeys();
            p.roundPattern = "(?i)\\bround\\s*[:#]?\\s*(\\d+)";
            p.forwardEvery = 3;
            return p;
        }

        static Profile backtestDefaults() {
            var p = new Profile();
            p.initialPhase = Phase.BACKTESTING;
            p.noise = new ArrayList<>(List.of(
                    "field data contains nan",
                    "common_infra",
                    "PyTorch models are skipped",
                    "UserWarning: pkg_resources",
                    "Training until validation scores",
                    "FutureWarning",
                    "UserWarning",
                    "Did not meet early stopping",
                    "num_leaves is set="));
            p.progressKeywords = new ArrayList<>(List.of("因子", "回测", "模型", "训练", "完成", "加载"));
            p.successMarkers = new ArrayList<>(List.of("完成", "success", "✓"));
            p.metricKeys = defaultMetricKeys();
            p.forwardEvery = 1;
            return p;
        }

        private static Map<String, String> defaultMetricKeys() {
            var keys = new LinkedHashMap<String, String>();
            keys.put("IC", "ic");
            keys.put("ICIR", "icir");
            keys.put("RankIC", "rankIc");
            keys.put("RankICIR", "rankIcir");
            keys.put("ARR", "annualReturn");
            keys.put("IR", "informationRatio");
            keys.put("MDD", "maxDrawdown");
            keys.put("Sharpe", "sharpeRatio");
            return keys;
        }

        public Phase getInitialPhase() { return initialPhase; }
        public void setInitialPhase(Phase initialPhase) { this.initialPhase = initialPhase; }
        public List<String> getNoise() { return noise; }
        public void setNoise(List<String> noise) { this.noise = noise; }
        public List<Rule> getPhaseRules() { return phaseRules; }
        public void setPhaseRules(List<Rule> phaseRules) { this.phaseRules = phaseRules; }
        public List<String> getProgressKeywords() { return progressKeywords; }
        public void setProgressKeywords(List<String> progressKeywords) { this.progressKeywords = progressKeywords; }
        public List<String> getErrorMarkers() { return errorMarkers; }
        public void setErrorMarkers(List<String> errorMarkers) { this.errorMarkers = errorMarkers; }
        public List<String> getWarningMarkers() { return warningMarkers; }
        public void setWarningMarkers(List<String> warningMarkers) { this.warningMarkers = warningMarkers; }
        public List<String> getSuccessMarkers() { return successMarkers; }
        public void setSuccessMarkers(List<String> successMarkers) { this.successMarkers = successMarkers; }
        public List<String> getInfoMarkers() { return infoMarkers; }
        public void setInfoMarkers(List<String> infoMarkers) { this.infoMarkers = infoMarkers; }
        public Map<String, String> getMetricKeys() { return metricKeys; }
        public void setMetricKeys(Map<String, String> metricKeys) { this.metricKeys = metricKeys; }
        public String getRoundPattern() { return roundPattern; }
        public void setRoundPattern(String roundPattern) { this.roundPattern = roundPattern; }
        public int getForwardEvery() { return forwardEvery; }
        public void setForwardEvery(int forwardEvery) { this.forwardEvery = forwardEvery; }
    }

    public static class Rule {
        private String pattern;
        private MatchMode match = MatchMode.CONTAINS;
        private Phase phase;

        public Rule() {
        }

        public Rule(String pattern, MatchMode match, Phase phase) {
            this.pattern = pattern;
            this.match = match;
            this.phase = phase;
        }

        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
        public MatchMode getMatch() { return match; }
        public void setMatch(MatchMode match) { this.match = match; }
        public Phase getPhase() { return phase; }
        public void setPhase(Phase phase) { this.phase = phase; }
    }
}
