package com.alphamind.core.classify;

import com.alphamind.core.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Compiled classification profiles, one per trial kind, built once from configuration.
 */
@Component
public class ClassifierProfiles {

    private static final Logger log = LoggerFactory.getLogger(ClassifierProfiles.class);

    private final ClassifierProfile mining;
    private final ClassifierProfile backtest;

    public ClassifierProfiles(ClassifierProperties properties) {
        this.mining = ClassifierProfile.from("mining", properties.getMining());
        this.backtest = ClassifierProfile.from("backtest", properties.getBacktest());
        log.info("Loaded output classifier profiles (mining phase rules: {}, backtest phase rules: {})",
                mining.hasPhaseRules(), backtest.hasPhaseRules());
    }

    public ClassifierProfile forKind(TaskKind kind) {
        return kind == TaskKind.MINING ? mining : backtest;
    }
}
