package com.alphamind.core.engine;

import com.alphamind.core.model.BacktestRequest;
import com.alphamind.core.model.MiningRequest;
import com.alphamind.core.scheduler.Branch;
import com.alphamind.trial.TrialCommand;

/**
 * Builds the command lines of trial processes.
 */
public interface TrialCommandFactory {

    /**
     * @param experimentId identifier shared by every branch of one mining task
     */
    TrialCommand mining(String experimentId, MiningRequest request, Branch branch);

    TrialCommand backtest(BacktestRequest request);
}
