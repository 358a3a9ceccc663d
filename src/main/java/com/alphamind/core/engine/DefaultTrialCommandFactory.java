package com.alphamind.core.engine;

import com.alphamind.core.model.BacktestRequest;
import com.alphamind.core.model.MiningRequest;
import com.alphamind.core.scheduler.Branch;
import com.alphamind.trial.LaunchException;
import com.alphamind.trial.TrialCommand;
import com.alphamind.trial.TrialProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Launches the Python mining CLI and backtest runner from the configured project root.
 */
@Component
public class DefaultTrialCommandFactory implements TrialCommandFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultTrialCommandFactory.class);

    private final TrialProperties properties;

    public DefaultTrialCommandFactory(TrialProperties properties) {
        this.properties = properties;
    }

    @Override
    public TrialCommand mining(String experimentId, MiningRequest request, Branch branch) {
        var argv = new ArrayList<>(List.of(properties.getPython(), "-m", properties.getMiningModule(), "mine"));
        if (branch.direction() != null && !branch.direction().isBlank()) {
            argv.add("--direction");
            argv.add(branch.direction());
        }
        argv.add("--config_path");
        argv.add(properties.getMiningConfigPath());

        Map<String, String> env = new LinkedHashMap<>(properties.getExtraEnv());
        env.put("EXPERIMENT_ID", experimentId);
        env.put("BRANCH_INDEX", String.valueOf(branch.index()));
        if (branch.logPath() != null) {
            env.put("BRANCH_LOG_DIR", branch.logPath().toAbsolutePath().toString());
        }
        if (request.librarySuffix() != null && !request.librarySuffix().isBlank()) {
            env.put("FACTOR_LIBRARY_SUFFIX", request.librarySuffix());
        }
        putIfSet(env, "NUM_DIRECTIONS", request.numDirections());
        env.put("MAX_ROUNDS", String.valueOf(request.effectiveMaxRounds()));
        putIfSet(env, "MAX_LOOPS", request.maxLoops());
        putIfSet(env, "FACTORS_PER_HYPOTHESIS", request.factorsPerHypothesis());

        Path results = projectRoot().resolve(properties.getResultsDir());
        env.put("WORKSPACE_PATH", ensureDirectory(results.resolve("workspace_" + experimentId)).toString());
        env.put("PICKLE_CACHE_FOLDER_PATH_STR",
                ensureDirectory(results.resolve("pickle_cache_" + experimentId)).toString());

        return new TrialCommand(argv, projectRoot(), env);
    }

    @Override
    public TrialCommand backtest(BacktestRequest request) {
        String config = request.configPath() != null && !request.configPath().isBlank()
                ? request.configPath() : properties.getBacktestConfigPath();
        var argv = List.of(properties.getPython(), "-m", properties.getBacktestModule(),
                "-c", config,
                "--factor-source", request.effectiveFactorSource(),
                "--factor-json", request.factorJson());
        return new TrialCommand(argv, projectRoot(), properties.getExtraEnv());
    }

    private Path projectRoot() {
        return Path.of(properties.getProjectRoot()).toAbsolutePath().normalize();
    }

    private static Path ensureDirectory(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Cannot create trial directory {}: {}", dir, e.getMessage());
            throw new LaunchException("Cannot create trial directory " + dir, e);
        }
    }

    private static void putIfSet(Map<String, String> env, String key, Integer value) {
        if (value != null) {
            env.put(key, String.valueOf(value));
        }
    }
}
