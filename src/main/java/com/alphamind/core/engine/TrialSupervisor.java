package com.alphamind.core.engine;

import com.alphamind.core.classify.ClassifierProfile;
import com.alphamind.core.classify.ClassifierProfiles;
import com.alphamind.core.classify.OutputClassifier;
import com.alphamind.core.events.EventBroadcaster;
import com.alphamind.core.events.TaskReporter;
import com.alphamind.core.logging.MdcContext;
import com.alphamind.core.metrics.AlphamindMetrics;
import com.alphamind.core.model.BacktestRequest;
import com.alphamind.core.model.MiningRequest;
import com.alphamind.core.model.TaskKind;
import com.alphamind.core.model.TaskStatus;
import com.alphamind.core.registry.TaskRecord;
import com.alphamind.core.scheduler.Branch;
import com.alphamind.core.scheduler.BranchResult;
import com.alphamind.core.scheduler.BranchScheduler;
import com.alphamind.trial.DeadlineEnforcer;
import com.alphamind.trial.LaunchException;
import com.alphamind.trial.ProcessFailureException;
import com.alphamind.trial.TrialCommand;
import com.alphamind.trial.TrialException;
import com.alphamind.trial.TrialExecutor;
import com.alphamind.trial.TrialHandle;
import com.alphamind.trial.TrialProperties;
import com.alphamind.trial.TrialTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the trials of one task to completion and decides the task's terminal status.
 * <p>
 * Every failure is caught here: launch errors, timeouts and unexpected exceptions end the task
 * as FAILED with an {@code error} event, and every task ends with a {@code result} event.
 */
@Component
public class TrialSupervisor {

    private static final Logger log = LoggerFactory.getLogger(TrialSupervisor.class);

    private static final DateTimeFormatter EXPERIMENT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    /** Slack for file systems with coarse modification times. */
    private static final Duration RESULT_FILE_SLACK = Duration.ofSeconds(2);

    private final TrialExecutor executor;
    private final DeadlineEnforcer deadlines;
    private final ClassifierProfiles profiles;
    private final BranchScheduler scheduler;
    private final TrialCommandFactory commands;
    private final TrialResultLoader results;
    private final EventBroadcaster broadcaster;
    private final TrialProperties trialProperties;
    private final SupervisorProperties supervisorProperties;
    private final AlphamindMetrics metrics;

    @Autowired
    public TrialSupervisor(TrialExecutor executor, DeadlineEnforcer deadlines, ClassifierProfiles profiles,
                           BranchScheduler scheduler, TrialCommandFactory commands, TrialResultLoader results,
                           EventBroadcaster broadcaster, TrialProperties trialProperties,
                           SupervisorProperties supervisorProperties,
                           @Autowired(required = false) AlphamindMetrics metrics) {
        this.executor = executor;
        this.deadlines = deadlines;
        this.profiles = profiles;
        this.scheduler = scheduler;
        this.commands = commands;
        this.results = results;
        this.broadcaster = broadcaster;
        this.trialProperties = trialProperties;
        this.supervisorProperties = supervisorProperties;
        this.metrics = metrics;
    }

    /**
     * Runs every branch of a mining task. The task completes only if all branches succeed.
     */
    public void superviseMining(TaskRecord record, MiningRequest request) {
        var reporter = new TaskReporter(record, broadcaster);
        long start = System.currentTimeMillis();
        try {
            String experimentId = "exp_" + LocalDateTime.now().format(EXPERIMENT_STAMP) + "_" + record.id();
            boolean parallel = request.parallel() != null
                    ? request.parallel() : supervisorProperties.isParallelBranches();
            Path logRoot = Path.of(trialProperties.getProjectRoot()).resolve(supervisorProperties.getBranchLogRoot());
            List<Branch> branches = scheduler.plan(request.branchDirections(), logRoot,
                    supervisorProperties.getBranchLogPrefix());
            log.info("Mining task {} ({}): {} branch(es), parallel={}", record.id(), experimentId,
                    branches.size(), parallel);

            List<BranchResult> outcome = scheduler.run(branches, parallel,
                    branch -> runBranch(reporter, experimentId, request, branch, branches.size() > 1));
            finishMining(reporter, request, outcome);
        } catch (RuntimeException e) {
            failUnexpectedly(reporter, e);
        } finally {
            recordDuration(record, start);
        }
    }

    /**
     * Runs a single backtest trial, then merges the metrics file it wrote.
     */
    public void superviseBacktest(TaskRecord record, BacktestRequest request) {
        var reporter = new TaskReporter(record, broadcaster);
        long start = System.currentTimeMillis();
        try {
            int exitCode = runTrial(reporter, 0, commands.backtest(request),
                    profiles.forKind(TaskKind.BACKTEST), backtestTimeout());
            if (exitCode != 0) {
                throw new ProcessFailureException(exitCode);
            }
            Path outputDir = Path.of(trialProperties.getProjectRoot()).resolve(trialProperties.getBacktestOutputDir());
            Map<String, Double> loaded = results.backtestMetrics(outputDir,
                    record.createdAt().minus(RESULT_FILE_SLACK));
            if (!loaded.isEmpty()) {
                reporter.metrics(loaded);
            }
            finish(reporter, TaskStatus.COMPLETED, "Backtest completed");
        } catch (ProcessFailureException e) {
            finish(reporter, TaskStatus.FAILED, e.getMessage());
        } catch (TrialException e) {
            failTrial(reporter, TaskKind.BACKTEST, e);
        } catch (RuntimeException e) {
            failUnexpectedly(reporter, e);
        } finally {
            recordDuration(record, start);
        }
    }

    private int runBranch(TaskReporter reporter, String experimentId, MiningRequest request, Branch branch,
                          boolean multiBranch) {
        if (multiBranch) {
            MdcContext.setBranch(reporter.taskId(), branch.index());
        }
        try {
            if (reporter.record().isTerminal()) {
                log.info("Task {} already {}, skipping branch {}", reporter.taskId(),
                        reporter.record().status(), branch.index());
                return -1;
            }
            TrialCommand command = commands.mining(experimentId, request, branch);
            int exitCode = runTrial(reporter, branch.index(), command, profiles.forKind(TaskKind.MINING),
                    miningTimeout());
            if (metrics != null) {
                metrics.recordBranchResult(exitCode == 0);
            }
            return exitCode;
        } catch (TrialException e) {
            if (metrics != null) {
                metrics.recordBranchResult(false);
            }
            countFailure(TaskKind.MINING, e);
            reporter.error(branchPrefix(branch, multiBranch) + e.getMessage());
            throw e;
        } finally {
            if (multiBranch) {
                MdcContext.clearBranch();
            }
        }
    }

    /**
     * Spawns one trial, feeds its output through a fresh classifier until it exits, and
     * returns its exit code. The process slot is held for exactly the lifetime of the process.
     */
    int runTrial(TaskReporter reporter, int slot, TrialCommand command, ClassifierProfile profile,
                 Duration timeout) {
        TaskRecord record = reporter.record();
        var classifier = new OutputClassifier(profile, reporter);
        try (TrialHandle handle = executor.spawn(command)) {
            synchronized (record) {
                if (record.isTerminal()) {
                    log.info("Task {} ended while process {} was starting, killing it", record.id(), handle.pid());
                    handle.kill();
                    return -1;
                }
                record.attachProcess(slot, handle);
            }
            int exitCode;
            try {
                exitCode = deadlines.supervise(handle, timeout, () -> {
                    try (Stream<String> lines = handle.lines()) {
                        lines.forEach(classifier::accept);
                    }
                    return handle.waitFor();
                });
            } finally {
                record.detachProcess(slot);
            }
            log.info("Process {} of task {} exited with code {} after {} lines", handle.pid(), record.id(),
                    exitCode, classifier.retainedLines());
            if (record.kind() == TaskKind.MINING && profile.hasPhaseRules() && !classifier.transitioned()
                    && classifier.retainedLines() > 0) {
                log.warn("Mining trial of task {} produced {} lines but no phase transition; "
                        + "the phase rules may no longer match its output", record.id(), classifier.retainedLines());
            }
            return exitCode;
        }
    }

    private void finishMining(TaskReporter reporter, MiningRequest request, List<BranchResult> outcome) {
        results.factorCount(Path.of(trialProperties.getProjectRoot()), request.librarySuffix())
                .ifPresent(count -> reporter.metrics(Map.of("totalFactors", count.doubleValue())));

        List<BranchResult> failed = outcome.stream().filter(r -> !r.succeeded()).toList();
        if (failed.isEmpty()) {
            finish(reporter, TaskStatus.COMPLETED, "Mining completed");
            return;
        }
        String message;
        if (outcome.size() == 1) {
            BranchResult only = failed.get(0);
            message = only.error() != null ? only.error().getMessage()
                    : new ProcessFailureException(only.exitCode()).getMessage();
        } else {
            message = failed.size() + " of " + outcome.size() + " branches failed: " + failed.stream()
                    .map(r -> "branch " + r.branch().index() + " (" + r.failureReason() + ")")
                    .collect(Collectors.joining(", "));
        }
        finish(reporter, TaskStatus.FAILED, message);
    }

    private void failTrial(TaskReporter reporter, TaskKind kind, TrialException e) {
        countFailure(kind, e);
        log.warn("Task {} failed: {}", reporter.taskId(), e.getMessage());
        reporter.error(e.getMessage());
        finish(reporter, TaskStatus.FAILED, e.getMessage());
    }

    private void failUnexpectedly(TaskReporter reporter, RuntimeException e) {
        log.error("Supervision of task {} failed unexpectedly", reporter.taskId(), e);
        String message = "Unexpected error: " + e.getMessage();
        reporter.error(message);
        finish(reporter, TaskStatus.FAILED, message);
    }

    private void finish(TaskReporter reporter, TaskStatus status, String message) {
        boolean decided = reporter.finish(status, message,
                p -> status == TaskStatus.COMPLETED ? p.finished(message) : p.withMessage(message));
        if (!decided) {
            log.debug("Task {} was already {}, ignoring {}", reporter.taskId(), reporter.record().status(), status);
            return;
        }
        log.info("Task {} {}: {}", reporter.taskId(), status, message);
        if (metrics != null) {
            metrics.recordTaskResult(reporter.record().kind(), status);
        }
    }

    private void countFailure(TaskKind kind, TrialException e) {
        if (metrics == null) {
            return;
        }
        if (e instanceof TrialTimeoutException) {
            metrics.recordTimeout(kind);
        } else if (e instanceof LaunchException) {
            metrics.recordLaunchFailure(kind);
        }
    }

    private void recordDuration(TaskRecord record, long start) {
        if (metrics != null) {
            metrics.recordTrialDuration(record.kind(), System.currentTimeMillis() - start);
        }
    }

    private Duration miningTimeout() {
        return Duration.ofSeconds(trialProperties.getMiningTimeoutSeconds());
    }

    private Duration backtestTimeout() {
        return Duration.ofSeconds(trialProperties.getBacktestTimeoutSeconds());
    }

    private static String branchPrefix(Branch branch, boolean multiBranch) {
        return multiBranch ? "Branch " + branch.index() + ": " : "";
    }
}
