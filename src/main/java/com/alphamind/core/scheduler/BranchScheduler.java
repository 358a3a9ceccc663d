package com.alphamind.core.scheduler;

import com.alphamind.core.engine.SupervisorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splits a mining run into branches and runs them, sequentially or on a bounded pool.
 * <p>
 * Every branch is always run to completion: a failing or throwing branch never cancels its
 * siblings, and results come back in branch index order.
 */
@Component
public class BranchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BranchScheduler.class);

    private final int maxParallel;

    @Autowired
    public BranchScheduler(SupervisorProperties properties) {
        this(properties.getMaxParallelBranches());
    }

    /**
     * @param maxParallel upper bound on concurrently running branches; 0 or less means one
     *                    thread per branch
     */
    public BranchScheduler(int maxParallel) {
        this.maxParallel = maxParallel;
    }

    /**
     * Plans and runs the branches for the given directions.
     */
    public List<BranchResult> run(List<String> directions, boolean parallel, Path logRoot, String prefix,
                                  BranchRunner runner) {
        return run(plan(directions, logRoot, prefix), parallel, runner);
    }

    /**
     * One branch per direction, numbered from 1. No directions yields a single default branch.
     * Branch log directories {@code {logRoot}/{prefix}_NN} are created only when there is more
     * than one branch.
     *
     * @throws UncheckedIOException if a branch log directory cannot be created
     */
    public List<Branch> plan(List<String> directions, Path logRoot, String prefix) {
        if (directions == null || directions.isEmpty()) {
            return List.of(new Branch(1, null, null));
        }
        if (directions.size() == 1) {
            return List.of(new Branch(1, directions.get(0), null));
        }
        var branches = new ArrayList<Branch>(directions.size());
        for (int i = 0; i < directions.size(); i++) {
            int index = i + 1;
            Path dir = logRoot.resolve(String.format("%s_%02d", prefix, index));
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create branch log directory " + dir, e);
            }
            branches.add(new Branch(index, directions.get(i), dir));
        }
        return branches;
    }

    public List<BranchResult> run(List<Branch> branches, boolean parallel, BranchRunner runner) {
        if (!parallel || branches.size() < 2) {
            var results = new ArrayList<BranchResult>(branches.size());
            for (Branch branch : branches) {
                results.add(runOne(branch, runner));
            }
            return results;
        }
        return runParallel(branches, runner);
    }

    private List<BranchResult> runParallel(List<Branch> branches, BranchRunner runner) {
        int threads = maxParallel > 0 ? Math.min(maxParallel, branches.size()) : branches.size();
        log.info("Running {} branches in parallel ({} at a time)", branches.size(), threads);

        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        var counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "branch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            var futures = new ArrayList<CompletableFuture<BranchResult>>(branches.size());
            for (Branch branch : branches) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    if (callerMdc != null) {
                        MDC.setContextMap(callerMdc);
                    }
                    try {
                        return runOne(branch, runner);
                    } finally {
                        MDC.clear();
                    }
                }, pool));
            }
            // runOne never throws, so join() only returns
            return futures.stream().map(CompletableFuture::join).toList();
        } finally {
            pool.shutdown();
        }
    }

    private BranchResult runOne(Branch branch, BranchRunner runner) {
        long start = System.currentTimeMillis();
        try {
            int exitCode = runner.run(branch);
            long elapsed = System.currentTimeMillis() - start;
            if (exitCode == 0) {
                log.info("Branch {} finished in {}ms", branch.index(), elapsed);
            } else {
                log.warn("Branch {} exited with code {} after {}ms", branch.index(), exitCode, elapsed);
            }
            return new BranchResult(branch, exitCode, null, elapsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new BranchResult(branch, -1, e, System.currentTimeMillis() - start);
        } catch (Exception e) {
            log.warn("Branch {} failed: {}", branch.index(), e.getMessage());
            return new BranchResult(branch, -1, e, System.currentTimeMillis() - start);
        }
    }
}
