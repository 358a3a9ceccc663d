package com.alphamind.core.scheduler;

/**
 * Runs one branch to completion and reports its exit code.
 */
@FunctionalInterface
public interface BranchRunner {

    int run(Branch branch) throws Exception;
}
