package com.alphamind.core.engine;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Task supervision settings: branch fan-out and retained history.
 */
@Component
@ConfigurationProperties(prefix = "alphamind.supervisor")
public class SupervisorProperties {

    /** Log entries retained per task; older entries are dropped first. */
    private int logCapacity = 500;
    /** Default for mining requests that do not say whether to run branches in parallel. */
    private boolean parallelBranches = true;
    /** 0 means one thread per branch. */
    private int maxParallelBranches = 0;
    private String branchLogRoot = "log";
    private String branchLogPrefix = "branch";

    public int getLogCapacity() { return logCapacity; }
    public void setLogCapacity(int logCapacity) { this.logCapacity = logCapacity; }
    public boolean isParallelBranches() { return parallelBranches; }
    public void setParallelBranches(boolean parallelBranches) { this.parallelBranches = parallelBranches; }
    public int getMaxParallelBranches() { return maxParallelBranches; }
    public void setMaxParallelBranches(int maxParallelBranches) { this.maxParallelBranches = maxParallelBranches; }
    public String getBranchLogRoot() { return branchLogRoot; }
    public void setBranchLogRoot(String branchLogRoot) { this.branchLogRoot = branchLogRoot; }
    public String getBranchLogPrefix() { return branchLogPrefix; }
    public void setBranchLogPrefix(String branchLogPrefix) { this.branchLogPrefix = branchLogPrefix; }
}
