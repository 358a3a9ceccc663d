package com.alphamind.trial;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How trial processes are located, launched and time-limited.
 */
@Component
@ConfigurationProperties(prefix = "alphamind.trial")
public class TrialProperties {

    /** auto, posix or windows. */
    private String platform = "auto";
    private String python = "python";
    private String projectRoot = ".";
    private String miningModule = "quantaalpha.cli";
    private String backtestModule = "quantaalpha.backtest.run_backtest";
    private String miningConfigPath = "configs/experiment.yaml";
    private String backtestConfigPath = "configs/backtest.yaml";
    private String resultsDir = "data/results";
    private String backtestOutputDir = "data/results/backtest_v2_results";
    private int miningTimeoutSeconds = 36_000;
    private int backtestTimeoutSeconds = 3_800;
    private List<String> extraPath = new ArrayList<>();
    private Map<String, String> extraEnv = new LinkedHashMap<>();

    public String getPlatform() { return platform; }
    public void setPlatform(String platform) { this.platform = platform; }
    public String getPython() { return python; }
    public void setPython(String python) { this.python = python; }
    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String projectRoot) { this.projectRoot = projectRoot; }
    public String getMiningModule() { return miningModule; }
    public void setMiningModule(String miningModule) { this.miningModule = miningModule; }
    public String getBacktestModule() { return backtestModule; }
    public void setBacktestModule(String backtestModule) { this.backtestModule = backtestModule; }
    public String getMiningConfigPath() { return miningConfigPath; }
    public void setMiningConfigPath(String miningConfigPath) { this.miningConfigPath = miningConfigPath; }
    public String getBacktestConfigPath() { return backtestConfigPath; }
    public void setBacktestConfigPath(String backtestConfigPath) { this.backtestConfigPath = backtestConfigPath; }
    public String getResultsDir() { return resultsDir; }
    public void setResultsDir(String resultsDir) { this.resultsDir = resultsDir; }
    public String getBacktestOutputDir() { return backtestOutputDir; }
    public void setBacktestOutputDir(String backtestOutputDir) { this.backtestOutputDir = backtestOutputDir; }
    public int getMiningTimeoutSeconds() { return miningTimeoutSeconds; }
    public void setMiningTimeoutSeconds(int miningTimeoutSeconds) { this.miningTimeoutSeconds = miningTimeoutSeconds; }
    public int getBacktestTimeoutSeconds() { return backtestTimeoutSeconds; }
    public void setBacktestTimeoutSeconds(int backtestTimeoutSeconds) { this.backtestTimeoutSeconds = backtestTimeoutSeconds; }
    public List<String> getExtraPath() { return extraPath; }
    public void setExtraPath(List<String> extraPath) { this.extraPath = extraPath; }
    public Map<String, String> getExtraEnv() { return extraEnv; }
    public void setExtraEnv(Map<String, String> extraEnv) { this.extraEnv = extraEnv; }
}
