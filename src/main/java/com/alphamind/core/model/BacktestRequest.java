package com.alphamind.core.model;

/**
 * Request to start a standalone backtest.
 *
 * @param factorJson   path to the factor library JSON (required)
 * @param factorSource {@code custom} or {@code combined}; nullable, defaults to {@code custom}
 * @param configPath   backtest config path; nullable, falls back to configuration
 */
public record BacktestRequest(
    String factorJson,
    String factorSource,
    String configPath
) {

    public String effectiveFactorSource() {
        return factorSource != null && !factorSource.isBlank() ? factorSource : "custom";
    }
}
