package com.apex.ledger.service.analytics;

/**
 * Single-series VaR and expected shortfall, both expressed as returns (negative for losses).
 *
 * @param sampleSize observations behind the estimate; simulated paths for Monte Carlo
 */
public record VaRResult(
        VaRMethod method,
        double var,
        double expectedShortfall,
        double confidenceLevel,
        int timeHorizon,
        int sampleSize
) {}
