package com.apex.ledger.service.analytics;

import java.util.Map;

/**
 * Covariance-based portfolio VaR with its per-asset decomposition. VaR is a
 * positive loss fraction; component VaRs sum to {@code portfolioVar}.
 */
public record PortfolioVarResult(
        double confidenceLevel,
        double portfolioVolatility,
        double portfolioVar,
        Map<String, Double> marginalVar,
        Map<String, Double> componentVar
) {

    public double componentTotal() {
        return componentVar.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
