package com.apex.ledger.service.analytics;

/**
 * Portfolio-level weight bounds, as fractions of portfolio value.
 */
public record RiskBudgetLimits(double maxPositionSize, double maxConcentration, double maxLeverage) {

    public static RiskBudgetLimits defaults() {
        return new RiskBudgetLimits(0.1, 0.2, 2.0);
    }
}
