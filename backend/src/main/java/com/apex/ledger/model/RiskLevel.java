package com.apex.ledger.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    static RiskLevel fromScore(int score) {
        if (score >= 7) {
            return CRITICAL;
        }
        if (score >= 5) {
            return HIGH;
        }
        if (score >= 3) {
            return MEDIUM;
        }
        return LOW;
    }

    /**
     * Three-tier score per factor (0-3 each), summed and bucketed.
     * {@code var95} is a return quantile, negative for losses.
     */
    public static RiskLevel assess(double volatility, double maxDrawdown, double var95) {
        int score = 0;
        if (volatility > 0.4) {
            score += 3;
        } else if (volatility > 0.25) {
            score += 2;
        } else if (volatility > 0.15) {
            score += 1;
        }

        if (maxDrawdown > 0.2) {
            score += 3;
        } else if (maxDrawdown > 0.15) {
            score += 2;
        } else if (maxDrawdown > 0.1) {
            score += 1;
        }

        if (var95 < -0.05) {
            score += 3;
        } else if (var95 < -0.03) {
            score += 2;
        } else if (var95 < -0.02) {
            score += 1;
        }
        return fromScore(score);
    }
}
