package com.apex.ledger.service.analytics;

public record PositionRiskResult(
        String symbol,
        double weight,
        double volatility,
        double var95,
        double var99,
        double riskContribution,
        double portfolioImpact
) {}
