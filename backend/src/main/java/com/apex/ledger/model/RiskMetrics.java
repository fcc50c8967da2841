package com.apex.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.OptionalDouble;

/**
 * Derived risk/performance figures for one return series. Ratios whose
 * denominator is zero are empty rather than zero. Benchmark-relative fields
 * are empty when no benchmark was supplied.
 */
@Value
@Builder
public class RiskMetrics {
    double meanReturn;
    double totalReturn;
    double annualizedReturn;
    double volatility;
    OptionalDouble sharpeRatio;
    OptionalDouble sortinoRatio;
    OptionalDouble calmarRatio;
    double maxDrawdown;
    double var95;
    double var99;
    double expectedShortfall95;
    double expectedShortfall99;
    OptionalDouble beta;
    OptionalDouble trackingError;
    OptionalDouble informationRatio;
    RiskLevel riskLevel;
    int dataPoints;
    double confidenceLevel;
    LocalDateTime calculatedAt;
}
