package com.apex.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable bounds applied by the risk gate. Money limits are fixed-point,
 * ratios are fractions of one (0.3 = 30%).
 */
@Value
@Builder(toBuilder = true)
public class RiskLimits {

    @Builder.Default
    BigDecimal minCashReserve = new BigDecimal("10000");

    @Builder.Default
    BigDecimal maxTradeValue = new BigDecimal("100000");

    @Builder.Default
    BigDecimal maxDailyLoss = new BigDecimal("50000");

    @Builder.Default
    BigDecimal maxPositionValue = new BigDecimal("500000");

    @Builder.Default
    BigDecimal maxPositionRatio = new BigDecimal("0.3");

    @Builder.Default
    BigDecimal maxSectorConcentration = new BigDecimal("0.5");

    @Builder.Default
    int maxDailyTrades = 100;

    @Builder.Default
    int maxOrderFrequency = 10;

    @Builder.Default
    BigDecimal maxDrawdown = new BigDecimal("0.15");

    public static RiskLimits defaults() {
        return RiskLimits.builder().build();
    }
}
