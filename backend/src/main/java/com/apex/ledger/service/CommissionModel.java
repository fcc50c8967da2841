package com.apex.ledger.service;

import com.apex.ledger.config.ExecutionProperties;
import com.apex.ledger.util.MoneyUtils;

import java.math.BigDecimal;

/**
 * Proportional commission with a per-fill floor: {@code max(value * rate, minimum)}.
 */
public class CommissionModel {

    private final BigDecimal rate;
    private final BigDecimal minimum;

    public CommissionModel(BigDecimal rate, BigDecimal minimum) {
        if (rate == null || rate.signum() < 0) {
            throw new IllegalArgumentException("Commission rate must be non-negative");
        }
        if (minimum == null || minimum.signum() < 0) {
            throw new IllegalArgumentException("Minimum commission must be non-negative");
        }
        this.rate = rate;
        this.minimum = MoneyUtils.scale(minimum);
    }

    public static CommissionModel from(ExecutionProperties properties) {
        return new CommissionModel(properties.getCommissionRate(), properties.getMinCommission());
    }

    public BigDecimal commissionFor(BigDecimal tradeValue) {
        BigDecimal proportional = MoneyUtils.scale(MoneyUtils.scale(tradeValue).multiply(rate));
        return MoneyUtils.max(proportional, minimum);
    }

    public BigDecimal getRate() {
        return rate;
    }

    public BigDecimal getMinimum() {
        return minimum;
    }
}
