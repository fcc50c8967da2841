package com.apex.ledger.config;

import com.apex.ledger.model.RiskLimits;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "risk.limits")
@Data
@Validated
public class RiskLimitProperties {

    @NotNull
    @DecimalMin("0")
    private BigDecimal minCashReserve = new BigDecimal("10000");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxTradeValue = new BigDecimal("100000");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxDailyLoss = new BigDecimal("50000");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal maxPositionValue = new BigDecimal("500000");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxPositionRatio = new BigDecimal("0.3");

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxSectorConcentration = new BigDecimal("0.5");

    @Min(1)
    private int maxDailyTrades = 100;

    @Min(1)
    private int maxOrderFrequency = 10;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    @DecimalMax("1")
    private BigDecimal maxDrawdown = new BigDecimal("0.15");

    public RiskLimits toRiskLimits() {
        return RiskLimits.builder()
                .minCashReserve(minCashReserve)
                .maxTradeValue(maxTradeValue)
                .maxDailyLoss(maxDailyLoss)
                .maxPositionValue(maxPositionValue)
                .maxPositionRatio(maxPositionRatio)
                .maxSectorConcentration(maxSectorConcentration)
                .maxDailyTrades(maxDailyTrades)
                .maxOrderFrequency(maxOrderFrequency)
                .maxDrawdown(maxDrawdown)
                .build();
    }
}
