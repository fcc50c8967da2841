package com.apex.ledger.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal initialBalance = new BigDecimal("1000000");

    @NotNull
    @DecimalMin("0")
    private BigDecimal commissionRate = new BigDecimal("0.001");

    @NotNull
    @DecimalMin("0")
    private BigDecimal minCommission = new BigDecimal("10");

    // Most recent fills kept in the in-memory trade history
    @Min(1)
    private int tradeHistoryLimit = 1000;

    // Time zone whose calendar date defines the trading day
    @NotBlank
    private String zone = "Asia/Hong_Kong";
}
