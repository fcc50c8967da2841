package com.apex.ledger.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "analytics")
@Data
@Validated
public class AnalyticsProperties {

    // Annual, converted to a daily rate by dividing by tradingDays
    private double riskFreeRate = 0.02;

    @Min(1)
    private int tradingDays = 252;

    @Min(2)
    private int minObservations = 30;

    private MonteCarlo monteCarlo = new MonteCarlo();

    @NotEmpty
    private Map<String, Double> stressScenarios = defaultScenarios();

    @Data
    public static class MonteCarlo {
        @Min(100)
        private int simulations = 10_000;

        @Positive
        private int horizonDays = 1;

        private long seed = 42L;
    }

    private static Map<String, Double> defaultScenarios() {
        Map<String, Double> scenarios = new LinkedHashMap<>();
        scenarios.put("mild-stress", 1.5);
        scenarios.put("severe-stress", 2.0);
        scenarios.put("extreme-stress", 3.0);
        return scenarios;
    }
}
