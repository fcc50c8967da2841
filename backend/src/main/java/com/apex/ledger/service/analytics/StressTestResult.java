package com.apex.ledger.service.analytics;

public record StressTestResult(
        String scenario,
        double stressFactor,
        double var95,
        double var99,
        double expectedShortfall95,
        double maxDrawdown,
        double expectedLoss     // Mean shocked daily return
) {}
