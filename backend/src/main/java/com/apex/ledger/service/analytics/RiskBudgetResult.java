package com.apex.ledger.service.analytics;

import java.util.Map;

public record RiskBudgetResult(
        Map<String, Double> positionViolations,
        double maxConcentration,
        boolean concentrationBreached,
        double totalLeverage,
        boolean leverageBreached
) {

    public boolean withinBudget() {
        return positionViolations.isEmpty() && !concentrationBreached && !leverageBreached;
    }
}
