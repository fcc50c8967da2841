package com.apex.ledger.service.analytics;

public enum VaRMethod {
    HISTORICAL,
    PARAMETRIC,
    MONTE_CARLO
}
