package com.apex.ledger.service.risk;

/**
 * Pre-trade checks in evaluation order.
 */
public enum RiskCheck {
    EMERGENCY_STOP,
    BASIC,
    CASH,
    POSITION,
    CONCENTRATION,
    FREQUENCY,
    DRAWDOWN,
    DAILY_LOSS
}
