package com.apex.ledger.service.risk;

public enum RiskRejectCode {
    EMERGENCY_STOP,
    INVALID_SIGNAL,          // Malformed signal, caller may resubmit
    PRICE_UNAVAILABLE,       // No limit price and no market quote
    INSUFFICIENT_CASH,
    TRADE_VALUE_LIMIT,
    INSUFFICIENT_POSITION,   // Sell exceeds holdings
    POSITION_VALUE_LIMIT,
    POSITION_RATIO_LIMIT,
    CONCENTRATION_LIMIT,
    DAILY_TRADE_LIMIT,
    SYMBOL_FREQUENCY_LIMIT,
    DRAWDOWN_LIMIT,
    DAILY_LOSS_LIMIT;

    public boolean isValidationError() {
        return this == INVALID_SIGNAL || this == PRICE_UNAVAILABLE;
    }
}
