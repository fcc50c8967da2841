package com.apex.ledger.exception;

import lombok.Getter;

/**
 * Typed failure of a risk/performance computation. Thrown instead of returning
 * zeroed metrics so that a failed calculation can never read as "no risk".
 */
@Getter
public class RiskComputationException extends TradingException {

    private final Reason reason;

    public RiskComputationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RiskComputationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public enum Reason {
        INSUFFICIENT_DATA,
        INVALID_INPUT,
        NON_POSITIVE_DEFINITE_COVARIANCE,
        DEGENERATE_BENCHMARK,
        DEGENERATE_PORTFOLIO
    }
}
