package com.apex.ledger.trading.pipeline;

import com.apex.ledger.model.TradeSignal;
import com.apex.ledger.service.ExecutionResult;
import com.apex.ledger.service.risk.RiskGateDecision;

/**
 * What happened to one submitted signal. {@code execution} is null when the
 * risk gate rejected the signal.
 */
public record ExecutionOutcome(Status status, TradeSignal signal, RiskGateDecision decision, ExecutionResult execution) {

    public enum Status {
        EXECUTED,
        RISK_REJECTED,
        EXECUTION_FAILED
    }

    public boolean isExecuted() {
        return status == Status.EXECUTED;
    }

    public String reason() {
        return switch (status) {
            case EXECUTED -> "Executed";
            case RISK_REJECTED -> decision.message();
            case EXECUTION_FAILED -> execution.message();
        };
    }
}
