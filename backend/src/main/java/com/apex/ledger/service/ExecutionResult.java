package com.apex.ledger.service;

import com.apex.ledger.model.PaperOrder;
import com.apex.ledger.model.PaperPosition;
import com.apex.ledger.util.MoneyUtils;

import java.math.BigDecimal;

/**
 * Outcome of one simulated fill. On failure only {@code failure}, {@code message}
 * and the (rejected) order are populated and the ledger is untouched.
 */
public record ExecutionResult(
        boolean success,
        ExecutionFailure failure,
        String message,
        PaperOrder order,
        BigDecimal filledPrice,
        int filledQuantity,
        BigDecimal tradeValue,
        BigDecimal commission,
        BigDecimal realizedPnl,
        PaperPosition position
) {

    public static ExecutionResult filled(PaperOrder order, BigDecimal tradeValue, BigDecimal realizedPnl, PaperPosition position) {
        return new ExecutionResult(true, null, "Filled", order, order.getAverageFillPrice(), order.getFilledQuantity(),
                tradeValue, order.getCommission(), realizedPnl, position);
    }

    public static ExecutionResult failed(ExecutionFailure failure, String message, PaperOrder order) {
        return new ExecutionResult(false, failure, message, order, null, 0, MoneyUtils.ZERO, MoneyUtils.ZERO,
                MoneyUtils.ZERO, null);
    }
}
