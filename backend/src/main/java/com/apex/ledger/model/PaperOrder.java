package com.apex.ledger.model;

import com.apex.ledger.exception.OrderStateException;
import com.apex.ledger.util.MoneyUtils;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Simulated order. Instances are immutable: every status change yields a new
 * instance, and terminal orders refuse further transitions.
 */
@Value
@Builder(toBuilder = true)
public class PaperOrder {

    String orderId;
    String signalId;
    String symbol;
    OrderSide side;
    OrderType orderType;
    int quantity;
    BigDecimal limitPrice;
    String strategy;
    OrderStatus status;

    @Builder.Default
    int filledQuantity = 0;

    BigDecimal averageFillPrice;

    @Builder.Default
    BigDecimal commission = MoneyUtils.ZERO;

    String rejectReason;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;

    public static PaperOrder fromSignal(TradeSignal signal, LocalDateTime now) {
        return PaperOrder.builder()
                .orderId("PAPER-" + signal.getSignalId())
                .signalId(signal.getSignalId())
                .symbol(signal.getSymbol())
                .side(signal.getSide())
                .orderType(signal.hasLimitPrice() ? OrderType.LIMIT : OrderType.MARKET)
                .quantity(signal.getQuantity())
                .limitPrice(signal.hasLimitPrice() ? MoneyUtils.scale(signal.getPrice()) : null)
                .strategy(signal.getStrategy())
                .status(OrderStatus.SUBMITTED)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public PaperOrder filled(BigDecimal fillPrice, BigDecimal fillCommission, LocalDateTime at) {
        return transition(OrderStatus.FILLED, at).toBuilder()
                .filledQuantity(quantity)
                .averageFillPrice(fillPrice)
                .commission(fillCommission)
                .build();
    }

    public PaperOrder rejected(String reason, LocalDateTime at) {
        return transition(OrderStatus.REJECTED, at).toBuilder()
                .rejectReason(reason)
                .build();
    }

    public PaperOrder cancelled(LocalDateTime at) {
        return transition(OrderStatus.CANCELLED, at);
    }

    private PaperOrder transition(OrderStatus target, LocalDateTime at) {
        if (!status.canTransitionTo(target)) {
            throw new OrderStateException(orderId, status, target);
        }
        return toBuilder().status(target).updatedAt(at).build();
    }
}
