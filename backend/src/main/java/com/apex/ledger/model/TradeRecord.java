package com.apex.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
@Builder
public class TradeRecord {
    String tradeId;
    String orderId;
    String signalId;
    String symbol;
    OrderSide side;
    int quantity;
    BigDecimal price;
    BigDecimal tradeValue;
    BigDecimal commission;
    BigDecimal realizedPnl;
    String strategy;
    LocalDateTime executedAt;
}
