package com.apex.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A strategy's request to trade. A null price means "at market".
 * Signals are not validated on construction; the risk gate rejects malformed ones.
 */
@Value
@Builder
public class TradeSignal {
    String signalId;
    String symbol;
    OrderSide side;
    int quantity;
    BigDecimal price;
    String strategy;
    LocalDateTime timestamp;

    public boolean hasLimitPrice() {
        return price != null;
    }
}
