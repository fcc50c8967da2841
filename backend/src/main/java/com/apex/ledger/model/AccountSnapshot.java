package com.apex.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Point-in-time view of the simulated account. Equity is cash plus the market
 * value of every open position and is the figure drawdown is tracked against.
 */
@Value
@Builder(toBuilder = true)
public class AccountSnapshot {
    String accountId;
    BigDecimal cash;
    BigDecimal marketValue;
    BigDecimal equity;
    BigDecimal buyingPower;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    LocalDateTime updatedAt;
}
