package com.apex.ledger.service;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class LedgerPerformance {
    String accountId;
    BigDecimal initialBalance;
    BigDecimal cash;
    BigDecimal marketValue;
    BigDecimal equity;
    BigDecimal totalReturn;
    BigDecimal returnRate;
    BigDecimal realizedPnl;
    BigDecimal unrealizedPnl;
    int tradeCount;
    int sellCount;
    int winningSells;
    BigDecimal winRate;
    BigDecimal totalBought;
    BigDecimal totalSold;
    BigDecimal totalCommission;
}
