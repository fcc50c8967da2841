package com.apex.ledger.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Read-only snapshot of the risk gate's state for monitoring and compliance.
 */
@Value
@Builder
public class RiskStatus {
    boolean emergencyStopActive;
    String emergencyStopReason;
    LocalDateTime emergencyStopTime;
    Long emergencyStopDurationSeconds;
    boolean limitsBackupHeld;
    BigDecimal dailyPnl;
    int dailyTradeCount;
    Map<String, Integer> tradesBySymbol;
    BigDecimal peakEquity;
    BigDecimal currentDrawdown;
    RiskLimits riskLimits;
    LocalDate lastResetDate;
}
