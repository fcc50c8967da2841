package com.apex.ledger.service.risk;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record RiskGateDecision(
        boolean allowed,
        RiskRejectCode reason,
        String message,
        BigDecimal threshold,       // Limit that was breached
        BigDecimal currentValue,    // Value that breached it
        String signalId,
        String symbol,
        BigDecimal tradeValue,
        List<CheckResult> checks,
        EmergencyStopDetail emergencyStop
) {

    public boolean isEmergencyStop() {
        return reason == RiskRejectCode.EMERGENCY_STOP;
    }

    public record CheckResult(RiskCheck check, boolean passed, String message) {}

    public record EmergencyStopDetail(String reason, LocalDateTime triggeredAt, long durationSeconds) {}
}
