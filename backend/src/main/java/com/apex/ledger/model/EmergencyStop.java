package com.apex.ledger.model;

import lombok.Value;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Active emergency stop: why and when it was triggered, and the limits that
 * were in force so they can be restored verbatim on resume.
 */
@Value
public class EmergencyStop {
    String reason;
    LocalDateTime triggeredAt;
    RiskLimits limitsBackup;

    public Duration elapsedSince(LocalDateTime now) {
        return Duration.between(triggeredAt, now);
    }
}
