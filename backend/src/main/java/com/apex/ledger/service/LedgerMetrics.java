package com.apex.ledger.service;

import com.apex.ledger.model.OrderSide;
import com.apex.ledger.service.risk.RiskRejectCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LedgerMetrics {

    static final String SIGNALS_SUBMITTED = "ledger_signals_submitted_total";
    static final String FILLS = "ledger_fills_total";
    static final String RISK_REJECTIONS = "ledger_risk_rejections_total";
    static final String LEDGER_REFUSALS = "ledger_execution_refusals_total";

    private final MeterRegistry meterRegistry;

    public void recordSignalSubmitted(String accountId) {
        Counter.builder(SIGNALS_SUBMITTED)
                .tag("account", accountId)
                .register(meterRegistry)
                .increment();
    }

    public void recordFill(String accountId, OrderSide side) {
        Counter.builder(FILLS)
                .tag("account", accountId)
                .tag("side", side.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordRiskRejection(String accountId, RiskRejectCode code) {
        Counter.builder(RISK_REJECTIONS)
                .tag("account", accountId)
                .tag("code", code == null ? "UNKNOWN" : code.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordLedgerRefusal(String accountId, ExecutionFailure failure) {
        Counter.builder(LEDGER_REFUSALS)
                .tag("account", accountId)
                .tag("reason", failure == null ? "UNKNOWN" : failure.name())
                .register(meterRegistry)
                .increment();
    }
}
