package com.apex.ledger.trading.pipeline;

import com.apex.ledger.config.ExecutionProperties;
import com.apex.ledger.config.RiskLimitProperties;
import com.apex.ledger.model.RiskLimits;
import com.apex.ledger.service.CommissionModel;
import com.apex.ledger.service.LedgerMetrics;
import com.apex.ledger.service.PaperExecutionLedger;
import com.apex.ledger.service.risk.RiskGate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * One {@link ExecutionController} per account id, each with its own risk gate
 * and ledger built from the configured defaults.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExecutionControllerRegistry {

    private final RiskLimitProperties riskLimitProperties;
    private final ExecutionProperties executionProperties;
    private final MarketDataProvider marketDataProvider;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    private final ConcurrentMap<String, ExecutionController> controllers = new ConcurrentHashMap<>();

    public ExecutionController forAccount(String accountId) {
        return controllers.computeIfAbsent(requireAccountId(accountId),
                id -> create(id, riskLimitProperties.toRiskLimits(), executionProperties.getInitialBalance()));
    }

    /**
     * Opens an account with explicit limits and starting cash.
     *
     * @throws IllegalStateException if the account is already open
     */
    public ExecutionController open(String accountId, RiskLimits limits, BigDecimal initialBalance) {
        ExecutionController controller = create(requireAccountId(accountId), limits, initialBalance);
        if (controllers.putIfAbsent(accountId, controller) != null) {
            throw new IllegalStateException("Account already open: " + accountId);
        }
        return controller;
    }

    public Optional<ExecutionController> find(String accountId) {
        return Optional.ofNullable(controllers.get(accountId));
    }

    public Set<String> accountIds() {
        return Set.copyOf(controllers.keySet());
    }

    /**
     * Triggers the emergency stop on every open account.
     *
     * @return number of accounts newly stopped
     */
    public int emergencyStopAll(String reason) {
        log.warn("Emergency stop requested for all {} accounts: {}", controllers.size(), reason);
        return (int) controllers.values().stream()
                .filter(controller -> controller.emergencyStop(reason))
                .count();
    }

    private ExecutionController create(String accountId, RiskLimits limits, BigDecimal initialBalance) {
        CommissionModel commissionModel = CommissionModel.from(executionProperties);
        RiskGate riskGate = new RiskGate(limits, commissionModel, clock);
        PaperExecutionLedger ledger = new PaperExecutionLedger(accountId, initialBalance, marketDataProvider,
                commissionModel, clock, executionProperties.getTradeHistoryLimit());
        log.info("Opened execution controller for account {}", accountId);
        return new ExecutionController(accountId, riskGate, ledger, marketDataProvider, ledgerMetrics);
    }

    private String requireAccountId(String accountId) {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("Account id is required");
        }
        return accountId;
    }
}
