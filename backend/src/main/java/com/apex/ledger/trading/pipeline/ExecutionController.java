package com.apex.ledger.trading.pipeline;

import com.apex.ledger.exception.MarketDataException;
import com.apex.ledger.model.AccountSnapshot;
import com.apex.ledger.model.OrderStatus;
import com.apex.ledger.model.PaperOrder;
import com.apex.ledger.model.PaperPosition;
import com.apex.ledger.model.RiskLimits;
import com.apex.ledger.model.RiskStatus;
import com.apex.ledger.model.TradeRecord;
import com.apex.ledger.model.TradeSignal;
import com.apex.ledger.service.ExecutionFailure;
import com.apex.ledger.service.ExecutionResult;
import com.apex.ledger.service.LedgerMetrics;
import com.apex.ledger.service.LedgerPerformance;
import com.apex.ledger.service.PaperExecutionLedger;
import com.apex.ledger.service.risk.RiskGate;
import com.apex.ledger.service.risk.RiskGateDecision;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Risk-gated execution for one account: signal, risk check, simulated fill,
 * risk attribution. Submissions are processed one at a time in arrival order
 * so that no two signals are gated against the same account snapshot.
 */
@Slf4j
public class ExecutionController {

    private static final String UNTAGGED = "untagged";

    private final String accountId;
    private final RiskGate riskGate;
    private final PaperExecutionLedger ledger;
    private final MarketDataProvider marketDataProvider;
    private final LedgerMetrics metrics;
    private final ReentrantLock executionLock = new ReentrantLock(true);
    private final Map<String, StrategyAttribution> attribution = new ConcurrentHashMap<>();

    public ExecutionController(String accountId,
                               RiskGate riskGate,
                               PaperExecutionLedger ledger,
                               MarketDataProvider marketDataProvider,
                               LedgerMetrics metrics) {
        this.accountId = accountId;
        this.riskGate = riskGate;
        this.ledger = ledger;
        this.marketDataProvider = marketDataProvider;
        this.metrics = metrics;
    }

    public ExecutionOutcome submit(TradeSignal signal) {
        executionLock.lock();
        try {
            metrics.recordSignalSubmitted(accountId);
            BigDecimal referencePrice = resolveReferencePrice(signal);
            // Gate against equity at current quotes, not at the last fill prices
            AccountSnapshot account = ledger.refreshMarketPrices();
            RiskGateDecision decision = riskGate.check(signal, referencePrice, account, ledger.getPositions());
            if (!decision.allowed()) {
                metrics.recordRiskRejection(accountId, decision.reason());
                if (signal != null) {
                    attribution.compute(strategyOf(signal), (key, current) ->
                            (current == null ? StrategyAttribution.empty(key) : current).withRiskRejection());
                }
                return new ExecutionOutcome(ExecutionOutcome.Status.RISK_REJECTED, signal, decision, null);
            }

            PaperOrder order = ledger.createOrder(signal);
            ExecutionResult result = ledger.execute(order);
            if (!result.success()) {
                metrics.recordLedgerRefusal(accountId, result.failure());
                if (result.failure() == ExecutionFailure.INSUFFICIENT_FUNDS
                        || result.failure() == ExecutionFailure.INSUFFICIENT_POSITION) {
                    log.warn("Ledger refused {} after risk gate passed (stale snapshot?) [{}]: {}",
                            order.getOrderId(), result.failure(), result.message());
                } else {
                    log.warn("Execution of {} failed after risk gate passed [{}]: {}",
                            order.getOrderId(), result.failure(), result.message());
                }
                return new ExecutionOutcome(ExecutionOutcome.Status.EXECUTION_FAILED, signal, decision, result);
            }

            riskGate.recordTrade(signal.getSymbol(), signal.getSide(), result.filledQuantity(),
                    result.filledPrice(), result.realizedPnl());
            attribution.compute(strategyOf(signal), (key, current) ->
                    (current == null ? StrategyAttribution.empty(key) : current).withFill(result));
            metrics.recordFill(accountId, signal.getSide());
            return new ExecutionOutcome(ExecutionOutcome.Status.EXECUTED, signal, decision, result);
        } finally {
            executionLock.unlock();
        }
    }

    public boolean emergencyStop(String reason) {
        return riskGate.emergencyStop(reason);
    }

    public boolean resume() {
        return riskGate.resumeFromEmergencyStop();
    }

    public void updateLimits(RiskLimits limits) {
        riskGate.updateLimits(limits);
    }

    /**
     * Starts the account over: new cash balance, cleared risk state and attribution.
     */
    public void resetAccount(BigDecimal newBalance) {
        executionLock.lock();
        try {
            ledger.resetAccount(newBalance);
            riskGate.resetRiskState();
            attribution.clear();
        } finally {
            executionLock.unlock();
        }
    }

    public int cancelAllOrders() {
        return ledger.cancelAllOrders();
    }

    public AccountSnapshot refreshMarketPrices() {
        executionLock.lock();
        try {
            return ledger.refreshMarketPrices();
        } finally {
            executionLock.unlock();
        }
    }

    public RiskStatus getRiskStatus() {
        return riskGate.getStatus();
    }

    public AccountSnapshot getAccountInfo() {
        return ledger.getAccountInfo();
    }

    public List<PaperPosition> getPositions() {
        return ledger.getPositions();
    }

    public List<PaperOrder> getOrders(OrderStatus statusFilter) {
        return ledger.getOrders(statusFilter);
    }

    public List<TradeRecord> getTradeHistory() {
        return ledger.getTradeHistory();
    }

    public LedgerPerformance getPerformance() {
        return ledger.getPerformance();
    }

    public Map<String, StrategyAttribution> getAttribution() {
        return Map.copyOf(attribution);
    }

    public String getAccountId() {
        return accountId;
    }

    private BigDecimal resolveReferencePrice(TradeSignal signal) {
        if (signal == null || signal.getSymbol() == null || signal.getSymbol().isBlank()) {
            return null;
        }
        if (signal.hasLimitPrice()) {
            return signal.getPrice();
        }
        try {
            return marketDataProvider.getCurrentPrice(signal.getSymbol()).orElse(null);
        } catch (MarketDataException e) {
            log.warn("No reference price for {}: {}", signal.getSymbol(), e.getMessage());
            return null;
        }
    }

    private String strategyOf(TradeSignal signal) {
        return signal.getStrategy() == null || signal.getStrategy().isBlank() ? UNTAGGED : signal.getStrategy();
    }
}
