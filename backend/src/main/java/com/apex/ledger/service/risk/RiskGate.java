package com.apex.ledger.service.risk;

import com.apex.ledger.model.AccountSnapshot;
import com.apex.ledger.model.EmergencyStop;
import com.apex.ledger.model.OrderSide;
import com.apex.ledger.model.PaperPosition;
import com.apex.ledger.model.RiskLimits;
import com.apex.ledger.model.RiskStatus;
import com.apex.ledger.model.TradeSignal;
import com.apex.ledger.service.CommissionModel;
import com.apex.ledger.service.risk.RiskGateDecision.CheckResult;
import com.apex.ledger.service.risk.RiskGateDecision.EmergencyStopDetail;
import com.apex.ledger.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stateful pre-trade validator for one account.
 *
 * <p>Runs eight checks in a fixed order and stops at the first failure. Owns the
 * daily counters, the equity peak used for drawdown, and the emergency stop.
 * Daily counters roll over when the clock's calendar date changes; while an
 * emergency stop is active the rollover is deferred and the stop persists
 * across day boundaries.
 *
 * <p>{@link #check} only updates the equity peak and current drawdown.
 * {@link #recordTrade} is the only mutator of daily PnL and trade counters and
 * must be called once per confirmed fill.
 */
@Slf4j
public class RiskGate {

    private final Clock clock;
    private final CommissionModel commissionModel;

    private RiskLimits limits;
    private BigDecimal dailyPnl = MoneyUtils.ZERO;
    private int dailyTradeCount;
    private final Map<String, Integer> tradesBySymbol = new LinkedHashMap<>();
    private LocalDate lastResetDate;
    private BigDecimal peakEquity = MoneyUtils.ZERO;
    private BigDecimal currentDrawdown = MoneyUtils.ratio(MoneyUtils.ZERO, MoneyUtils.ZERO);
    private EmergencyStop emergencyStop;

    public RiskGate(RiskLimits limits, CommissionModel commissionModel, Clock clock) {
        this.limits = limits;
        this.commissionModel = commissionModel;
        this.clock = clock;
        this.lastResetDate = LocalDate.now(clock);
        log.info("Risk gate initialised with limits {}", limits);
    }

    public RiskGateDecision check(TradeSignal signal, AccountSnapshot account, List<PaperPosition> positions) {
        return check(signal, signal != null ? signal.getPrice() : null, account, positions);
    }

    /**
     * Validates a signal against the current account and positions.
     *
     * @param referencePrice price the trade is valued at; the limit price for limit
     *                       signals, the current quote for market signals
     */
    public synchronized RiskGateDecision check(TradeSignal signal,
                                               BigDecimal referencePrice,
                                               AccountSnapshot account,
                                               List<PaperPosition> positions) {
        rollDailyCountersIfNeeded();

        if (emergencyStop != null) {
            return rejectForEmergencyStop(signal);
        }

        List<CheckResult> checks = new ArrayList<>();

        Verdict verdict = validateBasic(signal, referencePrice);
        checks.add(verdict.toResult(RiskCheck.BASIC));
        if (!verdict.passed()) {
            return reject(signal, null, verdict, checks);
        }

        BigDecimal price = MoneyUtils.scale(referencePrice);
        BigDecimal tradeValue = MoneyUtils.multiply(price, signal.getQuantity());

        verdict = checkCashSufficiency(signal, tradeValue, account);
        checks.add(verdict.toResult(RiskCheck.CASH));
        if (!verdict.passed()) {
            return reject(signal, tradeValue, verdict, checks);
        }

        PaperPosition held = findPosition(signal.getSymbol(), positions);

        verdict = checkPositionLimits(signal, price, account, held);
        checks.add(verdict.toResult(RiskCheck.POSITION));
        if (!verdict.passed()) {
            return reject(signal, tradeValue, verdict, checks);
        }

        verdict = checkConcentration(signal, tradeValue, positions);
        checks.add(verdict.toResult(RiskCheck.CONCENTRATION));
        if (!verdict.passed()) {
            return reject(signal, tradeValue, verdict, checks);
        }

        verdict = checkTradeFrequency(signal.getSymbol());
        checks.add(verdict.toResult(RiskCheck.FREQUENCY));
        if (!verdict.passed()) {
            return reject(signal, tradeValue, verdict, checks);
        }

        verdict = checkMaxDrawdown(account.getEquity());
        checks.add(verdict.toResult(RiskCheck.DRAWDOWN));
        if (!verdict.passed()) {
            return reject(signal, tradeValue, verdict, checks);
        }

        verdict = checkDailyLoss(signal, price, held);
        checks.add(verdict.toResult(RiskCheck.DAILY_LOSS));
        if (!verdict.passed()) {
            return reject(signal, tradeValue, verdict, checks);
        }

        log.info("Risk check passed: {} {} {} @ {}", signal.getSymbol(), signal.getSide(), signal.getQuantity(), price);
        return new RiskGateDecision(true, null, "Risk check passed", null, null,
                signal.getSignalId(), signal.getSymbol(), tradeValue, List.copyOf(checks), null);
    }

    /**
     * Attributes a confirmed fill to the daily counters.
     */
    public synchronized void recordTrade(String symbol, OrderSide side, int quantity, BigDecimal price, BigDecimal pnl) {
        rollDailyCountersIfNeeded();
        dailyPnl = MoneyUtils.add(dailyPnl, pnl);
        dailyTradeCount++;
        tradesBySymbol.merge(symbol, 1, Integer::sum);
        log.info("Recorded trade {} {} {} @ {}, pnl {}, daily trades {}",
                symbol, side, quantity, MoneyUtils.scale(price), MoneyUtils.format(pnl), dailyTradeCount);
    }

    /**
     * Blocks all further trades. A second call while stopped is a no-op and keeps
     * the original trigger time and reason.
     *
     * @return true if this call activated the stop
     */
    public synchronized boolean emergencyStop(String reason) {
        if (emergencyStop != null) {
            log.warn("Emergency stop already active since {} ({}); ignoring new trigger: {}",
                    emergencyStop.getTriggeredAt(), emergencyStop.getReason(), reason);
            return false;
        }
        String effectiveReason = reason == null || reason.isBlank() ? "unspecified" : reason;
        emergencyStop = new EmergencyStop(effectiveReason, LocalDateTime.now(clock), limits);
        log.warn("EMERGENCY STOP triggered at {}: {}", emergencyStop.getTriggeredAt(), effectiveReason);
        log.warn("Backed up limits: maxDailyTrades={}, maxTradeValue={}, maxPositionValue={}, maxDrawdown={}",
                limits.getMaxDailyTrades(), MoneyUtils.format(limits.getMaxTradeValue()),
                MoneyUtils.format(limits.getMaxPositionValue()), limits.getMaxDrawdown());
        return true;
    }

    /**
     * Leaves the stopped state, restoring the limits captured when it was entered.
     *
     * @return true if a stop was cleared
     */
    public synchronized boolean resumeFromEmergencyStop() {
        if (emergencyStop == null) {
            log.warn("Resume requested but no emergency stop is active");
            return false;
        }
        long seconds = emergencyStop.elapsedSince(LocalDateTime.now(clock)).getSeconds();
        limits = emergencyStop.getLimitsBackup();
        emergencyStop = null;
        log.warn("Emergency stop cleared after {}s; limits restored to {}", seconds, limits);
        return true;
    }

    public synchronized boolean isEmergencyStopActive() {
        return emergencyStop != null;
    }

    public synchronized void updateLimits(RiskLimits newLimits) {
        if (newLimits == null) {
            throw new IllegalArgumentException("Risk limits are required");
        }
        log.info("Risk limits updated: {} -> {}", limits, newLimits);
        limits = newLimits;
    }

    public synchronized RiskLimits getLimits() {
        return limits;
    }

    /**
     * Clears counters, equity peak and drawdown, and any emergency stop.
     */
    public synchronized void resetRiskState() {
        log.info("Resetting risk state");
        resetDailyCounters();
        lastResetDate = LocalDate.now(clock);
        peakEquity = MoneyUtils.ZERO;
        currentDrawdown = MoneyUtils.ratio(MoneyUtils.ZERO, MoneyUtils.ZERO);
        if (emergencyStop != null) {
            log.warn("Reset also clears the active emergency stop ({})", emergencyStop.getReason());
            emergencyStop = null;
        }
    }

    public synchronized RiskStatus getStatus() {
        rollDailyCountersIfNeeded();
        RiskStatus.RiskStatusBuilder status = RiskStatus.builder()
                .emergencyStopActive(emergencyStop != null)
                .limitsBackupHeld(emergencyStop != null)
                .dailyPnl(dailyPnl)
                .dailyTradeCount(dailyTradeCount)
                .tradesBySymbol(Map.copyOf(tradesBySymbol))
                .peakEquity(peakEquity)
                .currentDrawdown(currentDrawdown)
                .riskLimits(limits)
                .lastResetDate(lastResetDate);
        if (emergencyStop != null) {
            status.emergencyStopReason(emergencyStop.getReason())
                    .emergencyStopTime(emergencyStop.getTriggeredAt())
                    .emergencyStopDurationSeconds(emergencyStop.elapsedSince(LocalDateTime.now(clock)).getSeconds());
        }
        return status.build();
    }

    private RiskGateDecision rejectForEmergencyStop(TradeSignal signal) {
        LocalDateTime now = LocalDateTime.now(clock);
        long seconds = emergencyStop.elapsedSince(now).getSeconds();
        String message = String.format("Emergency stop active since %s (%ds): %s",
                emergencyStop.getTriggeredAt(), seconds, emergencyStop.getReason());
        log.info("Signal {} rejected: {}", signal != null ? signal.getSignalId() : null, message);
        return new RiskGateDecision(false, RiskRejectCode.EMERGENCY_STOP, message, null, null,
                signal != null ? signal.getSignalId() : null,
                signal != null ? signal.getSymbol() : null,
                null,
                List.of(new CheckResult(RiskCheck.EMERGENCY_STOP, false, message)),
                new EmergencyStopDetail(emergencyStop.getReason(), emergencyStop.getTriggeredAt(), seconds));
    }

    private Verdict validateBasic(TradeSignal signal, BigDecimal referencePrice) {
        if (signal == null) {
            return Verdict.fail(RiskRejectCode.INVALID_SIGNAL, "Signal is required");
        }
        if (signal.getSymbol() == null || signal.getSymbol().isBlank()) {
            return Verdict.fail(RiskRejectCode.INVALID_SIGNAL, "Symbol must not be empty");
        }
        if (signal.getQuantity() <= 0) {
            return Verdict.fail(RiskRejectCode.INVALID_SIGNAL, "Quantity must be greater than zero");
        }
        if (signal.getSide() == null) {
            return Verdict.fail(RiskRejectCode.INVALID_SIGNAL, "Side must be BUY or SELL");
        }
        if (signal.getPrice() != null && signal.getPrice().signum() <= 0) {
            return Verdict.fail(RiskRejectCode.INVALID_SIGNAL, "Price must be greater than zero");
        }
        if (referencePrice == null || referencePrice.signum() <= 0) {
            return Verdict.fail(RiskRejectCode.PRICE_UNAVAILABLE, "No price available to value " + signal.getSymbol());
        }
        return Verdict.pass("Basic validation passed");
    }

    private Verdict checkCashSufficiency(TradeSignal signal, BigDecimal tradeValue, AccountSnapshot account) {
        BigDecimal cash = account.getCash() != null ? account.getCash() : MoneyUtils.ZERO;
        if (signal.getSide() == OrderSide.BUY) {
            BigDecimal commission = commissionModel.commissionFor(tradeValue);
            BigDecimal required = MoneyUtils.add(MoneyUtils.add(tradeValue, commission), limits.getMinCashReserve());
            if (cash.compareTo(required) < 0) {
                return Verdict.fail(RiskRejectCode.INSUFFICIENT_CASH,
                        String.format("Insufficient cash: required %s, available %s, shortfall %s",
                                MoneyUtils.format(required), MoneyUtils.format(cash),
                                MoneyUtils.format(MoneyUtils.subtract(required, cash))),
                        cash, required);
            }
        }
        if (tradeValue.compareTo(limits.getMaxTradeValue()) > 0) {
            return Verdict.fail(RiskRejectCode.TRADE_VALUE_LIMIT,
                    String.format("Trade value limit exceeded: %s > %s",
                            MoneyUtils.format(tradeValue), MoneyUtils.format(limits.getMaxTradeValue())),
                    limits.getMaxTradeValue(), tradeValue);
        }
        return Verdict.pass("Cash sufficient for trade value " + MoneyUtils.format(tradeValue));
    }

    private Verdict checkPositionLimits(TradeSignal signal, BigDecimal price, AccountSnapshot account, PaperPosition held) {
        int current = held != null ? held.getQuantity() : 0;
        if (signal.getSide() == OrderSide.SELL) {
            if (signal.getQuantity() > current) {
                return Verdict.fail(RiskRejectCode.INSUFFICIENT_POSITION,
                        String.format("Sell quantity %d exceeds position %d in %s",
                                signal.getQuantity(), current, signal.getSymbol()),
                        BigDecimal.valueOf(current), BigDecimal.valueOf(signal.getQuantity()));
            }
            // Reducing exposure is never blocked by the position caps
            return Verdict.pass("Position after sell: " + (current - signal.getQuantity()));
        }

        int newQuantity = current + signal.getQuantity();
        BigDecimal positionValue = MoneyUtils.multiply(price, newQuantity);
        if (positionValue.compareTo(limits.getMaxPositionValue()) > 0) {
            return Verdict.fail(RiskRejectCode.POSITION_VALUE_LIMIT,
                    String.format("Position value limit exceeded: %s > %s",
                            MoneyUtils.format(positionValue), MoneyUtils.format(limits.getMaxPositionValue())),
                    limits.getMaxPositionValue(), positionValue);
        }
        BigDecimal equity = account.getEquity();
        if (MoneyUtils.isPositive(equity)) {
            BigDecimal ratio = MoneyUtils.ratio(positionValue, equity);
            if (ratio.compareTo(limits.getMaxPositionRatio()) > 0) {
                return Verdict.fail(RiskRejectCode.POSITION_RATIO_LIMIT,
                        String.format("Position ratio limit exceeded: %s > %s",
                                MoneyUtils.formatPercent(ratio), MoneyUtils.formatPercent(limits.getMaxPositionRatio())),
                        limits.getMaxPositionRatio(), ratio);
            }
        }
        return Verdict.pass("Position after buy: " + newQuantity);
    }

    private Verdict checkConcentration(TradeSignal signal, BigDecimal tradeValue, List<PaperPosition> positions) {
        if (signal.getSide() != OrderSide.BUY) {
            return Verdict.pass("Sell reduces concentration");
        }
        BigDecimal totalMarketValue = positions == null ? MoneyUtils.ZERO : positions.stream()
                .map(PaperPosition::getMarketValue)
                .filter(value -> value != null)
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
        // First position taken is not capped
        if (totalMarketValue.signum() == 0) {
            return Verdict.pass("No market exposure, concentration check skipped");
        }
        BigDecimal total = MoneyUtils.add(totalMarketValue, tradeValue);
        BigDecimal ratio = MoneyUtils.ratio(tradeValue, total);
        if (ratio.compareTo(limits.getMaxSectorConcentration()) > 0) {
            return Verdict.fail(RiskRejectCode.CONCENTRATION_LIMIT,
                    String.format("Concentration limit exceeded: trade is %s of portfolio > %s",
                            MoneyUtils.formatPercent(ratio), MoneyUtils.formatPercent(limits.getMaxSectorConcentration())),
                    limits.getMaxSectorConcentration(), ratio);
        }
        return Verdict.pass("Concentration " + MoneyUtils.formatPercent(ratio));
    }

    private Verdict checkTradeFrequency(String symbol) {
        if (dailyTradeCount >= limits.getMaxDailyTrades()) {
            return Verdict.fail(RiskRejectCode.DAILY_TRADE_LIMIT,
                    String.format("Daily trade frequency limit reached: %d >= %d", dailyTradeCount, limits.getMaxDailyTrades()),
                    BigDecimal.valueOf(limits.getMaxDailyTrades()), BigDecimal.valueOf(dailyTradeCount));
        }
        int symbolCount = tradesBySymbol.getOrDefault(symbol, 0);
        if (symbolCount >= limits.getMaxOrderFrequency()) {
            return Verdict.fail(RiskRejectCode.SYMBOL_FREQUENCY_LIMIT,
                    String.format("Trade frequency limit reached for %s: %d >= %d", symbol, symbolCount, limits.getMaxOrderFrequency()),
                    BigDecimal.valueOf(limits.getMaxOrderFrequency()), BigDecimal.valueOf(symbolCount));
        }
        return Verdict.pass(String.format("Daily trades %d, %s trades %d", dailyTradeCount, symbol, symbolCount));
    }

    private Verdict checkMaxDrawdown(BigDecimal equity) {
        BigDecimal current = MoneyUtils.scale(equity);
        if (current.compareTo(peakEquity) > 0) {
            peakEquity = current;
        }
        if (peakEquity.signum() > 0) {
            currentDrawdown = MoneyUtils.ratio(MoneyUtils.subtract(peakEquity, current), peakEquity);
            if (currentDrawdown.compareTo(limits.getMaxDrawdown()) > 0) {
                return Verdict.fail(RiskRejectCode.DRAWDOWN_LIMIT,
                        String.format("Max drawdown exceeded: %s > %s",
                                MoneyUtils.formatPercent(currentDrawdown), MoneyUtils.formatPercent(limits.getMaxDrawdown())),
                        limits.getMaxDrawdown(), currentDrawdown);
            }
        }
        return Verdict.pass("Drawdown " + MoneyUtils.formatPercent(currentDrawdown));
    }

    private Verdict checkDailyLoss(TradeSignal signal, BigDecimal price, PaperPosition held) {
        if (signal.getSide() != OrderSide.SELL || held == null) {
            return Verdict.pass("Daily PnL " + MoneyUtils.format(dailyPnl));
        }
        BigDecimal estimatedPnl = MoneyUtils.multiply(MoneyUtils.subtract(price, held.getAverageCost()), signal.getQuantity());
        if (estimatedPnl.signum() < 0) {
            BigDecimal projected = MoneyUtils.add(dailyPnl, estimatedPnl);
            if (projected.signum() < 0 && projected.abs().compareTo(limits.getMaxDailyLoss()) > 0) {
                return Verdict.fail(RiskRejectCode.DAILY_LOSS_LIMIT,
                        String.format("Daily loss limit exceeded: %s > %s",
                                MoneyUtils.format(projected.abs()), MoneyUtils.format(limits.getMaxDailyLoss())),
                        limits.getMaxDailyLoss(), projected.abs());
            }
        }
        return Verdict.pass("Daily PnL " + MoneyUtils.format(dailyPnl));
    }

    private RiskGateDecision reject(TradeSignal signal, BigDecimal tradeValue, Verdict verdict, List<CheckResult> checks) {
        log.info("Risk check rejected {} {}: [{}] {}",
                signal != null ? signal.getSignalId() : null,
                signal != null ? signal.getSymbol() : null,
                verdict.code(), verdict.message());
        return new RiskGateDecision(false, verdict.code(), verdict.message(), verdict.threshold(), verdict.observed(),
                signal != null ? signal.getSignalId() : null,
                signal != null ? signal.getSymbol() : null,
                tradeValue, List.copyOf(checks), null);
    }

    private PaperPosition findPosition(String symbol, List<PaperPosition> positions) {
        if (positions == null) {
            return null;
        }
        return positions.stream()
                .filter(position -> symbol.equals(position.getSymbol()))
                .findFirst()
                .orElse(null);
    }

    private void rollDailyCountersIfNeeded() {
        LocalDate today = LocalDate.now(clock);
        if (today.equals(lastResetDate)) {
            return;
        }
        if (emergencyStop != null) {
            log.debug("Daily rollover to {} deferred while emergency stop is active", today);
            return;
        }
        log.info("Daily risk counters reset ({} -> {})", lastResetDate, today);
        resetDailyCounters();
        lastResetDate = today;
    }

    private void resetDailyCounters() {
        dailyPnl = MoneyUtils.ZERO;
        dailyTradeCount = 0;
        tradesBySymbol.clear();
    }

    private record Verdict(boolean passed, RiskRejectCode code, String message, BigDecimal threshold, BigDecimal observed) {

        static Verdict pass(String message) {
            return new Verdict(true, null, message, null, null);
        }

        static Verdict fail(RiskRejectCode code, String message) {
            return new Verdict(false, code, message, null, null);
        }

        static Verdict fail(RiskRejectCode code, String message, BigDecimal threshold, BigDecimal observed) {
            return new Verdict(false, code, message, threshold, observed);
        }

        CheckResult toResult(RiskCheck check) {
            return new CheckResult(check, passed, message);
        }
    }
}
