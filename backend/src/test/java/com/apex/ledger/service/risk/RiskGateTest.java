package com.apex.ledger.service.risk;

import com.apex.ledger.model.AccountSnapshot;
import com.apex.ledger.model.OrderSide;
import com.apex.ledger.model.PaperPosition;
import com.apex.ledger.model.RiskLimits;
import com.apex.ledger.model.RiskStatus;
import com.apex.ledger.model.TradeSignal;
import com.apex.ledger.service.CommissionModel;
import com.apex.ledger.support.MutableClock;
import com.apex.ledger.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RiskGateTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 4, 10, 0);

    private MutableClock clock;
    private CommissionModel commissionModel;
    private int signalSequence;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at(START);
        commissionModel = new CommissionModel(new BigDecimal("0.001"), new BigDecimal("10"));
    }

    @Test
    void allowsBuyWithinCashAndTradeValueLimits() {
        RiskGate gate = gate(RiskLimits.builder()
                .minCashReserve(MoneyUtils.bd(100_000))
                .maxTradeValue(MoneyUtils.bd(50_000))
                .build());

        RiskGateDecision decision = gate.check(buy("0700.HK", 100, "300"), account(1_000_000), List.of());

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isNull();
        assertThat(decision.tradeValue()).isEqualByComparingTo("30000");
        assertThat(decision.checks()).extracting(RiskGateDecision.CheckResult::check)
                .containsExactly(RiskCheck.BASIC, RiskCheck.CASH, RiskCheck.POSITION, RiskCheck.CONCENTRATION,
                        RiskCheck.FREQUENCY, RiskCheck.DRAWDOWN, RiskCheck.DAILY_LOSS);
    }

    @Test
    void rejectsTradeAboveMaxTradeValue() {
        RiskGate gate = gate(RiskLimits.builder()
                .minCashReserve(MoneyUtils.bd(100_000))
                .maxTradeValue(MoneyUtils.bd(50_000))
                .build());

        RiskGateDecision decision = gate.check(buy("0700.HK", 500, "350"), account(1_000_000), List.of());

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(RiskRejectCode.TRADE_VALUE_LIMIT);
        assertThat(decision.message()).contains("Trade value limit");
        assertThat(decision.threshold()).isEqualByComparingTo("50000");
        assertThat(decision.currentValue()).isEqualByComparingTo("175000");
    }

    @Test
    void tradeValueExactlyAtLimitPassesAndAnythingAboveIsRejected() {
        RiskGate gate = gate(RiskLimits.builder().maxTradeValue(MoneyUtils.bd(50_000)).build());

        assertThat(gate.check(buy("0005.HK", 500, "100"), account(1_000_000), List.of()).allowed()).isTrue();
        assertThat(gate.check(buy("0005.HK", 500, "100.01"), account(1_000_000), List.of()).reason())
                .isEqualTo(RiskRejectCode.TRADE_VALUE_LIMIT);
        assertThat(gate.check(buy("0005.HK", 501, "100"), account(1_000_000), List.of()).reason())
                .isEqualTo(RiskRejectCode.TRADE_VALUE_LIMIT);
    }

    @Test
    void rejectsBuyThatWouldBreachCashReserve() {
        RiskGate gate = gate(RiskLimits.defaults());

        RiskGateDecision decision = gate.check(buy("0005.HK", 400, "100"), account(50_000), List.of());

        assertThat(decision.reason()).isEqualTo(RiskRejectCode.INSUFFICIENT_CASH);
        assertThat(decision.threshold()).isEqualByComparingTo("50000");
        assertThat(decision.currentValue()).isEqualByComparingTo("50040");
    }

    @Test
    void dailyTradeLimitResetsOnDateRollover() {
        RiskGate gate = gate(RiskLimits.builder().maxDailyTrades(3).build());

        for (int i = 0; i < 3; i++) {
            RiskGateDecision decision = gate.check(buy("X", 10, "100"), account(1_000_000), List.of());
            assertThat(decision.allowed()).isTrue();
            gate.recordTrade("X", OrderSide.BUY, 10, MoneyUtils.bd(100), MoneyUtils.ZERO);
        }

        RiskGateDecision fourth = gate.check(buy("X", 10, "100"), account(1_000_000), List.of());
        assertThat(fourth.allowed()).isFalse();
        assertThat(fourth.reason()).isEqualTo(RiskRejectCode.DAILY_TRADE_LIMIT);
        assertThat(fourth.message()).contains("frequency");

        clock.advance(Duration.ofDays(1));

        RiskGateDecision nextDay = gate.check(buy("X", 10, "100"), account(1_000_000), List.of());
        assertThat(nextDay.allowed()).isTrue();
        assertThat(gate.getStatus().getDailyTradeCount()).isZero();
        assertThat(gate.getStatus().getLastResetDate()).isEqualTo(LocalDate.of(2024, 3, 5));
    }

    @Test
    void rejectsWhenSymbolFrequencyLimitReached() {
        RiskGate gate = gate(RiskLimits.builder().maxOrderFrequency(2).build());
        gate.recordTrade("X", OrderSide.BUY, 10, MoneyUtils.bd(100), MoneyUtils.ZERO);
        gate.recordTrade("X", OrderSide.BUY, 10, MoneyUtils.bd(100), MoneyUtils.ZERO);

        assertThat(gate.check(buy("X", 10, "100"), account(1_000_000), List.of()).reason())
                .isEqualTo(RiskRejectCode.SYMBOL_FREQUENCY_LIMIT);
        assertThat(gate.check(buy("Y", 10, "100"), account(1_000_000), List.of()).allowed()).isTrue();
    }

    @Test
    void emergencyStopRejectsEverySignal() {
        RiskGate gate = gate(RiskLimits.defaults());
        gate.emergencyStop("exchange halt");
        clock.advance(Duration.ofSeconds(90));

        RiskGateDecision decision = gate.check(buy("0005.HK", 1, "1"), account(10_000_000), List.of());

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.isEmergencyStop()).isTrue();
        assertThat(decision.emergencyStop()).isNotNull();
        assertThat(decision.emergencyStop().reason()).isEqualTo("exchange halt");
        assertThat(decision.emergencyStop().triggeredAt()).isEqualTo(START);
        assertThat(decision.emergencyStop().durationSeconds()).isEqualTo(90);
        assertThat(decision.checks()).hasSize(1);
    }

    @Test
    void secondEmergencyStopKeepsOriginalTrigger() {
        RiskGate gate = gate(RiskLimits.defaults());

        assertThat(gate.emergencyStop("first")).isTrue();
        clock.advance(Duration.ofMinutes(5));
        assertThat(gate.emergencyStop("second")).isFalse();

        RiskStatus status = gate.getStatus();
        assertThat(status.isEmergencyStopActive()).isTrue();
        assertThat(status.getEmergencyStopTime()).isEqualTo(START);
        assertThat(status.getEmergencyStopReason()).isEqualTo("first");
        assertThat(status.getEmergencyStopDurationSeconds()).isEqualTo(300L);
    }

    @Test
    void resumeRestoresLimitsCapturedAtStop() {
        RiskLimits original = RiskLimits.builder()
                .maxTradeValue(new BigDecimal("12345.67"))
                .maxDailyTrades(7)
                .build();
        RiskGate gate = gate(original);

        gate.emergencyStop("drill");
        gate.updateLimits(RiskLimits.builder().maxTradeValue(MoneyUtils.bd(1)).build());
        assertThat(gate.resumeFromEmergencyStop()).isTrue();

        assertThat(gate.getLimits()).isEqualTo(original);
        assertThat(gate.isEmergencyStopActive()).isFalse();
        assertThat(gate.getStatus().getEmergencyStopTime()).isNull();
        assertThat(gate.resumeFromEmergencyStop()).isFalse();
    }

    @Test
    void emergencyStopPersistsAcrossDayBoundary() {
        RiskGate gate = gate(RiskLimits.defaults());
        gate.recordTrade("X", OrderSide.BUY, 10, MoneyUtils.bd(100), MoneyUtils.ZERO);
        gate.emergencyStop("overnight");

        clock.advance(Duration.ofDays(1));

        assertThat(gate.check(buy("X", 1, "1"), account(1_000_000), List.of()).isEmergencyStop()).isTrue();
        assertThat(gate.getStatus().getLastResetDate()).isEqualTo(START.toLocalDate());
        assertThat(gate.getStatus().getDailyTradeCount()).isEqualTo(1);

        gate.resumeFromEmergencyStop();

        assertThat(gate.getStatus().getDailyTradeCount()).isZero();
        assertThat(gate.getStatus().getLastResetDate()).isEqualTo(START.toLocalDate().plusDays(1));
    }

    @Test
    void rejectsMalformedSignalsAsValidationErrors() {
        RiskGate gate = gate(RiskLimits.defaults());

        RiskGateDecision zeroQuantity = gate.check(buy("X", 0, "10"), account(1_000_000), List.of());
        RiskGateDecision blankSymbol = gate.check(buy(" ", 10, "10"), account(1_000_000), List.of());
        RiskGateDecision negativePrice = gate.check(buy("X", 10, "-1"), account(1_000_000), List.of());

        assertThat(List.of(zeroQuantity, blankSymbol, negativePrice))
                .allSatisfy(decision -> {
                    assertThat(decision.reason()).isEqualTo(RiskRejectCode.INVALID_SIGNAL);
                    assertThat(decision.reason().isValidationError()).isTrue();
                });
    }

    @Test
    void marketSignalWithoutReferencePriceIsRejected() {
        RiskGate gate = gate(RiskLimits.defaults());
        TradeSignal market = TradeSignal.builder()
                .signalId("S-market")
                .symbol("X")
                .side(OrderSide.BUY)
                .quantity(10)
                .build();

        RiskGateDecision decision = gate.check(market, account(1_000_000), List.of());

        assertThat(decision.reason()).isEqualTo(RiskRejectCode.PRICE_UNAVAILABLE);
        assertThat(gate.check(market, MoneyUtils.bd(50), account(1_000_000), List.of()).allowed()).isTrue();
    }

    @Test
    void rejectsSellLargerThanHolding() {
        RiskGate gate = gate(RiskLimits.defaults());

        RiskGateDecision decision = gate.check(sell("X", 20, "100"), account(1_000_000),
                List.of(position("X", 10, "90", "100")));

        assertThat(decision.reason()).isEqualTo(RiskRejectCode.INSUFFICIENT_POSITION);
    }

    @Test
    void rejectsBuyThatWouldExceedPositionRatio() {
        RiskGate gate = gate(RiskLimits.builder().maxPositionRatio(new BigDecimal("0.05")).build());

        RiskGateDecision decision = gate.check(buy("X", 600, "100"), account(1_000_000), List.of());

        assertThat(decision.reason()).isEqualTo(RiskRejectCode.POSITION_RATIO_LIMIT);
        assertThat(decision.currentValue()).isEqualByComparingTo("0.06");
    }

    @Test
    void concentrationCheckAppliesOnceThePortfolioHasExposure() {
        RiskGate gate = gate(RiskLimits.defaults());
        AccountSnapshot account = account(950_000).toBuilder().equity(MoneyUtils.bd(1_000_000)).build();

        RiskGateDecision first = gate.check(buy("BBB", 600, "100"), account, List.of());
        RiskGateDecision withExposure = gate.check(buy("BBB", 600, "100"), account,
                List.of(position("AAA", 500, "100", "100")));

        assertThat(first.allowed()).isTrue();
        assertThat(withExposure.reason()).isEqualTo(RiskRejectCode.CONCENTRATION_LIMIT);
    }

    @Test
    void rejectsOnceDrawdownFromPeakExceedsLimit() {
        RiskGate gate = gate(RiskLimits.defaults());

        assertThat(gate.check(buy("X", 10, "100"), account(1_000_000), List.of()).allowed()).isTrue();
        RiskGateDecision decision = gate.check(buy("X", 10, "100"), account(800_000), List.of());

        assertThat(decision.reason()).isEqualTo(RiskRejectCode.DRAWDOWN_LIMIT);
        assertThat(decision.currentValue()).isEqualByComparingTo("0.2");
        assertThat(gate.getStatus().getPeakEquity()).isEqualByComparingTo("1000000");
    }

    @Test
    void rejectsLosingSellBeyondDailyLossLimit() {
        RiskGate gate = gate(RiskLimits.builder().maxDailyLoss(MoneyUtils.bd(1_000)).build());
        List<PaperPosition> positions = List.of(position("X", 100, "100", "80"));

        RiskGateDecision losing = gate.check(sell("X", 100, "80"), account(1_000_000), positions);
        RiskGateDecision small = gate.check(sell("X", 40, "80"), account(1_000_000), positions);

        assertThat(losing.reason()).isEqualTo(RiskRejectCode.DAILY_LOSS_LIMIT);
        assertThat(losing.currentValue()).isEqualByComparingTo("2000");
        assertThat(small.allowed()).isTrue();
    }

    @Test
    void checkDoesNotTouchDailyCounters() {
        RiskGate gate = gate(RiskLimits.defaults());

        gate.check(buy("X", 10, "100"), account(1_000_000), List.of());
        gate.recordTrade("X", OrderSide.SELL, 10, MoneyUtils.bd(100), MoneyUtils.bd(-250));

        RiskStatus status = gate.getStatus();
        assertThat(status.getDailyTradeCount()).isEqualTo(1);
        assertThat(status.getTradesBySymbol()).containsEntry("X", 1);
        assertThat(status.getDailyPnl()).isEqualByComparingTo("-250");
    }

    @Test
    void resetRiskStateClearsCountersAndStop() {
        RiskGate gate = gate(RiskLimits.defaults());
        gate.check(buy("X", 10, "100"), account(1_000_000), List.of());
        gate.recordTrade("X", OrderSide.BUY, 10, MoneyUtils.bd(100), MoneyUtils.ZERO);
        gate.emergencyStop("test");

        gate.resetRiskState();

        RiskStatus status = gate.getStatus();
        assertThat(status.isEmergencyStopActive()).isFalse();
        assertThat(status.getDailyTradeCount()).isZero();
        assertThat(status.getPeakEquity()).isEqualByComparingTo("0");
    }

    private RiskGate gate(RiskLimits limits) {
        return new RiskGate(limits, commissionModel, clock);
    }

    private TradeSignal buy(String symbol, int quantity, String price) {
        return signal(symbol, OrderSide.BUY, quantity, price);
    }

    private TradeSignal sell(String symbol, int quantity, String price) {
        return signal(symbol, OrderSide.SELL, quantity, price);
    }

    private TradeSignal signal(String symbol, OrderSide side, int quantity, String price) {
        return TradeSignal.builder()
                .signalId("S-" + (++signalSequence))
                .symbol(symbol)
                .side(side)
                .quantity(quantity)
                .price(new BigDecimal(price))
                .strategy("test")
                .timestamp(START)
                .build();
    }

    private AccountSnapshot account(long cash) {
        return AccountSnapshot.builder()
                .accountId("acc")
                .cash(MoneyUtils.bd(cash))
                .marketValue(MoneyUtils.ZERO)
                .equity(MoneyUtils.bd(cash))
                .buyingPower(MoneyUtils.bd(cash))
                .build();
    }

    private PaperPosition position(String symbol, int quantity, String averageCost, String price) {
        BigDecimal avg = new BigDecimal(averageCost);
        return PaperPosition.builder()
                .symbol(symbol)
                .quantity(quantity)
                .averageCost(MoneyUtils.scale(avg))
                .costBasis(MoneyUtils.multiply(avg, quantity))
                .build()
                .markedAt(new BigDecimal(price), START);
    }
}
