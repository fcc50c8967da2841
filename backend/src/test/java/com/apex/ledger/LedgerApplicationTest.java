package com.apex.ledger;

import com.apex.ledger.config.AnalyticsProperties;
import com.apex.ledger.model.OrderSide;
import com.apex.ledger.model.RiskLimits;
import com.apex.ledger.model.TradeSignal;
import com.apex.ledger.trading.pipeline.ExecutionController;
import com.apex.ledger.trading.pipeline.ExecutionControllerRegistry;
import com.apex.ledger.trading.pipeline.ExecutionOutcome;
import com.apex.ledger.trading.pipeline.InMemoryMarketDataProvider;
import com.apex.ledger.util.MoneyUtils;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class LedgerApplicationTest {

    @Autowired
    private ExecutionControllerRegistry registry;

    @Autowired
    private InMemoryMarketDataProvider marketData;

    @Autowired
    private AnalyticsProperties analyticsProperties;

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    void accountsOpenWithConfiguredLimitsAndTradeAtMarket() {
        marketData.updatePrice("0700.HK", MoneyUtils.bd(300));
        ExecutionController controller = registry.forAccount("context-1");

        ExecutionOutcome outcome = controller.submit(TradeSignal.builder()
                .signalId("CTX-1")
                .symbol("0700.HK")
                .side(OrderSide.BUY)
                .quantity(100)
                .strategy("momentum")
                .timestamp(LocalDateTime.now())
                .build());

        assertThat(outcome.isExecuted()).isTrue();
        assertThat(controller.getAccountInfo().getCash()).isEqualByComparingTo("969970");
        RiskLimits limits = controller.getRiskStatus().getRiskLimits();
        assertThat(limits.getMaxTradeValue()).isEqualByComparingTo("100000");
        assertThat(limits.getMaxPositionRatio()).isEqualByComparingTo("0.3");
        assertThat(limits.getMaxDailyTrades()).isEqualTo(100);
        assertThat(registry.forAccount("context-1")).isSameAs(controller);
        assertThat(meterRegistry.get("ledger_fills_total").tag("account", "context-1").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void openingTheSameAccountTwiceFails() {
        registry.open("context-2", RiskLimits.defaults(), MoneyUtils.bd(50_000));

        assertThatThrownBy(() -> registry.open("context-2", RiskLimits.defaults(), MoneyUtils.bd(50_000)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emergencyStopAllHaltsEveryOpenAccount() {
        ExecutionController first = registry.forAccount("context-3");
        ExecutionController second = registry.open("context-4", RiskLimits.defaults(), MoneyUtils.bd(200_000));
        try {
            int stopped = registry.emergencyStopAll("venue outage");

            assertThat(stopped).isEqualTo(registry.accountIds().size());
            assertThat(registry.accountIds()).contains("context-3", "context-4");
            assertThat(registry.find("context-4")).containsSame(second);
            assertThat(registry.find("missing")).isEmpty();
            assertThat(first.getRiskStatus().isEmergencyStopActive()).isTrue();
            assertThat(second.getRiskStatus().getEmergencyStopReason()).isEqualTo("venue outage");
            assertThat(registry.emergencyStopAll("again")).isZero();
        } finally {
            registry.accountIds().forEach(id -> registry.find(id).ifPresent(ExecutionController::resume));
        }
    }

    @Test
    void analyticsDefaultsBindFromConfiguration() {
        assertThat(analyticsProperties.getMinObservations()).isEqualTo(30);
        assertThat(analyticsProperties.getStressScenarios())
                .containsKeys("mild-stress", "severe-stress", "extreme-stress");
        assertThat(analyticsProperties.getMonteCarlo().getSeed()).isEqualTo(42L);
    }
}
