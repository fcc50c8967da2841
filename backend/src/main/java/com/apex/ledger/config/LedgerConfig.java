package com.apex.ledger.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Core beans shared by every account: the trading-day clock and the meter registry.
 */
@Configuration
public class LedgerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock tradingClock(ExecutionProperties executionProperties) {
        return Clock.system(ZoneId.of(executionProperties.getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
