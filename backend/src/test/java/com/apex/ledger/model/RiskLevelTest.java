package com.apex.ledger.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RiskLevelTest {

    @Test
    void calmSeriesIsLow() {
        assertThat(RiskLevel.assess(0.1, 0.05, -0.01)).isEqualTo(RiskLevel.LOW);
    }

    @Test
    void scoresAccumulateAcrossFactors() {
        // 1 + 1 + 1
        assertThat(RiskLevel.assess(0.2, 0.12, -0.025)).isEqualTo(RiskLevel.MEDIUM);
        // 2 + 2 + 1
        assertThat(RiskLevel.assess(0.3, 0.18, -0.025)).isEqualTo(RiskLevel.HIGH);
        // 3 + 3 + 3
        assertThat(RiskLevel.assess(0.5, 0.3, -0.08)).isEqualTo(RiskLevel.CRITICAL);
    }

    @Test
    void thresholdsAreExclusive() {
        assertThat(RiskLevel.assess(0.15, 0.1, -0.02)).isEqualTo(RiskLevel.LOW);
    }
}
