package com.infra.anomaly.engine;

import com.infra.anomaly.config.AnomalyDetectionConfig;
import com.infra.anomaly.engine.strategies.AdaptiveThresholdStrategy;
import com.infra.anomaly.engine.strategies.BollingerBandStrategy;
import com.infra.anomaly.engine.strategies.ZScoreStrategy;
import com.infra.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DetectionStrategiesTest {

    private AnomalyDetectionConfig config;

    @BeforeEach
    void setUp() {
        config = new AnomalyDetectionConfig();
        config.setZscoreThreshold(2.0);
    }

    @Test
    void adaptive_tiersAreNonMonotonic() {
        AdaptiveThresholdStrategy adaptive = new AdaptiveThresholdStrategy(config);

        // cv 0.6 -> x1.5
        assertThat(adaptive.evaluate(100, TestDataFactory.createStats(50, 30, 30)).getThreshold())
                .isCloseTo(3.0, within(1e-9));
        // cv 0.3 -> x1.0
        assertThat(adaptive.evaluate(100, TestDataFactory.createStats(50, 15, 30)).getThreshold())
                .isCloseTo(2.0, within(1e-9));
        // cv 0.2 exactly -> lowest tier, x1.2
        assertThat(adaptive.evaluate(100, TestDataFactory.createStats(50, 10, 30)).getThreshold())
                .isCloseTo(2.4, within(1e-9));
        // cv 0.5 exactly stays in the middle tier
        assertThat(adaptive.evaluate(100, TestDataFactory.createStats(50, 25, 30)).getThreshold())
                .isCloseTo(2.0, within(1e-9));
    }

    @Test
    void adaptive_decisionUsesScaledThreshold() {
        AdaptiveThresholdStrategy adaptive = new AdaptiveThresholdStrategy(config);

        // cv 0.6, threshold 3.0; z = (130-50)/30 = 2.67 -> not anomalous under 3.0
        DetectionVerdict verdict = adaptive.evaluate(130, TestDataFactory.createStats(50, 30, 30));

        assertThat(verdict.isAnomalous()).isFalse();
        assertThat(verdict.getZScore()).isCloseTo(2.6667, within(1e-3));
    }

    @Test
    void bollinger_lowerBandFlooredAtZero() {
        BollingerBandStrategy bollinger = new BollingerBandStrategy(config);
        config.setBollingerMultiplier(2.0);

        // mean 10, stddev 8 -> raw lower band -6, floored to 0; 0 is inside
        assertThat(bollinger.evaluate(0, TestDataFactory.createStats(10, 8, 30)).isAnomalous()).isFalse();
        assertThat(bollinger.evaluate(27, TestDataFactory.createStats(10, 8, 30)).isAnomalous()).isTrue();
    }

    @Test
    void zscore_zeroStdDev_reportsZeroScore() {
        ZScoreStrategy zscore = new ZScoreStrategy(config);

        DetectionVerdict verdict = zscore.evaluate(80, TestDataFactory.createStats(50, 0, 30));

        assertThat(verdict.getZScore()).isEqualTo(0.0);
        assertThat(verdict.isAnomalous()).isFalse();
    }
}
