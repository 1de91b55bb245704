package com.infra.anomaly.engine.strategies;

import com.infra.anomaly.config.AnomalyDetectionConfig;
import com.infra.anomaly.engine.DetectionStrategy;
import com.infra.anomaly.engine.DetectionVerdict;
import com.infra.anomaly.model.AnomalyStats;
import com.infra.anomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

/**
 * Standard z-score test.
 *
 * Logic: z = (value - mean) / stddev. Flag when |z| > configured threshold.
 * A value exactly on the threshold is not anomalous.
 */
@Component
public class ZScoreStrategy implements DetectionStrategy {

    private final AnomalyDetectionConfig config;

    public ZScoreStrategy(AnomalyDetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.ZSCORE;
    }

    @Override
    public DetectionVerdict evaluate(double currentValue, AnomalyStats stats) {
        double threshold = config.getZscoreThreshold();
        double zScore = DetectionStrategy.zScore(currentValue, stats);
        return DetectionVerdict.builder()
                .anomalous(Math.abs(zScore) > threshold)
                .threshold(threshold)
                .zScore(zScore)
                .build();
    }
}
