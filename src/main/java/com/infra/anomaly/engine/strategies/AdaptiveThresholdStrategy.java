package com.infra.anomaly.engine.strategies;

import com.infra.anomaly.config.AnomalyDetectionConfig;
import com.infra.anomaly.engine.DetectionStrategy;
import com.infra.anomaly.engine.DetectionVerdict;
import com.infra.anomaly.model.AnomalyStats;
import com.infra.anomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

/**
 * Z-score test whose threshold is scaled by the coefficient of variation.
 *
 * Tiers:
 *   cv > 0.5        threshold x 1.5
 *   0.2 < cv <= 0.5 threshold x 1.0
 *   cv <= 0.2       threshold x 1.2
 *
 * The lowest tier is intentionally wider than the middle one.
 */
@Component
public class AdaptiveThresholdStrategy implements DetectionStrategy {

    static final double HIGH_CV = 0.5;
    static final double MEDIUM_CV = 0.2;

    private final AnomalyDetectionConfig config;

    public AdaptiveThresholdStrategy(AnomalyDetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.ADAPTIVE;
    }

    @Override
    public DetectionVerdict evaluate(double currentValue, AnomalyStats stats) {
        double threshold = scaledThreshold(stats.coefficientOfVariation());
        double zScore = DetectionStrategy.zScore(currentValue, stats);
        return DetectionVerdict.builder()
                .anomalous(Math.abs(zScore) > threshold)
                .threshold(threshold)
                .zScore(zScore)
                .build();
    }

    double scaledThreshold(double cv) {
        double base = config.getZscoreThreshold();
        if (cv > HIGH_CV) {
            return base * 1.5;
        }
        if (cv > MEDIUM_CV) {
            return base;
        }
        return base * 1.2;
    }
}
