package com.infra.anomaly.engine.strategies;

import com.infra.anomaly.config.AnomalyDetectionConfig;
import com.infra.anomaly.engine.DetectionStrategy;
import com.infra.anomaly.engine.DetectionVerdict;
import com.infra.anomaly.model.AnomalyStats;
import com.infra.anomaly.model.BollingerBands;
import com.infra.anomaly.model.DetectionMethod;
import org.springframework.stereotype.Component;

/**
 * Flags values outside mean +/- k*stddev, with the lower band floored at 0.
 *
 * Picked automatically for low-variance series (cv < 0.1), where bands are
 * more sensitive than a plain z-score. The reported threshold is the band
 * multiplier; the z-score is still computed for diagnostics but plays no part
 * in the decision.
 */
@Component
public class BollingerBandStrategy implements DetectionStrategy {

    private final AnomalyDetectionConfig config;

    public BollingerBandStrategy(AnomalyDetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectionMethod getSupportedMethod() {
        return DetectionMethod.BOLLINGER;
    }

    @Override
    public DetectionVerdict evaluate(double currentValue, AnomalyStats stats) {
        double multiplier = config.getBollingerMultiplier();
        BollingerBands bands = BollingerBands.of(stats.getMean(), stats.getStdDev(), multiplier);
        return DetectionVerdict.builder()
                .anomalous(bands.isOutside(currentValue))
                .threshold(multiplier)
                .zScore(DetectionStrategy.zScore(currentValue, stats))
                .build();
    }
}
