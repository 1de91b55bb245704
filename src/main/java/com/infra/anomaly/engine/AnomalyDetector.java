package com.infra.anomaly.engine;

import com.infra.anomaly.config.AnomalyDetectionConfig;
import com.infra.anomaly.model.AnomalyDetectionResult;
import com.infra.anomaly.model.AnomalyStats;
import com.infra.anomaly.model.DetectionMethod;
import com.infra.anomaly.repository.MetricSampleRepository;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Picks a detection method for a metric reading and returns the verdict.
 * Uses the Strategy pattern: each DetectionMethod is handled by a registered DetectionStrategy.
 *
 * Method selection when the caller does not ask for one:
 *   fewer than 20 samples -> zscore
 *   cv < 0.1             -> bollinger
 *   cv > 0.3             -> adaptive
 *   otherwise            -> zscore
 * A bollinger request (explicit or automatic) runs as zscore when bands are disabled.
 *
 * Only reads statistics; logging and metrics are left to the caller.
 */
@Component
public class AnomalyDetector {

    static final long MIN_SAMPLES_FOR_SELECTION = 20;
    static final double LOW_CV = 0.1;
    static final double HIGH_CV = 0.3;

    private static final double RELATIVE_TOLERANCE = 0.1;
    private static final double MIN_TOLERANCE = 0.01;

    private final MetricSampleRepository metricSampleRepository;
    private final AnomalyDetectionConfig config;
    private final Map<DetectionMethod, DetectionStrategy> strategyMap;

    public AnomalyDetector(MetricSampleRepository metricSampleRepository,
                           AnomalyDetectionConfig config,
                           List<DetectionStrategy> strategies) {
        this.metricSampleRepository = metricSampleRepository;
        this.config = config;
        this.strategyMap = new EnumMap<>(DetectionMethod.class);
        for (DetectionStrategy strategy : strategies) {
            strategyMap.put(strategy.getSupportedMethod(), strategy);
        }
        for (DetectionMethod method : DetectionMethod.values()) {
            if (!strategyMap.containsKey(method)) {
                throw new IllegalStateException("No detection strategy registered for " + method);
            }
        }
    }

    public AnomalyDetectionResult detect(String containerId, String containerName,
                                         String metricType, double currentValue) {
        return detect(containerId, containerName, metricType, currentValue, null);
    }

    /**
     * @param requestedMethod method to force, or null to select from the data
     * @return the verdict, or null when the window holds fewer than the minimum samples
     */
    public AnomalyDetectionResult detect(String containerId, String containerName,
                                         String metricType, double currentValue,
                                         DetectionMethod requestedMethod) {
        AnomalyStats stats = metricSampleRepository.getMovingAverage(
                containerId, metricType, config.getMovingAverageWindow());
        if (stats == null || stats.getSampleCount() < config.getMinSamples()) {
            return null;
        }

        DetectionMethod method = resolveMethod(
                requestedMethod != null ? requestedMethod : selectMethod(stats),
                config.isBollingerBandsEnabled());

        DetectionVerdict verdict = strategyMap.get(method).evaluate(currentValue, stats);
        boolean anomalous = verdict.isAnomalous();
        double zScore = verdict.getZScore();

        // Flat history: a z-score is meaningless, compare against an absolute tolerance instead.
        if (stats.getStdDev() == 0) {
            double tolerance = Math.max(Math.abs(stats.getMean()) * RELATIVE_TOLERANCE, MIN_TOLERANCE);
            double delta = currentValue - stats.getMean();
            anomalous = Math.abs(delta) > tolerance;
            zScore = anomalous ? delta / tolerance : 0.0;
        }

        return AnomalyDetectionResult.builder()
                .containerId(containerId)
                .containerName(containerName)
                .metricType(metricType)
                .currentValue(currentValue)
                .mean(stats.getMean())
                .stdDev(stats.getStdDev())
                .zScore(Math.round(zScore * 100.0) / 100.0)
                .anomalous(anomalous)
                .threshold(verdict.getThreshold())
                .method(method)
                .timestamp(System.currentTimeMillis())
                .build();
    }

    static DetectionMethod selectMethod(AnomalyStats stats) {
        if (stats.getSampleCount() < MIN_SAMPLES_FOR_SELECTION) {
            return DetectionMethod.ZSCORE;
        }
        double cv = stats.coefficientOfVariation();
        if (cv < LOW_CV) {
            return DetectionMethod.BOLLINGER;
        }
        if (cv > HIGH_CV) {
            return DetectionMethod.ADAPTIVE;
        }
        return DetectionMethod.ZSCORE;
    }

    static DetectionMethod resolveMethod(DetectionMethod method, boolean bollingerEnabled) {
        if (method == DetectionMethod.BOLLINGER && !bollingerEnabled) {
            return DetectionMethod.ZSCORE;
        }
        return method;
    }
}
