package com.infra.anomaly.engine;

import com.infra.anomaly.model.AnomalyStats;
import com.infra.anomaly.model.DetectionMethod;

/**
 * Interface for all anomaly detection methods.
 * Each implementation handles a specific DetectionMethod.
 */
public interface DetectionStrategy {

    /**
     * The detection method this strategy implements.
     */
    DetectionMethod getSupportedMethod();

    /**
     * Decide whether the current value is anomalous against the window statistics.
     *
     * @param currentValue the latest reading
     * @param stats        rolling mean/stddev/sample count for the same container+metric
     * @return the raw verdict; z-score is not rounded
     */
    DetectionVerdict evaluate(double currentValue, AnomalyStats stats);

    static double zScore(double currentValue, AnomalyStats stats) {
        return stats.getStdDev() > 0 ? (currentValue - stats.getMean()) / stats.getStdDev() : 0.0;
    }
}
