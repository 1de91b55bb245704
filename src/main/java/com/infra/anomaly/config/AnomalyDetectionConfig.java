package com.infra.anomaly.config;

import com.infra.anomaly.model.DetectionMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyDetectionConfig {

    // Base z-score threshold. The adaptive method scales it by the cv tier.
    private double zscoreThreshold = 2.5;

    // Number of most recent samples used for mean/stddev.
    private int movingAverageWindow = 30;

    // Below this many samples in the window, detection returns no result.
    private long minSamples = 10;

    // When false, a requested bollinger detection silently runs as zscore.
    private boolean bollingerBandsEnabled = true;

    private double bollingerMultiplier = 2.0;

    // |z| above this turns an anomalous verdict into a critical insight (warning otherwise).
    private double criticalZscore = 4.0;

    private List<String> metricTypes = List.of("cpu", "memory");

    // "auto" picks a method per series from its coefficient of variation.
    private String detectionMethod = "auto";

    // A container+metric flagged within this many minutes is not flagged again. 0 disables.
    private int cooldownMinutes = 15;

    /**
     * The configured method, or null for automatic selection.
     *
     * @throws IllegalArgumentException if the configured tag is not a known method
     */
    public DetectionMethod requestedMethod() {
        if (detectionMethod == null || detectionMethod.isBlank() || "auto".equalsIgnoreCase(detectionMethod)) {
            return null;
        }
        return DetectionMethod.fromTag(detectionMethod.trim());
    }
}
