package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyDetectionConfig;
import com.infra.anomaly.model.AnomalyDetectionResult;
import com.infra.anomaly.model.Insight;
import com.infra.anomaly.model.InsightCategory;
import com.infra.anomaly.model.MetricSample;
import com.infra.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Builds the anomaly insight emitted for an anomalous detection verdict.
 *
 * Example: cpu at 95% against a mean of 40% with z=5.5 becomes a critical insight
 * titled {@code Anomalous cpu usage on "web-app"}.
 */
@Component
public class AnomalyInsightFactory {

    private final AnomalyDetectionConfig config;

    public AnomalyInsightFactory(AnomalyDetectionConfig config) {
        this.config = config;
    }

    public Insight fromDetection(AnomalyDetectionResult result, MetricSample sample, long createdAt) {
        String metric = result.getMetricType();
        double z = result.getZScore();

        String description = String.format(Locale.ROOT,
                "Current %s: %.1f%% (mean: %.1f%%, z-score: %.2f, method: %s). " +
                        "This is %.1f standard deviations from the moving average.",
                metric, result.getCurrentValue(), result.getMean(), z,
                result.getMethod().getTag(), Math.abs(z));

        return Insight.builder()
                .id(UUID.randomUUID().toString())
                .endpointId(sample.getEndpointId())
                .endpointName(sample.getEndpointName())
                .containerId(result.getContainerId())
                .containerName(result.getContainerName())
                .severity(Math.abs(z) > config.getCriticalZscore() ? Severity.CRITICAL : Severity.WARNING)
                .category(InsightCategory.ANOMALY)
                .metricType(metric)
                .title("Anomalous " + metric + " usage on \"" + result.getContainerName() + "\"")
                .description(description)
                .suggestedAction(suggestedAction(metric))
                .createdAt(createdAt)
                .acknowledged(false)
                .build();
    }

    static String suggestedAction(String metricType) {
        if ("memory".equalsIgnoreCase(metricType)) {
            return "Investigate memory usage patterns and check container configuration";
        }
        return "Investigate CPU usage patterns and check for process anomalies";
    }
}
